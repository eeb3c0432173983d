package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.MacroEnvironment;
import io.github.cyfko.tgrep.core.api.NodePredicate;
import io.github.cyfko.tgrep.core.api.TreeNode;
import io.github.cyfko.tgrep.core.api.TreePosition;
import io.github.cyfko.tgrep.core.exception.UndefinedMacroException;
import io.github.cyfko.tgrep.core.tree.ParentedTree;
import io.github.cyfko.tgrep.core.tree.TreeReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("NodeLiteralCompiler Tests")
class NodeLiteralCompilerTest {

    private static boolean matches(String token, String value) {
        return NodeLiteralCompiler.compile(token).test(ParentedTree.leaf(value), MacroEnvironment.empty());
    }

    @Nested
    @DisplayName("Label tokens")
    class LabelTokens {

        @ParameterizedTest
        @ValueSource(strings = {"*", "__"})
        @DisplayName("Wildcards match any value")
        void wildcards(String token) {
            assertTrue(matches(token, "NP"));
            assertTrue(matches(token, ""));
        }

        @ParameterizedTest
        @CsvSource({
                "NP, NP, true",
                "NP, NNP, false",
                "NP, np, false",
                "'\"NP\"', NP, true",
                "'\"a b\"', a b, true",
                "/^NN/, NNS, true",
                "/NN/, JJ, false",
                "/P$/, NP, true",
                "'i@\"np\"', NP, true",
                "'i@\"np\"', NPS, false",
                "i@/^vb/, VBD, true",
                "i@/^VB/, vbd, true",
                "i@/^vb$/, VBD, false",
                "'i@\"A\\\"B\"', 'a\"b', true",
                "'i@\"C\\\\D\"', 'c\\d', true",
                "'i@\"C\\\\D\"', 'c\\\\d', false"
        })
        @DisplayName("Token matches value as expected")
        void tokenMatches(String token, String value, boolean expected) {
            assertEquals(expected, matches(token, value));
        }

        @Test
        @DisplayName("Quoted literals unescape quotes and backslashes")
        void quotedEscapes() {
            assertTrue(matches("\"say \\\"hi\\\"\"", "say \"hi\""));
            assertTrue(matches("\"a\\\\b\"", "a\\b"));
        }

        @Test
        @DisplayName("Regular expressions may contain escaped slashes")
        void regexEscapedSlash() {
            assertTrue(matches("/^a\\/b$/", "a/b"));
        }

        @Test
        @DisplayName("Alternatives match when any token matches")
        void alternatives() {
            NodePredicate predicate = NodeLiteralCompiler.compileAlternatives(List.of("NP", "/^VB/", "\"JJ\""));
            MacroEnvironment macros = MacroEnvironment.empty();

            assertTrue(predicate.test(ParentedTree.leaf("NP"), macros));
            assertTrue(predicate.test(ParentedTree.leaf("VBZ"), macros));
            assertTrue(predicate.test(ParentedTree.leaf("JJ"), macros));
            assertFalse(predicate.test(ParentedTree.leaf("DT"), macros));
        }

        @Test
        @DisplayName("Invalid regular expressions are rejected at compile time")
        void invalidRegex() {
            assertThrows(PatternSyntaxException.class, () -> NodeLiteralCompiler.compile("/[/"));
            assertThrows(PatternSyntaxException.class, () -> NodeLiteralCompiler.compile("i@/(/"));
        }

        @Test
        @DisplayName("Unterminated tokens are rejected")
        void unterminated() {
            assertThrows(IllegalArgumentException.class, () -> NodeLiteralCompiler.compile("\"abc"));
            assertThrows(IllegalArgumentException.class, () -> NodeLiteralCompiler.compile("/"));
            assertThrows(IllegalArgumentException.class, () -> NodeLiteralCompiler.compile(""));
        }
    }

    @Nested
    @DisplayName("Structural tokens")
    class StructuralTokens {

        @Test
        @DisplayName("Position predicate matches exactly one node")
        void position() {
            ParentedTree tree = TreeReader.read("(S (NP (DT the)) (VP (VBD ran)))");
            NodePredicate predicate = NodeLiteralCompiler.position(TreePosition.of(1, 0));

            int count = 0;
            for (TreePosition position : tree.positions(true)) {
                if (predicate.test(tree.get(position), MacroEnvironment.empty())) {
                    count++;
                    assertEquals(TreePosition.of(1, 0), position);
                }
            }
            assertEquals(1, count);
        }

        @Test
        @DisplayName("Macro reference delegates to the bound definition")
        void macroDelegates() {
            TreeNode node = ParentedTree.leaf("NP");
            NodePredicate body = mock(NodePredicate.class);
            when(body.test(any(), any())).thenReturn(true);
            MacroEnvironment macros = MacroEnvironment.of(Map.of("PHRASE", body));

            assertTrue(NodeLiteralCompiler.macro("PHRASE").test(node, macros));
            verify(body).test(node, macros);
        }

        @Test
        @DisplayName("Macro reference is resolved only when evaluated")
        void macroIsLazy() {
            NodePredicate reference = NodeLiteralCompiler.macro("MISSING");

            UndefinedMacroException exception = assertThrows(UndefinedMacroException.class,
                    () -> reference.test(ParentedTree.leaf("x"), MacroEnvironment.empty()));
            assertEquals("MISSING", exception.getMacroName());
        }
    }
}
