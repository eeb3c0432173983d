package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.MacroEnvironment;
import io.github.cyfko.tgrep.core.config.QueryPolicy;
import io.github.cyfko.tgrep.core.exception.TgrepSyntaxException;
import io.github.cyfko.tgrep.core.tree.ParentedTree;
import io.github.cyfko.tgrep.core.tree.TreeReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TgrepGrammar Tests")
class TgrepGrammarTest {

    private static final QueryPolicy POLICY = QueryPolicy.defaults();

    private static List<String> tokenize(String query) {
        return TgrepGrammar.tokenize(query, POLICY);
    }

    private static TgrepSyntaxException parseError(String query) {
        return assertThrows(TgrepSyntaxException.class, () -> TgrepGrammar.parse(query, POLICY));
    }

    @Nested
    @DisplayName("Tokenization")
    class Tokenization {

        @Test
        @DisplayName("Operators, brackets and negations are split into tokens")
        void mixedQuery() {
            assertEquals(
                    List.of("A", "..", "(", "B", "!", "<", "C", ".", "D", ")", "|",
                            "!", "[", "<<", "(", "E", ",", "F", ")", "$", "G", "]"),
                    tokenize("A .. (B !< C . D) | ![<< (E , F) $ G]"));
        }

        @Test
        @DisplayName("Macro definitions and uses keep their raw form")
        void macros() {
            String query = "@ NP /^NP/;\n@ NN /^NN/;\n@NP [!< NP | < @NN] !$.. @NN";

            assertEquals(
                    List.of("@", "NP", "/^NP/", ";", "@", "NN", "/^NN/", ";",
                            "@NP", "[", "!", "<", "NP", "|", "<", "@NN", "]", "!", "$..", "@NN"),
                    tokenize(query));
        }

        @Test
        @DisplayName("Tree positions may end with a comma")
        void treePosition() {
            assertEquals(List.of("N(", "0", ",", ")"), tokenize("N(0,)"));
            assertEquals(List.of("N(", "0", ",", "1", ")"), tokenize("N(0,1)"));
            assertEquals(List.of("N(", ")"), tokenize("N()"));
        }

        @Test
        @DisplayName("Strings and regular expressions are single tokens")
        void delimitedTokens() {
            assertEquals(List.of("\"a b\"", "<", "/x y/", "|", "i@\"NP\""),
                    tokenize("\"a b\" < /x y/|i@\"NP\""));
        }

        @Test
        @DisplayName("Comments and line breaks are skipped")
        void comments() {
            assertEquals(List.of("NP", "<", "DT"), tokenize("NP # the phrase\n  < DT"));
        }

        @Test
        @DisplayName("Only the longest well-formed prefix is returned")
        void longestPrefix() {
            assertEquals(List.of("NP", "<", "DT"), tokenize("NP < DT )"));
            assertEquals(List.of("NP"), tokenize("NP ; "));
        }

        @Test
        @DisplayName("Operators and regular expressions are not validated")
        void noValidation() {
            assertEquals(List.of("NP", "<<<<", "DT"), tokenize("NP <<<< DT"));
            assertEquals(List.of("/[/"), tokenize("/[/"));
        }

        @Test
        @DisplayName("Text without any statement is rejected")
        void noStatement() {
            assertThrows(TgrepSyntaxException.class, () -> tokenize(")"));
            assertThrows(TgrepSyntaxException.class, () -> tokenize("@ X NP"));
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("One expression per search statement, macros collected apart")
        void statements() {
            ParsedQuery parsed = TgrepGrammar.parse("@ D DT; NP < @D; VP", POLICY);

            assertEquals(2, parsed.expressions().size());
            assertEquals(Set.of("D"), parsed.macros().names());
            assertEquals(List.of("@", "D", "DT", ";", "NP", "<", "@D", ";", "VP"), parsed.tokens());
        }

        @Test
        @DisplayName("Combined predicate ORs the search statements")
        void combinedPredicate() {
            ParentedTree tree = TreeReader.read("(S (NP (DT the)) (VP (VBD ran)))");
            ParsedQuery parsed = TgrepGrammar.parse("NP ; VP", POLICY);
            MacroEnvironment macros = parsed.macros();

            assertTrue(parsed.predicate().test(tree.children().get(0), macros));
            assertTrue(parsed.predicate().test(tree.children().get(1), macros));
            assertFalse(parsed.predicate().test(tree, macros));
        }

        @Test
        @DisplayName("Conjunction binds tighter than disjunction")
        void precedence() {
            ParentedTree tree = TreeReader.read("(S (A (X x)) (B (Y y)) (C (X x) (Y y)))");
            ParsedQuery parsed = TgrepGrammar.parse("* < X & < Y | < x", POLICY);
            MacroEnvironment macros = parsed.macros();

            assertFalse(parsed.predicate().test(tree.children().get(0), macros));
            assertFalse(parsed.predicate().test(tree.children().get(1), macros));
            assertTrue(parsed.predicate().test(tree.children().get(2), macros));
            assertTrue(parsed.predicate().test(tree.children().get(0).children().get(0), macros));
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("Missing relation target points past the operator")
        void missingTarget() {
            TgrepSyntaxException exception = parseError("NP <");

            assertEquals(4, exception.getPosition());
            assertEquals("Expected a node at position 4", exception.getMessage());
        }

        @Test
        @DisplayName("Trailing input is reported where it starts")
        void trailingInput() {
            TgrepSyntaxException exception = parseError("NP < DT )");

            assertEquals(8, exception.getPosition());
            assertTrue(exception.getMessage().contains("Unexpected ')'"));
        }

        @Test
        @DisplayName("Unknown operator is reported at the operator")
        void unknownOperator() {
            TgrepSyntaxException exception = parseError("NP <<<< DT");

            assertEquals(3, exception.getPosition());
            assertInstanceOf(IllegalArgumentException.class, exception.getCause());
        }

        @Test
        @DisplayName("Invalid regular expression is reported at the node")
        void invalidRegex() {
            TgrepSyntaxException exception = parseError("NP < /[/");

            assertEquals(5, exception.getPosition());
            assertTrue(exception.getMessage().startsWith("Invalid regular expression"));
        }

        @Test
        @DisplayName("Unterminated string is reported where it opens")
        void unterminatedString() {
            TgrepSyntaxException exception = parseError("\"abc");

            assertEquals(0, exception.getPosition());
            assertTrue(exception.getMessage().startsWith("Unterminated"));
        }

        @Test
        @DisplayName("Missing closing bracket or parenthesis")
        void unclosed() {
            assertTrue(parseError("(NP < DT").getMessage().contains("Expected ')'"));
            assertTrue(parseError("NP [< DT").getMessage().contains("Expected ']'"));
        }

        @Test
        @DisplayName("Macro definitions alone are not a query")
        void onlyDefinitions() {
            TgrepSyntaxException exception = parseError("@ N NP");

            assertTrue(exception.getMessage().contains("no search expression"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"NP ;", "NP ;;", "; NP", "NP < < DT", "NP !", "NP [ ]", "NP &", "N(a)"})
        @DisplayName("Malformed statements are rejected")
        void malformed(String query) {
            parseError(query);
        }

        @Test
        @DisplayName("Tree position index beyond int range")
        void hugeTreePosition() {
            TgrepSyntaxException exception = parseError("N(99999999999)");

            assertEquals(2, exception.getPosition());
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class PolicyLimits {

        @Test
        @DisplayName("Should reject query exceeding maxQueryLength")
        void queryTooLong() {
            // Given
            QueryPolicy policy = QueryPolicy.builder().maxQueryLength(10).build();

            // When
            TgrepSyntaxException exception = assertThrows(TgrepSyntaxException.class,
                    () -> TgrepGrammar.parse("NP < DT < NN", policy));

            // Then
            assertTrue(exception.getMessage().contains("Query too long"));
            assertTrue(exception.getMessage().contains("12 characters"));
            assertTrue(exception.getMessage().contains("max: 10"));
            assertTrue(exception.getMessage().contains("CUSTOM_POLICY"));
        }

        @Test
        @DisplayName("Should enforce maxNestingDepth on parentheses and brackets")
        void nestingDepth() {
            QueryPolicy policy = QueryPolicy.builder().maxNestingDepth(2).build();

            assertDoesNotThrow(() -> TgrepGrammar.parse("((NP))", policy));
            assertDoesNotThrow(() -> TgrepGrammar.parse("NP [< (DT)]", policy));

            TgrepSyntaxException exception = assertThrows(TgrepSyntaxException.class,
                    () -> TgrepGrammar.parse("(((NP)))", policy));
            assertEquals(2, exception.getPosition());
            assertTrue(exception.getMessage().contains("Nesting depth exceeds the maximum of 2"));
        }
    }
}
