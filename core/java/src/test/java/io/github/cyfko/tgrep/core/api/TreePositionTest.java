package io.github.cyfko.tgrep.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TreePosition Tests")
class TreePositionTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Root position is empty")
        void rootIsEmpty() {
            assertTrue(TreePosition.root().isRoot());
            assertEquals(0, TreePosition.root().length());
            assertEquals(TreePosition.root(), TreePosition.of());
        }

        @Test
        @DisplayName("Should reject negative indexes")
        void shouldRejectNegativeIndexes() {
            assertThrows(IllegalArgumentException.class, () -> TreePosition.of(0, -1));
        }

        @Test
        @DisplayName("Should not share the caller's array")
        void shouldCopyIndexes() {
            int[] indexes = {1, 2};
            TreePosition position = TreePosition.of(indexes);
            indexes[0] = 9;

            assertEquals(List.of(1, 2), position.toList());
        }

        @Test
        @DisplayName("List and varargs factories agree")
        void listFactoryMatchesVarargs() {
            assertEquals(TreePosition.of(0, 3, 1), TreePosition.of(List.of(0, 3, 1)));
        }
    }

    @Nested
    @DisplayName("Navigation")
    class Navigation {

        @Test
        @DisplayName("child, prefix and concat build the expected paths")
        void derivedPositions() {
            TreePosition position = TreePosition.of(0, 1);

            assertEquals(TreePosition.of(0, 1, 4), position.child(4));
            assertEquals(TreePosition.of(0), position.prefix(1));
            assertSame(position, position.prefix(5));
            assertEquals(TreePosition.root(), position.prefix(0));
            assertEquals(TreePosition.of(0, 1, 2, 3), position.concat(TreePosition.of(2, 3)));
            assertEquals(1, position.last());
            assertEquals(0, position.get(0));
        }

        @Test
        @DisplayName("Root has no last index")
        void rootHasNoLastIndex() {
            assertThrows(IllegalStateException.class, () -> TreePosition.root().last());
        }

        @Test
        @DisplayName("isPrefixOf is reflexive and follows ancestry")
        void prefixRelation() {
            TreePosition parent = TreePosition.of(1);
            TreePosition child = TreePosition.of(1, 0);

            assertTrue(parent.isPrefixOf(child));
            assertTrue(child.isPrefixOf(child));
            assertTrue(TreePosition.root().isPrefixOf(child));
            assertFalse(child.isPrefixOf(parent));
            assertFalse(TreePosition.of(0).isPrefixOf(child));
        }
    }

    @Test
    @DisplayName("Ordering is lexicographic with prefixes first")
    void orderingIsPreOrder() {
        List<TreePosition> positions = new ArrayList<>(List.of(
                TreePosition.of(1),
                TreePosition.of(0, 1),
                TreePosition.root(),
                TreePosition.of(0),
                TreePosition.of(1, 0, 0),
                TreePosition.of(0, 0)));

        positions.sort(null);

        assertEquals(List.of(
                TreePosition.root(),
                TreePosition.of(0),
                TreePosition.of(0, 0),
                TreePosition.of(0, 1),
                TreePosition.of(1),
                TreePosition.of(1, 0, 0)), positions);
    }

    @Test
    @DisplayName("toString uses tuple notation")
    void toStringUsesTupleNotation() {
        assertEquals("()", TreePosition.root().toString());
        assertEquals("(2,)", TreePosition.of(2).toString());
        assertEquals("(0, 1, 0)", TreePosition.of(0, 1, 0).toString());
    }

    @Test
    @DisplayName("Equal positions have equal hash codes")
    void equalsAndHashCode() {
        assertEquals(TreePosition.of(3, 4), TreePosition.of(3, 4));
        assertEquals(TreePosition.of(3, 4).hashCode(), TreePosition.of(3, 4).hashCode());
        assertNotEquals(TreePosition.of(3, 4), TreePosition.of(4, 3));
    }
}
