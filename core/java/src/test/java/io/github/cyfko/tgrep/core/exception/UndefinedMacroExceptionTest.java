package io.github.cyfko.tgrep.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UndefinedMacroExceptionTest {

    @Test
    @DisplayName("Should name the missing macro")
    void shouldNameMacro() {
        // When
        UndefinedMacroException exception = new UndefinedMacroException("NP");

        // Then
        assertEquals("Macro @NP is not defined", exception.getMessage());
        assertEquals("NP", exception.getMacroName());
        assertInstanceOf(TgrepException.class, exception);
    }

    @Test
    @DisplayName("TreeFormatException should report the position")
    void treeFormatPosition() {
        // When
        TreeFormatException exception = new TreeFormatException("Expected '('", 7);

        // Then
        assertEquals("Expected '(' at position 7", exception.getMessage());
        assertInstanceOf(TgrepException.class, exception);
    }
}
