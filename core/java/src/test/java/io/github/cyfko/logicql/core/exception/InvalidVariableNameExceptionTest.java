package io.github.cyfko.logicql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvalidVariableNameExceptionTest {

    @Test
    @DisplayName("Should report every invalid name")
    void shouldReportInvalidNames() {
        // Given
        List<String> names = new ArrayList<>(List.of("3fe", "@q"));

        // When
        InvalidVariableNameException exception = new InvalidVariableNameException(names);
        names.clear();

        // Then
        assertEquals(List.of("3fe", "@q"), exception.getInvalidNames());
        assertEquals("Invalid variable names: [3fe, @q]", exception.getMessage());
        assertInstanceOf(LogicSyntaxException.class, exception);
    }

    @Test
    @DisplayName("Should require at least one name")
    void shouldRequireNames() {
        assertThrows(IllegalArgumentException.class, () -> new InvalidVariableNameException(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new InvalidVariableNameException(null));
    }

    @Test
    @DisplayName("Should keep message and cause of syntax exceptions")
    void shouldKeepCause() {
        // Given
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        MalformedStatementException exception = new MalformedStatementException("Malformed", cause);

        // Then
        assertEquals("Malformed", exception.getMessage());
        assertEquals(cause, exception.getCause());
        assertInstanceOf(LogicSyntaxException.class, exception);
    }
}
