package io.github.cyfko.logicql.core.impl;

import io.github.cyfko.logicql.core.api.Statement;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.config.CachePolicy;
import io.github.cyfko.logicql.core.config.LogicPolicy;
import io.github.cyfko.logicql.core.exception.InvalidVariableNameException;
import io.github.cyfko.logicql.core.exception.LogicSyntaxException;
import io.github.cyfko.logicql.core.exception.MalformedStatementException;
import io.github.cyfko.logicql.core.model.VariableRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BasicLogicParser}: tokenization, structural verification and caching.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicLogicParser Tests")
class BasicLogicParserTest {

    private BasicLogicParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicLogicParser();
    }

    @Nested
    @DisplayName("Valid Expressions")
    class ValidExpressionTests {

        @Test
        @DisplayName("Statement keeps wrapped tokens and declaration order")
        void testStatementContent() {
            Statement statement = parser.parse("a&b|!(c|a)");

            assertEquals(List.of("a", "b", "c"), statement.variables());
            assertEquals(Token.OPEN_PAREN, statement.tokens().get(0));
            assertEquals(Token.CLOSE_PAREN, statement.tokens().get(statement.tokens().size() - 1));
            assertEquals("(a&b|!(c|a))", statement.expression());
        }

        @Test
        @DisplayName("All variables start false")
        void testDefaultValues() {
            VariableRegistry registry = parser.parse("p -> q").registry();
            assertEquals(Map.of("p", false, "q", false), registry.snapshot());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "!a", "a & b", "(a)", "((a | b) -> c) <-> !d", "!!a", "x1&y2&z3"})
        void testValid(String expression) {
            assertDoesNotThrow(() -> parser.parse(expression));
        }
    }

    @Nested
    @DisplayName("Rejected Expressions")
    class RejectedExpressionTests {

        @Test
        @DisplayName("Invalid name is reported alone, valid names are not")
        void testInvalidName() {
            InvalidVariableNameException exception = assertThrows(
                    InvalidVariableNameException.class,
                    () -> parser.parse("3x & y")
            );
            assertEquals(List.of("3x"), exception.getInvalidNames());
        }

        @Test
        @DisplayName("Unbalanced parentheses are malformed")
        void testUnbalanced() {
            assertThrows(MalformedStatementException.class, () -> parser.parse("a&((b)"));
        }

        @Test
        @DisplayName("Both failure kinds share the syntax exception base")
        void testFailureKindsAreDistinct() {
            LogicSyntaxException invalid = assertThrows(LogicSyntaxException.class, () -> parser.parse("a & 1b"));
            LogicSyntaxException malformed = assertThrows(LogicSyntaxException.class, () -> parser.parse("a &"));

            assertInstanceOf(InvalidVariableNameException.class, invalid);
            assertInstanceOf(MalformedStatementException.class, malformed);
            assertFalse(malformed instanceof InvalidVariableNameException);
        }

        @Test
        @DisplayName("Null and empty expressions are rejected")
        void testNullAndEmpty() {
            assertThrows(LogicSyntaxException.class, () -> parser.parse(null));
            assertThrows(MalformedStatementException.class, () -> parser.parse(""));
            assertThrows(MalformedStatementException.class, () -> parser.parse("   "));
        }

        @Test
        @DisplayName("Expression length is bounded by the policy")
        void testPolicyLimit() {
            BasicLogicParser strict = new BasicLogicParser(LogicPolicy.strict());
            String expression = String.join("&", java.util.Collections.nCopies(600, "a"));

            assertThrows(LogicSyntaxException.class, () -> strict.parse(expression));
            assertDoesNotThrow(() -> parser.parse(expression));
        }

        @Test
        @DisplayName("Default policy accepts expressions of any length")
        void testDefaultPolicyUnbounded() {
            String expression = String.join("&", java.util.Collections.nCopies(2000, "abcd"));
            assertTrue(expression.length() > 5000);

            Statement statement = assertDoesNotThrow(() -> parser.parse(expression));
            assertEquals(List.of("abcd"), statement.variables());
        }

        @Test
        @DisplayName("Length limit is opt-in through the builder")
        void testBuilderLimit() {
            BasicLogicParser limited = new BasicLogicParser(LogicPolicy.builder().maxExpressionLength(10).build());

            assertDoesNotThrow(() -> limited.parse("a & b"));
            LogicSyntaxException e = assertThrows(LogicSyntaxException.class, () -> limited.parse("alpha & beta"));
            assertTrue(e.getMessage().contains("CUSTOM_POLICY"));
        }

        @Test
        @DisplayName("Null policies are rejected")
        void testNullPolicies() {
            assertThrows(IllegalArgumentException.class, () -> new BasicLogicParser(null));
            assertThrows(IllegalArgumentException.class, () -> new BasicLogicParser(LogicPolicy.defaults(), null));
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Repeated parses hit the cache but yield independent statements")
        void testCacheHit() {
            Statement first = parser.parse("a | b");
            Statement second = parser.parse("a | b");

            assertEquals(1, parser.getCacheStats().get("size"));
            assertEquals(first, second);
            assertNotSame(first, second);
            assertNotSame(first.registry(), second.registry());
        }

        @Test
        @DisplayName("Failed parses are not cached")
        void testFailureNotCached() {
            assertThrows(MalformedStatementException.class, () -> parser.parse("a |"));
            assertThrows(MalformedStatementException.class, () -> parser.parse("a |"));
            assertEquals(0, parser.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Cache respects its bound and can be cleared")
        void testBoundAndClear() {
            BasicLogicParser small = new BasicLogicParser(LogicPolicy.defaults(), CachePolicy.custom(2));
            small.parse("a");
            small.parse("b");
            small.parse("c");
            assertEquals(2, small.getCacheStats().get("size"));

            small.clearCache();
            assertEquals(0, small.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Disabled cache reports enabled=false")
        void testDisabledCache() {
            BasicLogicParser uncached = new BasicLogicParser(LogicPolicy.defaults(), CachePolicy.none());
            uncached.parse("a & b");
            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
        }
    }
}
