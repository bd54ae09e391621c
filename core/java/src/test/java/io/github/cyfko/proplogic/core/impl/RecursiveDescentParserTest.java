package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Expression;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecursiveDescentParser}: precedence, associativity and error reporting.
 */
@DisplayName("RecursiveDescentParser Tests")
class RecursiveDescentParserTest {

    private RecursiveDescentParser parser;

    @BeforeEach
    void setUp() {
        parser = new RecursiveDescentParser();
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Structure {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "P                               | P",
                "NOT P                           | NOT P",
                "NOT NOT P                       | NOT NOT P",
                "P AND Q OR R                    | ((P AND Q) OR R)",
                "P OR Q AND R                    | (P OR (Q AND R))",
                "NOT P AND Q                     | (NOT P AND Q)",
                "NOT (P AND Q)                   | NOT (P AND Q)",
                "P OR Q IMPLIES R                | ((P OR Q) IMPLIES R)",
                "P IMPLIES Q BICONDITIONAL R     | ((P IMPLIES Q) BICONDITIONAL R)",
                "P AND Q AND R                   | ((P AND Q) AND R)",
                "P OR Q OR R                     | ((P OR Q) OR R)",
                "P IMPLIES Q IMPLIES R           | (P IMPLIES (Q IMPLIES R))",
                "P BICONDITIONAL Q BICONDITIONAL R | (P BICONDITIONAL (Q BICONDITIONAL R))",
                "(P IMPLIES Q) IMPLIES R         | ((P IMPLIES Q) IMPLIES R)",
                "((P))                           | P"
        })
        @DisplayName("Should build the expected tree")
        void shouldBuildExpectedTree(String expression, String expected) {
            assertEquals(expected, parser.parse(expression).toString());
        }

        @Test
        @DisplayName("Symbolic aliases parse like keywords")
        void aliasesParseLikeKeywords() {
            assertEquals(parser.parse("NOT P AND Q OR R IMPLIES S BICONDITIONAL T"),
                    parser.parse("¬P ∧ Q ∨ R → S ↔ T"));
        }

        @Test
        @DisplayName("Should build typed nodes")
        void shouldBuildTypedNodes() {
            Expression ast = parser.parse("P IMPLIES NOT Q");

            Expression.Implies implies = assertInstanceOf(Expression.Implies.class, ast);
            assertEquals(new Expression.Var("P"), implies.left());
            assertEquals(new Expression.Not(new Expression.Var("Q")), implies.right());
        }

        @Test
        @DisplayName("Should list variables in first-occurrence order")
        void shouldListVariables() {
            assertEquals(List.of("Q", "P", "R"), parser.parse("Q AND (P OR Q) IMPLIES R").variables());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t\n"})
        @DisplayName("Should reject empty expressions")
        void shouldRejectEmpty(String expression) {
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse(expression));
            assertEquals(SyntaxErrorKind.EMPTY_EXPRESSION, exception.getKind());
            assertEquals(-1, exception.getColumn());
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "(P AND Q     | UNBALANCED_PARENS",
                "((P)         | UNBALANCED_PARENS",
                "P AND Q)     | UNBALANCED_PARENS",
                "P AND )      | UNBALANCED_PARENS",
                "P Q          | TRAILING_INPUT",
                "(P) (Q)      | TRAILING_INPUT",
                "P AND        | UNEXPECTED_TOKEN",
                "AND P        | UNEXPECTED_TOKEN",
                "P OR OR Q    | UNEXPECTED_TOKEN",
                "()           | UNEXPECTED_TOKEN",
                "NOT          | UNEXPECTED_TOKEN",
                "(P Q)        | UNEXPECTED_TOKEN",
                "P % Q        | UNEXPECTED_TOKEN"
        })
        @DisplayName("Should classify malformed expressions")
        void shouldClassifyMalformed(String expression, SyntaxErrorKind expected) {
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse(expression));
            assertEquals(expected, exception.getKind());
        }

        @Test
        @DisplayName("Should locate the unclosed parenthesis")
        void shouldLocateUnclosedParenthesis() {
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse("P OR (Q"));

            assertEquals(5, exception.getColumn());
            assertEquals("(", exception.getOffendingText());
            assertTrue(exception.getMessage().contains("never closed"));
        }

        @Test
        @DisplayName("Should report the dangling operator at end of input")
        void shouldReportEndOfInput() {
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse("P AND"));

            assertEquals(5, exception.getColumn());
            assertTrue(exception.getMessage().contains("end of expression"));
        }

        @Test
        @DisplayName("Should locate trailing input")
        void shouldLocateTrailingInput() {
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse("P Q"));

            assertEquals("Q", exception.getOffendingText());
            assertEquals(2, exception.getColumn());
        }
    }

    @Nested
    @DisplayName("Complexity limits")
    class ComplexityLimits {

        @Test
        @DisplayName("Should reject expression exceeding maxExpressionLength")
        void shouldRejectLongExpression() {
            // Given: strict policy with 1000 characters
            RecursiveDescentParser strict = new RecursiveDescentParser(ParserPolicy.strict(), CachePolicy.none());
            String expression = "P" + " OR P".repeat(250);

            // When / Then
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> strict.parse(expression));
            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, exception.getKind());
            assertTrue(exception.getMessage().contains("Expression too long"));
            assertTrue(exception.getMessage().contains("1251 characters"));
            assertTrue(exception.getMessage().contains("STRICT_POLICY"));
        }

        @Test
        @DisplayName("Should reject nesting deeper than maxNestingDepth")
        void shouldRejectDeepNesting() {
            // Given: depth limit of 3
            RecursiveDescentParser limited = new RecursiveDescentParser(
                    new ParserPolicy("TEST", 1000, 3), CachePolicy.none());

            // When / Then
            assertDoesNotThrow(() -> limited.parse("(((P)))"));
            assertDoesNotThrow(() -> limited.parse("NOT (NOT P)"));
            LogicSyntaxException parens = assertThrows(LogicSyntaxException.class, () -> limited.parse("((((P))))"));
            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, parens.getKind());
            assertEquals(3, parens.getColumn());
            LogicSyntaxException negations = assertThrows(LogicSyntaxException.class,
                    () -> limited.parse("NOT NOT NOT NOT P"));
            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, negations.getKind());
        }

        @Test
        @DisplayName("Sibling groups do not accumulate depth")
        void siblingGroupsDoNotAccumulateDepth() {
            RecursiveDescentParser limited = new RecursiveDescentParser(
                    new ParserPolicy("TEST", 1000, 2), CachePolicy.none());

            assertDoesNotThrow(() -> limited.parse("((P)) AND ((Q)) OR ((R))"));
        }

        @Test
        @DisplayName("Long operator chains count towards the depth limit")
        void longChainsCountTowardsDepth() {
            // Given: a left-folded chain of 2499 conjunctions, within the default length limit
            String chain = "P" + "∧P".repeat(2499);

            // When / Then
            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> parser.parse(chain));
            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, exception.getKind());
            assertTrue(exception.getMessage().contains("max depth: 256"));
            assertEquals("∧", exception.getOffendingText());
        }

        @Test
        @DisplayName("Right-folded implication chains count towards the depth limit")
        void rightFoldedChainsCountTowardsDepth() {
            RecursiveDescentParser relaxed = new RecursiveDescentParser(ParserPolicy.relaxed(), CachePolicy.none());
            String chain = "P" + "→P".repeat(9999);

            LogicSyntaxException exception = assertThrows(LogicSyntaxException.class, () -> relaxed.parse(chain));
            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, exception.getKind());
        }

        @Test
        @DisplayName("A chain exactly as deep as the limit is accepted")
        void chainAtLimitIsAccepted() {
            RecursiveDescentParser limited = new RecursiveDescentParser(
                    new ParserPolicy("TEST", 1000, 3), CachePolicy.none());

            assertEquals("(((P AND Q) AND R) AND S)", limited.parse("P AND Q AND R AND S").toString());
            assertThrows(LogicSyntaxException.class, () -> limited.parse("P AND Q AND R AND S AND T"));
            assertThrows(LogicSyntaxException.class, () -> limited.parse("NOT NOT (P AND Q AND R)"));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Should return the cached tree for identical text")
        void shouldReturnCachedTree() {
            // When
            Expression first = parser.parse("P AND Q");
            Expression second = parser.parse("P AND Q");

            // Then
            assertSame(first, second);
            Map<String, Object> stats = parser.getCacheStats();
            assertEquals(true, stats.get("enabled"));
            assertEquals(1, stats.get("size"));
            assertEquals(1L, stats.get("hits"));
            assertEquals(1L, stats.get("misses"));
        }

        @Test
        @DisplayName("Should not cache failed parses")
        void shouldNotCacheFailures() {
            assertThrows(LogicSyntaxException.class, () -> parser.parse("P AND"));
            assertThrows(LogicSyntaxException.class, () -> parser.parse("P AND"));

            assertEquals(0, parser.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("clearCache empties the cache")
        void clearCacheEmptiesCache() {
            parser.parse("P");
            parser.parse("Q");

            parser.clearCache();

            assertEquals(0, parser.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Disabled cache parses every time")
        void disabledCacheParsesEveryTime() {
            RecursiveDescentParser uncached = new RecursiveDescentParser(ParserPolicy.defaults(), CachePolicy.none());

            Expression first = uncached.parse("P OR Q");
            Expression second = uncached.parse("P OR Q");

            assertNotSame(first, second);
            assertEquals(first, second);
            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
        }

        @Test
        @DisplayName("Should reject null policies")
        void shouldRejectNullPolicies() {
            assertThrows(IllegalArgumentException.class, () -> new RecursiveDescentParser(null, CachePolicy.defaults()));
            assertThrows(IllegalArgumentException.class, () -> new RecursiveDescentParser(ParserPolicy.defaults(), null));
        }
    }
}
