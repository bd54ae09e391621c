package io.github.cyfko.proplogic.core.evaluation;

import io.github.cyfko.proplogic.core.api.Expression;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.impl.RecursiveDescentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpressionEvaluator Tests")
class ExpressionEvaluatorTest {

    private final RecursiveDescentParser parser = new RecursiveDescentParser();

    private boolean eval(String expression, boolean a, boolean b) {
        return ExpressionEvaluator.evaluate(parser.parse(expression), Map.of("a", a, "b", b));
    }

    @Nested
    @DisplayName("Connectives")
    class Connectives {

        @ParameterizedTest(name = "a={0}, b={1}")
        @CsvSource({"true, true", "true, false", "false, true", "false, false"})
        @DisplayName("Should match the truth function of every connective")
        void shouldMatchTruthFunctions(boolean a, boolean b) {
            assertEquals(a && b, eval("a AND b", a, b));
            assertEquals(a || b, eval("a OR b", a, b));
            assertEquals(!a, eval("NOT a", a, b));
            assertEquals(!a || b, eval("a IMPLIES b", a, b));
            assertEquals(a == b, eval("a BICONDITIONAL b", a, b));
        }

        @ParameterizedTest(name = "a={0}, b={1}")
        @CsvSource({"true, true", "true, false", "false, true", "false, false"})
        @DisplayName("Symbolic aliases evaluate like keywords")
        void aliasesEvaluateLikeKeywords(boolean a, boolean b) {
            assertEquals(eval("NOT a AND b OR a IMPLIES b BICONDITIONAL a", a, b),
                    eval("¬a ∧ b ∨ a → b ↔ a", a, b));
        }

        @Test
        @DisplayName("Implication chains associate to the right")
        void implicationIsRightAssociative() {
            // Given: P=false, Q=true, R=false
            Map<String, Boolean> assignment = Map.of("P", false, "Q", true, "R", false);

            // Then: P -> (Q -> R) is true, (P -> Q) -> R would be false
            assertTrue(ExpressionEvaluator.evaluate(parser.parse("P IMPLIES Q IMPLIES R"), assignment));
            assertFalse(ExpressionEvaluator.evaluate(parser.parse("(P IMPLIES Q) IMPLIES R"), assignment));
        }

        @Test
        @DisplayName("Should ignore extra assignment entries")
        void shouldIgnoreExtraEntries() {
            assertTrue(ExpressionEvaluator.evaluate(new Expression.Var("P"), Map.of("P", true, "Unused", false)));
        }
    }

    @Nested
    @DisplayName("Undefined variables")
    class UndefinedVariables {

        @Test
        @DisplayName("Should name the missing variable")
        void shouldNameMissingVariable() {
            UndefinedVariableException exception = assertThrows(UndefinedVariableException.class,
                    () -> ExpressionEvaluator.evaluate(parser.parse("P AND Q"), Map.of("P", true)));

            assertEquals("Q", exception.getVariableName());
            assertTrue(exception.getMessage().contains("'Q'"));
        }

        @Test
        @DisplayName("Should report the missing variable even when the left operand decides")
        void shouldEvaluateBothOperands() {
            // Given: P=false decides P AND Q alone
            Expression ast = parser.parse("P AND Q");

            // Then
            assertThrows(UndefinedVariableException.class,
                    () -> ExpressionEvaluator.evaluate(ast, Map.of("P", false)));
        }

        @Test
        @DisplayName("A null value counts as missing")
        void nullValueCountsAsMissing() {
            Map<String, Boolean> assignment = new HashMap<>();
            assignment.put("P", null);

            UndefinedVariableException exception = assertThrows(UndefinedVariableException.class,
                    () -> ExpressionEvaluator.evaluate(parser.parse("NOT P"), assignment));
            assertEquals("P", exception.getVariableName());
        }
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNullArguments() {
        assertThrows(NullPointerException.class, () -> ExpressionEvaluator.evaluate(null, Map.of()));
        assertThrows(NullPointerException.class, () -> ExpressionEvaluator.evaluate(new Expression.Var("P"), null));
    }
}
