package io.github.cyfko.proplogic.core.utils;

import io.github.cyfko.proplogic.core.config.TablePolicy;
import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariableValidationUtils Tests")
class VariableValidationUtilsTest {

    @Nested
    @DisplayName("Variable lists")
    class VariableLists {

        @Test
        @DisplayName("Should accept distinct identifiers")
        void shouldAcceptDistinctIdentifiers() {
            ValidationResult result = VariableValidationUtils.validate(List.of("P", "q", "_tmp", "x1"));

            assertTrue(result.isValid());
            assertSame(ValidationResult.success(), result);
        }

        @Test
        @DisplayName("Should reject an empty list")
        void shouldRejectEmptyList() {
            ValidationResult result = VariableValidationUtils.validate(List.of());

            assertFalse(result.isValid());
            assertEquals(ValidationErrorKind.EMPTY_VARIABLE_LIST, result.getErrorKind());
        }

        @Test
        @DisplayName("Should report the first duplicate")
        void shouldRejectDuplicates() {
            ValidationResult result = VariableValidationUtils.validate(List.of("P", "Q", "P"));

            assertEquals(ValidationErrorKind.DUPLICATE_VARIABLE, result.getErrorKind());
            assertEquals("Duplicate variable name 'P' at index 2", result.getErrorMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1x", "a-b", "AND", "NOT", "BICONDITIONAL"})
        @DisplayName("Should reject invalid names and keywords")
        void shouldRejectInvalidNames(String name) {
            ValidationResult result = VariableValidationUtils.validate(List.of("P", name));

            assertEquals(ValidationErrorKind.INVALID_VARIABLE_NAME, result.getErrorKind());
            assertTrue(result.getErrorMessage().contains("index 1"));
        }

        @Test
        @DisplayName("Should reject null names and null lists")
        void shouldRejectNulls() {
            assertEquals(ValidationErrorKind.INVALID_VARIABLE_NAME,
                    VariableValidationUtils.validate(Arrays.asList("P", null)).getErrorKind());
            assertThrows(NullPointerException.class, () -> VariableValidationUtils.validate(null));
        }
    }

    @Nested
    @DisplayName("Table size")
    class TableSize {

        @Test
        @DisplayName("Should accept sizes up to the policy limit")
        void shouldAcceptWithinLimit() {
            assertTrue(VariableValidationUtils.validateTableSize(12, TablePolicy.strict()).isValid());
        }

        @Test
        @DisplayName("Should reject sizes above the policy limit")
        void shouldRejectAboveLimit() {
            ValidationResult result = VariableValidationUtils.validateTableSize(13, TablePolicy.strict());

            assertEquals(ValidationErrorKind.TOO_MANY_VARIABLES, result.getErrorKind());
            LogicValidationException exception = assertThrows(LogicValidationException.class, result::throwIfInvalid);
            assertEquals(ValidationErrorKind.TOO_MANY_VARIABLES, exception.getKind());
            assertEquals(result.getErrorMessage(), exception.getMessage());
        }
    }

    @Test
    @DisplayName("ValidationResult describes itself")
    void validationResultToString() {
        assertEquals("ValidationResult[valid=true]", ValidationResult.success().toString());
        assertTrue(ValidationResult.failure(ValidationErrorKind.VARIABLE_MISMATCH, "nope").toString()
                .contains("kind=VARIABLE_MISMATCH"));
        assertDoesNotThrow(() -> ValidationResult.success().throwIfInvalid());
    }
}
