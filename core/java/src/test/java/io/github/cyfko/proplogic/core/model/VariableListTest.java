package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class VariableListTest {

    @Test
    @DisplayName("VariableList keeps order and is immutable")
    void variableListKeepsOrder() {
        List<String> names = new ArrayList<>(List.of("Q", "P"));
        VariableList variables = VariableList.of(names);
        names.add("R");

        assertEquals(List.of("Q", "P"), variables.names());
        assertEquals(2, variables.size());
        assertEquals("P", variables.get(1));
        assertTrue(variables.contains("Q"));
        assertThrows(UnsupportedOperationException.class, () -> variables.names().add("X"));
        assertEquals(VariableList.of("Q", "P"), variables);
        assertNotEquals(VariableList.of("P", "Q"), variables);
        assertEquals("[Q, P]", variables.toString());
    }

    @Test
    @DisplayName("VariableList rejects invalid lists")
    void variableListRejectsInvalidLists() {
        LogicValidationException exception = assertThrows(LogicValidationException.class,
                () -> VariableList.of("P", "P"));
        assertEquals(ValidationErrorKind.DUPLICATE_VARIABLE, exception.getKind());
        assertThrows(LogicValidationException.class, () -> VariableList.of());
    }

    @Test
    @DisplayName("A row holds either a result or an error")
    void rowHoldsResultOrError() {
        assertFalse(TruthTableRow.ofResult(0, List.of(true), true).hasError());
        assertTrue(TruthTableRow.ofError(0, List.of(true), "missing").hasError());
        assertThrows(IllegalArgumentException.class, () -> new TruthTableRow(0, List.of(true), true, "both"));
        assertThrows(IllegalArgumentException.class, () -> new TruthTableRow(0, List.of(true), null, null));
    }

    @Test
    @DisplayName("A table needs exactly 2^n rows")
    void tableNeedsAllRows() {
        VariableList variables = VariableList.of("P");
        List<TruthTableRow> oneRow = List.of(TruthTableRow.ofResult(0, List.of(true), true));

        assertThrows(IllegalArgumentException.class,
                () -> new TruthTable(variables, "P", oneRow, Instant.EPOCH));
    }

    @Test
    @DisplayName("Outcomes summarise failures with the exception type")
    void outcomeSummarisesFailures() {
        OperationOutcome outcome = OperationOutcome.failure(new IllegalArgumentException("bad arity"));

        assertFalse(outcome.success());
        assertEquals("IllegalArgumentException: bad arity", outcome.summary());
    }
}
