package io.github.cyfko.proplogic.core.model;

/**
 * Kinds of engine operations tracked by the analysis recorder.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperationKind {
    EVALUATE,
    TRUTH_TABLE,
    TAUTOLOGY,
    CONTRADICTION,
    SATISFIABILITY,
    EQUIVALENCE,
    /** Direct application of a single connective to literal truth values. */
    OPERATOR
}
