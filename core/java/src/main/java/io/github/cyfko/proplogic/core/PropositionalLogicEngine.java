package io.github.cyfko.proplogic.core;

import io.github.cyfko.proplogic.core.analysis.PropertyAnalyzer;
import io.github.cyfko.proplogic.core.api.AnalysisRecorder;
import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.api.LogicalOperator;
import io.github.cyfko.proplogic.core.config.EngineConfig;
import io.github.cyfko.proplogic.core.config.TablePolicy;
import io.github.cyfko.proplogic.core.evaluation.ExpressionEvaluator;
import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;
import io.github.cyfko.proplogic.core.exception.LogicValidationException;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.impl.BoundedAnalysisRecorder;
import io.github.cyfko.proplogic.core.impl.RecursiveDescentParser;
import io.github.cyfko.proplogic.core.model.AnalysisMetrics;
import io.github.cyfko.proplogic.core.model.AnalysisRecord;
import io.github.cyfko.proplogic.core.model.EquivalenceResult;
import io.github.cyfko.proplogic.core.model.OperationKind;
import io.github.cyfko.proplogic.core.model.OperationOutcome;
import io.github.cyfko.proplogic.core.model.PropertyResult;
import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.VariableList;
import io.github.cyfko.proplogic.core.table.TruthTableGenerator;
import io.github.cyfko.proplogic.core.table.TruthTableRenderer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point of the propositional logic engine.
 * <p>
 * Every analysis operation runs the pipeline tokenize, parse, evaluate or tabulate, analyze, and is
 * then recorded in the shared {@link AnalysisRecorder} with its duration and outcome, whether it
 * succeeded or failed. Failures are rethrown unchanged after being recorded.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The engine is safe for concurrent use. Parsing, evaluation and table generation only touch
 * call-local data; the recorder serializes its own updates.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PropositionalLogicEngine engine = new PropositionalLogicEngine();
 *
 * boolean r = engine.evaluate("P AND Q", Map.of("P", true, "Q", false));          // false
 * PropertyResult t = engine.detectTautology("P OR NOT P", List.of("P"));          // tautology
 * EquivalenceResult e = engine.checkEquivalence(
 *         "P IMPLIES Q", "NOT P OR Q", List.of("P", "Q"));                           // equivalent
 *
 * PropositionalLogicEngine strict = new PropositionalLogicEngine(EngineConfig.builder()
 *         .parserPolicy(ParserPolicy.strict())
 *         .tablePolicy(TablePolicy.strict())
 *         .build());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PropositionalLogicEngine {

    private static final Logger log = Logger.getLogger(PropositionalLogicEngine.class.getName());

    private final ExpressionParser parser;
    private final AnalysisRecorder recorder;
    private final TruthTableGenerator generator;

    public PropositionalLogicEngine() {
        this(EngineConfig.defaults());
    }

    public PropositionalLogicEngine(EngineConfig config) {
        this(new RecursiveDescentParser(
                        Objects.requireNonNull(config, "config").getParserPolicy(), config.getCachePolicy()),
                new BoundedAnalysisRecorder(config.getRecorderPolicy(), Clock.systemUTC()),
                config.getTablePolicy(),
                Clock.systemUTC());
    }

    /**
     * Assembles an engine from its collaborators.
     *
     * @param parser      expression parser
     * @param recorder    analysis recorder shared by every operation
     * @param tablePolicy truth table limits
     * @param clock       clock stamped on generated tables
     */
    public PropositionalLogicEngine(ExpressionParser parser, AnalysisRecorder recorder, TablePolicy tablePolicy, Clock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.generator = new TruthTableGenerator(parser, tablePolicy, clock);
    }

    /**
     * Evaluates an expression under one assignment.
     *
     * @param expression the expression text
     * @param assignment truth values by variable name; extra entries are ignored
     * @return the truth value
     * @throws LogicSyntaxException       if the expression is malformed
     * @throws UndefinedVariableException if a referenced variable has no value
     */
    public boolean evaluate(String expression, Map<String, Boolean> assignment) {
        Objects.requireNonNull(assignment, "assignment");
        return run(OperationKind.EVALUATE, List.of(nullSafe(expression)), new ArrayList<>(assignment.keySet()),
                () -> ExpressionEvaluator.evaluate(parser.parse(expression), assignment),
                Object::toString);
    }

    /**
     * @param variables  the columns, in enumeration order
     * @param expression the expression text
     * @return the complete truth table, with error rows for unassigned references
     * @throws LogicValidationException if the variable list is invalid or too long
     * @throws LogicSyntaxException     if the expression is malformed
     */
    public TruthTable generateTruthTable(List<String> variables, String expression) {
        return run(OperationKind.TRUTH_TABLE, List.of(nullSafe(expression)), variables,
                () -> generator.generate(VariableList.of(variables), expression),
                table -> String.format("%d rows, %d errors", table.rowCount(), table.errorRowCount()));
    }

    /**
     * Same as {@link #generateTruthTable(List, String)}, rendered with {@link TruthTableRenderer}.
     */
    public String renderTruthTable(List<String> variables, String expression) {
        return run(OperationKind.TRUTH_TABLE, List.of(nullSafe(expression)), variables,
                () -> TruthTableRenderer.render(generator.generate(VariableList.of(variables), expression)),
                text -> "rendered " + text.length() + " characters");
    }

    public PropertyResult detectTautology(String expression, List<String> variables) {
        return run(OperationKind.TAUTOLOGY, List.of(nullSafe(expression)), variables,
                () -> PropertyAnalyzer.analyze(generator.generate(VariableList.of(variables), expression)),
                result -> "tautology=" + result.isTautology());
    }

    public PropertyResult detectContradiction(String expression, List<String> variables) {
        return run(OperationKind.CONTRADICTION, List.of(nullSafe(expression)), variables,
                () -> PropertyAnalyzer.analyze(generator.generate(VariableList.of(variables), expression)),
                result -> "contradiction=" + result.isContradiction());
    }

    public PropertyResult checkSatisfiability(String expression, List<String> variables) {
        return run(OperationKind.SATISFIABILITY, List.of(nullSafe(expression)), variables,
                () -> PropertyAnalyzer.analyze(generator.generate(VariableList.of(variables), expression)),
                result -> "satisfiable=" + result.isSatisfiable());
    }

    /**
     * Compares two expressions over the same variables.
     *
     * @return the comparison; rows where either side failed to evaluate count as differing
     * @throws LogicSyntaxException     if either expression is malformed
     * @throws LogicValidationException if the variable list is invalid or too long
     */
    public EquivalenceResult checkEquivalence(String first, String second, List<String> variables) {
        return run(OperationKind.EQUIVALENCE, List.of(nullSafe(first), nullSafe(second)), variables,
                () -> {
                    VariableList columns = VariableList.of(variables);
                    TruthTable left = generator.generate(columns, first);
                    TruthTable right = generator.generate(columns, second);
                    return PropertyAnalyzer.checkEquivalence(left, right);
                },
                result -> String.format("equivalent=%s, confidence=%.2f%%", result.areEquivalent(), result.confidence()));
    }

    /**
     * Applies a single connective to literal operands.
     *
     * @throws IllegalArgumentException if the operand count does not match the operator arity
     */
    public boolean applyOperator(LogicalOperator operator, boolean... operands) {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operands, "operands");
        String rendered = operator.keyword() + " " + Arrays.toString(operands);
        return run(OperationKind.OPERATOR, List.of(rendered), List.of(),
                () -> operator.apply(operands),
                Object::toString);
    }

    public AnalysisMetrics getMetrics() {
        return recorder.getMetrics();
    }

    public List<AnalysisRecord> getHistory(OperationKind kind, int limit) {
        return recorder.history(kind, limit);
    }

    public List<AnalysisRecord> getHistory(int limit) {
        return recorder.history(limit);
    }

    public void clearHistory() {
        recorder.clear();
    }

    private <T> T run(OperationKind kind,
                      List<String> expressions,
                      List<String> variables,
                      Supplier<T> operation,
                      Function<T, String> summary) {
        List<String> recordedVariables = variables == null ? List.of() : nullSafe(variables);
        long start = System.nanoTime();
        try {
            T result = operation.get();
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            String text = summary.apply(result);
            recorder.record(kind, expressions, recordedVariables, OperationOutcome.success(text), duration);
            log.info(() -> String.format("%s on %s completed in %d µs: %s",
                    kind, expressions, duration.toNanos() / 1_000, text));
            return result;
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            recorder.record(kind, expressions, recordedVariables, OperationOutcome.failure(e), duration);
            log.warning(() -> String.format("%s on %s failed after %d µs: %s",
                    kind, expressions, duration.toNanos() / 1_000, e.getMessage()));
            throw e;
        }
    }

    private static String nullSafe(String text) {
        return text == null ? "" : text;
    }

    // records keep copies made with List.copyOf, which rejects null elements
    private static List<String> nullSafe(List<String> names) {
        List<String> copy = new ArrayList<>(names.size());
        for (String name : names) {
            copy.add(nullSafe(name));
        }
        return copy;
    }
}
