package io.github.cyfko.proplogic.core.config;

/**
 * Complexity limits applied by the expression parser for DoS protection.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of the trimmed expression</li>
 *   <li><strong>maxNestingDepth</strong>: maximum depth of nested parentheses and negations, and maximum
 *       height of the parsed tree, where every connective adds one level. A chain such as
 *       {@code P AND P AND ... AND P} is as deep as it has operators.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.defaults(); // 5000 chars, depth 256
 * ParserPolicy policy = ParserPolicy.strict();   // 1000 chars, depth 64
 * ParserPolicy policy = ParserPolicy.relaxed();  // 20000 chars, depth 1024
 * }</pre>
 *
 * @param policyName          name reported in error messages
 * @param maxExpressionLength maximum character length of expression string
 * @param maxNestingDepth     maximum nesting depth of the parsed tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxExpressionLength,
        int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    public static ParserPolicy defaults() {
        return new ParserPolicy("DEFAULT_POLICY", 5000, 256);
    }

    /**
     * Strict configuration for expressions coming from untrusted clients.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy("STRICT_POLICY", 1000, 64);
    }

    /**
     * Relaxed configuration for trusted batch processing of large formulas.
     * <p>
     * Deep nesting consumes thread stack; callers raising the depth further should run the engine on
     * threads with an enlarged stack size.
     * </p>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy("RELAXED_POLICY", 20000, 1024);
    }
}
