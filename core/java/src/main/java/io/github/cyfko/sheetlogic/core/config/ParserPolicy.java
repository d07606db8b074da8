package io.github.cyfko.sheetlogic.core.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration of the formula parser and of reference expansion.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxFormulaLength</strong>: Maximum character length of a formula (default: 8192)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum parenthesis nesting (default: 64)</li>
 *   <li><strong>maxRangeExpansion</strong>: Largest range materialized into individual graph edges (default: 1000)</li>
 *   <li><strong>dynamicFunctions</strong>: Functions computing references at runtime; parsed into
 *       placeholders and reported as unsupported (default: INDIRECT, OFFSET, ADDRESS)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.defaults();
 * ParserPolicy policy = ParserPolicy.strict();
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxRangeExpansion(10_000)
 *     .build();
 * }</pre>
 *
 * @param policyName        name of the policy, used in error messages
 * @param maxFormulaLength  maximum formula length in characters
 * @param maxNestingDepth   maximum parenthesis nesting depth
 * @param maxRangeExpansion maximum number of cells a range may expand into
 * @param dynamicFunctions  upper-case names of runtime-reference functions
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxFormulaLength,
        int maxNestingDepth,
        int maxRangeExpansion,
        Set<String> dynamicFunctions
) {

    private static final Set<String> DEFAULT_DYNAMIC_FUNCTIONS = Set.of("INDIRECT", "OFFSET", "ADDRESS");

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxFormulaLength <= 0) {
            throw new IllegalArgumentException("maxFormulaLength must be positive, got: " + maxFormulaLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (maxRangeExpansion <= 0) {
            throw new IllegalArgumentException("maxRangeExpansion must be positive, got: " + maxRangeExpansion);
        }
        if (dynamicFunctions == null) {
            throw new IllegalArgumentException("dynamicFunctions is required");
        }
        dynamicFunctions = dynamicFunctions.stream()
                .map(name -> name.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Formula Length: 8192 characters (the spreadsheet application limit)</li>
     *   <li>Max Nesting Depth: 64</li>
     *   <li>Max Range Expansion: 1000 cells</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 8192, 64, 1000, DEFAULT_DYNAMIC_FUNCTIONS);
    }

    /**
     * Strict configuration for untrusted workbooks.
     * <ul>
     *   <li>Max Formula Length: 2048 characters</li>
     *   <li>Max Nesting Depth: 16</li>
     *   <li>Max Range Expansion: 500 cells</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 2048, 16, 500, DEFAULT_DYNAMIC_FUNCTIONS);
    }

    /**
     * Relaxed configuration for large trusted models.
     * <ul>
     *   <li>Max Formula Length: 32768 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     *   <li>Max Range Expansion: 100 000 cells</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 32768, 128, 100_000, DEFAULT_DYNAMIC_FUNCTIONS);
    }

    /**
     * Whether the given function computes a reference at runtime.
     *
     * @param functionName function name, any case
     * @return true for dynamic-reference functions
     */
    public boolean isDynamic(String functionName) {
        return functionName != null && dynamicFunctions.contains(functionName.toUpperCase(Locale.ROOT));
    }

    /**
     * Creates a custom configuration, initialized exactly as {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxFormulaLength = 8192;
        private int _maxNestingDepth = 64;
        private int _maxRangeExpansion = 1000;
        private Set<String> _dynamicFunctions = DEFAULT_DYNAMIC_FUNCTIONS;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxFormulaLength, _maxNestingDepth, _maxRangeExpansion, _dynamicFunctions);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxFormulaLength(int maxFormulaLength) { this._maxFormulaLength = maxFormulaLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder maxRangeExpansion(int maxRangeExpansion) { this._maxRangeExpansion = maxRangeExpansion; return this; }
        public Builder dynamicFunctions(Set<String> dynamicFunctions) { this._dynamicFunctions = dynamicFunctions; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
