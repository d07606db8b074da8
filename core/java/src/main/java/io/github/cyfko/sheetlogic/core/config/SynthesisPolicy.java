package io.github.cyfko.sheetlogic.core.config;

/**
 * Configuration of regression test synthesis.
 *
 * <ul>
 *   <li><strong>includeBoundaries</strong>: emit boundary cases for numeric inputs (default: true)</li>
 *   <li><strong>includeListOptions</strong>: emit one case per list-validation option (default: true)</li>
 *   <li><strong>maxCasesPerCluster</strong>: cap on cases per cluster after deduplication (default: 200)</li>
 * </ul>
 *
 * @param includeBoundaries  whether boundary cases are generated
 * @param includeListOptions whether list-option cases are generated
 * @param maxCasesPerCluster maximum number of cases kept per cluster
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SynthesisPolicy(
        boolean includeBoundaries,
        boolean includeListOptions,
        int maxCasesPerCluster
) {

    public SynthesisPolicy {
        if (maxCasesPerCluster <= 0) {
            throw new IllegalArgumentException("maxCasesPerCluster must be positive, got: " + maxCasesPerCluster);
        }
    }

    public static SynthesisPolicy defaults() {
        return new SynthesisPolicy(true, true, 200);
    }

    /**
     * Only the observed baseline case per cluster.
     *
     * @return observation-only configuration
     */
    public static SynthesisPolicy observedOnly() {
        return new SynthesisPolicy(false, false, 1);
    }
}
