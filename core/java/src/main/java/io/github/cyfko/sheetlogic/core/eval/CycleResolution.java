package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.graph.CircularRef;

/**
 * How a circular reference was settled during one cluster evaluation.
 *
 * @param cycle      the circular reference
 * @param outcome    result of the resolution
 * @param iterations iterations performed, 0 for error cycles
 * @since 1.0.0
 */
public record CycleResolution(CircularRef cycle, Outcome outcome, int iterations) {

    public enum Outcome {
        /** Successive iterations differed by less than the threshold for every member. */
        CONVERGED,
        /** The iteration limit was reached first; members hold {@code #DIDNOTCONVERGE!}. */
        DID_NOT_CONVERGE,
        /** Error cycle, or an iterative cycle producing non-numeric values; members hold {@code #CIRCULAR!}. */
        CIRCULAR
    }
}
