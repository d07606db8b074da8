package io.github.cyfko.sheetlogic.core.parsing;

/**
 * A construct the parser accepted but the compiler cannot translate faithfully.
 *
 * @param function    upper-case function name involved
 * @param featureType category of the construct
 * @param reason      human-readable explanation
 * @param position    offset in the formula text
 * @since 1.0.0
 */
public record UnsupportedConstruct(String function, FeatureType featureType, String reason, int position) {

    public enum FeatureType {
        /** A reference computed at run time: {@code INDIRECT}, {@code OFFSET}, {@code ADDRESS}. */
        DYNAMIC_REFERENCE,
        /** A function missing from the registry; it evaluates to {@code #NAME?}. */
        UNKNOWN_FUNCTION
    }
}
