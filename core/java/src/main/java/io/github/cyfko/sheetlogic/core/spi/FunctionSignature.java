package io.github.cyfko.sheetlogic.core.spi;

/**
 * Declared arity of a function, checked at parse time.
 *
 * @param minArgs          minimum number of arguments
 * @param maxArgs          maximum number of arguments, {@link #VARIADIC} for no limit
 * @param emptyAllowedFrom first argument index that may be written as an empty slot, as in {@code IF(A1,,0)}
 * @since 1.0.0
 */
public record FunctionSignature(int minArgs, int maxArgs, int emptyAllowedFrom) {

    public static final int VARIADIC = -1;

    public FunctionSignature {
        if (minArgs < 0) {
            throw new IllegalArgumentException("minArgs cannot be negative, got: " + minArgs);
        }
        if (maxArgs != VARIADIC && maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs (" + maxArgs + ") must be >= minArgs (" + minArgs + ")");
        }
        if (emptyAllowedFrom < 0) {
            throw new IllegalArgumentException("emptyAllowedFrom cannot be negative, got: " + emptyAllowedFrom);
        }
    }

    public static FunctionSignature exactly(int count) {
        return new FunctionSignature(count, count, count);
    }

    public static FunctionSignature between(int minArgs, int maxArgs) {
        return new FunctionSignature(minArgs, maxArgs, minArgs);
    }

    public static FunctionSignature atLeast(int minArgs) {
        return new FunctionSignature(minArgs, VARIADIC, minArgs);
    }

    /**
     * Copy of this signature allowing empty slots from the given index on.
     *
     * @param index first index where an empty slot is accepted
     * @return the new signature
     */
    public FunctionSignature emptyFrom(int index) {
        return new FunctionSignature(minArgs, maxArgs, index);
    }

    public boolean accepts(int argCount) {
        return argCount >= minArgs && (maxArgs == VARIADIC || argCount <= maxArgs);
    }

    public boolean emptyAllowedAt(int index) {
        return index >= emptyAllowedFrom;
    }

    public String describe() {
        if (maxArgs == VARIADIC) return "at least " + minArgs;
        if (minArgs == maxArgs) return "exactly " + minArgs;
        return "between " + minArgs + " and " + maxArgs;
    }
}
