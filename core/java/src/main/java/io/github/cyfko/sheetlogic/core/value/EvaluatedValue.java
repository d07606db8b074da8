package io.github.cyfko.sheetlogic.core.value;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Result of evaluating a cell or a sub-expression.
 * <p>
 * Values follow spreadsheet semantics: arithmetic on text or on missing cells never throws, it
 * degrades to an {@link ErrorValue}. Dates are day serials tagged as {@link DateSerialValue}; they
 * share the numeric value space and differ from plain numbers only by their type tag.
 * </p>
 *
 * <pre>{@code
 * EvaluatedValue sum = EvaluatedValue.number(6);
 * EvaluatedValue failure = EvaluatedValue.error(ErrorKind.DIV_ZERO);
 * failure.isError();           // true
 * sum.type();                  // ValueType.NUMBER
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface EvaluatedValue
        permits EvaluatedValue.NumberValue, EvaluatedValue.TextValue, EvaluatedValue.BooleanValue,
        EvaluatedValue.DateSerialValue, EvaluatedValue.ErrorValue, EvaluatedValue.EmptyValue {

    ValueType type();

    /**
     * Returns the spreadsheet display text of the value.
     *
     * @return display text
     */
    String display();

    default boolean isError() {
        return this instanceof ErrorValue;
    }

    default boolean isEmpty() {
        return this instanceof EmptyValue;
    }

    /**
     * Whether the value lives in the numeric value space (plain numbers and date serials).
     *
     * @return true for numbers and dates
     */
    default boolean isNumeric() {
        return this instanceof NumberValue || this instanceof DateSerialValue;
    }

    static EvaluatedValue number(double value) {
        return new NumberValue(value);
    }

    static EvaluatedValue text(String value) {
        return new TextValue(value);
    }

    static EvaluatedValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static EvaluatedValue date(double serial) {
        return new DateSerialValue(serial);
    }

    static EvaluatedValue error(ErrorKind kind) {
        return new ErrorValue(kind);
    }

    static EvaluatedValue empty() {
        return EmptyValue.INSTANCE;
    }

    /**
     * Converts a plain Java value (as produced by an upstream classifier) into an evaluated value.
     * Numbers become {@link NumberValue}, booleans {@link BooleanValue}, strings {@link TextValue},
     * {@code null} becomes {@link EmptyValue}; anything else is rendered as text.
     *
     * @param raw the raw value
     * @return the evaluated value
     */
    static EvaluatedValue of(Object raw) {
        if (raw == null) return empty();
        if (raw instanceof EvaluatedValue value) return value;
        if (raw instanceof Number number) return number(number.doubleValue());
        if (raw instanceof Boolean flag) return bool(flag);
        return text(raw.toString());
    }

    /**
     * Interprets option text the way a spreadsheet interprets typed input:
     * numeric text becomes a number, {@code TRUE}/{@code FALSE} a boolean, blank text empty,
     * and everything else stays text.
     *
     * @param input the typed text
     * @return the interpreted value
     */
    static EvaluatedValue parse(String input) {
        if (input == null || input.isBlank()) return empty();
        String trimmed = input.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper)) return bool(true);
        if ("FALSE".equals(upper)) return bool(false);
        OptionalDouble number = ValueFormat.parseNumber(trimmed);
        return number.isPresent() ? number(number.getAsDouble()) : text(input);
    }

    record NumberValue(double value) implements EvaluatedValue {
        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }

        @Override
        public String display() {
            return ValueFormat.formatNumber(value);
        }
    }

    record TextValue(String value) implements EvaluatedValue {
        public TextValue {
            value = value == null ? "" : value;
        }

        @Override
        public ValueType type() {
            return ValueType.TEXT;
        }

        @Override
        public String display() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements EvaluatedValue {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public String display() {
            return ValueFormat.formatBoolean(value);
        }
    }

    record DateSerialValue(double serial) implements EvaluatedValue {
        @Override
        public ValueType type() {
            return ValueType.DATE;
        }

        @Override
        public String display() {
            return ValueFormat.formatNumber(serial);
        }
    }

    record ErrorValue(ErrorKind kind) implements EvaluatedValue {
        public ErrorValue {
            if (kind == null) {
                throw new IllegalArgumentException("error kind is required");
            }
        }

        @Override
        public ValueType type() {
            return ValueType.ERROR;
        }

        @Override
        public String display() {
            return kind.code();
        }
    }

    record EmptyValue() implements EvaluatedValue {
        static final EmptyValue INSTANCE = new EmptyValue();

        @Override
        public ValueType type() {
            return ValueType.EMPTY;
        }

        @Override
        public String display() {
            return "";
        }
    }
}
