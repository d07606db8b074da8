package io.github.cyfko.sheetlogic.core.value;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Text rendering of scalar values, shared by the {@code &} operator, text functions and the formula printer,
 * and the one reading of numeric text used by coercions and criteria.
 *
 * @since 1.0.0
 */
public final class ValueFormat {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private ValueFormat() {}

    /**
     * Reads text the way a spreadsheet reads a typed number: plain decimal notation with an
     * optional exponent and an optional trailing {@code %}. Surrounding blanks are ignored.
     * <pre>{@code
     * parseNumber(" 1.5e3 ") // 1500
     * parseNumber("25%")     // 0.25
     * parseNumber("1d")      // empty
     * parseNumber("NaN")     // empty
     * }</pre>
     *
     * @param text the text
     * @return the number, or empty when the text is not a finite decimal number
     */
    public static OptionalDouble parseNumber(String text) {
        if (text == null) return OptionalDouble.empty();
        String trimmed = text.trim();
        boolean percent = trimmed.endsWith("%");
        if (percent) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        OptionalDouble number = parseDecimal(trimmed);
        if (percent && number.isPresent()) {
            return OptionalDouble.of(number.getAsDouble() / 100);
        }
        return number;
    }

    /**
     * Like {@link #parseNumber(String)} without the {@code %} suffix and without trimming.
     *
     * @param text the text
     * @return the number, or empty when the text is not a finite decimal number
     */
    public static OptionalDouble parseDecimal(String text) {
        if (text == null || !DECIMAL.matcher(text).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(text);
        return Double.isInfinite(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Formats a number without trailing zeros and without exponent notation.
     * <pre>{@code
     * formatNumber(3.0)   // "3"
     * formatNumber(2.50)  // "2.5"
     * formatNumber(-0.0)  // "0"
     * }</pre>
     *
     * @param value the number
     * @return its text form
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0) return "0";
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }
}
