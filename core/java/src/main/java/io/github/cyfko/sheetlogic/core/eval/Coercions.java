package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueFormat;

import java.util.Locale;

/**
 * Spreadsheet coercion table.
 *
 * <table>
 *   <caption>Coercions</caption>
 *   <tr><th>from</th><th>number</th><th>text</th><th>boolean</th></tr>
 *   <tr><td>number / date</td><td>itself</td><td>no trailing zeros</td><td>non-zero</td></tr>
 *   <tr><td>text</td><td>parsed, else {@code #VALUE!}</td><td>itself</td><td>TRUE/FALSE, else {@code #VALUE!}</td></tr>
 *   <tr><td>boolean</td><td>1 / 0</td><td>TRUE / FALSE</td><td>itself</td></tr>
 *   <tr><td>empty</td><td>0</td><td>""</td><td>FALSE</td></tr>
 *   <tr><td>error</td><td colspan="3">propagated</td></tr>
 * </table>
 *
 * <p>Every method throws {@link EvaluationError} instead of returning an error value.</p>
 *
 * @since 1.0.0
 */
public final class Coercions {

    private Coercions() {}

    public static double toNumber(EvaluatedValue value) {
        if (value instanceof EvaluatedValue.NumberValue number) return number.value();
        if (value instanceof EvaluatedValue.DateSerialValue date) return date.serial();
        if (value instanceof EvaluatedValue.BooleanValue flag) return flag.value() ? 1 : 0;
        if (value instanceof EvaluatedValue.EmptyValue) return 0;
        if (value instanceof EvaluatedValue.ErrorValue error) throw new EvaluationError(error.kind());
        return ValueFormat.parseNumber(((EvaluatedValue.TextValue) value).value())
                .orElseThrow(() -> new EvaluationError(ErrorKind.VALUE));
    }

    /**
     * Integer coercion truncating toward negative infinity, as spreadsheet index arguments do.
     *
     * @param value the value
     * @return the floored integer
     */
    public static int toInteger(EvaluatedValue value) {
        double number = toNumber(value);
        if (Double.isNaN(number) || Math.abs(number) > Integer.MAX_VALUE) {
            throw new EvaluationError(ErrorKind.NUM);
        }
        return (int) Math.floor(number);
    }

    public static String toText(EvaluatedValue value) {
        if (value instanceof EvaluatedValue.TextValue text) return text.value();
        if (value instanceof EvaluatedValue.NumberValue number) return ValueFormat.formatNumber(number.value());
        if (value instanceof EvaluatedValue.DateSerialValue date) return ValueFormat.formatNumber(date.serial());
        if (value instanceof EvaluatedValue.BooleanValue flag) return ValueFormat.formatBoolean(flag.value());
        if (value instanceof EvaluatedValue.EmptyValue) return "";
        throw new EvaluationError(((EvaluatedValue.ErrorValue) value).kind());
    }

    public static boolean toBoolean(EvaluatedValue value) {
        if (value instanceof EvaluatedValue.BooleanValue flag) return flag.value();
        if (value instanceof EvaluatedValue.NumberValue number) return number.value() != 0;
        if (value instanceof EvaluatedValue.DateSerialValue date) return date.serial() != 0;
        if (value instanceof EvaluatedValue.EmptyValue) return false;
        if (value instanceof EvaluatedValue.ErrorValue error) throw new EvaluationError(error.kind());
        String text = ((EvaluatedValue.TextValue) value).value().trim().toUpperCase(Locale.ROOT);
        if ("TRUE".equals(text)) return true;
        if ("FALSE".equals(text)) return false;
        throw new EvaluationError(ErrorKind.VALUE);
    }

    /**
     * Throws the error carried by {@code value}, if any.
     *
     * @param value the value to check
     * @return the same value when it is not an error
     */
    public static EvaluatedValue requireNoError(EvaluatedValue value) {
        if (value instanceof EvaluatedValue.ErrorValue error) {
            throw new EvaluationError(error.kind());
        }
        return value;
    }

    /**
     * Wraps a computed double, mapping NaN and infinities to {@code #NUM!}.
     *
     * @param result the computed number
     * @return a number value
     */
    public static EvaluatedValue number(double result) {
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        return EvaluatedValue.number(result == 0 ? 0 : result);
    }
}
