package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.ast.AffixOperator;
import io.github.cyfko.sheetlogic.core.ast.InfixOperator;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Locale;

/**
 * Operator semantics, one function per operator.
 * <p>
 * Errors propagate leftmost first. Comparisons never produce errors: ordering between values of
 * different kinds is {@code FALSE}, while {@code =} and {@code <>} compare structurally with
 * case-insensitive text and a blank equal to {@code 0}, {@code ""} and {@code FALSE}.
 * Date serials keep their date tag through {@code date ± number}; {@code date - date} is a number.
 * </p>
 *
 * @since 1.0.0
 */
public final class Operators {

    private Operators() {}

    public static EvaluatedValue apply(InfixOperator op, EvaluatedValue left, EvaluatedValue right) {
        if (left.isError()) return left;
        if (right.isError()) return right;
        try {
            return switch (op) {
                case ADD -> add(left, right);
                case SUBTRACT -> subtract(left, right);
                case MULTIPLY -> Coercions.number(Coercions.toNumber(left) * Coercions.toNumber(right));
                case DIVIDE -> divide(left, right);
                case POWER -> power(left, right);
                case CONCAT -> EvaluatedValue.text(Coercions.toText(left) + Coercions.toText(right));
                case EQ -> EvaluatedValue.bool(looselyEqual(left, right));
                case NE -> EvaluatedValue.bool(!looselyEqual(left, right));
                case LT -> EvaluatedValue.bool(order(left, right) < 0 && comparable(left, right));
                case GT -> EvaluatedValue.bool(order(left, right) > 0 && comparable(left, right));
                case LE -> EvaluatedValue.bool(comparable(left, right) && order(left, right) <= 0);
                case GE -> EvaluatedValue.bool(comparable(left, right) && order(left, right) >= 0);
            };
        } catch (EvaluationError e) {
            return e.toValue();
        }
    }

    public static EvaluatedValue apply(AffixOperator op, EvaluatedValue operand) {
        if (operand.isError()) return operand;
        try {
            return switch (op) {
                case NEGATE -> Coercions.number(-Coercions.toNumber(operand));
                case PLUS -> operand;
                case PERCENT -> Coercions.number(Coercions.toNumber(operand) / 100);
            };
        } catch (EvaluationError e) {
            return e.toValue();
        }
    }

    private static EvaluatedValue add(EvaluatedValue left, EvaluatedValue right) {
        double sum = Coercions.toNumber(left) + Coercions.toNumber(right);
        boolean leftDate = left instanceof EvaluatedValue.DateSerialValue;
        boolean rightDate = right instanceof EvaluatedValue.DateSerialValue;
        return leftDate != rightDate ? date(sum) : Coercions.number(sum);
    }

    private static EvaluatedValue subtract(EvaluatedValue left, EvaluatedValue right) {
        double difference = Coercions.toNumber(left) - Coercions.toNumber(right);
        boolean leftDate = left instanceof EvaluatedValue.DateSerialValue;
        boolean rightDate = right instanceof EvaluatedValue.DateSerialValue;
        return leftDate && !rightDate ? date(difference) : Coercions.number(difference);
    }

    private static EvaluatedValue divide(EvaluatedValue left, EvaluatedValue right) {
        double numerator = Coercions.toNumber(left);
        double denominator = Coercions.toNumber(right);
        if (denominator == 0) {
            return EvaluatedValue.error(ErrorKind.DIV_ZERO);
        }
        return Coercions.number(numerator / denominator);
    }

    private static EvaluatedValue power(EvaluatedValue left, EvaluatedValue right) {
        double base = Coercions.toNumber(left);
        double exponent = Coercions.toNumber(right);
        if (base == 0 && exponent == 0) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        if (base == 0 && exponent < 0) {
            return EvaluatedValue.error(ErrorKind.DIV_ZERO);
        }
        return Coercions.number(Math.pow(base, exponent));
    }

    private static EvaluatedValue date(double serial) {
        if (Double.isNaN(serial) || Double.isInfinite(serial)) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        return EvaluatedValue.date(serial);
    }

    /**
     * Structural equality used by {@code =}, {@code <>}, lookups and criteria.
     *
     * @param left  non-error value
     * @param right non-error value
     * @return true when the values are equal under spreadsheet rules
     */
    public static boolean looselyEqual(EvaluatedValue left, EvaluatedValue right) {
        Category a = category(left, right);
        Category b = category(right, left);
        if (a != b) {
            return false;
        }
        return switch (a) {
            case NUMBER -> Coercions.toNumber(left) == Coercions.toNumber(right);
            case TEXT -> Coercions.toText(left).equalsIgnoreCase(Coercions.toText(right));
            case BOOLEAN -> Coercions.toBoolean(left) == Coercions.toBoolean(right);
            case EMPTY -> true;
        };
    }

    /**
     * Whether two values can be ordered: both numeric, both text or both boolean, blanks taking
     * the kind of the other side.
     *
     * @param left  non-error value
     * @param right non-error value
     * @return true when {@link #order} is meaningful
     */
    public static boolean comparable(EvaluatedValue left, EvaluatedValue right) {
        return category(left, right) == category(right, left);
    }

    /**
     * Ordering of two {@link #comparable} values; text compares case-insensitively.
     *
     * @param left  non-error value
     * @param right non-error value
     * @return negative, zero or positive
     */
    public static int order(EvaluatedValue left, EvaluatedValue right) {
        Category a = category(left, right);
        if (a != category(right, left)) {
            return 0;
        }
        return switch (a) {
            case NUMBER -> Double.compare(Coercions.toNumber(left), Coercions.toNumber(right));
            case TEXT -> Coercions.toText(left).toLowerCase(Locale.ROOT).compareTo(Coercions.toText(right).toLowerCase(Locale.ROOT));
            case BOOLEAN -> Boolean.compare(Coercions.toBoolean(left), Coercions.toBoolean(right));
            case EMPTY -> 0;
        };
    }

    private enum Category { NUMBER, TEXT, BOOLEAN, EMPTY }

    private static Category category(EvaluatedValue value, EvaluatedValue other) {
        if (value.isNumeric()) return Category.NUMBER;
        if (value instanceof EvaluatedValue.TextValue) return Category.TEXT;
        if (value instanceof EvaluatedValue.BooleanValue) return Category.BOOLEAN;
        // blank takes the kind of the other operand
        if (other.isEmpty()) return Category.EMPTY;
        if (other.isError()) return Category.EMPTY;
        return category(other, value);
    }
}
