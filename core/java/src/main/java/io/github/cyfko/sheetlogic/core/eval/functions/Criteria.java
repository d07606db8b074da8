package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.eval.Operators;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueFormat;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Spreadsheet criteria used by {@code SUMIF}, {@code COUNTIF} and their multi-criteria forms.
 * <p>
 * A criterion is a number, a boolean, or a string optionally prefixed with one of
 * {@code >= <= <> = > <}. The operand is compared numerically when it parses as a number,
 * otherwise as case-insensitive text. Plain text criteria accept the {@code *} and {@code ?}
 * wildcards, {@code ~} escaping them.
 * </p>
 *
 * <pre>{@code
 * Criteria.parse(EvaluatedValue.text(">=10")).test(EvaluatedValue.number(12)); // true
 * Criteria.parse(EvaluatedValue.text("<>x")).test(EvaluatedValue.text("X"));    // false
 * Criteria.parse(EvaluatedValue.text("ab*")).test(EvaluatedValue.text("abc"));  // true
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Criteria {

    private static final String[] OPERATORS = {">=", "<=", "<>", "=", ">", "<"};

    private Criteria() {}

    /**
     * Compiles a criterion into a cell predicate. Error cells never match.
     *
     * @param criterion the criterion value
     * @return the predicate
     * @throws io.github.cyfko.sheetlogic.core.eval.EvaluationError when the criterion itself is an error
     */
    public static Predicate<EvaluatedValue> parse(EvaluatedValue criterion) {
        Coercions.requireNoError(criterion);
        Predicate<EvaluatedValue> predicate;
        if (criterion.isNumeric()) {
            double target = Coercions.toNumber(criterion);
            predicate = cell -> numericValue(cell) != null && numericValue(cell) == target;
        } else if (criterion instanceof EvaluatedValue.BooleanValue flag) {
            predicate = cell -> cell instanceof EvaluatedValue.BooleanValue b && b.value() == flag.value();
        } else {
            predicate = parseText(Coercions.toText(criterion));
        }
        return cell -> !cell.isError() && predicate.test(cell);
    }

    private static Predicate<EvaluatedValue> parseText(String criterion) {
        String operator = "";
        for (String candidate : OPERATORS) {
            if (criterion.startsWith(candidate)) {
                operator = candidate;
                break;
            }
        }
        String operand = criterion.substring(operator.length());
        Double number = parseNumber(operand);

        if (operator.isEmpty() || "=".equals(operator)) {
            if (operand.isEmpty()) {
                return cell -> cell.isEmpty() || (cell instanceof EvaluatedValue.TextValue t && t.value().isEmpty());
            }
            if (number != null) {
                return cell -> numericValue(cell) != null && numericValue(cell).doubleValue() == number;
            }
            Pattern pattern = wildcard(operand);
            return cell -> !cell.isEmpty() && pattern.matcher(Coercions.toText(cell)).matches();
        }

        if ("<>".equals(operator)) {
            if (operand.isEmpty()) {
                return cell -> !cell.isEmpty();
            }
            if (number != null) {
                return cell -> numericValue(cell) == null || numericValue(cell).doubleValue() != number;
            }
            Pattern pattern = wildcard(operand);
            return cell -> cell.isEmpty() || !pattern.matcher(Coercions.toText(cell)).matches();
        }

        String comparison = operator;
        if (number != null) {
            return cell -> cell.isNumeric() && compare(Double.compare(Coercions.toNumber(cell), number), comparison);
        }
        String lowered = operand.toLowerCase(Locale.ROOT);
        return cell -> cell instanceof EvaluatedValue.TextValue text
                && compare(text.value().toLowerCase(Locale.ROOT).compareTo(lowered), comparison);
    }

    private static boolean compare(int order, String operator) {
        return switch (operator) {
            case ">=" -> order >= 0;
            case "<=" -> order <= 0;
            case ">" -> order > 0;
            case "<" -> order < 0;
            default -> throw new IllegalStateException("Unexpected comparison " + operator);
        };
    }

    /**
     * Numeric reading of a cell for equality criteria: numbers and dates, and text holding a number.
     */
    private static Double numericValue(EvaluatedValue cell) {
        if (cell.isNumeric()) {
            return Coercions.toNumber(cell);
        }
        if (cell instanceof EvaluatedValue.TextValue text) {
            return parseNumber(text.value());
        }
        return null;
    }

    private static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        OptionalDouble number = ValueFormat.parseDecimal(trimmed);
        return number.isPresent() ? number.getAsDouble() : null;
    }

    /**
     * Case-insensitive matcher for {@code *} / {@code ?} wildcards.
     *
     * @param criterion the text criterion
     * @return compiled pattern
     */
    static Pattern wildcard(String criterion) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < criterion.length(); i++) {
            char c = criterion.charAt(i);
            if (c == '~' && i + 1 < criterion.length()) {
                regex.append(Pattern.quote(String.valueOf(criterion.charAt(++i))));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    /**
     * Lookup equality: {@link Operators#looselyEqual} with wildcard support for text lookups.
     *
     * @param lookup    the searched value
     * @param candidate the cell value
     * @param wildcards whether text lookups honor wildcards
     * @return true on match
     */
    static boolean matches(EvaluatedValue lookup, EvaluatedValue candidate, boolean wildcards) {
        if (candidate.isError()) {
            return false;
        }
        if (wildcards && lookup instanceof EvaluatedValue.TextValue text && candidate instanceof EvaluatedValue.TextValue) {
            return wildcard(text.value()).matcher(Coercions.toText(candidate)).matches();
        }
        if (candidate.isEmpty() != lookup.isEmpty()) {
            return false;
        }
        return Operators.looselyEqual(lookup, candidate);
    }
}
