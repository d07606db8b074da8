package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueFormat;
import io.github.cyfko.sheetlogic.core.value.ValueGrid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Aggregates over ranges: {@code SUM AVERAGE MIN MAX COUNT COUNTA PRODUCT} and the criteria forms
 * {@code SUMIF SUMIFS COUNTIF COUNTIFS AVERAGEIF AVERAGEIFS}.
 * <p>
 * Numeric aggregates skip blanks, text and booleans found in ranges; errors in ranges propagate.
 * Criteria ranges must all have the shape of the first one.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregateFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("SUM", FunctionSignature.atLeast(1), args -> sum(FunctionSupport.numbers(args, 0))),
                FunctionDefinition.of("AVERAGE", FunctionSignature.atLeast(1), args -> average(FunctionSupport.numbers(args, 0))),
                FunctionDefinition.of("MIN", FunctionSignature.atLeast(1),
                        args -> Coercions.number(FunctionSupport.numbers(args, 0).stream().mapToDouble(Double::doubleValue).min().orElse(0))),
                FunctionDefinition.of("MAX", FunctionSignature.atLeast(1),
                        args -> Coercions.number(FunctionSupport.numbers(args, 0).stream().mapToDouble(Double::doubleValue).max().orElse(0))),
                FunctionDefinition.of("PRODUCT", FunctionSignature.atLeast(1), AggregateFunctions::product),
                FunctionDefinition.of("COUNT", FunctionSignature.atLeast(1), AggregateFunctions::count),
                FunctionDefinition.of("COUNTA", FunctionSignature.atLeast(1), AggregateFunctions::countA),
                FunctionDefinition.of("SUMIF", FunctionSignature.between(2, 3), args -> sum(numbersIf(args))),
                FunctionDefinition.of("AVERAGEIF", FunctionSignature.between(2, 3), args -> average(numbersIf(args))),
                FunctionDefinition.of("COUNTIF", FunctionSignature.exactly(2),
                        args -> EvaluatedValue.number(matchingPositions(args, 0).size())),
                FunctionDefinition.of("SUMIFS", FunctionSignature.atLeast(3), args -> sum(numbersIfs(args))),
                FunctionDefinition.of("AVERAGEIFS", FunctionSignature.atLeast(3), args -> average(numbersIfs(args))),
                FunctionDefinition.of("COUNTIFS", FunctionSignature.atLeast(2), AggregateFunctions::countIfs)
        );
    }

    private static EvaluatedValue sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) total += n;
        return Coercions.number(total);
    }

    private static EvaluatedValue average(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return EvaluatedValue.error(ErrorKind.DIV_ZERO);
        }
        double total = 0;
        for (double n : numbers) total += n;
        return Coercions.number(total / numbers.size());
    }

    private static EvaluatedValue product(FunctionArguments args) {
        List<Double> numbers = FunctionSupport.numbers(args, 0);
        if (numbers.isEmpty()) {
            return EvaluatedValue.number(0);
        }
        double result = 1;
        for (double n : numbers) result *= n;
        return Coercions.number(result);
    }

    private static EvaluatedValue count(FunctionArguments args) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.isMissing(i)) continue;
            if (args.isGrid(i) || args.isReference(i)) {
                count += (int) args.grid(i).values().stream().filter(EvaluatedValue::isNumeric).count();
            } else {
                EvaluatedValue value = args.value(i);
                if (value.isNumeric() || value instanceof EvaluatedValue.BooleanValue
                        || (value instanceof EvaluatedValue.TextValue text && isNumericText(text.value()))) {
                    count++;
                }
            }
        }
        return EvaluatedValue.number(count);
    }

    private static boolean isNumericText(String text) {
        return ValueFormat.parseNumber(text).isPresent();
    }

    private static EvaluatedValue countA(FunctionArguments args) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.isMissing(i)) continue;
            if (args.isGrid(i) || args.isReference(i)) {
                count += (int) args.grid(i).values().stream().filter(value -> !value.isEmpty()).count();
            } else {
                count++;
            }
        }
        return EvaluatedValue.number(count);
    }

    /**
     * {@code XXXIF(range, criterion[, valueRange])}: numbers of {@code valueRange} (default the
     * criteria range) at the matching positions. The value range is read from its top-left corner
     * with the shape of the criteria range.
     */
    private static List<Double> numbersIf(FunctionArguments args) {
        ValueGrid criteriaRange = args.grid(0);
        ValueGrid values = args.isMissing(2) ? criteriaRange : args.grid(2);
        List<Double> numbers = new ArrayList<>();
        for (int position : matchingPositions(args, 0)) {
            int row = position / criteriaRange.columns();
            int column = position % criteriaRange.columns();
            if (row >= values.rows() || column >= values.columns()) {
                continue;
            }
            addIfNumeric(values.get(row, column), numbers);
        }
        return numbers;
    }

    /**
     * {@code XXXIFS(valueRange, range1, criterion1, ...)}.
     */
    private static List<Double> numbersIfs(FunctionArguments args) {
        if (args.size() % 2 == 0) {
            throw FunctionSupport.error(ErrorKind.VALUE);
        }
        ValueGrid values = args.grid(0);
        List<Double> numbers = new ArrayList<>();
        for (int position : matchingPositionsAll(args, 1, values)) {
            addIfNumeric(values.values().get(position), numbers);
        }
        return numbers;
    }

    private static EvaluatedValue countIfs(FunctionArguments args) {
        if (args.size() % 2 != 0) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        return EvaluatedValue.number(matchingPositionsAll(args, 0, args.grid(0)).size());
    }

    private static void addIfNumeric(EvaluatedValue value, List<Double> numbers) {
        Coercions.requireNoError(value);
        if (value.isNumeric()) {
            numbers.add(Coercions.toNumber(value));
        }
    }

    private static List<Integer> matchingPositions(FunctionArguments args, int rangeIndex) {
        ValueGrid range = args.grid(rangeIndex);
        Predicate<EvaluatedValue> criterion = Criteria.parse(args.value(rangeIndex + 1));
        List<Integer> positions = new ArrayList<>();
        List<EvaluatedValue> values = range.values();
        for (int i = 0; i < values.size(); i++) {
            if (criterion.test(values.get(i))) {
                positions.add(i);
            }
        }
        return positions;
    }

    /**
     * Positions matching every (range, criterion) pair starting at {@code from}.
     */
    private static List<Integer> matchingPositionsAll(FunctionArguments args, int from, ValueGrid shape) {
        List<Integer> positions = new ArrayList<>();
        List<ValueGrid> ranges = new ArrayList<>();
        List<Predicate<EvaluatedValue>> criteria = new ArrayList<>();
        for (int i = from; i < args.size(); i += 2) {
            ValueGrid range = args.grid(i);
            if (range.rows() != shape.rows() || range.columns() != shape.columns()) {
                throw FunctionSupport.error(ErrorKind.VALUE);
            }
            ranges.add(range);
            criteria.add(Criteria.parse(args.value(i + 1)));
        }
        for (int position = 0; position < shape.size(); position++) {
            boolean all = true;
            for (int c = 0; c < ranges.size() && all; c++) {
                all = criteria.get(c).test(ranges.get(c).values().get(position));
            }
            if (all) {
                positions.add(position);
            }
        }
        return positions;
    }
}
