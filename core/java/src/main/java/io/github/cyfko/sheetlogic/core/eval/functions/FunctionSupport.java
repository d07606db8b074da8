package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.eval.EvaluationError;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument helpers shared by the builtin function families.
 */
final class FunctionSupport {

    private FunctionSupport() {}

    /**
     * Collects the numbers of an aggregate's arguments, left to right.
     * <p>
     * Values reached through references or arrays count only when numeric; blanks, text and
     * booleans there are skipped. Values written directly are coerced. Errors propagate.
     * </p>
     */
    static List<Double> numbers(FunctionArguments args, int from) {
        List<Double> numbers = new ArrayList<>();
        for (int i = from; i < args.size(); i++) {
            if (args.isMissing(i)) {
                continue;
            }
            if (args.isGrid(i) || args.isReference(i)) {
                for (EvaluatedValue value : args.grid(i).values()) {
                    Coercions.requireNoError(value);
                    if (value.isNumeric()) {
                        numbers.add(Coercions.toNumber(value));
                    }
                }
            } else {
                numbers.add(Coercions.toNumber(args.value(i)));
            }
        }
        return numbers;
    }

    /**
     * Every value of the arguments, flattened in row-major order, ranges included.
     */
    static List<EvaluatedValue> flatten(FunctionArguments args, int from) {
        List<EvaluatedValue> values = new ArrayList<>();
        for (int i = from; i < args.size(); i++) {
            if (args.isGrid(i)) {
                values.addAll(args.grid(i).values());
            } else {
                values.add(args.value(i));
            }
        }
        return values;
    }

    static double number(FunctionArguments args, int index, double whenMissing) {
        return args.isMissing(index) ? whenMissing : Coercions.toNumber(args.value(index));
    }

    static int integer(FunctionArguments args, int index, int whenMissing) {
        return args.isMissing(index) ? whenMissing : Coercions.toInteger(args.value(index));
    }

    static boolean bool(FunctionArguments args, int index, boolean whenMissing) {
        return args.isMissing(index) ? whenMissing : Coercions.toBoolean(args.value(index));
    }

    static EvaluationError error(ErrorKind kind) {
        return new EvaluationError(kind);
    }
}
