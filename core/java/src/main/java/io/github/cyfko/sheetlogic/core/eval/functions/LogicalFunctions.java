package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Collection;
import java.util.List;

/**
 * Logical builtins: {@code IF IFS AND OR NOT IFERROR ISERROR ISBLANK ISNUMBER TRUE FALSE}.
 * <p>
 * {@code IF}, {@code IFS} and {@code IFERROR} only evaluate the branch they return.
 * {@code IFERROR} and the {@code IS*} functions are the only builtins that consume errors
 * instead of propagating them.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogicalFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("IF", FunctionSignature.between(2, 3).emptyFrom(1), LogicalFunctions::ifFunction),
                FunctionDefinition.of("IFS", FunctionSignature.atLeast(2), LogicalFunctions::ifs),
                FunctionDefinition.of("AND", FunctionSignature.atLeast(1), args -> logical(args, true)),
                FunctionDefinition.of("OR", FunctionSignature.atLeast(1), args -> logical(args, false)),
                FunctionDefinition.of("NOT", FunctionSignature.exactly(1),
                        args -> EvaluatedValue.bool(!Coercions.toBoolean(args.value(0)))),
                FunctionDefinition.of("IFERROR", FunctionSignature.exactly(2).emptyFrom(1), LogicalFunctions::ifError),
                FunctionDefinition.of("ISERROR", FunctionSignature.exactly(1), args -> EvaluatedValue.bool(args.value(0).isError())),
                FunctionDefinition.of("ISBLANK", FunctionSignature.exactly(1), args -> EvaluatedValue.bool(args.value(0).isEmpty())),
                FunctionDefinition.of("ISNUMBER", FunctionSignature.exactly(1), args -> EvaluatedValue.bool(args.value(0).isNumeric())),
                FunctionDefinition.of("TRUE", FunctionSignature.exactly(0), args -> EvaluatedValue.bool(true)),
                FunctionDefinition.of("FALSE", FunctionSignature.exactly(0), args -> EvaluatedValue.bool(false))
        );
    }

    private static EvaluatedValue ifFunction(FunctionArguments args) {
        boolean condition = Coercions.toBoolean(args.value(0));
        int branch = condition ? 1 : 2;
        if (branch >= args.size()) {
            return EvaluatedValue.bool(false);
        }
        return branchValue(args, branch);
    }

    private static EvaluatedValue ifs(FunctionArguments args) {
        if (args.size() % 2 != 0) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        for (int i = 0; i < args.size(); i += 2) {
            if (Coercions.toBoolean(args.value(i))) {
                return branchValue(args, i + 1);
            }
        }
        return EvaluatedValue.error(ErrorKind.NOT_FOUND);
    }

    private static EvaluatedValue ifError(FunctionArguments args) {
        EvaluatedValue value = args.value(0);
        return value.isError() ? branchValue(args, 1) : value;
    }

    /**
     * An empty branch slot yields 0, as in {@code IF(A1,,1)}.
     */
    private static EvaluatedValue branchValue(FunctionArguments args, int index) {
        if (args.isMissing(index)) {
            return EvaluatedValue.number(0);
        }
        return args.value(index);
    }

    /**
     * {@code AND} / {@code OR}: ranges contribute their booleans and numbers, skipping blanks and
     * text; direct arguments are coerced. No logical value at all is {@code #VALUE!}.
     */
    private static EvaluatedValue logical(FunctionArguments args, boolean conjunction) {
        boolean seen = false;
        boolean result = conjunction;
        for (int i = 0; i < args.size(); i++) {
            if (args.isMissing(i)) continue;
            if (args.isGrid(i) || args.isReference(i)) {
                for (EvaluatedValue value : args.grid(i).values()) {
                    Coercions.requireNoError(value);
                    if (value.isNumeric() || value instanceof EvaluatedValue.BooleanValue) {
                        seen = true;
                        result = conjunction ? result && Coercions.toBoolean(value) : result || Coercions.toBoolean(value);
                    }
                }
            } else {
                boolean flag = Coercions.toBoolean(args.value(i));
                seen = true;
                result = conjunction ? result && flag : result || flag;
            }
        }
        return seen ? EvaluatedValue.bool(result) : EvaluatedValue.error(ErrorKind.VALUE);
    }
}
