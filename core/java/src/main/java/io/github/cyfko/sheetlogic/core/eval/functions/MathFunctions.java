package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.ast.InfixOperator;
import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.eval.Operators;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;

/**
 * Numeric builtins: {@code ABS ROUND ROUNDUP ROUNDDOWN INT MOD POWER SQRT}.
 *
 * @since 1.0.0
 */
public final class MathFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("ABS", FunctionSignature.exactly(1),
                        args -> Coercions.number(Math.abs(Coercions.toNumber(args.value(0))))),
                FunctionDefinition.of("ROUND", FunctionSignature.exactly(2), args -> round(args, RoundingMode.HALF_UP)),
                FunctionDefinition.of("ROUNDUP", FunctionSignature.exactly(2), args -> round(args, RoundingMode.UP)),
                FunctionDefinition.of("ROUNDDOWN", FunctionSignature.exactly(2), args -> round(args, RoundingMode.DOWN)),
                FunctionDefinition.of("INT", FunctionSignature.exactly(1),
                        args -> Coercions.number(Math.floor(Coercions.toNumber(args.value(0))))),
                FunctionDefinition.of("MOD", FunctionSignature.exactly(2), MathFunctions::mod),
                FunctionDefinition.of("POWER", FunctionSignature.exactly(2),
                        args -> Operators.apply(InfixOperator.POWER, args.value(0), args.value(1))),
                FunctionDefinition.of("SQRT", FunctionSignature.exactly(1), MathFunctions::sqrt)
        );
    }

    /**
     * Rounds half away from zero; negative digit counts round left of the decimal point.
     */
    private static EvaluatedValue round(FunctionArguments args, RoundingMode mode) {
        double value = Coercions.toNumber(args.value(0));
        int digits = Coercions.toInteger(args.value(1));
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        return Coercions.number(BigDecimal.valueOf(value).setScale(digits, mode).doubleValue());
    }

    private static EvaluatedValue mod(FunctionArguments args) {
        double number = Coercions.toNumber(args.value(0));
        double divisor = Coercions.toNumber(args.value(1));
        if (divisor == 0) {
            return EvaluatedValue.error(ErrorKind.DIV_ZERO);
        }
        // result takes the sign of the divisor
        return Coercions.number(number - divisor * Math.floor(number / divisor));
    }

    private static EvaluatedValue sqrt(FunctionArguments args) {
        double number = Coercions.toNumber(args.value(0));
        if (number < 0) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        return Coercions.number(Math.sqrt(number));
    }
}
