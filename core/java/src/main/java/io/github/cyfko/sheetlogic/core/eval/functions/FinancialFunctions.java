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
 * Time-value-of-money builtins: {@code PMT FV PV NPV}.
 * <p>
 * Sign convention follows spreadsheets: cash paid out is negative. The optional {@code type}
 * argument is 1 for payments at the start of each period, 0 (default) for the end.
 * </p>
 *
 * @since 1.0.0
 */
public final class FinancialFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("PMT", FunctionSignature.between(3, 5).emptyFrom(3), FinancialFunctions::pmt),
                FunctionDefinition.of("FV", FunctionSignature.between(3, 5).emptyFrom(2), FinancialFunctions::fv),
                FunctionDefinition.of("PV", FunctionSignature.between(3, 5).emptyFrom(2), FinancialFunctions::pv),
                FunctionDefinition.of("NPV", FunctionSignature.atLeast(2), FinancialFunctions::npv)
        );
    }

    private static EvaluatedValue pmt(FunctionArguments args) {
        double rate = Coercions.toNumber(args.value(0));
        double periods = Coercions.toNumber(args.value(1));
        double present = Coercions.toNumber(args.value(2));
        double future = FunctionSupport.number(args, 3, 0);
        int type = paymentType(args, 4);
        if (periods == 0) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        if (rate == 0) {
            return Coercions.number(-(present + future) / periods);
        }
        double growth = Math.pow(1 + rate, periods);
        return Coercions.number(-(rate * (present * growth + future)) / ((1 + rate * type) * (growth - 1)));
    }

    private static EvaluatedValue fv(FunctionArguments args) {
        double rate = Coercions.toNumber(args.value(0));
        double periods = Coercions.toNumber(args.value(1));
        double payment = FunctionSupport.number(args, 2, 0);
        double present = FunctionSupport.number(args, 3, 0);
        int type = paymentType(args, 4);
        if (rate == 0) {
            return Coercions.number(-(present + payment * periods));
        }
        double growth = Math.pow(1 + rate, periods);
        return Coercions.number(-(present * growth + payment * (1 + rate * type) * (growth - 1) / rate));
    }

    private static EvaluatedValue pv(FunctionArguments args) {
        double rate = Coercions.toNumber(args.value(0));
        double periods = Coercions.toNumber(args.value(1));
        double payment = FunctionSupport.number(args, 2, 0);
        double future = FunctionSupport.number(args, 3, 0);
        int type = paymentType(args, 4);
        if (rate == 0) {
            return Coercions.number(-(future + payment * periods));
        }
        double growth = Math.pow(1 + rate, periods);
        return Coercions.number(-(future + payment * (1 + rate * type) * (growth - 1) / rate) / growth);
    }

    /**
     * Discounts the flows at the end of periods 1..n.
     */
    private static EvaluatedValue npv(FunctionArguments args) {
        double rate = Coercions.toNumber(args.value(0));
        if (rate == -1) {
            return EvaluatedValue.error(ErrorKind.DIV_ZERO);
        }
        double total = 0;
        int period = 1;
        for (double flow : FunctionSupport.numbers(args, 1)) {
            total += flow / Math.pow(1 + rate, period++);
        }
        return Coercions.number(total);
    }

    private static int paymentType(FunctionArguments args, int index) {
        return FunctionSupport.number(args, index, 0) != 0 ? 1 : 0;
    }
}
