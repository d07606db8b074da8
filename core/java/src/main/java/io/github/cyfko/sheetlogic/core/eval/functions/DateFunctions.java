package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;

/**
 * Date builtins: {@code DATE YEAR MONTH DAY TODAY NOW EOMONTH}.
 * <p>
 * Dates are serial day numbers counted from the policy epoch; {@code TODAY} and {@code NOW} read
 * the policy clock so compiled results are reproducible.
 * </p>
 *
 * @since 1.0.0
 */
public final class DateFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("DATE", FunctionSignature.exactly(3), DateFunctions::date),
                FunctionDefinition.of("YEAR", FunctionSignature.exactly(1), args -> EvaluatedValue.number(toDate(args, 0).getYear())),
                FunctionDefinition.of("MONTH", FunctionSignature.exactly(1), args -> EvaluatedValue.number(toDate(args, 0).getMonthValue())),
                FunctionDefinition.of("DAY", FunctionSignature.exactly(1), args -> EvaluatedValue.number(toDate(args, 0).getDayOfMonth())),
                FunctionDefinition.of("TODAY", FunctionSignature.exactly(0),
                        args -> EvaluatedValue.date(serial(args, LocalDate.now(args.policy().clock())))),
                FunctionDefinition.of("NOW", FunctionSignature.exactly(0), DateFunctions::now),
                FunctionDefinition.of("EOMONTH", FunctionSignature.exactly(2), DateFunctions::endOfMonth)
        );
    }

    /**
     * Years below 1900 are offsets from 1900; months and days overflow into the next unit.
     */
    private static EvaluatedValue date(FunctionArguments args) {
        int year = Coercions.toInteger(args.value(0));
        int month = Coercions.toInteger(args.value(1));
        int day = Coercions.toInteger(args.value(2));
        if (year < 0 || year > 9999) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        if (year < 1900) {
            year += 1900;
        }
        LocalDate date = LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
        long serial = serial(args, date);
        if (serial < 0) {
            return EvaluatedValue.error(ErrorKind.NUM);
        }
        return EvaluatedValue.date(serial);
    }

    private static EvaluatedValue now(FunctionArguments args) {
        LocalDateTime now = LocalDateTime.now(args.policy().clock());
        double fraction = now.toLocalTime().toSecondOfDay() / 86_400.0;
        return EvaluatedValue.date(serial(args, now.toLocalDate()) + fraction);
    }

    private static EvaluatedValue endOfMonth(FunctionArguments args) {
        LocalDate start = toDate(args, 0);
        int months = Coercions.toInteger(args.value(1));
        LocalDate shifted = start.plusMonths(months);
        return EvaluatedValue.date(serial(args, shifted.withDayOfMonth(shifted.lengthOfMonth())));
    }

    private static LocalDate toDate(FunctionArguments args, int index) {
        double serial = Coercions.toNumber(args.value(index));
        if (serial < 0) {
            throw FunctionSupport.error(ErrorKind.NUM);
        }
        return args.policy().epoch().plusDays((long) Math.floor(serial));
    }

    private static long serial(FunctionArguments args, LocalDate date) {
        return ChronoUnit.DAYS.between(args.policy().epoch(), date);
    }
}
