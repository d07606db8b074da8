package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Text builtins: {@code CONCAT CONCATENATE LEFT RIGHT MID LEN UPPER LOWER TRIM TEXT}.
 *
 * @since 1.0.0
 */
public final class TextFunctions implements FunctionProvider {

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("CONCAT", FunctionSignature.atLeast(1), TextFunctions::concat),
                FunctionDefinition.of("CONCATENATE", FunctionSignature.atLeast(1), TextFunctions::concat),
                FunctionDefinition.of("LEFT", FunctionSignature.between(1, 2), args -> {
                    String text = Coercions.toText(args.value(0));
                    int count = count(args, 1);
                    return EvaluatedValue.text(text.substring(0, Math.min(count, text.length())));
                }),
                FunctionDefinition.of("RIGHT", FunctionSignature.between(1, 2), args -> {
                    String text = Coercions.toText(args.value(0));
                    int count = count(args, 1);
                    return EvaluatedValue.text(text.substring(Math.max(0, text.length() - count)));
                }),
                FunctionDefinition.of("MID", FunctionSignature.exactly(3), TextFunctions::mid),
                FunctionDefinition.of("LEN", FunctionSignature.exactly(1),
                        args -> EvaluatedValue.number(Coercions.toText(args.value(0)).length())),
                FunctionDefinition.of("UPPER", FunctionSignature.exactly(1),
                        args -> EvaluatedValue.text(Coercions.toText(args.value(0)).toUpperCase(Locale.ROOT))),
                FunctionDefinition.of("LOWER", FunctionSignature.exactly(1),
                        args -> EvaluatedValue.text(Coercions.toText(args.value(0)).toLowerCase(Locale.ROOT))),
                FunctionDefinition.of("TRIM", FunctionSignature.exactly(1),
                        args -> EvaluatedValue.text(Coercions.toText(args.value(0)).trim().replaceAll(" +", " "))),
                FunctionDefinition.of("TEXT", FunctionSignature.exactly(2), TextFunctions::text)
        );
    }

    private static EvaluatedValue concat(FunctionArguments args) {
        StringBuilder result = new StringBuilder();
        for (EvaluatedValue value : FunctionSupport.flatten(args, 0)) {
            result.append(Coercions.toText(value));
        }
        return EvaluatedValue.text(result.toString());
    }

    private static int count(FunctionArguments args, int index) {
        int count = FunctionSupport.integer(args, index, 1);
        if (count < 0) {
            throw FunctionSupport.error(ErrorKind.VALUE);
        }
        return count;
    }

    private static EvaluatedValue mid(FunctionArguments args) {
        String text = Coercions.toText(args.value(0));
        int start = Coercions.toInteger(args.value(1));
        int length = Coercions.toInteger(args.value(2));
        if (start < 1 || length < 0) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        if (start > text.length()) {
            return EvaluatedValue.text("");
        }
        int from = start - 1;
        return EvaluatedValue.text(text.substring(from, (int) Math.min((long) from + length, text.length())));
    }

    /**
     * {@code TEXT(value, format)} for numeric patterns ({@code 0}, {@code #,##0.00}, {@code 0%})
     * and date patterns built from {@code yyyy}, {@code mm}, {@code dd}.
     */
    private static EvaluatedValue text(FunctionArguments args) {
        EvaluatedValue value = Coercions.requireNoError(args.value(0));
        String format = Coercions.toText(args.value(1));
        if (value instanceof EvaluatedValue.TextValue text) {
            return text;
        }
        double number = Coercions.toNumber(value);
        if (isDateFormat(format)) {
            LocalDate date = args.policy().epoch().plusDays((long) Math.floor(number));
            String pattern = format.replace("Y", "y").replace("D", "d").replace("m", "M");
            return EvaluatedValue.text(DateTimeFormatter.ofPattern(pattern, Locale.US).format(date));
        }
        try {
            DecimalFormat decimal = new DecimalFormat(format, DecimalFormatSymbols.getInstance(Locale.US));
            decimal.setRoundingMode(RoundingMode.HALF_UP);
            return EvaluatedValue.text(decimal.format(number));
        } catch (IllegalArgumentException e) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
    }

    private static boolean isDateFormat(String format) {
        String lower = format.toLowerCase(Locale.ROOT);
        return lower.contains("yy") || lower.contains("dd");
    }
}
