package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.eval.Coercions;
import io.github.cyfko.sheetlogic.core.eval.Operators;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionProvider;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueGrid;

import java.util.Collection;
import java.util.List;

/**
 * Lookup builtins: {@code VLOOKUP HLOOKUP INDEX MATCH XLOOKUP}.
 *
 * <h2>Match modes</h2>
 * <ul>
 *   <li>exact match is a linear scan, first hit wins; text compares case-insensitively and
 *       honors {@code *}/{@code ?} wildcards</li>
 *   <li>approximate match ({@code VLOOKUP} TRUE, {@code MATCH} 1) is a binary scan for the largest
 *       value not greater than the lookup value in an ascending vector</li>
 *   <li>{@code MATCH} -1 scans a descending vector for the smallest value not less than the lookup value</li>
 *   <li>{@code XLOOKUP} modes 0, -1 (next smaller) and 1 (next larger) are linear scans;
 *       search mode -1 scans last to first</li>
 * </ul>
 * <p>Every miss is {@code #N/A}.</p>
 *
 * @since 1.0.0
 */
public final class LookupFunctions implements FunctionProvider {

    private static final int NOT_FOUND = -1;

    @Override
    public Collection<FunctionDefinition> functions() {
        return List.of(
                FunctionDefinition.of("VLOOKUP", FunctionSignature.between(3, 4), args -> tableLookup(args, true)),
                FunctionDefinition.of("HLOOKUP", FunctionSignature.between(3, 4), args -> tableLookup(args, false)),
                FunctionDefinition.of("INDEX", FunctionSignature.between(2, 3).emptyFrom(1), LookupFunctions::index),
                FunctionDefinition.of("MATCH", FunctionSignature.between(2, 3), LookupFunctions::match),
                FunctionDefinition.of("XLOOKUP", FunctionSignature.between(3, 6).emptyFrom(3), LookupFunctions::xlookup)
        );
    }

    private static EvaluatedValue tableLookup(FunctionArguments args, boolean vertical) {
        EvaluatedValue lookup = Coercions.requireNoError(args.value(0));
        ValueGrid table = args.grid(1);
        int offset = Coercions.toInteger(args.value(2));
        boolean approximate = FunctionSupport.bool(args, 3, true);

        int extent = vertical ? table.columns() : table.rows();
        if (offset < 1) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        if (offset > extent) {
            return EvaluatedValue.error(ErrorKind.REF);
        }

        List<EvaluatedValue> keys = vertical ? table.column(0) : table.row(0);
        int hit = approximate ? ascendingScan(keys, lookup) : exactScan(keys, lookup);
        if (hit == NOT_FOUND) {
            return EvaluatedValue.error(ErrorKind.NOT_FOUND);
        }
        return vertical ? table.get(hit, offset - 1) : table.get(offset - 1, hit);
    }

    private static EvaluatedValue index(FunctionArguments args) {
        ValueGrid grid = args.grid(0);
        int row = FunctionSupport.integer(args, 1, 0);
        int column = FunctionSupport.integer(args, 2, 0);
        if (row < 0 || column < 0) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        if (args.isMissing(2) && grid.rows() == 1 && grid.columns() > 1) {
            // a single row indexed by one number is read along the row
            column = row;
            row = 1;
        }
        if (row == 0) row = grid.rows() == 1 ? 1 : 0;
        if (column == 0) column = grid.columns() == 1 ? 1 : 0;
        if (row == 0 || column == 0) {
            // whole row or column selections are not single values
            return EvaluatedValue.error(ErrorKind.VALUE);
        }
        if (row > grid.rows() || column > grid.columns()) {
            return EvaluatedValue.error(ErrorKind.REF);
        }
        return grid.get(row - 1, column - 1);
    }

    private static EvaluatedValue match(FunctionArguments args) {
        EvaluatedValue lookup = Coercions.requireNoError(args.value(0));
        ValueGrid grid = args.grid(1);
        int type = FunctionSupport.integer(args, 2, 1);
        if (!grid.isVector()) {
            return EvaluatedValue.error(ErrorKind.NOT_FOUND);
        }
        List<EvaluatedValue> vector = grid.values();
        int hit;
        if (type == 0) {
            hit = exactScan(vector, lookup);
        } else if (type > 0) {
            hit = ascendingScan(vector, lookup);
        } else {
            hit = descendingScan(vector, lookup);
        }
        return hit == NOT_FOUND ? EvaluatedValue.error(ErrorKind.NOT_FOUND) : EvaluatedValue.number(hit + 1);
    }

    private static EvaluatedValue xlookup(FunctionArguments args) {
        EvaluatedValue lookup = Coercions.requireNoError(args.value(0));
        ValueGrid keys = args.grid(1);
        ValueGrid results = args.grid(2);
        int matchMode = FunctionSupport.integer(args, 4, 0);
        int searchMode = FunctionSupport.integer(args, 5, 1);
        if (!keys.isVector() || (matchMode < -1 || matchMode > 2) || (searchMode != 1 && searchMode != -1)) {
            return EvaluatedValue.error(ErrorKind.VALUE);
        }

        List<EvaluatedValue> vector = keys.values();
        int hit = NOT_FOUND;
        int best = NOT_FOUND;
        int n = vector.size();
        for (int k = 0; k < n && hit == NOT_FOUND; k++) {
            int i = searchMode == 1 ? k : n - 1 - k;
            EvaluatedValue candidate = vector.get(i);
            if (Criteria.matches(lookup, candidate, matchMode == 2)) {
                hit = i;
            } else if (matchMode == -1 || matchMode == 1) {
                if (candidate.isError() || candidate.isEmpty() || !Operators.comparable(candidate, lookup)) continue;
                int order = Operators.order(candidate, lookup);
                boolean eligible = matchMode == -1 ? order < 0 : order > 0;
                if (eligible && (best == NOT_FOUND || (matchMode == -1
                        ? Operators.order(candidate, vector.get(best)) > 0
                        : Operators.order(candidate, vector.get(best)) < 0))) {
                    best = i;
                }
            }
        }
        if (hit == NOT_FOUND) {
            hit = best;
        }
        if (hit == NOT_FOUND) {
            return args.isMissing(3) ? EvaluatedValue.error(ErrorKind.NOT_FOUND) : args.value(3);
        }

        boolean byRow = keys.columns() == 1 && keys.rows() > 1;
        if (byRow) {
            return hit < results.rows() ? results.get(hit, 0) : EvaluatedValue.error(ErrorKind.REF);
        }
        return hit < results.columns() ? results.get(0, hit) : EvaluatedValue.error(ErrorKind.REF);
    }

    private static int exactScan(List<EvaluatedValue> vector, EvaluatedValue lookup) {
        for (int i = 0; i < vector.size(); i++) {
            if (Criteria.matches(lookup, vector.get(i), true)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * Binary scan for the last position whose value is not greater than {@code lookup}.
     */
    private static int ascendingScan(List<EvaluatedValue> vector, EvaluatedValue lookup) {
        int low = 0;
        int high = vector.size() - 1;
        int result = NOT_FOUND;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            EvaluatedValue candidate = vector.get(mid);
            if (!candidate.isError() && !candidate.isEmpty() && Operators.comparable(candidate, lookup)
                    && Operators.order(candidate, lookup) <= 0) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }

    /**
     * Binary scan of a descending vector for the last position whose value is not less than {@code lookup}.
     */
    private static int descendingScan(List<EvaluatedValue> vector, EvaluatedValue lookup) {
        int low = 0;
        int high = vector.size() - 1;
        int result = NOT_FOUND;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            EvaluatedValue candidate = vector.get(mid);
            if (!candidate.isError() && !candidate.isEmpty() && Operators.comparable(candidate, lookup)
                    && Operators.order(candidate, lookup) >= 0) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }
}
