package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.UnsupportedConstruct;

import java.util.List;

/**
 * A formula construct the compiler cannot translate, with the cells whose values depend on it.
 *
 * @param coordinate    cell holding the construct
 * @param formula       formula text of that cell
 * @param featureType   kind of construct
 * @param function      function name involved
 * @param reason        why the construct is not supported
 * @param suggestedFix  how a workbook author can remove the construct
 * @param impactedCells cells forward-reachable from {@code coordinate}, itself included
 * @since 1.0.0
 */
public record UnsupportedFeature(
        Coordinate coordinate,
        String formula,
        UnsupportedConstruct.FeatureType featureType,
        String function,
        String reason,
        String suggestedFix,
        List<Coordinate> impactedCells
) {

    static final String DYNAMIC_REFERENCE_FIX =
            "Replace dynamic references with explicit ranges, or restructure data to avoid runtime cell selection.";

    public UnsupportedFeature {
        impactedCells = List.copyOf(impactedCells);
    }

    public static UnsupportedFeature of(Coordinate coordinate, String formula, UnsupportedConstruct construct,
                                        List<Coordinate> impactedCells) {
        String fix = construct.featureType() == UnsupportedConstruct.FeatureType.DYNAMIC_REFERENCE
                ? DYNAMIC_REFERENCE_FIX
                : "Rewrite the formula with supported functions, or register a FunctionProvider implementing "
                + construct.function() + ".";
        return new UnsupportedFeature(coordinate, formula, construct.featureType(), construct.function(),
                construct.reason(), fix, impactedCells);
    }
}
