package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.ast.AffixOperator;
import io.github.cyfko.sheetlogic.core.ast.DynamicReference;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.ast.FormulaNodes;
import io.github.cyfko.sheetlogic.core.ast.FunctionCall;
import io.github.cyfko.sheetlogic.core.ast.UnaryOp;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the human-facing name and the purpose of a cluster.
 * <p>
 * Purpose scoring counts every function call of the cluster's formulas against fixed keyword
 * groups; postfix {@code %} counts towards {@code percentage}. The group with the highest count
 * wins, earlier groups winning ties.
 * </p>
 */
final class ClusterProfiler {

    private static final String PERCENT = "%";

    private static final Map<String, Set<String>> PURPOSE_KEYWORDS = new LinkedHashMap<>();

    static {
        PURPOSE_KEYWORDS.put("lookup", Set.of("VLOOKUP", "HLOOKUP", "XLOOKUP", "INDEX", "MATCH"));
        PURPOSE_KEYWORDS.put("aggregation", Set.of("SUM", "SUMIF", "SUMIFS", "AVERAGE", "AVERAGEIF", "AVERAGEIFS",
                "COUNT", "COUNTA", "COUNTIF", "COUNTIFS", "MIN", "MAX", "PRODUCT"));
        PURPOSE_KEYWORDS.put("conditional_logic", Set.of("IF", "IFS", "AND", "OR", "NOT", "IFERROR", "SWITCH"));
        PURPOSE_KEYWORDS.put("date_calculation", Set.of("DATE", "TODAY", "NOW", "YEAR", "MONTH", "DAY", "DATEDIF", "EOMONTH"));
        PURPOSE_KEYWORDS.put("financial_formula", Set.of("NPV", "IRR", "PMT", "FV", "PV", "RATE"));
        PURPOSE_KEYWORDS.put("percentage", Set.of(PERCENT));
        PURPOSE_KEYWORDS.put("rounding", Set.of("ROUND", "ROUNDUP", "ROUNDDOWN"));
        PURPOSE_KEYWORDS.put("text", Set.of("CONCAT", "CONCATENATE", "LEFT", "RIGHT", "MID", "TEXT"));
    }

    private ClusterProfiler() {}

    /**
     * {@code cluster_<index>}, followed by the slug of the first labelled output or input.
     *
     * @param index  cluster index
     * @param labels labels of the outputs then the inputs, in that order; nulls allowed
     * @return the cluster name
     */
    static String name(int index, List<String> labels) {
        for (String label : labels) {
            if (label == null) continue;
            String clean = label.replaceAll("[^a-zA-Z0-9 _-]", "").trim();
            if (!clean.isEmpty()) {
                return "cluster_" + index + "_" + clean.toLowerCase(Locale.ROOT).replace(' ', '_');
            }
        }
        return "cluster_" + index;
    }

    /**
     * @param formulas parsed formulas of the cluster members
     * @return the winning purpose, or null when no keyword occurs
     */
    static String purpose(Collection<FormulaNode> formulas) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FormulaNode formula : formulas) {
            FormulaNodes.walk(formula, node -> {
                String keyword = keyword(node);
                if (keyword != null) {
                    counts.merge(keyword, 1, Integer::sum);
                }
            });
        }

        String best = null;
        int bestScore = 0;
        for (Map.Entry<String, Set<String>> group : PURPOSE_KEYWORDS.entrySet()) {
            int score = 0;
            for (String keyword : group.getValue()) {
                score += counts.getOrDefault(keyword, 0);
            }
            if (score > bestScore) {
                best = group.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    private static String keyword(FormulaNode node) {
        if (node instanceof FunctionCall call) return call.name();
        if (node instanceof DynamicReference dynamic) return dynamic.function();
        if (node instanceof UnaryOp unary && unary.op() == AffixOperator.PERCENT) return PERCENT;
        return null;
    }
}
