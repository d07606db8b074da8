package io.github.cyfko.sheetlogic.core.ast;

import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.List;

/**
 * Inline constant array such as <code>{1,2;3,4}</code>: rows separated by {@code ;}, columns by {@code ,}.
 *
 * @param rows the rows, all of the same width
 * @since 1.0.0
 */
public record ArrayLiteral(List<List<EvaluatedValue>> rows) implements FormulaNode {

    public ArrayLiteral {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("array literal needs at least one row");
        }
        int width = rows.get(0).size();
        for (List<EvaluatedValue> row : rows) {
            if (row.size() != width || width == 0) {
                throw new IllegalArgumentException("array literal rows must have the same non-zero width");
            }
        }
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int width() {
        return rows.get(0).size();
    }

    public int height() {
        return rows.size();
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }
}
