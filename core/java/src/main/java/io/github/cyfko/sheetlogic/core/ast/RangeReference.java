package io.github.cyfko.sheetlogic.core.ast;

import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a rectangular range. The range is kept unexpanded.
 *
 * @param range the referenced range
 * @param kind  how the reference was written
 * @param name  the range name for {@link ReferenceKind#NAMED} references, else null
 * @since 1.0.0
 */
public record RangeReference(CellRange range, ReferenceKind kind, String name) implements FormulaNode {

    public RangeReference {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitRangeReference(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }
}
