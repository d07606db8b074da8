package io.github.cyfko.sheetlogic.core.ast;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a single resolved cell.
 *
 * @param coordinate the referenced cell
 * @param kind       how the reference was written
 * @param name       the range name for {@link ReferenceKind#NAMED} references, else null
 * @since 1.0.0
 */
public record CellReference(Coordinate coordinate, ReferenceKind kind, String name) implements FormulaNode {

    public CellReference {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(kind, "kind");
    }

    public static CellReference direct(Coordinate coordinate) {
        return new CellReference(coordinate, ReferenceKind.DIRECT, null);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellReference(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }
}
