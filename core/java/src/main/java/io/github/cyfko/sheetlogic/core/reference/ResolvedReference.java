package io.github.cyfko.sheetlogic.core.reference;

import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.Objects;

/**
 * Outcome of resolving a reference token: a single cell or a range, how it was written, and the
 * range name when it came from the named-range table.
 *
 * @param cell  resolved cell, or null for a range
 * @param range resolved range, or null for a single cell
 * @param kind  how the reference was written
 * @param name  the named-range name, or null
 * @since 1.0.0
 */
public record ResolvedReference(Coordinate cell, CellRange range, ReferenceKind kind, String name) {

    public ResolvedReference {
        if ((cell == null) == (range == null)) {
            throw new IllegalArgumentException("exactly one of cell and range must be set");
        }
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isRange() {
        return range != null;
    }
}
