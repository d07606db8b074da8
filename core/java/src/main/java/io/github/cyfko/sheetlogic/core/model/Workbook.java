package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a classified workbook: the ordered cells, the named-range table and the
 * workbook-wide iterative-calculation switch.
 * <p>
 * A workbook is built once per snapshot with {@link #builder()}; the compiler never mutates it.
 * </p>
 *
 * <pre>{@code
 * Workbook workbook = Workbook.builder()
 *     .cell(ClassifiedCell.input(Coordinate.of("Sheet1", "A1"), 1))
 *     .cell(ClassifiedCell.formula(Coordinate.of("Sheet1", "A2"), CellRole.OUTPUT, "=A1*2"))
 *     .namedRange(NamedRange.ofCell("Base", Coordinate.of("Sheet1", "A1")))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Workbook {

    private final List<ClassifiedCell> cells;
    private final Map<Coordinate, ClassifiedCell> cellsByCoordinate;
    private final List<NamedRange> namedRanges;
    private final IterativeSettings iterativeCalculation;
    private final Map<String, SheetExtent> extents;

    private Workbook(Builder builder) {
        Map<Coordinate, ClassifiedCell> index = new LinkedHashMap<>();
        Map<String, SheetExtent> sheetExtents = new LinkedHashMap<>();
        for (ClassifiedCell cell : builder.cells) {
            if (index.putIfAbsent(cell.coordinate(), cell) != null) {
                throw new WorkbookDefinitionException("cell " + cell.coordinate() + " is declared twice");
            }
            Coordinate c = cell.coordinate();
            sheetExtents.merge(c.sheet(), new SheetExtent(c.column(), c.row()),
                    (a, b) -> new SheetExtent(Math.max(a.maxColumn(), b.maxColumn()), Math.max(a.maxRow(), b.maxRow())));
        }
        Map<String, NamedRange> names = new LinkedHashMap<>();
        for (NamedRange namedRange : builder.namedRanges) {
            if (names.putIfAbsent(namedRange.name().toUpperCase(Locale.ROOT), namedRange) != null) {
                throw new WorkbookDefinitionException("named range " + namedRange.name() + " is declared twice");
            }
        }
        this.cells = List.copyOf(builder.cells);
        this.cellsByCoordinate = Collections.unmodifiableMap(index);
        this.namedRanges = List.copyOf(names.values());
        this.iterativeCalculation = builder.iterativeCalculation;
        this.extents = Collections.unmodifiableMap(sheetExtents);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ClassifiedCell> cells() {
        return cells;
    }

    public Optional<ClassifiedCell> cell(Coordinate coordinate) {
        return Optional.ofNullable(cellsByCoordinate.get(coordinate));
    }

    public List<NamedRange> namedRanges() {
        return namedRanges;
    }

    /**
     * Workbook-wide iterative-calculation settings; when present every cell is allowed to take part
     * in an iterative cycle.
     *
     * @return the settings, or empty when iterative calculation is disabled workbook-wide
     */
    public Optional<IterativeSettings> iterativeCalculation() {
        return Optional.ofNullable(iterativeCalculation);
    }

    /**
     * Effective iterative settings of a cell: its own flag first, then the workbook-wide switch.
     *
     * @param coordinate the cell
     * @return the settings, or empty when iteration is not permitted for that cell
     */
    public Optional<IterativeSettings> iterativeSettingsOf(Coordinate coordinate) {
        ClassifiedCell cell = cellsByCoordinate.get(coordinate);
        if (cell != null && cell.iterative() != null) {
            return Optional.of(cell.iterative());
        }
        return iterativeCalculation();
    }

    /**
     * Used area of a sheet, derived from the classified cells.
     *
     * @param sheet the sheet name
     * @return the extent, {@code A1} for unknown sheets
     */
    public SheetExtent extentOf(String sheet) {
        return extents.getOrDefault(sheet, new SheetExtent(1, 1));
    }

    public Collection<String> sheets() {
        return extents.keySet();
    }

    public static final class Builder {
        private final List<ClassifiedCell> cells = new ArrayList<>();
        private final List<NamedRange> namedRanges = new ArrayList<>();
        private IterativeSettings iterativeCalculation;

        private Builder() {}

        public Builder cell(ClassifiedCell cell) {
            cells.add(Objects.requireNonNull(cell, "cell"));
            return this;
        }

        public Builder cells(Collection<ClassifiedCell> cells) {
            cells.forEach(this::cell);
            return this;
        }

        public Builder namedRange(NamedRange namedRange) {
            namedRanges.add(Objects.requireNonNull(namedRange, "namedRange"));
            return this;
        }

        public Builder iterativeCalculation(IterativeSettings settings) {
            this.iterativeCalculation = settings;
            return this;
        }

        public Workbook build() {
            return new Workbook(this);
        }
    }
}
