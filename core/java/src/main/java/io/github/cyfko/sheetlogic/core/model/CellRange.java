package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A rectangular block of cells on one sheet.
 * <p>
 * The corners are normalized at construction so that {@link #start()} is the top-left and
 * {@link #end()} the bottom-right cell. Iteration is lazy and row-major: ranges used only by
 * aggregate functions are never materialized, and {@link #contains(Coordinate)} answers
 * membership in constant time.
 * </p>
 *
 * <pre>{@code
 * CellRange range = CellRange.of(Coordinate.of("Sheet1", "D9"), Coordinate.of("Sheet1", "B5"));
 * range.start();   // Sheet1!B5
 * range.size();    // 15
 * range.contains(Coordinate.of("Sheet1", "C7")); // true
 * }</pre>
 *
 * @param start top-left corner
 * @param end   bottom-right corner
 * @since 1.0.0
 */
public record CellRange(Coordinate start, Coordinate end) implements Iterable<Coordinate> {

    public CellRange {
        if (start == null || end == null)
            throw new WorkbookDefinitionException("range corners cannot be null");
        if (!start.sheet().equals(end.sheet()))
            throw new WorkbookDefinitionException("range corners must be on the same sheet: " + start + ", " + end);
        if (start.row() > end.row() || start.column() > end.column()) {
            Coordinate topLeft = new Coordinate(start.sheet(),
                    Math.min(start.column(), end.column()), Math.min(start.row(), end.row()));
            Coordinate bottomRight = new Coordinate(start.sheet(),
                    Math.max(start.column(), end.column()), Math.max(start.row(), end.row()));
            start = topLeft;
            end = bottomRight;
        }
    }

    public static CellRange of(Coordinate a, Coordinate b) {
        return new CellRange(a, b);
    }

    public String sheet() {
        return start.sheet();
    }

    public int rows() {
        return end.row() - start.row() + 1;
    }

    public int columns() {
        return end.column() - start.column() + 1;
    }

    /**
     * Number of cells covered by the range.
     *
     * @return rows × columns
     */
    public long size() {
        return (long) rows() * columns();
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    /**
     * Membership test that never expands the range.
     *
     * @param coordinate the coordinate to test
     * @return true when the coordinate lies inside the rectangle
     */
    public boolean contains(Coordinate coordinate) {
        return coordinate != null
                && coordinate.sheet().equals(start.sheet())
                && coordinate.row() >= start.row() && coordinate.row() <= end.row()
                && coordinate.column() >= start.column() && coordinate.column() <= end.column();
    }

    /**
     * Returns the cell at the given zero-based offsets from the top-left corner.
     *
     * @param rowOffset    zero-based row offset
     * @param columnOffset zero-based column offset
     * @return the coordinate
     * @throws IndexOutOfBoundsException when the offsets fall outside the range
     */
    public Coordinate get(int rowOffset, int columnOffset) {
        if (rowOffset < 0 || rowOffset >= rows() || columnOffset < 0 || columnOffset >= columns()) {
            throw new IndexOutOfBoundsException("offset (" + rowOffset + "," + columnOffset + ") outside " + this);
        }
        return new Coordinate(start.sheet(), start.column() + columnOffset, start.row() + rowOffset);
    }

    /**
     * Materializes every coordinate in row-major order.
     *
     * @param limit maximum number of cells the caller accepts
     * @return the coordinates
     * @throws IllegalStateException if the range is larger than {@code limit}
     */
    public List<Coordinate> expand(int limit) {
        if (size() > limit) {
            throw new IllegalStateException("Range " + this + " has " + size() + " cells, more than the expansion limit " + limit);
        }
        List<Coordinate> cells = new ArrayList<>((int) size());
        forEach(cells::add);
        return cells;
    }

    @Override
    public Iterator<Coordinate> iterator() {
        return new Iterator<>() {
            private int row = start.row();
            private int column = start.column();

            @Override
            public boolean hasNext() {
                return row <= end.row();
            }

            @Override
            public Coordinate next() {
                if (!hasNext()) throw new NoSuchElementException();
                Coordinate current = new Coordinate(start.sheet(), column, row);
                if (++column > end.column()) {
                    column = start.column();
                    row++;
                }
                return current;
            }
        };
    }

    public Stream<Coordinate> stream() {
        return StreamSupport.stream(Spliterators.spliterator(iterator(), size(),
                Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.SIZED), false);
    }

    @Override
    public String toString() {
        return Coordinate.quoteSheet(start.sheet()) + "!" + start.toA1() + ":" + end.toA1();
    }
}
