package io.github.cyfko.sheetlogic.core.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular block of values in row-major order: the evaluated form of a range or array argument.
 *
 * @since 1.0.0
 */
public final class ValueGrid {

    private final int rows;
    private final int columns;
    private final List<EvaluatedValue> values;

    private ValueGrid(int rows, int columns, List<EvaluatedValue> values) {
        if (rows <= 0 || columns <= 0 || values.size() != rows * columns) {
            throw new IllegalArgumentException("grid of " + rows + "x" + columns + " cannot hold " + values.size() + " values");
        }
        this.rows = rows;
        this.columns = columns;
        this.values = List.copyOf(values);
    }

    public static ValueGrid of(int rows, int columns, List<EvaluatedValue> rowMajorValues) {
        return new ValueGrid(rows, columns, rowMajorValues);
    }

    public static ValueGrid single(EvaluatedValue value) {
        return new ValueGrid(1, 1, List.of(value));
    }

    public static ValueGrid ofRows(List<List<EvaluatedValue>> rowValues) {
        List<EvaluatedValue> flat = new ArrayList<>();
        rowValues.forEach(flat::addAll);
        return new ValueGrid(rowValues.size(), rowValues.isEmpty() ? 0 : rowValues.get(0).size(), flat);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int size() {
        return values.size();
    }

    /**
     * @param row    zero-based row
     * @param column zero-based column
     * @return the value at that position
     */
    public EvaluatedValue get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
        }
        return values.get(row * columns + column);
    }

    /**
     * Values in row-major order.
     *
     * @return immutable list
     */
    public List<EvaluatedValue> values() {
        return values;
    }

    public List<EvaluatedValue> row(int row) {
        return values.subList(row * columns, (row + 1) * columns);
    }

    public List<EvaluatedValue> column(int column) {
        List<EvaluatedValue> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(get(r, column));
        }
        return result;
    }

    /**
     * A one-row or one-column grid read as a flat vector.
     *
     * @return true when either dimension is 1
     */
    public boolean isVector() {
        return rows == 1 || columns == 1;
    }

    public EvaluatedValue topLeft() {
        return values.get(0);
    }

    @Override
    public String toString() {
        return "ValueGrid[" + rows + "x" + columns + "]";
    }
}
