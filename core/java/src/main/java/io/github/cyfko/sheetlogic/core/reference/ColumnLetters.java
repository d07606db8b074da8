package io.github.cyfko.sheetlogic.core.reference;

import java.util.Locale;

/**
 * Bijective base-26 encoding of column indices: {@code A}=1, {@code Z}=26, {@code AA}=27, {@code XFD}=16384.
 *
 * @since 1.0.0
 */
public final class ColumnLetters {

    /** Largest column addressable in a worksheet ({@code XFD}). */
    public static final int MAX_COLUMN = 16_384;

    /** Largest row addressable in a worksheet. */
    public static final int MAX_ROW = 1_048_576;

    private ColumnLetters() {}

    /**
     * Decodes column letters into a 1-based index.
     *
     * @param letters one to three ASCII letters, any case
     * @return the column index
     * @throws IllegalArgumentException if the letters are blank or not alphabetic
     */
    public static int toIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("column letters cannot be null or empty");
        }
        int index = 0;
        for (char c : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("invalid column letters: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index;
    }

    /**
     * Encodes a 1-based column index into letters.
     *
     * @param index the column index, at least 1
     * @return the column letters
     */
    public static String toLetters(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("column index must be >= 1, got: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = index;
        while (remaining > 0) {
            int rem = (remaining - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            remaining = (remaining - 1) / 26;
        }
        return sb.toString();
    }
}
