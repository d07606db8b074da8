package io.github.cyfko.sheetlogic.core.reference;

import io.github.cyfko.sheetlogic.core.exception.UnknownReferenceException;
import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.NamedRange;
import io.github.cyfko.sheetlogic.core.model.SheetExtent;

import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes raw reference tokens into canonical coordinates and ranges.
 * <p>
 * Supported forms:
 * </p>
 * <ul>
 *   <li>single cells: {@code B5}, {@code $B$5}, {@code Sheet2!B5}, {@code 'My Sheet'!B5}</li>
 *   <li>ranges: {@code B5:D9}, {@code Sheet2!$B$5:D9}, {@code Sheet2!B5:Sheet2!D9}</li>
 *   <li>whole columns and rows: {@code A:C}, {@code 1:3}, bounded by the used area of the sheet</li>
 *   <li>named ranges: {@code TaxRate}, optionally sheet-qualified</li>
 * </ul>
 * <p>
 * {@code $} anchors are dropped: the compiler works on one static snapshot, so absolute and
 * relative references resolve to the same coordinate. The resolver holds no mutable state and
 * can be shared by parsing threads.
 * </p>
 *
 * <pre>{@code
 * ReferenceResolver resolver = new ReferenceResolver(NamedRangeTable.of(workbook.namedRanges()), workbook::extentOf);
 * ResolvedReference ref = resolver.resolve("Sheet2!B5:D9", "Sheet1");
 * ref.kind();   // CROSS_SHEET
 * ref.range();  // Sheet2!B5:D9
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReferenceResolver {

    private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})");
    private static final Pattern COLUMN = Pattern.compile("\\$?([A-Za-z]{1,3})");
    private static final Pattern ROW = Pattern.compile("\\$?([0-9]{1,7})");

    private final NamedRangeTable names;
    private final Function<String, SheetExtent> extents;

    /**
     * Creates a resolver without named ranges whose sheets are all reduced to {@code A1}.
     */
    public ReferenceResolver() {
        this(NamedRangeTable.empty(), sheet -> new SheetExtent(1, 1));
    }

    /**
     * @param names   the workbook's named ranges
     * @param extents used area per sheet, bounding whole-column and whole-row references
     */
    public ReferenceResolver(NamedRangeTable names, Function<String, SheetExtent> extents) {
        this.names = Objects.requireNonNull(names, "names");
        this.extents = Objects.requireNonNull(extents, "extents");
    }

    public NamedRangeTable names() {
        return names;
    }

    /**
     * Resolves a reference token in the context of the formula's sheet.
     *
     * @param token        raw token as written in the formula
     * @param currentSheet sheet of the cell containing the formula
     * @return the resolved reference
     * @throws UnknownReferenceException if the token is neither an address nor a defined name
     */
    public ResolvedReference resolve(String token, String currentSheet) {
        if (token == null || token.isBlank()) {
            throw new UnknownReferenceException(String.valueOf(token), "Reference cannot be null or empty");
        }
        Objects.requireNonNull(currentSheet, "currentSheet");

        SheetSplit first = splitSheet(token.trim(), token);
        String sheet = first.sheet() != null ? first.sheet() : currentSheet;
        String body = first.rest();

        int colon = body.indexOf(':');
        if (colon >= 0) {
            SheetSplit second = splitSheet(body.substring(colon + 1), token);
            if (second.sheet() != null && !second.sheet().equals(sheet)) {
                throw new UnknownReferenceException(token, "Range '" + token + "' spans two sheets");
            }
            CellRange range = resolveRange(body.substring(0, colon), second.rest(), sheet, token);
            ReferenceKind kind = !sheet.equals(currentSheet) ? ReferenceKind.CROSS_SHEET : ReferenceKind.RANGE;
            if (range.isSingleCell()) {
                return new ResolvedReference(range.start(), null, kind == ReferenceKind.RANGE ? ReferenceKind.DIRECT : kind, null);
            }
            return new ResolvedReference(null, range, kind, null);
        }

        Matcher cell = CELL.matcher(body);
        if (cell.matches()) {
            Coordinate coordinate = toCoordinate(sheet, cell.group(1), cell.group(2), token);
            ReferenceKind kind = !sheet.equals(currentSheet) ? ReferenceKind.CROSS_SHEET : ReferenceKind.DIRECT;
            return new ResolvedReference(coordinate, null, kind, null);
        }

        NamedRange named = names.lookup(body)
                .orElseThrow(() -> new UnknownReferenceException(token));
        return named.isRange()
                ? new ResolvedReference(null, named.range(), ReferenceKind.NAMED, named.name())
                : new ResolvedReference(named.cell(), null, ReferenceKind.NAMED, named.name());
    }

    /**
     * Whether the token has the shape of an A1 cell address, with optional anchors.
     *
     * @param token the token
     * @return true for tokens such as {@code B5} or {@code $AB$12}
     */
    public static boolean isCellAddress(String token) {
        return token != null && CELL.matcher(token).matches();
    }

    private CellRange resolveRange(String left, String right, String sheet, String token) {
        Matcher leftCell = CELL.matcher(left);
        Matcher rightCell = CELL.matcher(right);
        if (leftCell.matches() && rightCell.matches()) {
            return CellRange.of(
                    toCoordinate(sheet, leftCell.group(1), leftCell.group(2), token),
                    toCoordinate(sheet, rightCell.group(1), rightCell.group(2), token));
        }

        SheetExtent extent = extents.apply(sheet);
        Matcher leftColumn = COLUMN.matcher(left);
        Matcher rightColumn = COLUMN.matcher(right);
        if (leftColumn.matches() && rightColumn.matches()) {
            int from = column(leftColumn.group(1), token);
            int to = column(rightColumn.group(1), token);
            return CellRange.of(new Coordinate(sheet, from, 1), new Coordinate(sheet, to, extent.maxRow()));
        }

        Matcher leftRow = ROW.matcher(left);
        Matcher rightRow = ROW.matcher(right);
        if (leftRow.matches() && rightRow.matches()) {
            int from = row(leftRow.group(1), token);
            int to = row(rightRow.group(1), token);
            return CellRange.of(new Coordinate(sheet, 1, from), new Coordinate(sheet, extent.maxColumn(), to));
        }

        throw new UnknownReferenceException(token, "Malformed range '" + token + "'");
    }

    private static Coordinate toCoordinate(String sheet, String letters, String digits, String token) {
        return new Coordinate(sheet, column(letters, token), row(digits, token));
    }

    private static int column(String letters, String token) {
        int column = ColumnLetters.toIndex(letters);
        if (column > ColumnLetters.MAX_COLUMN) {
            throw new UnknownReferenceException(token, "Column '" + letters + "' is outside the sheet in '" + token + "'");
        }
        return column;
    }

    private static int row(String digits, String token) {
        int row = Integer.parseInt(digits);
        if (row < 1 || row > ColumnLetters.MAX_ROW) {
            throw new UnknownReferenceException(token, "Row " + digits + " is outside the sheet in '" + token + "'");
        }
        return row;
    }

    private static SheetSplit splitSheet(String text, String token) {
        if (text.startsWith("'")) {
            StringBuilder sheet = new StringBuilder();
            int i = 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        sheet.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                sheet.append(c);
                i++;
            }
            if (i >= text.length() || i + 1 >= text.length() || text.charAt(i + 1) != '!') {
                throw new UnknownReferenceException(token, "Malformed sheet reference '" + token + "'");
            }
            return new SheetSplit(sheet.toString(), text.substring(i + 2));
        }
        int bang = text.indexOf('!');
        if (bang == 0 || bang == text.length() - 1) {
            throw new UnknownReferenceException(token, "Malformed sheet reference '" + token + "'");
        }
        if (bang > 0) {
            return new SheetSplit(text.substring(0, bang), text.substring(bang + 1));
        }
        return new SheetSplit(null, text);
    }

    private record SheetSplit(String sheet, String rest) {}
}
