package io.github.cyfko.sheetlogic.core.reference;

import io.github.cyfko.sheetlogic.core.exception.UnknownReferenceException;
import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.NamedRange;
import io.github.cyfko.sheetlogic.core.model.SheetExtent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceResolver Tests")
class ReferenceResolverTest {

    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        NamedRangeTable names = NamedRangeTable.of(List.of(
                NamedRange.ofCell("TaxRate", Coordinate.of("Settings", "B2")),
                NamedRange.ofRange("Prices", CellRange.of(Coordinate.of("Sheet1", "A1"), Coordinate.of("Sheet1", "A10")))));
        resolver = new ReferenceResolver(names, sheet -> new SheetExtent(5, 20));
    }

    @Nested
    @DisplayName("Single cells")
    class SingleCells {

        @ParameterizedTest
        @ValueSource(strings = {"B5", "$B$5", "b5", "$B5", "B$5"})
        @DisplayName("Anchors and case do not change the coordinate")
        void anchorsAreIgnored(String token) {
            ResolvedReference ref = resolver.resolve(token, "Sheet1");

            assertEquals(Coordinate.of("Sheet1", "B5"), ref.cell());
            assertEquals(ReferenceKind.DIRECT, ref.kind());
            assertFalse(ref.isRange());
        }

        @Test
        @DisplayName("Sheet-qualified reference to another sheet is cross-sheet")
        void crossSheet() {
            ResolvedReference ref = resolver.resolve("Rates!C3", "Sheet1");

            assertEquals(new Coordinate("Rates", 3, 3), ref.cell());
            assertEquals(ReferenceKind.CROSS_SHEET, ref.kind());
        }

        @Test
        @DisplayName("Quoted sheet names keep spaces and escaped quotes")
        void quotedSheet() {
            ResolvedReference ref = resolver.resolve("'Q1 ''Data'''!A1", "Sheet1");

            assertEquals("Q1 'Data'", ref.cell().sheet());
            assertEquals(ReferenceKind.CROSS_SHEET, ref.kind());
        }

        @Test
        @DisplayName("Qualifying the current sheet stays direct")
        void ownSheetQualified() {
            assertEquals(ReferenceKind.DIRECT, resolver.resolve("Sheet1!A1", "Sheet1").kind());
        }
    }

    @Nested
    @DisplayName("Ranges")
    class Ranges {

        @Test
        @DisplayName("Corners are normalized to top-left and bottom-right")
        void normalizesCorners() {
            ResolvedReference ref = resolver.resolve("D9:B5", "Sheet1");

            assertEquals(ReferenceKind.RANGE, ref.kind());
            assertEquals(Coordinate.of("Sheet1", "B5"), ref.range().start());
            assertEquals(Coordinate.of("Sheet1", "D9"), ref.range().end());
            assertEquals(15, ref.range().size());
        }

        @Test
        @DisplayName("Whole columns are bounded by the used rows of the sheet")
        void wholeColumn() {
            CellRange range = resolver.resolve("A:B", "Sheet1").range();

            assertEquals(Coordinate.of("Sheet1", "A1"), range.start());
            assertEquals(Coordinate.of("Sheet1", "B20"), range.end());
        }

        @Test
        @DisplayName("Whole rows are bounded by the used columns of the sheet")
        void wholeRow() {
            CellRange range = resolver.resolve("2:3", "Sheet1").range();

            assertEquals(Coordinate.of("Sheet1", "A2"), range.start());
            assertEquals(Coordinate.of("Sheet1", "E3"), range.end());
        }

        @Test
        @DisplayName("A one-cell range resolves to a single cell")
        void singleCellRange() {
            ResolvedReference ref = resolver.resolve("C3:C3", "Sheet1");

            assertFalse(ref.isRange());
            assertEquals(Coordinate.of("Sheet1", "C3"), ref.cell());
        }

        @Test
        @DisplayName("A range spanning two sheets is rejected")
        void twoSheets() {
            assertThrows(UnknownReferenceException.class, () -> resolver.resolve("Sheet1!A1:Sheet2!B2", "Sheet1"));
        }
    }

    @Nested
    @DisplayName("Named ranges")
    class Names {

        @Test
        @DisplayName("Names resolve case-insensitively and keep their name")
        void namedCell() {
            ResolvedReference ref = resolver.resolve("taxrate", "Sheet1");

            assertEquals(ReferenceKind.NAMED, ref.kind());
            assertEquals("TaxRate", ref.name());
            assertEquals(Coordinate.of("Settings", "B2"), ref.cell());
        }

        @Test
        @DisplayName("Named ranges resolve to their range")
        void namedRange() {
            ResolvedReference ref = resolver.resolve("Prices", "Sheet1");

            assertTrue(ref.isRange());
            assertEquals(10, ref.range().size());
        }

        @ParameterizedTest
        @ValueSource(strings = {"Missing", "Discount_2"})
        @DisplayName("Undefined names fail with UnknownReferenceException")
        void undefinedName(String token) {
            UnknownReferenceException e = assertThrows(UnknownReferenceException.class,
                    () -> resolver.resolve(token, "Sheet1"));
            assertTrue(e.getMessage().contains(token));
        }
    }

    @Test
    @DisplayName("Rows beyond the sheet are rejected")
    void rowOutOfSheet() {
        assertThrows(UnknownReferenceException.class, () -> resolver.resolve("A2000000", "Sheet1"));
    }

    @Test
    @DisplayName("Blank tokens are rejected")
    void blankToken() {
        assertThrows(UnknownReferenceException.class, () -> resolver.resolve(" ", "Sheet1"));
    }
}
