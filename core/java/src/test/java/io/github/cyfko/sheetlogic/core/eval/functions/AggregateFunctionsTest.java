package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.sheetlogic.core.Formulas.eval;
import static io.github.cyfko.sheetlogic.core.Formulas.number;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Aggregate Functions Tests")
class AggregateFunctionsTest {

    private static final Object[] COLUMN = {"A1", 1, "A2", "text", "A3", 3, "A4", true};

    @Nested
    @DisplayName("Numeric aggregates")
    class Numeric {

        @Test
        @DisplayName("Ranges skip text, booleans and blanks")
        void sumSkipsNonNumbers() {
            assertEquals(4, number("=SUM(A1:A5)", COLUMN));
        }

        @Test
        @DisplayName("Direct arguments are coerced")
        void directArgumentsCoerced() {
            assertEquals(6, number("=SUM(1,\"2\",TRUE,2)"));
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=SUM(1,\"two\")"));
        }

        @Test
        @DisplayName("Errors inside ranges propagate")
        void errorsPropagate() {
            assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO),
                    eval("=SUM(A1:A2)", "A1", 1, "A2", EvaluatedValue.error(ErrorKind.DIV_ZERO)));
        }

        @Test
        void average() {
            assertEquals(2, number("=AVERAGE(A1:A5)", COLUMN));
            assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=AVERAGE(B1:B3)"));
        }

        @Test
        void minMax() {
            assertEquals(-2, number("=MIN(A1:A3,-2)", COLUMN));
            assertEquals(3, number("=MAX(A1:A5)", COLUMN));
            assertEquals(0, number("=MAX(B1:B3)"));
        }

        @Test
        void product() {
            assertEquals(3, number("=PRODUCT(A1:A4)", COLUMN));
            assertEquals(0, number("=PRODUCT(B1:B2)"));
        }

        @Test
        void counts() {
            assertEquals(2, number("=COUNT(A1:A5)", COLUMN));
            assertEquals(4, number("=COUNTA(A1:A5)", COLUMN));
            assertEquals(3, number("=COUNT(1,\"2\",TRUE,\"x\")"));
        }
    }

    @Nested
    @DisplayName("Criteria aggregates")
    class WithCriteria {

        private final Object[] sales = {
                "A1", "North", "B1", 100,
                "A2", "South", "B2", 50,
                "A3", "north", "B3", 25,
                "A4", "East", "B4", 10
        };

        @Test
        void sumIf() {
            assertEquals(125, number("=SUMIF(A1:A4,\"north\",B1:B4)", sales));
            assertEquals(150, number("=SUMIF(B1:B4,\">=50\")", sales));
        }

        @Test
        void countIf() {
            assertEquals(2, number("=COUNTIF(A1:A4,\"<>north\")", sales));
            assertEquals(3, number("=COUNTIF(A1:A4,\"*th\")", sales));
        }

        @Test
        void averageIf() {
            assertEquals(62.5, number("=AVERAGEIF(A1:A4,\"North\",B1:B4)", sales));
            assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=AVERAGEIF(A1:A4,\"West\",B1:B4)", sales));
        }

        @Test
        void multipleCriteria() {
            assertEquals(100, number("=SUMIFS(B1:B4,A1:A4,\"north\",B1:B4,\">50\")", sales));
            assertEquals(1, number("=COUNTIFS(A1:A4,\"north\",B1:B4,\"<50\")", sales));
            assertEquals(62.5, number("=AVERAGEIFS(B1:B4,A1:A4,\"North\")", sales));
        }

        @Test
        @DisplayName("Criteria ranges of different shapes are #VALUE!")
        void mismatchedShapes() {
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=SUMIFS(B1:B4,A1:A3,\"north\")", sales));
        }
    }

    @Nested
    @DisplayName("Criteria")
    class CriteriaParsing {

        @ParameterizedTest(name = "{0} matches {1}: {2}")
        @CsvSource({
                ">=10, 12, true",
                ">=10, 9, false",
                "<>x, X, false",
                "<>x, y, true",
                "ab*, ABC, true",
                "a?c, abc, true",
                "a?c, abbc, false",
                "~*, *, true",
                "~*, a, false",
                "=5, 5, true",
                "<b, a, true"
        })
        void matches(String criterion, String cell, boolean expected) {
            assertEquals(expected, Criteria.parse(EvaluatedValue.text(criterion)).test(EvaluatedValue.parse(cell)));
        }

        @Test
        @DisplayName("Error cells never match")
        void errorCells() {
            assertFalse(Criteria.parse(EvaluatedValue.text("<>1")).test(EvaluatedValue.error(ErrorKind.NOT_FOUND)));
        }

        @Test
        void emptyCriterion() {
            assertTrue(Criteria.parse(EvaluatedValue.text("")).test(EvaluatedValue.empty()));
            assertTrue(Criteria.parse(EvaluatedValue.text("<>")).test(EvaluatedValue.number(0)));
        }
    }
}
