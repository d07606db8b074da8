package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.sheetlogic.core.Formulas.eval;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lookups over a small fruit table (A1:C4), a grade scale (E1:F4), a descending
 * column (G1:G4) and a horizontal quarter table (A10:C11).
 */
@DisplayName("Lookup Functions Tests")
class LookupFunctionsTest {

    private static final Object[] SHEET = {
            "A1", "Apple", "B1", 1.5, "C1", "red",
            "A2", "Banana", "B2", 0.5, "C2", "yellow",
            "A3", "Cherry", "B3", 3, "C3", "red",
            "A4", "Date", "B4", 2, "C4", "brown",
            "E1", 0, "F1", "F",
            "E2", 60, "F2", "D",
            "E3", 70, "F3", "C",
            "E4", 90, "F4", "A",
            "G1", 100, "G2", 80, "G3", 60, "G4", 40,
            "A10", "Q1", "B10", "Q2", "C10", "Q3",
            "A11", 10, "B11", 20, "C11", 30
    };

    private static String display(String formula) {
        return eval(formula, SHEET).display();
    }

    @Nested
    @DisplayName("VLOOKUP / HLOOKUP")
    class TableLookups {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "=VLOOKUP(\"banana\",A1:C4,2,FALSE)  | 0.5",
                "=VLOOKUP(\"b*\",A1:C4,3,FALSE)      | yellow",
                "=VLOOKUP(75,E1:F4,2)                | C",
                "=VLOOKUP(95,E1:F4,2,TRUE)           | A",
                "=VLOOKUP(60,E1:F4,2,TRUE)           | D",
                "=HLOOKUP(\"Q2\",A10:C11,2,FALSE)    | 20"
        })
        void finds(String formula, String expected) {
            assertEquals(expected, display(formula));
        }

        @Test
        @DisplayName("Misses are #N/A")
        void misses() {
            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), eval("=VLOOKUP(\"Kiwi\",A1:C4,2,FALSE)", SHEET));
            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), eval("=VLOOKUP(-1,E1:F4,2)", SHEET));
        }

        @Test
        @DisplayName("Column offsets are bounded")
        void offsets() {
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=VLOOKUP(\"Apple\",A1:C4,0,FALSE)", SHEET));
            assertEquals(EvaluatedValue.error(ErrorKind.REF), eval("=VLOOKUP(\"Apple\",A1:C4,4,FALSE)", SHEET));
        }
    }

    @Nested
    @DisplayName("INDEX / MATCH")
    class IndexMatch {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "=INDEX(A1:C4,3,1)                    | Cherry",
                "=INDEX(B1:B4,2)                      | 0.5",
                "=INDEX(A10:C10,3)                    | Q3",
                "=MATCH(\"cherry\",A1:A4,0)           | 3",
                "=MATCH(75,E1:E4)                     | 3",
                "=MATCH(75,G1:G4,-1)                  | 2",
                "=INDEX(C1:C4,MATCH(\"Date\",A1:A4,0)) | brown"
        })
        void finds(String formula, String expected) {
            assertEquals(expected, display(formula));
        }

        @Test
        void indexOutOfRange() {
            assertEquals(EvaluatedValue.error(ErrorKind.REF), eval("=INDEX(A1:C4,5,1)", SHEET));
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=INDEX(A1:C4,0,1)", SHEET));
        }

        @Test
        void matchMisses() {
            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), eval("=MATCH(\"Kiwi\",A1:A4,0)", SHEET));
            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), eval("=MATCH(5,A1:C4,0)", SHEET));
        }
    }

    @Nested
    @DisplayName("XLOOKUP")
    class XLookup {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "=XLOOKUP(\"Date\",A1:A4,B1:B4)           | 2",
                "=XLOOKUP(\"Kiwi\",A1:A4,B1:B4,\"none\")  | none",
                "=XLOOKUP(65,E1:E4,F1:F4,,-1)             | D",
                "=XLOOKUP(65,E1:E4,F1:F4,,1)              | C",
                "=XLOOKUP(\"red\",C1:C4,A1:A4,,0,-1)      | Cherry",
                "=XLOOKUP(\"Ch*\",A1:A4,C1:C4,,2)         | red",
                "=XLOOKUP(\"Q3\",A10:C10,A11:C11)         | 30"
        })
        void finds(String formula, String expected) {
            assertEquals(expected, display(formula));
        }

        @Test
        void missWithoutFallback() {
            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), eval("=XLOOKUP(\"Kiwi\",A1:A4,B1:B4)", SHEET));
        }

        @Test
        void invalidModes() {
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=XLOOKUP(1,E1:E4,F1:F4,,3)", SHEET));
        }
    }
}
