package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.ast.InfixOperator;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.sheetlogic.core.Formulas.eval;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Operators Tests")
class OperatorsTest {

    private static EvaluatedValue num(double value) {
        return EvaluatedValue.number(value);
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', value = {
                "=1+2*3        | 7",
                "=(1+2)*3      | 9",
                "=2^3^2        | 512",
                "=-2^2         | 4",
                "=10/4         | 2.5",
                "=50%          | 0.5",
                "=\"3\"+1      | 4",
                "=TRUE+TRUE    | 2",
                "=\"25%\"*4    | 1"
        })
        void evaluates(String formula, String expected) {
            assertEquals(expected, eval(formula).display());
        }

        @Test
        void divisionByZero() {
            assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=A1/B1", "A1", 3));
        }

        @Test
        void zeroToTheZero() {
            assertEquals(EvaluatedValue.error(ErrorKind.NUM), eval("=0^0"));
        }

        @Test
        @DisplayName("Non-numeric text is #VALUE!")
        void textOperand() {
            assertEquals(EvaluatedValue.error(ErrorKind.VALUE), eval("=A1*2", "A1", "abc"));
        }

        @Test
        @DisplayName("The leftmost error wins")
        void leftmostError() {
            EvaluatedValue result = Operators.apply(InfixOperator.ADD,
                    EvaluatedValue.error(ErrorKind.NOT_FOUND), EvaluatedValue.error(ErrorKind.REF));

            assertEquals(EvaluatedValue.error(ErrorKind.NOT_FOUND), result);
        }

        @Test
        void concatenation() {
            assertEquals("Total: 12.5", eval("=\"Total: \"&A1", "A1", 12.5).display());
            assertEquals("TRUE", eval("=A1&\"\"", "A1", true).display());
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        void datePlusNumberStaysDate() {
            EvaluatedValue result = Operators.apply(InfixOperator.ADD, EvaluatedValue.date(45000), num(7));

            assertEquals(EvaluatedValue.date(45007), result);
        }

        @Test
        void dateMinusDateIsNumber() {
            EvaluatedValue result = Operators.apply(InfixOperator.SUBTRACT, EvaluatedValue.date(45010), EvaluatedValue.date(45000));

            assertEquals(num(10), result);
        }
    }

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "=1<2             | TRUE",
                "=\"abc\"=\"ABC\" | TRUE",
                "=\"b\">\"A\"     | TRUE",
                "=1<\"a\"         | FALSE",
                "=1>\"a\"         | FALSE",
                "=1=\"1\"         | FALSE",
                "=1<>\"1\"        | TRUE",
                "=TRUE>FALSE      | TRUE",
                "=A1=0            | TRUE",
                "=A1=\"\"         | TRUE",
                "=A1=FALSE        | TRUE",
                "=A1<1            | TRUE"
        })
        void compares(String formula, String expected) {
            assertEquals(expected, eval(formula).display());
        }

        @Test
        void errorsPropagate() {
            assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=1/0=1"));
        }
    }
}
