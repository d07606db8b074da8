package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.sheetlogic.core.Formulas.eval;
import static io.github.cyfko.sheetlogic.core.Formulas.number;
import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest {

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource(delimiter = '|', value = {
            "=ROUND(2.5,0)          | 3",
            "=ROUND(-2.5,0)         | -3",
            "=ROUND(1.005,2)        | 1.01",
            "=ROUND(1234,-2)        | 1200",
            "=ROUNDUP(1.21,1)       | 1.3",
            "=ROUNDDOWN(-1.29,1)    | -1.2",
            "=INT(-1.5)             | -2",
            "=ABS(-4)               | 4",
            "=MOD(-3,2)             | 1",
            "=MOD(3,-2)             | -1",
            "=POWER(2,10)           | 1024",
            "=SQRT(16)              | 4"
    })
    void evaluates(String formula, double expected) {
        assertEquals(expected, number(formula), 1e-9);
    }

    @Test
    void errors() {
        assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=MOD(1,0)"));
        assertEquals(EvaluatedValue.error(ErrorKind.NUM), eval("=SQRT(-1)"));
        assertEquals(EvaluatedValue.error(ErrorKind.NUM), eval("=POWER(0,0)"));
    }
}
