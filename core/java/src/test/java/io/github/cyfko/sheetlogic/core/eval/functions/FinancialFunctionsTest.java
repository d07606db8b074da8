package io.github.cyfko.sheetlogic.core.eval.functions;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.cyfko.sheetlogic.core.Formulas.eval;
import static io.github.cyfko.sheetlogic.core.Formulas.number;
import static org.junit.jupiter.api.Assertions.*;

class FinancialFunctionsTest {

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource(delimiter = '|', value = {
            "=PMT(0,10,1000)                | -100",
            "=PMT(0.05/12,360,200000)       | -1073.6432",
            "=PMT(0.1,1,100,0,1)            | -100",
            "=FV(0,10,-100)                 | 1000",
            "=FV(0.1,2,0,-100)              | 121",
            "=PV(0.1,1,0,110)               | -100",
            "=NPV(0.1,110,121)              | 200"
    })
    void evaluates(String formula, double expected) {
        assertEquals(expected, number(formula), 1e-3);
    }

    @Test
    void npvOverRange() {
        assertEquals(200, number("=NPV(A1,B1:B3)", "A1", 0.1, "B1", 110, "B2", "skip", "B3", 121), 1e-9);
    }

    @Test
    void errors() {
        assertEquals(EvaluatedValue.error(ErrorKind.DIV_ZERO), eval("=NPV(-1,100)"));
        assertEquals(EvaluatedValue.error(ErrorKind.NUM), eval("=PMT(0.1,0,100)"));
    }
}
