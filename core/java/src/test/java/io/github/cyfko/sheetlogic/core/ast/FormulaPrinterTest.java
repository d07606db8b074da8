package io.github.cyfko.sheetlogic.core.ast;

import io.github.cyfko.sheetlogic.core.Formulas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaPrinter Tests")
class FormulaPrinterTest {

    private final FormulaPrinter printer = new FormulaPrinter(Formulas.SHEET);

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
            "= sum( A1:A3 ) * 2      | =SUM(A1:A3)*2",
            "=((1+2))*3              | =(1+2)*3",
            "=1+(2*3)                | =1+2*3",
            "=10-(3-2)               | =10-(3-2)",
            "=(2^3)^2                | =(2^3)^2",
            "=2^(3^2)                | =2^3^2",
            "=-A1^2                  | =-A1^2",
            "=-(A1^2)                | =-(A1^2)",
            "=A1*10%                 | =A1*10%",
            "=Sheet1!B2&\"x\"\"y\"   | =B2&\"x\"\"y\"",
            "='My Sheet'!B2+Rates!C3 | ='My Sheet'!B2+Rates!C3",
            "=IF(A1>0,,#N/A)         | =IF(A1>0,,#N/A)",
            "=SUM({1,2;3,4})         | =SUM({1,2;3,4})",
    })
    @DisplayName("Prints normalized text with minimal parentheses")
    void normalizes(String source, String expected) {
        assertEquals(expected, printer.print(Formulas.parse(source)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=ROUND(A1*(1+B1)/C1,2)",
            "=IF(AND(A1>=0,A1<=100),\"ok\",\"out\")",
            "=VLOOKUP(A1,B1:D10,3,FALSE)",
            "=-2^-2",
            "=(A1-B1)-(C1-D1)",
            "=A1&B1&(C1&D1)",
            "=1-(-A1)",
            "=SUMIFS(C1:C9,A1:A9,\">=10\",B1:B9,\"x*\")",
    })
    @DisplayName("Printing then parsing yields the same tree")
    void roundTrip(String source) {
        FormulaNode tree = Formulas.parse(source);

        assertEquals(tree, Formulas.parse(printer.print(tree)));
    }

    @Test
    @DisplayName("Function names are collected in first-seen order")
    void functionNames() {
        FormulaNode tree = Formulas.parse("=IF(SUM(A1:A3)>0,ROUND(SUM(B1:B3),2),0)");

        assertEquals(List.of("IF", "SUM", "ROUND"), List.copyOf(FormulaNodes.functionNames(tree)));
    }

    @Test
    void noFunctions() {
        assertEquals(Set.of(), FormulaNodes.functionNames(Formulas.parse("=A1+1")));
    }
}
