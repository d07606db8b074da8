package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaLexer Tests")
class FormulaLexerTest {

    private static List<TokenType> types(String formula) {
        return FormulaLexer.tokenize(formula).stream().map(Token::type).collect(Collectors.toList());
    }

    private static List<String> texts(String formula) {
        return FormulaLexer.tokenize(formula).stream().map(Token::text).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Function calls consume their opening parenthesis")
    void functionCall() {
        assertEquals(List.of(TokenType.FUNCTION, TokenType.REFERENCE, TokenType.RPAREN, TokenType.OPERATOR, TokenType.NUMBER),
                types("=sum(A1:A3)*2"));
        assertEquals("SUM", FormulaLexer.tokenize("=sum(A1:A3)").get(0).text());
    }

    @Test
    @DisplayName("Quoted sheet references stay one token")
    void quotedSheetReference() {
        assertEquals(List.of("'Q1 Data'!A1:A3"), texts("='Q1 Data'!A1:A3"));
    }

    @Test
    @DisplayName("String literals unescape doubled quotes")
    void stringLiteral() {
        List<Token> tokens = FormulaLexer.tokenize("=\"say \"\"hi\"\"\"&A1");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("say \"hi\"", tokens.get(0).text());
    }

    @Test
    @DisplayName("Two-character comparison operators are single tokens")
    void comparisonOperators() {
        assertEquals(List.of("A1", "<>", "B1", "<=", "C1", ">=", "D1"), texts("=A1<>B1<=C1>=D1"));
    }

    @Test
    @DisplayName("Error literals, booleans and arrays are recognized")
    void constants() {
        assertEquals(List.of(TokenType.ERROR, TokenType.COMMA, TokenType.BOOLEAN, TokenType.COMMA, TokenType.ARRAY),
                types("=#N/A,true,{1,2;3,4}").subList(0, 5));
    }

    @Test
    @DisplayName("Row ranges and anchored references are references, not numbers")
    void rowRanges() {
        assertEquals(List.of(TokenType.FUNCTION, TokenType.REFERENCE, TokenType.COMMA, TokenType.REFERENCE, TokenType.RPAREN),
                types("=SUM(1:3,$B$2)"));
    }

    @Test
    @DisplayName("Future-function prefix is stripped")
    void futureFunctionPrefix() {
        assertEquals("XLOOKUP", FormulaLexer.tokenize("=_xlfn.XLOOKUP(A1,B1:B3,C1:C3)").get(0).text());
    }

    @Test
    @DisplayName("Numbers with exponent are one token")
    void scientificNotation() {
        assertEquals(List.of("1.5e-3"), texts("=1.5e-3"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A1+1", "=\"open", "=A1 ~ 2", "={1,2", "=#BOGUS"})
    @DisplayName("Malformed input fails with FormulaSyntaxException")
    void malformed(String formula) {
        assertThrows(FormulaSyntaxException.class, () -> FormulaLexer.tokenize(formula));
    }
}
