package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Splits formula text into tokens in a single left-to-right pass.
 * <p>
 * The lexer only decides token boundaries: whether {@code -} is unary, whether a reference
 * exists, and whether a function is known are decided by later phases.
 * </p>
 *
 * <pre>{@code
 * FormulaLexer.tokenize("=SUM('Q1 Data'!A1:A3)*-2%")
 * // FUNCTION(SUM) REFERENCE('Q1 Data'!A1:A3) RPAREN OPERATOR(*) OPERATOR(-) NUMBER(2) OPERATOR(%)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaLexer {

    private static final String FUTURE_FUNCTION_PREFIX = "_XLFN.";

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private FormulaLexer(String text) {
        this.text = text;
    }

    /**
     * Tokenizes a formula.
     *
     * @param formula formula text starting with {@code =}
     * @return tokens in source order
     * @throws FormulaSyntaxException on characters that cannot start a token
     */
    public static List<Token> tokenize(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new FormulaSyntaxException("Formula cannot be null or empty");
        }
        if (formula.charAt(0) != '=') {
            throw new FormulaSyntaxException("Formula must start with '='", 0);
        }
        FormulaLexer lexer = new FormulaLexer(formula);
        lexer.pos = 1;
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                readString();
            } else if (c == '#') {
                readError();
            } else if (c == '{') {
                readArray();
            } else if (c == '\'') {
                readQualifiedReference();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                readNumberOrRowRange();
            } else if (c == '$' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))) {
                readNumberOrRowRange();
            } else if (isIdentifierStart(c)) {
                readIdentifier();
            } else {
                readPunctuation(c);
            }
        }
    }

    private void readString() {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw new FormulaSyntaxException("Unterminated string literal", start);
            }
            char c = text.charAt(pos++);
            if (c == '"') {
                if (pos < text.length() && text.charAt(pos) == '"') {
                    value.append('"');
                    pos++;
                    continue;
                }
                break;
            }
            value.append(c);
        }
        tokens.add(Token.of(TokenType.STRING, value.toString(), start));
    }

    private void readError() {
        for (String code : ErrorKind.literalCodes()) {
            if (text.regionMatches(true, pos, code, 0, code.length())) {
                tokens.add(Token.of(TokenType.ERROR, code, pos));
                pos += code.length();
                return;
            }
        }
        throw new FormulaSyntaxException("Unknown error literal", pos);
    }

    private void readArray() {
        int start = pos;
        boolean inString = false;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                inString = !inString;
            } else if (c == '}' && !inString) {
                tokens.add(Token.of(TokenType.ARRAY, text.substring(start, pos), start));
                return;
            }
        }
        throw new FormulaSyntaxException("Unterminated array constant", start);
    }

    private void readQualifiedReference() {
        int start = pos;
        skipQuotedSheet();
        if (pos >= text.length() || text.charAt(pos) != '!') {
            throw new FormulaSyntaxException("Quoted sheet name must be followed by '!'", start);
        }
        pos++;
        readReferenceBody();
        readRangeTail();
        tokens.add(Token.of(TokenType.REFERENCE, text.substring(start, pos), start));
    }

    private void readNumberOrRowRange() {
        int start = pos;
        if (text.charAt(pos) == '$' || rowRangeAhead()) {
            readReferenceBody();
            readRangeTail();
            tokens.add(Token.of(TokenType.REFERENCE, text.substring(start, pos), start));
            return;
        }
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
            if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
                throw new FormulaSyntaxException("Malformed number exponent", mark);
            }
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        tokens.add(Token.of(TokenType.NUMBER, text.substring(start, pos), start));
    }

    private boolean rowRangeAhead() {
        int i = pos;
        while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
        return i < text.length() && text.charAt(i) == ':';
    }

    private void readIdentifier() {
        int start = pos;
        readReferenceBody();
        String word = text.substring(start, pos);

        if (pos < text.length() && text.charAt(pos) == '!') {
            pos++;
            readReferenceBody();
            readRangeTail();
            tokens.add(Token.of(TokenType.REFERENCE, text.substring(start, pos), start));
            return;
        }
        if (pos < text.length() && text.charAt(pos) == '(') {
            pos++;
            String name = word.toUpperCase(Locale.ROOT);
            // future-function prefix written by newer spreadsheet versions
            if (name.startsWith(FUTURE_FUNCTION_PREFIX)) {
                name = name.substring(FUTURE_FUNCTION_PREFIX.length());
            }
            tokens.add(Token.of(TokenType.FUNCTION, name, start));
            return;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        if (("TRUE".equals(upper) || "FALSE".equals(upper)) && !(pos < text.length() && text.charAt(pos) == ':')) {
            tokens.add(Token.of(TokenType.BOOLEAN, upper, start));
            return;
        }
        readRangeTail();
        tokens.add(Token.of(TokenType.REFERENCE, text.substring(start, pos), start));
    }

    private void readRangeTail() {
        if (pos >= text.length() || text.charAt(pos) != ':') {
            return;
        }
        pos++;
        if (pos < text.length() && text.charAt(pos) == '\'') {
            skipQuotedSheet();
            if (pos >= text.length() || text.charAt(pos) != '!') {
                throw new FormulaSyntaxException("Quoted sheet name must be followed by '!'", pos);
            }
            pos++;
        }
        int mark = pos;
        readReferenceBody();
        if (pos < text.length() && text.charAt(pos) == '!') {
            pos++;
            readReferenceBody();
        }
        if (pos == mark) {
            throw new FormulaSyntaxException("Incomplete range", mark);
        }
    }

    private void readReferenceBody() {
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) pos++;
    }

    private void skipQuotedSheet() {
        int start = pos++;
        while (true) {
            if (pos >= text.length()) {
                throw new FormulaSyntaxException("Unterminated quoted sheet name", start);
            }
            char c = text.charAt(pos++);
            if (c == '\'') {
                if (pos < text.length() && text.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                return;
            }
        }
    }

    private void readPunctuation(char c) {
        int start = pos;
        switch (c) {
            case '(' -> tokens.add(Token.of(TokenType.LPAREN, "(", start));
            case ')' -> tokens.add(Token.of(TokenType.RPAREN, ")", start));
            case ',' -> tokens.add(Token.of(TokenType.COMMA, ",", start));
            case '+', '-', '*', '/', '^', '&', '=', '%' -> tokens.add(Token.of(TokenType.OPERATOR, String.valueOf(c), start));
            case '<' -> {
                if (pos + 1 < text.length() && (text.charAt(pos + 1) == '=' || text.charAt(pos + 1) == '>')) {
                    tokens.add(Token.of(TokenType.OPERATOR, text.substring(pos, pos + 2), start));
                    pos += 2;
                    return;
                }
                tokens.add(Token.of(TokenType.OPERATOR, "<", start));
            }
            case '>' -> {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '=') {
                    tokens.add(Token.of(TokenType.OPERATOR, ">=", start));
                    pos += 2;
                    return;
                }
                tokens.add(Token.of(TokenType.OPERATOR, ">", start));
            }
            default -> throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
        }
        pos++;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '\\' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '\\';
    }

    /**
     * Decodes the content of an {@link TokenType#ARRAY} token.
     *
     * @param token the array token
     * @return rows of constant values
     * @throws FormulaSyntaxException on elements that are not constants or on ragged rows
     */
    static List<List<EvaluatedValue>> arrayRows(Token token) {
        String body = token.text().substring(1, token.text().length() - 1);
        List<List<EvaluatedValue>> rows = new ArrayList<>();
        List<EvaluatedValue> row = new ArrayList<>();
        StringBuilder element = new StringBuilder();
        boolean inString = false;
        for (int i = 0; i <= body.length(); i++) {
            char c = i < body.length() ? body.charAt(i) : ';';
            if (c == '"') {
                inString = !inString;
                element.append(c);
            } else if (!inString && (c == ',' || c == ';')) {
                row.add(arrayElement(element.toString().trim(), token.position() + 1 + Math.max(0, i - element.length())));
                element.setLength(0);
                if (c == ';') {
                    if (!rows.isEmpty() && rows.get(0).size() != row.size()) {
                        throw new FormulaSyntaxException("Array constant rows must have the same length", token.position());
                    }
                    rows.add(row);
                    row = new ArrayList<>();
                }
            } else {
                element.append(c);
            }
        }
        return rows;
    }

    private static EvaluatedValue arrayElement(String element, int position) {
        if (element.isEmpty()) {
            throw new FormulaSyntaxException("Empty element in array constant", position);
        }
        if (element.length() >= 2 && element.startsWith("\"") && element.endsWith("\"")) {
            return EvaluatedValue.text(element.substring(1, element.length() - 1).replace("\"\"", "\""));
        }
        if (element.startsWith("#")) {
            return ErrorKind.fromLiteral(element)
                    .map(EvaluatedValue::error)
                    .orElseThrow(() -> new FormulaSyntaxException("Unknown error literal in array constant", position));
        }
        String upper = element.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
            return EvaluatedValue.bool("TRUE".equals(upper));
        }
        OptionalDouble number = ValueFormat.parseDecimal(element);
        if (number.isEmpty()) {
            throw new FormulaSyntaxException("Array constants may only contain numbers, strings, booleans or errors", position);
        }
        return EvaluatedValue.number(number.getAsDouble());
    }
}
