package io.github.cyfko.sheetlogic.core.parsing;

/**
 * Token categories produced by {@link FormulaLexer} and rewritten by {@link PostfixConverter}.
 *
 * @since 1.0.0
 */
public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    /** Cell, range or name, including any sheet qualifier. */
    REFERENCE,
    /** Inline constant array, braces included. */
    ARRAY,
    /** Function name; the opening parenthesis is consumed with it. */
    FUNCTION,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    /** Prefix sign operator, assigned by the converter. */
    PREFIX,
    /** Postfix percent, assigned by the converter. */
    POSTFIX,
    /** Empty argument slot, emitted by the converter. */
    MISSING;

    public boolean isOperand() {
        return this == NUMBER || this == STRING || this == BOOLEAN || this == ERROR
                || this == REFERENCE || this == ARRAY;
    }
}
