package io.github.cyfko.sheetlogic.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators with their spreadsheet precedence.
 * <p>
 * Precedence, low to high: comparison (1), {@code &} (2), {@code + -} (3), {@code * /} (4),
 * {@code ^} (5). Only {@code ^} is right-associative.
 * </p>
 *
 * @since 1.0.0
 */
public enum InfixOperator {
    EQ("=", 1),
    NE("<>", 1),
    LT("<", 1),
    GT(">", 1),
    LE("<=", 1),
    GE(">=", 1),
    CONCAT("&", 2),
    ADD("+", 3),
    SUBTRACT("-", 3),
    MULTIPLY("*", 4),
    DIVIDE("/", 4),
    POWER("^", 5);

    private final String symbol;
    private final int precedence;

    InfixOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public boolean isComparison() {
        return precedence == 1;
    }

    public static Optional<InfixOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
