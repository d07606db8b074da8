package io.github.cyfko.sheetlogic.core.ast;

/**
 * Unary operators: prefix sign operators bind tighter than {@code ^}, postfix percent binds
 * tightest of all.
 *
 * @since 1.0.0
 */
public enum AffixOperator {
    NEGATE("-", 6, false),
    PLUS("+", 6, false),
    PERCENT("%", 7, true);

    private final String symbol;
    private final int precedence;
    private final boolean postfix;

    AffixOperator(String symbol, int precedence, boolean postfix) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.postfix = postfix;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isPostfix() {
        return postfix;
    }
}
