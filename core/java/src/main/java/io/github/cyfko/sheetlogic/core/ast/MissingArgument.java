package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;

/**
 * An explicitly empty argument slot, as in {@code IF(A1,,0)}.
 *
 * @since 1.0.0
 */
public record MissingArgument() implements FormulaNode {

    public static final MissingArgument INSTANCE = new MissingArgument();

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitMissingArgument(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }
}
