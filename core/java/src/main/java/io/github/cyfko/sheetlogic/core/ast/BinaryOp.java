package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Infix operation such as {@code A1 + B1} or {@code A1 >= 10}.
 *
 * @since 1.0.0
 */
public record BinaryOp(InfixOperator op, FormulaNode left, FormulaNode right) implements FormulaNode {

    public BinaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of(left, right);
    }
}
