package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Prefix sign or postfix percent applied to one operand.
 *
 * @since 1.0.0
 */
public record UnaryOp(AffixOperator op, FormulaNode operand) implements FormulaNode {

    public UnaryOp {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of(operand);
    }
}
