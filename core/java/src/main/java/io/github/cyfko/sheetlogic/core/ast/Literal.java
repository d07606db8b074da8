package io.github.cyfko.sheetlogic.core.ast;

import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.List;
import java.util.Objects;

/**
 * Constant: number, string, boolean or error literal.
 *
 * @since 1.0.0
 */
public record Literal(EvaluatedValue value) implements FormulaNode {

    public Literal {
        Objects.requireNonNull(value, "value");
    }

    public static Literal number(double value) {
        return new Literal(EvaluatedValue.number(value));
    }

    public static Literal text(String value) {
        return new Literal(EvaluatedValue.text(value));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public List<FormulaNode> children() {
        return List.of();
    }
}
