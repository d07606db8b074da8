package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Call of a named function, e.g. {@code SUM(A1:A3, 2)}.
 *
 * @param name upper-case function name
 * @param args arguments in call order, {@link MissingArgument} for empty slots
 * @since 1.0.0
 */
public record FunctionCall(String name, List<FormulaNode> args) implements FormulaNode {

    public FunctionCall {
        name = Objects.requireNonNull(name, "name").toUpperCase(Locale.ROOT);
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public List<FormulaNode> children() {
        return args;
    }
}
