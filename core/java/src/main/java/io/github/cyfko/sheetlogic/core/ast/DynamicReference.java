package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Call of a function whose target cells are only known at run time ({@code INDIRECT},
 * {@code OFFSET} with computed offsets, {@code ADDRESS}).
 * <p>
 * The compiler cannot draw dependency edges to the cells such a call reaches, so it evaluates to
 * an unsupported error. The position is diagnostic only and does not take part in equality.
 * </p>
 *
 * @param function upper-case function name
 * @param args     the call arguments
 * @param position offset of the function name in the formula text
 * @since 1.0.0
 */
public record DynamicReference(String function, List<FormulaNode> args, int position) implements FormulaNode {

    public DynamicReference {
        function = Objects.requireNonNull(function, "function").toUpperCase(Locale.ROOT);
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitDynamicReference(this);
    }

    @Override
    public List<FormulaNode> children() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DynamicReference other
                && function.equals(other.function)
                && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, args);
    }
}
