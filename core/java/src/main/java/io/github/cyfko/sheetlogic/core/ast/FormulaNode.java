package io.github.cyfko.sheetlogic.core.ast;

import java.util.List;

/**
 * Node of a parsed formula.
 * <p>
 * The hierarchy is closed: consumers either switch over {@link #accept(FormulaVisitor)} or walk
 * {@link #children()} generically. Nodes are immutable records with structural equality, so two
 * formulas that parse to equal trees compare equal regardless of their original spelling.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FormulaNode
        permits FunctionCall, BinaryOp, UnaryOp, CellReference, RangeReference, Literal,
        ArrayLiteral, MissingArgument, DynamicReference {

    <R> R accept(FormulaVisitor<R> visitor);

    /**
     * Direct sub-expressions in evaluation order.
     *
     * @return the children, empty for leaves
     */
    List<FormulaNode> children();
}
