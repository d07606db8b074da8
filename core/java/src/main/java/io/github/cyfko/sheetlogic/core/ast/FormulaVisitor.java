package io.github.cyfko.sheetlogic.core.ast;

/**
 * Visitor over every {@link FormulaNode} kind.
 *
 * @param <R> result type
 * @since 1.0.0
 */
public interface FormulaVisitor<R> {

    R visitFunctionCall(FunctionCall node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);

    R visitCellReference(CellReference node);

    R visitRangeReference(RangeReference node);

    R visitLiteral(Literal node);

    R visitArrayLiteral(ArrayLiteral node);

    R visitMissingArgument(MissingArgument node);

    R visitDynamicReference(DynamicReference node);
}
