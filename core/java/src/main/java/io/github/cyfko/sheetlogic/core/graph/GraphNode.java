package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.Optional;

/**
 * A cell taking part in the dependency graph.
 * <p>
 * Nodes live in a dense array inside {@link DependencyGraph}; {@code id} is their index there and
 * is stable for the lifetime of the graph. Cells referenced by formulas but absent from the
 * workbook appear as {@link CellRole#INPUT} nodes with {@code implicit} set.
 * </p>
 *
 * @param id         index of the node in the graph
 * @param coordinate the cell
 * @param role       role of the cell
 * @param ast        parsed formula, or null for constants, implicit cells and cells that failed to parse
 * @param implicit   whether the cell was only discovered through a reference
 * @param inDegree   number of distinct dependencies
 * @param outDegree  number of distinct dependents
 * @param depth      longest dependency chain leading to this node
 * @param clusterId  id of the weakly connected component holding this node
 * @since 1.0.0
 */
public record GraphNode(
        int id,
        Coordinate coordinate,
        CellRole role,
        FormulaNode ast,
        boolean implicit,
        int inDegree,
        int outDegree,
        int depth,
        int clusterId
) {

    public Optional<FormulaNode> formula() {
        return Optional.ofNullable(ast);
    }

    public boolean isSource() {
        return inDegree == 0;
    }
}
