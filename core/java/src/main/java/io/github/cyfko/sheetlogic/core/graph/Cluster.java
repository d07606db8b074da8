package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A weakly connected component of the dependency graph: one independent piece of business logic.
 *
 * @param id            position of the cluster in {@link DependencyGraph#clusters()}
 * @param name          stable name, {@code cluster_<id>} optionally followed by a label slug
 * @param inputs        input cells, in coordinate order
 * @param intermediates formula cells that are not outputs, in coordinate order
 * @param outputs       output cells, in coordinate order
 * @param purpose       dominant kind of calculation, or null when no formula hints at one
 * @since 1.0.0
 */
public record Cluster(
        int id,
        String name,
        List<Coordinate> inputs,
        List<Coordinate> intermediates,
        List<Coordinate> outputs,
        String purpose
) {

    public Cluster {
        inputs = List.copyOf(inputs);
        intermediates = List.copyOf(intermediates);
        outputs = List.copyOf(outputs);
    }

    public Optional<String> purposeHint() {
        return Optional.ofNullable(purpose);
    }

    /**
     * @return every member cell: inputs, then intermediates, then outputs
     */
    public List<Coordinate> members() {
        List<Coordinate> members = new ArrayList<>(inputs.size() + intermediates.size() + outputs.size());
        members.addAll(inputs);
        members.addAll(intermediates);
        members.addAll(outputs);
        return members;
    }

    public int size() {
        return inputs.size() + intermediates.size() + outputs.size();
    }
}
