package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;

/**
 * Dependency edge from a referenced node to the node whose formula references it.
 *
 * @param from id of the dependency
 * @param to   id of the dependent
 * @param kind how the reference was written
 */
public record Edge(int from, int to, ReferenceKind kind) {

    public Edge {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("edge endpoints must be node ids, got " + from + " -> " + to);
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
    }
}
