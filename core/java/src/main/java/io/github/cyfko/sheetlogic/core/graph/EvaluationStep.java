package io.github.cyfko.sheetlogic.core.graph;

import java.util.List;

/**
 * One unit of the evaluation schedule: a single acyclic node, or a whole cycle solved at once.
 *
 * @since 1.0.0
 */
public sealed interface EvaluationStep permits EvaluationStep.NodeStep, EvaluationStep.CycleStep {

    /**
     * @return ids of the nodes computed by this step
     */
    List<Integer> nodes();

    record NodeStep(int node) implements EvaluationStep {
        @Override
        public List<Integer> nodes() {
            return List.of(node);
        }
    }

    /**
     * @param cycle   the circular reference
     * @param members node ids of the cycle members, ascending
     */
    record CycleStep(CircularRef cycle, List<Integer> members) implements EvaluationStep {

        public CycleStep {
            members = List.copyOf(members);
        }

        @Override
        public List<Integer> nodes() {
            return members;
        }
    }
}
