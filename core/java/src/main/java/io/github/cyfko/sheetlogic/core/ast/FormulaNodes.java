package io.github.cyfko.sheetlogic.core.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Generic traversals over formula trees.
 *
 * @since 1.0.0
 */
public final class FormulaNodes {

    private FormulaNodes() {}

    /**
     * Visits every node in pre-order, children left to right.
     *
     * @param root   the tree root
     * @param action callback invoked once per node
     */
    public static void walk(FormulaNode root, Consumer<FormulaNode> action) {
        Deque<FormulaNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FormulaNode node = stack.pop();
            action.accept(node);
            List<FormulaNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Names of every function called in the tree, dynamic ones included.
     *
     * @param root the tree root
     * @return upper-case names in first-seen order
     */
    public static Set<String> functionNames(FormulaNode root) {
        Set<String> names = new LinkedHashSet<>();
        walk(root, node -> {
            if (node instanceof FunctionCall call) names.add(call.name());
            else if (node instanceof DynamicReference dynamic) names.add(dynamic.function());
        });
        return names;
    }
}
