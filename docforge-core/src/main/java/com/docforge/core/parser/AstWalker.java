package com.docforge.core.parser;

import com.docforge.core.parser.PythonAst.ClassDef;
import com.docforge.core.parser.PythonAst.FunctionDef;
import com.docforge.core.parser.PythonAst.Lambda;
import com.docforge.core.parser.PythonAst.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order traversal over {@link PythonAst} nodes.
 *
 * <p>Traversal is iterative so deeply nested expressions cannot overflow the stack.
 */
public final class AstWalker {

    private AstWalker() {
        // Utility class - no instantiation
    }

    /**
     * Callback invoked once per visited node.
     */
    @FunctionalInterface
    public interface NodeVisitor {

        /**
         * Visits a node.
         *
         * @param node current node
         * @return true to descend into its children
         */
        boolean visit(Node node);
    }

    public static void walk(Node root, NodeVisitor visitor) {
        walk(List.of(root), visitor);
    }

    /**
     * Walks several roots in order, each in pre-order.
     *
     * @param roots nodes to start from
     * @param visitor callback
     */
    public static void walk(List<? extends Node> roots, NodeVisitor visitor) {
        Deque<Node> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (!visitor.visit(node)) {
                continue;
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Walks a function or class body without entering nested scopes.
     *
     * <p>Nested {@code def}, {@code class} and {@code lambda} nodes are still passed to the
     * visitor, but their contents are not.
     *
     * @param statements body statements
     * @param visitor callback
     */
    public static void walkScope(List<? extends Node> statements, NodeVisitor visitor) {
        walk(statements, node -> {
            boolean descend = visitor.visit(node);
            return descend && !isScope(node);
        });
    }

    /**
     * Collects every node of the given type within one scope.
     *
     * @param statements body statements
     * @param type node type
     * @param <T> node type
     * @return matches in source pre-order
     */
    public static <T extends Node> List<T> collectInScope(List<? extends Node> statements, Class<T> type) {
        List<T> found = new ArrayList<>();
        walkScope(statements, node -> {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
            return true;
        });
        return found;
    }

    public static boolean isScope(Node node) {
        return node instanceof FunctionDef || node instanceof ClassDef || node instanceof Lambda;
    }
}
