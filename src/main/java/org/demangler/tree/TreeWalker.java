package org.demangler.tree;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a demangled tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system keyed by
 * {@link NodeKind}, so consumers only register for the kinds they care about.
 * The walker never modifies the tree.
 */
public class TreeWalker {

    private final Map<NodeKind, Consumer<Node>> handlers;
    private final Consumer<Node> fallback;

    /**
     * Constructs a new TreeWalker without a fallback handler.
     * @param handlers A map from node kinds to their corresponding handlers.
     */
    public TreeWalker(Map<NodeKind, Consumer<Node>> handlers) {
        this(handlers, n -> {});
    }

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node kinds to their corresponding handlers.
     * @param fallback The handler for every node whose kind has no registered handler.
     */
    public TreeWalker(Map<NodeKind, Consumer<Node>> handlers, Consumer<Node> fallback) {
        this.handlers = handlers.isEmpty() ? new EnumMap<>(NodeKind.class) : new EnumMap<>(handlers);
        this.fallback = fallback;
    }

    /**
     * Walks a node and its children depth-first, visiting each node before its children.
     * @param node The node to walk. {@code null} is ignored.
     */
    public void walk(Node node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getKind(), fallback).accept(node);

        for (Node child : node) {
            walk(child);
        }
    }

    /**
     * Counts the nodes of a subtree.
     * @param root The root of the subtree.
     * @return The number of nodes, including the root.
     */
    public static int countNodes(Node root) {
        int[] count = {0};
        new TreeWalker(Map.of(), n -> count[0]++).walk(root);
        return count[0];
    }
}
