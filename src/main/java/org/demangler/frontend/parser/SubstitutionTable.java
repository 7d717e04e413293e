package org.demangler.frontend.parser;

import org.demangler.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * The back-reference cache of one decode. An append-only, ordered list of finished subtrees.
 * <p>
 * Entries are numbered in the order their subtree <em>finishes</em> parsing, not the order
 * it starts: a nested context completes, and is registered, before the declaration that
 * contains it. Resolving an entry always yields a fresh copy, so the cached subtree can be
 * attached at any number of positions without sharing nodes.
 */
public class SubstitutionTable {

    private final List<Node> entries = new ArrayList<>();

    /**
     * Registers a finished subtree.
     * @param node The subtree. The table keeps the reference; callers may still attach it once.
     * @return The index assigned to the entry.
     */
    public int register(Node node) {
        entries.add(node);
        return entries.size() - 1;
    }

    /**
     * Checks whether an index refers to a registered entry.
     * @param index The index to check.
     * @return {@code true} if {@link #resolve(int)} would succeed.
     */
    public boolean contains(int index) {
        return index >= 0 && index < entries.size();
    }

    /**
     * Returns an independent copy of a registered subtree.
     * @param index The index of the entry.
     * @return A deep, unlinked copy of the entry.
     * @throws IndexOutOfBoundsException if no entry has this index. Callers check {@link #contains(int)} first.
     */
    public Node resolve(int index) {
        return entries.get(index).copy();
    }

    public int size() {
        return entries.size();
    }
}
