package org.demangler.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A node of a demangled tree. Every node has a {@link NodeKind}, an optional text payload
 * and an ordered list of children. Child order follows the grammar and is significant.
 * <p>
 * A node is owned by exactly one parent. The parent's child list is the only owning link;
 * the parent reference and the sibling views are derived from it. A node can only be
 * attached while it is unlinked, which guarantees that no subtree appears at two positions.
 * <p>
 * Once the demangler hands a tree to a caller the tree is sealed and can no longer be
 * extended. Sealed trees are safe to read from multiple threads.
 */
public final class Node implements Iterable<Node> {

    private final NodeKind kind;
    private final String text;
    private final List<Node> children = new ArrayList<>();
    private final List<Node> childrenView = Collections.unmodifiableList(children);

    private Node parent;
    private int indexInParent = -1;
    private volatile boolean sealed;

    private Node(NodeKind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text;
    }

    /**
     * Creates a new, unlinked node without text.
     * @param kind The kind of the node.
     * @return The new node.
     */
    public static Node create(NodeKind kind) {
        return new Node(kind, null);
    }

    /**
     * Creates a new, unlinked node carrying a text payload.
     * @param kind The kind of the node.
     * @param text The text payload, e.g. an identifier or an operator spelling.
     * @return The new node.
     */
    public static Node create(NodeKind kind, String text) {
        return new Node(kind, Objects.requireNonNull(text, "text"));
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * Returns the text payload.
     * @return The text, or an empty string if the node carries none.
     */
    public String getText() {
        return text != null ? text : "";
    }

    public boolean hasText() {
        return text != null;
    }

    /**
     * Attaches a child at the end of this node's child list.
     *
     * @param child The node to attach. Must be unlinked.
     * @return The attached child.
     * @throws IllegalStateException if the child is already linked, is an ancestor of this node
     *                               or this node itself, or if this node is sealed.
     */
    public Node addChild(Node child) {
        Objects.requireNonNull(child, "child");
        if (sealed) {
            throw new IllegalStateException("Cannot attach a child to sealed node " + kind);
        }
        if (!child.isUnlinked()) {
            throw new IllegalStateException("Node " + child.kind + " is already attached to " + child.parent.kind);
        }
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalStateException("Attaching " + child.kind + " would create a cycle");
            }
        }
        child.parent = this;
        child.indexInParent = children.size();
        children.add(child);
        return child;
    }

    /**
     * Attaches two children in order.
     * @param first The first child.
     * @param second The second child.
     */
    public void addChildren(Node first, Node second) {
        addChild(first);
        addChild(second);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public int getNumChildren() {
        return children.size();
    }

    /**
     * Returns the child at the given position.
     * @param index The position, starting at zero.
     * @return The child node.
     * @throws IndexOutOfBoundsException if there is no child at that position.
     */
    public Node getChild(int index) {
        return children.get(index);
    }

    /**
     * Returns the first child.
     * @return The first child.
     * @throws IllegalStateException if this node has no children.
     */
    public Node getFirstChild() {
        if (children.isEmpty()) {
            throw new IllegalStateException("Node " + kind + " has no children");
        }
        return children.get(0);
    }

    /**
     * Returns an unmodifiable view of the children.
     * @return The children in grammar order.
     */
    public List<Node> getChildren() {
        return childrenView;
    }

    @Override
    public Iterator<Node> iterator() {
        return childrenView.iterator();
    }

    public Node getParent() {
        return parent;
    }

    /**
     * Returns the sibling directly before this node in its parent's child list.
     * @return The previous sibling, or {@code null} if this node is unlinked or the first child.
     */
    public Node getPreviousSibling() {
        if (parent == null || indexInParent == 0) {
            return null;
        }
        return parent.children.get(indexInParent - 1);
    }

    /**
     * Returns the sibling directly after this node in its parent's child list.
     * @return The next sibling, or {@code null} if this node is unlinked or the last child.
     */
    public Node getNextSibling() {
        if (parent == null || indexInParent == parent.children.size() - 1) {
            return null;
        }
        return parent.children.get(indexInParent + 1);
    }

    /**
     * Returns the position of this node in its parent's child list.
     * @return The index, or -1 if this node is unlinked.
     */
    public int getIndexInParent() {
        return indexInParent;
    }

    /**
     * Checks whether this node has no parent. An unlinked node has no siblings either.
     * @return {@code true} if the node can be attached somewhere.
     */
    public boolean isUnlinked() {
        return parent == null;
    }

    /**
     * Creates a deep copy of this subtree. The copy is unlinked, unsealed and shares no
     * node with the original.
     * @return The root of the copy.
     */
    public Node copy() {
        Node copy = new Node(kind, text);
        for (Node child : children) {
            copy.addChild(child.copy());
        }
        return copy;
    }

    /**
     * Seals this node and its whole subtree. Sealing is idempotent.
     * @return This node.
     */
    public Node seal() {
        if (!sealed) {
            for (Node child : children) {
                child.seal();
            }
            sealed = true;
        }
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Compares two subtrees by kind, text and children, ignoring node identity and links.
     * @param other The subtree to compare with.
     * @return {@code true} if both subtrees have the same shape and payloads.
     */
    public boolean structurallyEquals(Node other) {
        if (other == this) {
            return true;
        }
        if (other == null || kind != other.kind || !Objects.equals(text, other.text)
                || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).structurallyEquals(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return TreeDump.dump(this);
    }
}
