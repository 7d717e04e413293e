package org.demangler.tree;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the ownership and linkage rules of {@link Node}.
 */
@Tag("unit")
class NodeTest {

    private static Node nominal(String module, String name) {
        Node nominal = Node.create(NodeKind.CLASS);
        nominal.addChildren(Node.create(NodeKind.MODULE, module), Node.create(NodeKind.IDENTIFIER, name));
        return nominal;
    }

    /**
     * Verifies that a new node has no parent and no siblings.
     */
    @Test
    void create_shouldReturnUnlinkedNode() {
        // Act
        Node node = Node.create(NodeKind.IDENTIFIER, "foo");

        // Assert
        assertThat(node.isUnlinked()).isTrue();
        assertThat(node.getParent()).isNull();
        assertThat(node.getPreviousSibling()).isNull();
        assertThat(node.getNextSibling()).isNull();
        assertThat(node.getIndexInParent()).isEqualTo(-1);
        assertThat(node.getText()).isEqualTo("foo");
        assertThat(node.hasChildren()).isFalse();
    }

    /**
     * Verifies that a node without text reports none and returns the empty string.
     */
    @Test
    void getText_shouldBeEmptyWithoutPayload() {
        // Act
        Node node = Node.create(NodeKind.TYPE);

        // Assert
        assertThat(node.hasText()).isFalse();
        assertThat(node.getText()).isEmpty();
    }

    /**
     * Verifies that attaching children sets parents and that sibling views follow child positions.
     */
    @Test
    void addChild_shouldLinkParentAndSiblings() {
        // Arrange
        Node list = Node.create(NodeKind.TYPE_LIST);
        Node first = Node.create(NodeKind.IDENTIFIER, "a");
        Node second = Node.create(NodeKind.IDENTIFIER, "b");
        Node third = Node.create(NodeKind.IDENTIFIER, "c");

        // Act
        list.addChild(first);
        list.addChildren(second, third);

        // Assert
        assertThat(list.getChildren()).containsExactly(first, second, third);
        assertThat(first.getParent()).isSameAs(list);
        assertThat(first.getPreviousSibling()).isNull();
        assertThat(first.getNextSibling()).isSameAs(second);
        assertThat(second.getPreviousSibling()).isSameAs(first);
        assertThat(second.getNextSibling()).isSameAs(third);
        assertThat(third.getNextSibling()).isNull();
        assertThat(third.getIndexInParent()).isEqualTo(2);
        assertThat(list.getFirstChild()).isSameAs(first);
    }

    /**
     * Verifies that a node that already has a parent cannot be attached a second time.
     */
    @Test
    void addChild_shouldRejectLinkedNode() {
        // Arrange
        Node owner = Node.create(NodeKind.TYPE);
        Node other = Node.create(NodeKind.TYPE);
        Node child = Node.create(NodeKind.IDENTIFIER, "x");
        owner.addChild(child);

        // Act & Assert
        assertThatThrownBy(() -> other.addChild(child))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already attached");
        assertThat(child.getParent()).isSameAs(owner);
        assertThat(other.hasChildren()).isFalse();
    }

    /**
     * Verifies that attaching a node to its own descendant is rejected.
     */
    @Test
    void addChild_shouldRejectCycles() {
        // Arrange
        Node root = Node.create(NodeKind.TYPE);
        Node inner = Node.create(NodeKind.TYPE);
        root.addChild(inner);

        // Act & Assert
        assertThatThrownBy(() -> inner.addChild(root)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> root.addChild(root)).isInstanceOf(IllegalStateException.class);
    }

    /**
     * Verifies that a sealed tree rejects new children at every level.
     */
    @Test
    void seal_shouldFreezeWholeTree() {
        // Arrange
        Node root = Node.create(NodeKind.TYPE);
        Node nominal = nominal("M", "C");
        root.addChild(nominal);

        // Act
        root.seal();

        // Assert
        assertThat(root.isSealed()).isTrue();
        assertThat(nominal.getChild(1).isSealed()).isTrue();
        assertThatThrownBy(() -> nominal.addChild(Node.create(NodeKind.IDENTIFIER, "x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sealed");
        assertThatThrownBy(() -> root.getChildren().add(Node.create(NodeKind.TYPE)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    /**
     * Verifies that a copy is structurally equal, shares no node with the source and is unlinked and unsealed.
     */
    @Test
    void copy_shouldBeIndependentOfSource() {
        // Arrange
        Node parent = Node.create(NodeKind.TYPE);
        Node source = nominal("M", "C");
        parent.addChild(source);
        parent.seal();

        // Act
        Node copy = source.copy();

        // Assert
        assertThat(copy.structurallyEquals(source)).isTrue();
        assertThat(copy).isNotSameAs(source);
        assertThat(copy.getChild(0)).isNotSameAs(source.getChild(0));
        assertThat(copy.isUnlinked()).isTrue();
        assertThat(copy.isSealed()).isFalse();
        assertThat(copy.getChild(0).getParent()).isSameAs(copy);
    }

    /**
     * Verifies that attaching and extending a copy leaves the source untouched.
     */
    @Test
    void copy_attachingCopyShouldNotAlterSource() {
        // Arrange
        Node source = nominal("M", "C");
        Node snapshot = source.copy();
        Node copy = source.copy();
        Node newParent = Node.create(NodeKind.TYPE);

        // Act
        newParent.addChild(copy);
        copy.addChild(Node.create(NodeKind.IDENTIFIER, "extra"));

        // Assert
        assertThat(source.isUnlinked()).isTrue();
        assertThat(source.getNumChildren()).isEqualTo(2);
        assertThat(source.structurallyEquals(snapshot)).isTrue();
        assertThat(copy.getParent()).isSameAs(newParent);
    }

    /**
     * Verifies that structural equality compares kind, text and children.
     */
    @Test
    void structurallyEquals_shouldCompareKindTextAndChildren() {
        // Arrange
        Node a = nominal("M", "C");
        Node b = nominal("M", "C");
        Node differentText = nominal("M", "D");
        Node differentKind = Node.create(NodeKind.STRUCTURE);
        differentKind.addChildren(Node.create(NodeKind.MODULE, "M"), Node.create(NodeKind.IDENTIFIER, "C"));

        // Act & Assert
        assertThat(a.structurallyEquals(b)).isTrue();
        assertThat(a.structurallyEquals(differentText)).isFalse();
        assertThat(a.structurallyEquals(differentKind)).isFalse();
        assertThat(a.structurallyEquals(null)).isFalse();
    }

    /**
     * Verifies that asking an empty node for its first child is a precondition violation.
     */
    @Test
    void getFirstChild_shouldFailWithoutChildren() {
        // Arrange
        Node node = Node.create(NodeKind.TYPE_LIST);

        // Act & Assert
        assertThatThrownBy(node::getFirstChild).isInstanceOf(IllegalStateException.class);
    }
}
