package org.treefix.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of a {@link MutableSyntaxTree}. A leaf carries its own text, a composite node's
 * text is the concatenation of its children. Offsets are derived from the position in
 * the tree, so they stay consistent across edits without bookkeeping.
 * <p>
 * Nodes are only mutated through their owning {@link MutableSyntaxTree}.
 */
public final class MutableNode implements TreeNode {

    private final String kind;
    private final boolean leaf;
    private final List<MutableNode> children;
    private String text;
    private MutableNode parent;
    private MutableSyntaxTree tree;

    private MutableNode(String kind, String text, List<MutableNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.leaf = text != null;
        this.text = text;
        this.children = new ArrayList<>();
        for (MutableNode child : children) {
            child.adoptBy(this);
            this.children.add(child);
        }
    }

    /**
     * Creates a detached leaf node.
     * @param kind The node kind.
     * @param text The text of the leaf.
     * @return The new node.
     */
    public static MutableNode leaf(String kind, String text) {
        return new MutableNode(kind, Objects.requireNonNull(text, "text"), List.of());
    }

    /**
     * Creates a detached composite node.
     * @param kind The node kind.
     * @param children The children, which must not be attached anywhere yet.
     * @return The new node.
     */
    public static MutableNode composite(String kind, MutableNode... children) {
        return composite(kind, Arrays.asList(children));
    }

    /**
     * Creates a detached composite node.
     * @param kind The node kind.
     * @param children The children, which must not be attached anywhere yet.
     * @return The new node.
     */
    public static MutableNode composite(String kind, List<MutableNode> children) {
        return new MutableNode(kind, null, children);
    }

    @Override
    public String kind() {
        return kind;
    }

    /**
     * @return {@code true} if this node carries its own text.
     */
    public boolean isLeaf() {
        return leaf;
    }

    @Override
    public String text() {
        if (leaf) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (MutableNode child : children) {
            sb.append(child.text());
        }
        return sb.toString();
    }

    @Override
    public TextRange textRange() {
        int start = startOffset();
        return new TextRange(start, start + length());
    }

    @Override
    public List<MutableNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public boolean isValid() {
        return tree != null;
    }

    /**
     * @return The parent node, empty for the root and for detached nodes.
     */
    public Optional<MutableNode> parent() {
        return Optional.ofNullable(parent);
    }

    int length() {
        if (leaf) {
            return text.length();
        }
        int length = 0;
        for (MutableNode child : children) {
            length += child.length();
        }
        return length;
    }

    int startOffset() {
        if (parent == null) {
            return 0;
        }
        int offset = parent.startOffset();
        for (MutableNode sibling : parent.children) {
            if (sibling == this) {
                break;
            }
            offset += sibling.length();
        }
        return offset;
    }

    MutableSyntaxTree tree() {
        return tree;
    }

    List<MutableNode> mutableChildren() {
        return children;
    }

    void updateText(String newText) {
        this.text = newText;
    }

    void adoptBy(MutableNode newParent) {
        if (parent != null || tree != null) {
            throw new IllegalStateException("Node '" + kind + "' is already attached");
        }
        this.parent = newParent;
        if (newParent.tree != null) {
            attachTo(newParent.tree);
        }
    }

    void attachTo(MutableSyntaxTree owner) {
        this.tree = owner;
        for (MutableNode child : children) {
            child.attachTo(owner);
        }
    }

    void detach() {
        this.parent = null;
        invalidate();
    }

    private void invalidate() {
        this.tree = null;
        for (MutableNode child : children) {
            child.invalidate();
        }
    }

    @Override
    public String toString() {
        return kind + textRange() + (leaf ? "'" + text + "'" : "");
    }
}
