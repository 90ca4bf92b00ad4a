package org.treefix.tree;

import java.util.List;

/**
 * A node of a {@link SyntaxTree}.
 * <p>
 * Nodes are tagged with a {@link #kind()} so that rules can match on the node kind
 * without knowing the full node taxonomy of the host.
 */
public interface TreeNode {

    /**
     * @return The kind tag of this node, e.g. {@code "call"} or {@code "identifier"}.
     */
    String kind();

    /**
     * @return The source text covered by this node.
     */
    String text();

    /**
     * @return The range this node covers in the text of its tree.
     */
    TextRange textRange();

    /**
     * @return The direct children in document order. Empty for leaves.
     */
    List<? extends TreeNode> children();

    /**
     * A node becomes invalid once it is detached from its tree, e.g. because an
     * ancestor was replaced or deleted.
     *
     * @return {@code true} while the node is still part of a live tree.
     */
    boolean isValid();
}
