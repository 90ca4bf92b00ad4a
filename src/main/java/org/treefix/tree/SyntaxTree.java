package org.treefix.tree;

/**
 * A mutable syntax tree as provided by the host.
 */
public interface SyntaxTree {

    /**
     * @return The root node. Its children are the top-level elements of the tree.
     */
    TreeNode root();

    /**
     * @return The full source text of the tree.
     */
    String text();

    /**
     * Returns an opaque token that changes whenever the tree is mutated.
     * Only equality between two readings is meaningful.
     *
     * @return The current modification stamp.
     */
    long modificationStamp();

    /**
     * Creates a marker that follows the given range while the tree is edited.
     * @param range The initial range, which must lie within the tree text.
     * @return A live range marker.
     */
    RangeMarker createRangeMarker(TextRange range);
}
