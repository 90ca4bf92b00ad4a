package org.treefix.postprocess.engine;

import org.treefix.tree.RangeMarker;
import org.treefix.tree.TextRange;
import org.treefix.tree.TreeNode;

/**
 * Classifies tree nodes against an optional processing scope.
 */
public final class ScopeFilter {

    /**
     * How a node relates to the scope.
     */
    public enum Result {
        /** Skip the node and its whole subtree. */
        EXCLUDED,
        /** Visit the children, but do not collect actions for the node itself. */
        TRAVERSE_ONLY,
        /** Collect actions for the node and visit its children. */
        ELIGIBLE
    }

    private ScopeFilter() {}

    /**
     * Classifies a node.
     * @param node The node to classify.
     * @param scope The scope, or null for the whole tree.
     * @return The classification.
     */
    public static Result classify(TreeNode node, RangeMarker scope) {
        if (scope == null) {
            return Result.ELIGIBLE;
        }
        if (!scope.isValid()) {
            return Result.EXCLUDED;
        }
        TextRange range = scope.range();
        TextRange nodeRange = node.textRange();
        if (range.contains(nodeRange)) {
            return Result.ELIGIBLE;
        }
        if (range.intersects(nodeRange)) {
            return Result.TRAVERSE_ONLY;
        }
        return Result.EXCLUDED;
    }
}
