package org.treefix.postprocess.format;

import org.treefix.tree.SyntaxTree;
import org.treefix.tree.TextRange;

/**
 * Host collaborator that reformats code. Both operations mutate the tree.
 */
public interface IFormatter {

    /** A formatter that leaves the tree untouched. */
    IFormatter NONE = new IFormatter() {
        @Override
        public void reformat(SyntaxTree tree) {}

        @Override
        public void reformatRange(SyntaxTree tree, TextRange range) {}
    };

    /**
     * Reformats the whole tree.
     * @param tree The tree.
     */
    void reformat(SyntaxTree tree);

    /**
     * Reformats the part of the tree covered by the range.
     * @param tree The tree.
     * @param range The range to reformat.
     */
    void reformatRange(SyntaxTree tree, TextRange range);
}
