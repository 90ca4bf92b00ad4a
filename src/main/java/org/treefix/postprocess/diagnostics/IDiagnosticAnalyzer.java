package org.treefix.postprocess.diagnostics;

import org.treefix.tree.SyntaxTree;
import org.treefix.tree.TreeNode;

import java.util.List;

/**
 * Host collaborator that performs semantic analysis (resolution, type checking) on a tree.
 */
@FunctionalInterface
public interface IDiagnosticAnalyzer {

    /** An analyzer for hosts without semantic information. Always yields an empty set. */
    IDiagnosticAnalyzer NONE = (tree, elements) -> DiagnosticSet.EMPTY;

    /**
     * Analyzes the given elements of the tree with full semantic checking.
     * @param tree The tree being processed.
     * @param elements The elements to analyze; either the root or a set of top-level elements.
     * @return The diagnostics for the current snapshot of the tree.
     */
    DiagnosticSet analyze(SyntaxTree tree, List<TreeNode> elements);
}
