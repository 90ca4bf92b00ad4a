package org.treefix.postprocess.engine;

import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.postprocess.diagnostics.IDiagnosticAnalyzer;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;
import org.treefix.tree.TextRange;
import org.treefix.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the diagnostics for the current snapshot of a tree, restricted to the scope.
 * The result is only valid until the next mutation, so it is recomputed every round.
 */
public final class DiagnosticSnapshotProvider {

    private final IDiagnosticAnalyzer analyzer;

    public DiagnosticSnapshotProvider(IDiagnosticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Analyzes the whole tree, or only the top-level elements that intersect the scope.
     *
     * @param tree The tree.
     * @param scope The scope, or null for the whole tree.
     * @return The diagnostics; empty if nothing in the tree falls within the scope.
     */
    public DiagnosticSet analyze(SyntaxTree tree, RangeMarker scope) {
        if (scope == null) {
            return analyzer.analyze(tree, List.of(tree.root()));
        }
        if (!scope.isValid()) {
            return DiagnosticSet.EMPTY;
        }
        TextRange range = scope.range();
        List<TreeNode> elements = new ArrayList<>();
        for (TreeNode element : tree.root().children()) {
            if (element.textRange().intersects(range)) {
                elements.add(element);
            }
        }
        return elements.isEmpty() ? DiagnosticSet.EMPTY : analyzer.analyze(tree, elements);
    }
}
