package org.treefix.postprocess.imports;

import org.treefix.tree.SyntaxTree;

/**
 * Host collaborator that adds an import directive to a tree.
 * Mutates the tree and therefore runs under exclusive mutation.
 */
@FunctionalInterface
public interface IImportInserter {

    /** An inserter that ignores every request. */
    IImportInserter NONE = (tree, declaration) -> {};

    /**
     * @param tree The tree to add the import to.
     * @param declaration The declaration to import.
     */
    void insertImport(SyntaxTree tree, Declaration declaration);
}
