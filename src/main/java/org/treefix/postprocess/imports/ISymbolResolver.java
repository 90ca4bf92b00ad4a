package org.treefix.postprocess.imports;

import org.treefix.tree.SyntaxTree;

import java.util.List;

/**
 * Host collaborator that resolves qualified names to declarations.
 */
@FunctionalInterface
public interface ISymbolResolver {

    /** A resolver that never finds anything. */
    ISymbolResolver NONE = (tree, name) -> List.of();

    /**
     * Resolves a name in the context of a tree.
     * @param tree The tree the name is used in.
     * @param name The name to resolve.
     * @return Candidate declarations in resolver order; empty if none.
     */
    List<Declaration> resolveQualifiedName(SyntaxTree tree, QualifiedName name);
}
