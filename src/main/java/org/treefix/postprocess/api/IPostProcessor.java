package org.treefix.postprocess.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.treefix.postprocess.imports.QualifiedName;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;

/**
 * Fixes up freshly translated syntax trees by applying rewrite rules until nothing changes.
 */
public interface IPostProcessor {

    /**
     * Runs all rule batches over the tree until each converges, then formats the result
     * if formatting is enabled.
     *
     * @param tree The tree to process. Owned by the call for its duration.
     * @param scope Restricts processing to a range of the tree. Can be null to process the whole tree.
     * @param settings Settings passed to every rule. Can be null.
     * @return A summary of the run.
     * @throws PostProcessingException if the rule registry tree contains a node that is neither a rule
     *         nor a group. Registries from {@code RuleRegistry.builder()} are always well-formed; only
     *         trees passed to {@code RuleRegistry.of} can fail here.
     */
    PostProcessingReport runPostProcessing(SyntaxTree tree, RangeMarker scope, Config settings) throws PostProcessingException;

    /**
     * Processes the whole tree without rule settings.
     * @param tree The tree to process.
     * @return A summary of the run.
     * @throws PostProcessingException if the rule registry tree contains a node that is neither a rule
     *         nor a group. Registries from {@code RuleRegistry.builder()} are always well-formed; only
     *         trees passed to {@code RuleRegistry.of} can fail here.
     */
    default PostProcessingReport runPostProcessing(SyntaxTree tree) throws PostProcessingException {
        return runPostProcessing(tree, null, ConfigFactory.empty());
    }

    /**
     * Resolves a qualified name and imports the first declaration found.
     * Does nothing if the name cannot be resolved.
     *
     * @param tree The tree to add the import to.
     * @param qualifiedName The name to import.
     */
    void insertImport(SyntaxTree tree, QualifiedName qualifiedName);

    /**
     * @param tree The tree to add the import to.
     * @param qualifiedName The dot-separated name to import.
     * @throws IllegalArgumentException if the name is malformed.
     */
    default void insertImport(SyntaxTree tree, String qualifiedName) {
        insertImport(tree, QualifiedName.parse(qualifiedName));
    }
}
