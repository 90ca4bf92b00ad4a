package org.treefix.postprocess.rules;

import com.typesafe.config.Config;
import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.tree.TreeNode;

import java.util.Optional;

/**
 * A rewrite rule applied to translated trees. Rules are stateless across invocations and
 * change the tree only through the action they return.
 * <p>
 * The relative priority of a rule and the rules it is batched with are defined by the
 * {@link RuleRegistry} it is registered in.
 */
@FunctionalInterface
public interface IPostProcessingRule {

    /**
     * Inspects a node and, if the rule applies, returns the mutation to perform.
     * Must not modify the tree itself.
     *
     * @param node The node to inspect.
     * @param diagnostics The diagnostics of the current snapshot.
     * @param settings Rule settings, passed through opaquely. Empty if none were supplied.
     * @return The action to run, or empty if the rule does not apply to this node.
     */
    Optional<Runnable> tryCreateAction(TreeNode node, DiagnosticSet diagnostics, Config settings);

    /**
     * @return {@code true} if the action must run under exclusive mutation access.
     */
    default boolean requiresExclusiveMutation() {
        return true;
    }

    /**
     * @return A name used in logs and reports.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
