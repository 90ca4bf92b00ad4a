package org.treefix.postprocess.engine;

import org.treefix.tree.TreeNode;

/**
 * An action collected in one round. Never carried over to the next round.
 *
 * @param node The node the action was created for.
 * @param action The mutation to run.
 * @param priority The priority of the rule that created it; lower runs first.
 * @param requiresExclusiveMutation Whether the action must run under exclusive mutation.
 * @param ruleName The name of the rule that created it.
 */
public record ActionData(
        TreeNode node,
        Runnable action,
        int priority,
        boolean requiresExclusiveMutation,
        String ruleName
) {}
