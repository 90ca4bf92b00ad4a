package org.treefix.postprocess.engine;

import org.treefix.postprocess.api.RegistryCorruptedException;
import org.treefix.postprocess.rules.IPostProcessingRule;
import org.treefix.postprocess.rules.IRegistryNode;
import org.treefix.postprocess.rules.RuleGroup;
import org.treefix.postprocess.rules.SingleRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the rule registry tree into an ordered list of batches.
 * <p>
 * A group whose children are all single rules becomes one batch. Any other group is
 * split into the batches of its children, keeping registry order.
 */
public final class BatchPlanner {

    private BatchPlanner() {}

    /**
     * @param root The root of the registry tree.
     * @return The batches in processing order.
     * @throws RegistryCorruptedException if a node is neither a single rule nor a group.
     */
    public static List<Batch> plan(IRegistryNode root) throws RegistryCorruptedException {
        List<Batch> batches = new ArrayList<>();
        flatten(root, batches);
        return batches;
    }

    private static void flatten(IRegistryNode node, List<Batch> batches) throws RegistryCorruptedException {
        if (node instanceof SingleRule single) {
            batches.add(new Batch(single.name(), List.of(single.rule())));
        } else if (node instanceof RuleGroup group) {
            if (group.children().stream().allMatch(child -> child instanceof SingleRule)) {
                List<IPostProcessingRule> rules = new ArrayList<>();
                for (IRegistryNode child : group.children()) {
                    rules.add(((SingleRule) child).rule());
                }
                batches.add(new Batch(group.name(), rules));
            } else {
                for (IRegistryNode child : group.children()) {
                    flatten(child, batches);
                }
            }
        } else {
            throw new RegistryCorruptedException("Rule registry is corrupted: unexpected node "
                    + (node == null ? "null" : node.getClass().getName()));
        }
    }
}
