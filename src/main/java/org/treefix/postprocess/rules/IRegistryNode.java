package org.treefix.postprocess.rules;

/**
 * A node of the rule registry tree: either a {@link SingleRule} or a {@link RuleGroup}.
 */
public interface IRegistryNode {

    /**
     * @return The name of this node, used for logging.
     */
    String name();
}
