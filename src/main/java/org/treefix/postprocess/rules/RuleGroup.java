package org.treefix.postprocess.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named group of registry nodes. A group whose children are all single rules is
 * processed as one batch; other groups are split into the batches of their children.
 *
 * @param name The group name.
 * @param children The children in registry order.
 */
public record RuleGroup(String name, List<IRegistryNode> children) implements IRegistryNode {

    public RuleGroup {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name must not be blank");
        }
        // null children are kept; BatchPlanner rejects them
        children = Collections.unmodifiableList(new ArrayList<>(children));
    }
}
