package org.treefix.postprocess.rules;

import java.util.Objects;

/**
 * A registry leaf holding exactly one rule.
 *
 * @param rule The rule.
 */
public record SingleRule(IPostProcessingRule rule) implements IRegistryNode {

    public SingleRule {
        Objects.requireNonNull(rule, "rule");
    }

    @Override
    public String name() {
        return rule.name();
    }
}
