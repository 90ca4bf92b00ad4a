package org.treefix.postprocess.rules;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Registry of post-processing rules. Holds the ordered rule tree and the priority
 * of every registered rule.
 * <p>
 * Unless given explicitly, the priority of a rule is its position in depth-first
 * registration order, so rules registered earlier run first within a round.
 */
public final class RuleRegistry {

    /** Name of the implicit top-level group. */
    public static final String ROOT_GROUP = "main";

    private final IRegistryNode root;
    private final Map<IPostProcessingRule, Integer> priorities;

    private RuleRegistry(IRegistryNode root, Map<IPostProcessingRule, Integer> priorities) {
        this.root = root;
        this.priorities = priorities;
    }

    /**
     * @return A builder whose top-level group is named {@value #ROOT_GROUP}.
     */
    public static Builder builder() {
        return new Builder(ROOT_GROUP);
    }

    /**
     * Wraps a registry tree assembled by the host. Rules get their depth-first position as
     * priority. Nodes that are neither {@link SingleRule} nor {@link RuleGroup} are kept as
     * they are and rejected when the batches are planned.
     *
     * @param root The root of the registry tree.
     * @return The registry.
     * @throws IllegalArgumentException if a rule instance occurs twice.
     */
    public static RuleRegistry of(IRegistryNode root) {
        Map<IPostProcessingRule, Integer> priorities = new IdentityHashMap<>();
        assignPositions(root, priorities);
        return new RuleRegistry(root, priorities);
    }

    private static void assignPositions(IRegistryNode node, Map<IPostProcessingRule, Integer> priorities) {
        if (node instanceof SingleRule single) {
            if (priorities.put(single.rule(), priorities.size()) != null) {
                throw new IllegalArgumentException("Rule '" + single.name() + "' is registered twice");
            }
        } else if (node instanceof RuleGroup group) {
            for (IRegistryNode child : group.children()) {
                assignPositions(child, priorities);
            }
        }
    }

    /**
     * @return The root of the registry tree.
     */
    public IRegistryNode root() {
        return root;
    }

    /**
     * Returns the priority of a registered rule. Lower values are applied first.
     * @param rule The rule.
     * @return Its priority.
     * @throws IllegalArgumentException if the rule is not registered.
     */
    public int priority(IPostProcessingRule rule) {
        Integer priority = priorities.get(rule);
        if (priority == null) {
            throw new IllegalArgumentException("Rule '" + rule.name() + "' is not registered");
        }
        return priority;
    }

    /**
     * @return The number of registered rules.
     */
    public int size() {
        return priorities.size();
    }

    /**
     * Builds a {@link RuleRegistry}. Groups are declared with nested builders.
     */
    public static final class Builder {

        private final String name;
        private final List<Object> entries = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Registers a rule with the next priority in registration order.
         * @param rule The rule to register.
         * @return This builder.
         */
        public Builder rule(IPostProcessingRule rule) {
            entries.add(new Entry(Objects.requireNonNull(rule, "rule"), null));
            return this;
        }

        /**
         * Registers a rule with an explicit priority.
         * @param rule The rule to register.
         * @param priority The priority; lower values are applied first.
         * @return This builder.
         */
        public Builder rule(IPostProcessingRule rule, int priority) {
            entries.add(new Entry(Objects.requireNonNull(rule, "rule"), priority));
            return this;
        }

        /**
         * Registers a named group of rules or nested groups.
         * @param groupName The group name.
         * @param members Callback declaring the group members.
         * @return This builder.
         */
        public Builder group(String groupName, Consumer<Builder> members) {
            Builder nested = new Builder(groupName);
            members.accept(nested);
            entries.add(nested);
            return this;
        }

        /**
         * @return The registry.
         * @throws IllegalArgumentException if a rule instance is registered twice.
         */
        public RuleRegistry build() {
            Map<IPostProcessingRule, Integer> priorities = new IdentityHashMap<>();
            IRegistryNode root = toNode(priorities, new int[] {0});
            return new RuleRegistry(root, priorities);
        }

        private RuleGroup toNode(Map<IPostProcessingRule, Integer> priorities, int[] position) {
            List<IRegistryNode> children = new ArrayList<>();
            for (Object entry : entries) {
                if (entry instanceof Builder nested) {
                    children.add(nested.toNode(priorities, position));
                } else {
                    Entry ruleEntry = (Entry) entry;
                    int priority = ruleEntry.priority() != null ? ruleEntry.priority() : position[0];
                    position[0]++;
                    if (priorities.put(ruleEntry.rule(), priority) != null) {
                        throw new IllegalArgumentException("Rule '" + ruleEntry.rule().name() + "' is registered twice");
                    }
                    children.add(new SingleRule(ruleEntry.rule()));
                }
            }
            return new RuleGroup(name, children);
        }

        private record Entry(IPostProcessingRule rule, Integer priority) {}
    }
}
