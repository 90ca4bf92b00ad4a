package org.treefix.postprocess.engine;

import com.typesafe.config.Config;
import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.postprocess.rules.IPostProcessingRule;
import org.treefix.tree.MutableNode;
import org.treefix.tree.MutableSyntaxTree;
import org.treefix.tree.TreeNode;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Rules shared by the engine and processor tests.
 */
public final class RuleFixtures {

    private RuleFixtures() {}

    /**
     * A rule with a fixed name that offers the action produced by {@code action} for every
     * node matching {@code applies}.
     */
    public static IPostProcessingRule named(String name, Predicate<TreeNode> applies, Function<TreeNode, Runnable> action) {
        return new NamedRule(name, applies, action, true);
    }

    /**
     * Like {@link #named}, but the action does not need exclusive mutation.
     */
    public static IPostProcessingRule shared(String name, Predicate<TreeNode> applies, Function<TreeNode, Runnable> action) {
        return new NamedRule(name, applies, action, false);
    }

    /**
     * Rewrites every expression leaf whose text is {@code from} to {@code to}.
     */
    public static IPostProcessingRule rewrite(MutableSyntaxTree tree, String from, String to) {
        return named(from + "->" + to,
                node -> node.kind().equals("expression") && node.text().equals(from),
                node -> () -> tree.setText((MutableNode) node, to));
    }

    private static final class NamedRule implements IPostProcessingRule {

        private final String name;
        private final Predicate<TreeNode> applies;
        private final Function<TreeNode, Runnable> action;
        private final boolean exclusive;

        private NamedRule(String name, Predicate<TreeNode> applies, Function<TreeNode, Runnable> action, boolean exclusive) {
            this.name = name;
            this.applies = applies;
            this.action = action;
            this.exclusive = exclusive;
        }

        @Override
        public Optional<Runnable> tryCreateAction(TreeNode node, DiagnosticSet diagnostics, Config settings) {
            return applies.test(node) ? Optional.of(action.apply(node)) : Optional.empty();
        }

        @Override
        public boolean requiresExclusiveMutation() {
            return exclusive;
        }

        @Override
        public String name() {
            return name;
        }
    }
}
