package org.treefix.postprocess.engine;

import com.typesafe.config.Config;
import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.postprocess.rules.IPostProcessingRule;
import org.treefix.postprocess.rules.RuleRegistry;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;
import org.treefix.tree.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Walks a tree snapshot and asks every rule of a batch for an action on each node in scope.
 * <p>
 * Children are visited before their parent. The collected actions are sorted by rule
 * priority; the sort is stable, so actions of equal priority keep traversal order and,
 * per node, registry order. Collection never mutates the tree.
 */
public final class ActionCollector {

    private final RuleRegistry registry;

    /**
     * @param registry The registry the batch rules were taken from; provides their priorities.
     */
    public ActionCollector(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Collects the actions the batch offers for the current tree.
     *
     * @param rules The rules of the batch.
     * @param tree The tree.
     * @param scope The scope, or null for the whole tree.
     * @param diagnostics The diagnostics of the current snapshot.
     * @param settings The rule settings.
     * @return The actions in application order.
     */
    public List<ActionData> collect(List<IPostProcessingRule> rules,
                                    SyntaxTree tree,
                                    RangeMarker scope,
                                    DiagnosticSet diagnostics,
                                    Config settings) {
        List<ActionData> actions = new ArrayList<>();
        walk(tree.root(), new Round(rules, scope, diagnostics, settings, actions));
        actions.sort(Comparator.comparingInt(ActionData::priority));
        return actions;
    }

    private void walk(TreeNode node, Round round) {
        ScopeFilter.Result result = ScopeFilter.classify(node, round.scope());
        if (result == ScopeFilter.Result.EXCLUDED) {
            return;
        }

        for (TreeNode child : node.children()) {
            walk(child, round);
        }

        if (result == ScopeFilter.Result.ELIGIBLE) {
            for (IPostProcessingRule rule : round.rules()) {
                Optional<Runnable> action = rule.tryCreateAction(node, round.diagnostics(), round.settings());
                action.ifPresent(a -> round.actions().add(new ActionData(
                        node, a, registry.priority(rule), rule.requiresExclusiveMutation(), rule.name())));
            }
        }
    }

    private record Round(
            List<IPostProcessingRule> rules,
            RangeMarker scope,
            DiagnosticSet diagnostics,
            Config settings,
            List<ActionData> actions
    ) {}
}
