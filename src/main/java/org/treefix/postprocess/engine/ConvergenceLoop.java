package org.treefix.postprocess.engine;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treefix.postprocess.api.BatchOutcome;
import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.postprocess.host.IMutationScheduler;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;

import java.util.List;

/**
 * Drives one batch of rules to a fixpoint.
 * <p>
 * Every round recomputes the diagnostics and collects actions in a read phase, then
 * applies them in priority order on the mutation context. The batch is done when a round
 * collects nothing, or when a round changes nothing although all of its actions could be
 * run. An action whose node was invalidated earlier in the round is skipped, and the
 * round then always counts as having changed the tree.
 * <p>
 * With a round limit configured, a batch that keeps changing the tree is stopped after
 * the limit even though it has not reached its fixpoint. The outcome records this.
 */
public final class ConvergenceLoop {

    private static final Logger LOG = LoggerFactory.getLogger(ConvergenceLoop.class);

    private final IMutationScheduler scheduler;
    private final DiagnosticSnapshotProvider diagnosticsProvider;
    private final ActionCollector collector;
    private final int maxRounds;

    /**
     * @param scheduler Schedules read and write phases.
     * @param diagnosticsProvider Computes the diagnostics of each round.
     * @param collector Collects the actions of each round.
     * @param maxRounds The maximum number of rounds per batch; 0 for no limit.
     */
    public ConvergenceLoop(IMutationScheduler scheduler,
                           DiagnosticSnapshotProvider diagnosticsProvider,
                           ActionCollector collector,
                           int maxRounds) {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must not be negative, was " + maxRounds);
        }
        this.scheduler = scheduler;
        this.diagnosticsProvider = diagnosticsProvider;
        this.collector = collector;
        this.maxRounds = maxRounds;
    }

    /**
     * Runs the batch until it converges or the round limit is reached.
     *
     * @param batch The batch to run.
     * @param tree The tree.
     * @param scope The scope, or null for the whole tree.
     * @param settings The rule settings.
     * @return The outcome of the batch.
     */
    public BatchOutcome converge(Batch batch, SyntaxTree tree, RangeMarker scope, Config settings) {
        int rounds = 0;
        int applied = 0;
        int skipped = 0;
        boolean limitReached = false;

        while (true) {
            long stampBefore = tree.modificationStamp();
            rounds++;

            List<ActionData> actions = scheduler.read(() -> {
                DiagnosticSet diagnostics = diagnosticsProvider.analyze(tree, scope);
                return collector.collect(batch.rules(), tree, scope, diagnostics, settings);
            });
            LOG.trace("Batch '{}' round {}: {} actions collected", batch.name(), rounds, actions.size());
            if (actions.isEmpty()) {
                break;
            }

            RoundResult result = scheduler.onMutationContext(() -> apply(actions));
            applied += result.applied();
            skipped += result.skipped();

            if (!result.uncertain() && tree.modificationStamp() == stampBefore) {
                LOG.trace("Batch '{}' round {}: actions left the tree unchanged", batch.name(), rounds);
                break;
            }
            if (maxRounds > 0 && rounds >= maxRounds) {
                LOG.warn("Batch '{}' did not converge within {} rounds, continuing with the next batch",
                        batch.name(), maxRounds);
                limitReached = true;
                break;
            }
        }
        return new BatchOutcome(batch.name(), rounds, applied, skipped, limitReached);
    }

    private RoundResult apply(List<ActionData> actions) {
        int applied = 0;
        int skipped = 0;
        for (ActionData data : actions) {
            if (!data.node().isValid()) {
                LOG.trace("Skipping action of rule '{}': its node was invalidated", data.ruleName());
                skipped++;
                continue;
            }
            if (data.requiresExclusiveMutation()) {
                scheduler.exclusive(data.action());
            } else {
                data.action().run();
            }
            applied++;
        }
        return new RoundResult(applied, skipped);
    }

    private record RoundResult(int applied, int skipped) {
        boolean uncertain() {
            return skipped > 0;
        }
    }
}
