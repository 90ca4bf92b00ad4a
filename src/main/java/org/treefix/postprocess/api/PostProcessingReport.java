package org.treefix.postprocess.api;

import java.util.List;

/**
 * Summary of one post-processing run.
 *
 * @param batches The outcome of every batch, in processing order.
 * @param formatted {@code true} if the formatter ran at the end.
 */
public record PostProcessingReport(List<BatchOutcome> batches, boolean formatted) {

    public PostProcessingReport {
        batches = List.copyOf(batches);
    }

    public int totalRounds() {
        return batches.stream().mapToInt(BatchOutcome::rounds).sum();
    }

    public int totalAppliedActions() {
        return batches.stream().mapToInt(BatchOutcome::appliedActions).sum();
    }

    /**
     * @return {@code true} if every batch converged without hitting the round limit.
     */
    public boolean converged() {
        return batches.stream().noneMatch(BatchOutcome::roundLimitReached);
    }
}
