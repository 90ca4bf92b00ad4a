package org.treefix.postprocess.api;

/**
 * Result of driving one batch of rules to its fixpoint.
 *
 * @param batchName The name of the batch.
 * @param rounds The number of collection rounds, including the final one.
 * @param appliedActions The number of actions that were executed.
 * @param skippedActions The number of actions dropped because their node had become invalid.
 * @param roundLimitReached {@code true} if the batch was stopped by the round limit instead of converging.
 */
public record BatchOutcome(
        String batchName,
        int rounds,
        int appliedActions,
        int skippedActions,
        boolean roundLimitReached
) {}
