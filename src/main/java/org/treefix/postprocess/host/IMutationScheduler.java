package org.treefix.postprocess.host;

import java.util.function.Supplier;

/**
 * Separates read phases from write phases of tree processing.
 * <p>
 * Read phases may run concurrently with other readers and never mutate the tree.
 * Write phases run on a single designated mutation context; procedures that change
 * the tree structure additionally run under exclusive mutation, serialized with respect
 * to all other mutators and readers.
 */
public interface IMutationScheduler {

    /**
     * Runs a read phase and waits for its result.
     * @param work The read-only work.
     * @param <T> The result type.
     * @return The result of the work.
     */
    <T> T read(Supplier<T> work);

    /**
     * Hands work to the mutation context and waits for it to complete.
     * Runs the work directly if the caller already is on the mutation context.
     *
     * @param work The work to run.
     * @param <T> The result type.
     * @return The result of the work.
     */
    <T> T onMutationContext(Supplier<T> work);

    /**
     * Runs a procedure under exclusive mutation. All changes are committed before this
     * method returns.
     *
     * @param work The mutating procedure.
     * @throws IllegalStateException if not called on the mutation context.
     */
    void exclusive(Runnable work);

    /**
     * @return {@code true} if the calling thread is the mutation context.
     */
    boolean isMutationContext();

    /**
     * Hands a procedure to the mutation context and waits for it to complete.
     * @param work The procedure to run.
     */
    default void runOnMutationContext(Runnable work) {
        onMutationContext(() -> {
            work.run();
            return null;
        });
    }
}
