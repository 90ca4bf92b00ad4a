package org.treefix.postprocess.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link IMutationScheduler} backed by executors. Read phases run on a fixed pool under the
 * shared side of a read-write lock; the mutation context is one dedicated thread and
 * exclusive mutation holds the write lock.
 * <p>
 * Work is handed over as tasks and the caller blocks on the returned future, so failures
 * inside a phase surface on the calling thread.
 */
public final class ExecutorMutationScheduler implements IMutationScheduler, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorMutationScheduler.class);
    private static final String MUTATION_THREAD_NAME = "treefix-mutation";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService readPool;
    private final ExecutorService mutationExecutor;
    private volatile Thread mutationThread;

    /**
     * Constructs a scheduler.
     * @param readThreads The number of threads available to read phases.
     */
    public ExecutorMutationScheduler(int readThreads) {
        if (readThreads < 1) {
            throw new IllegalArgumentException("readThreads must be at least 1, was " + readThreads);
        }
        this.readPool = Executors.newFixedThreadPool(readThreads, readThreadFactory());
        this.mutationExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, MUTATION_THREAD_NAME);
            t.setDaemon(true);
            mutationThread = t;
            return t;
        });
        LOG.debug("Started scheduler with {} read threads", readThreads);
    }

    @Override
    public <T> T read(Supplier<T> work) {
        if (lock.isWriteLockedByCurrentThread()) {
            return work.get();
        }
        return await(readPool.submit(() -> {
            lock.readLock().lock();
            try {
                return work.get();
            } finally {
                lock.readLock().unlock();
            }
        }));
    }

    @Override
    public <T> T onMutationContext(Supplier<T> work) {
        if (isMutationContext()) {
            return work.get();
        }
        return await(mutationExecutor.submit(work::get));
    }

    @Override
    public void exclusive(Runnable work) {
        if (!isMutationContext()) {
            throw new IllegalStateException("Exclusive mutation requested outside the mutation context by "
                    + Thread.currentThread().getName());
        }
        lock.writeLock().lock();
        try {
            work.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isMutationContext() {
        return Thread.currentThread() == mutationThread;
    }

    /**
     * Stops both executors, waiting briefly for running phases to finish.
     */
    @Override
    public void close() {
        readPool.shutdown();
        mutationExecutor.shutdown();
        try {
            if (!readPool.awaitTermination(5, TimeUnit.SECONDS)) {
                readPool.shutdownNow();
            }
            if (!mutationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                mutationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            readPool.shutdownNow();
            mutationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("Scheduler stopped");
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for tree processing phase");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Tree processing phase failed", cause);
        }
    }

    private static ThreadFactory readThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "treefix-read-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
