package org.treefix.postprocess.host;

import java.util.function.Supplier;

/**
 * Runs every phase on the calling thread. Suitable for hosts that already confine
 * all tree access to one thread.
 */
public final class InlineMutationScheduler implements IMutationScheduler {

    @Override
    public <T> T read(Supplier<T> work) {
        return work.get();
    }

    @Override
    public <T> T onMutationContext(Supplier<T> work) {
        return work.get();
    }

    @Override
    public void exclusive(Runnable work) {
        work.run();
    }

    @Override
    public boolean isMutationContext() {
        return true;
    }
}
