package org.treefix.postprocess.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treefix.postprocess.format.IFormatter;
import org.treefix.postprocess.host.IMutationScheduler;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;

/**
 * Formats the processed code once all batches have converged.
 */
public final class Finalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Finalizer.class);

    private final IMutationScheduler scheduler;
    private final IFormatter formatter;
    private final boolean formatCode;

    public Finalizer(IMutationScheduler scheduler, IFormatter formatter, boolean formatCode) {
        this.scheduler = scheduler;
        this.formatter = formatter;
        this.formatCode = formatCode;
    }

    /**
     * Reformats the scope, or the whole tree if there is no scope.
     * A scope that no longer exists leaves nothing to format.
     *
     * @param tree The tree.
     * @param scope The scope, or null for the whole tree.
     * @return {@code true} if the formatter ran.
     */
    public boolean finish(SyntaxTree tree, RangeMarker scope) {
        if (!formatCode) {
            return false;
        }
        return scheduler.onMutationContext(() -> {
            if (scope != null && !scope.isValid()) {
                LOG.debug("Scope collapsed during processing, skipping formatting");
                return false;
            }
            scheduler.exclusive(() -> {
                if (scope != null) {
                    formatter.reformatRange(tree, scope.range());
                } else {
                    formatter.reformat(tree);
                }
            });
            return true;
        });
    }
}
