package org.treefix.postprocess;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treefix.postprocess.api.BatchOutcome;
import org.treefix.postprocess.api.IPostProcessor;
import org.treefix.postprocess.api.PostProcessingException;
import org.treefix.postprocess.api.PostProcessingReport;
import org.treefix.postprocess.diagnostics.IDiagnosticAnalyzer;
import org.treefix.postprocess.engine.ActionCollector;
import org.treefix.postprocess.engine.Batch;
import org.treefix.postprocess.engine.BatchPlanner;
import org.treefix.postprocess.engine.ConvergenceLoop;
import org.treefix.postprocess.engine.DiagnosticSnapshotProvider;
import org.treefix.postprocess.engine.Finalizer;
import org.treefix.postprocess.format.IFormatter;
import org.treefix.postprocess.host.ExecutorMutationScheduler;
import org.treefix.postprocess.host.IMutationScheduler;
import org.treefix.postprocess.imports.Declaration;
import org.treefix.postprocess.imports.IImportInserter;
import org.treefix.postprocess.imports.ISymbolResolver;
import org.treefix.postprocess.imports.QualifiedName;
import org.treefix.postprocess.rules.RuleRegistry;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The post-processor implementation. Plans the rule batches of its registry, drives each
 * batch to its fixpoint and formats the result.
 * <p>
 * Instances may be reused for many trees, but each call processes one tree and runs
 * sequentially. Processors that created their own scheduler must be closed.
 */
public class PostProcessor implements IPostProcessor, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PostProcessor.class);

    private final RuleRegistry registry;
    private final IMutationScheduler scheduler;
    private final ExecutorMutationScheduler ownedScheduler;
    private final ISymbolResolver symbolResolver;
    private final IImportInserter importInserter;
    private final ConvergenceLoop convergenceLoop;
    private final Finalizer finalizer;

    private PostProcessor(Builder builder) {
        this.registry = builder.registry;
        this.ownedScheduler = builder.scheduler == null
                ? new ExecutorMutationScheduler(builder.options.readThreads())
                : null;
        this.scheduler = ownedScheduler != null ? ownedScheduler : builder.scheduler;
        this.symbolResolver = builder.symbolResolver;
        this.importInserter = builder.importInserter;
        this.convergenceLoop = new ConvergenceLoop(
                scheduler,
                new DiagnosticSnapshotProvider(builder.analyzer),
                new ActionCollector(registry),
                builder.options.maxRoundsPerBatch());
        this.finalizer = new Finalizer(scheduler, builder.formatter, builder.options.formatCode());
    }

    /**
     * Creates a builder for a processor applying the rules of the given registry.
     * @param registry The rule registry.
     * @return A new builder.
     */
    public static Builder builder(RuleRegistry registry) {
        return new Builder(registry);
    }

    @Override
    public PostProcessingReport runPostProcessing(SyntaxTree tree, RangeMarker scope, Config settings) throws PostProcessingException {
        Objects.requireNonNull(tree, "tree");
        Config ruleSettings = settings != null ? settings : ConfigFactory.empty();

        // Phase 1: Batch planning
        List<Batch> batches = BatchPlanner.plan(registry.root());
        LOG.debug("Planned {} batches for {} rules", batches.size(), registry.size());

        // Phase 2: Drive every batch to its fixpoint, strictly in planner order
        List<BatchOutcome> outcomes = new ArrayList<>();
        for (Batch batch : batches) {
            BatchOutcome outcome = convergenceLoop.converge(batch, tree, scope, ruleSettings);
            LOG.debug("Batch '{}' finished after {} rounds ({} actions applied, {} skipped)",
                    outcome.batchName(), outcome.rounds(), outcome.appliedActions(), outcome.skippedActions());
            outcomes.add(outcome);
        }

        // Phase 3: Formatting
        boolean formatted = finalizer.finish(tree, scope);

        return new PostProcessingReport(outcomes, formatted);
    }

    @Override
    public void insertImport(SyntaxTree tree, QualifiedName qualifiedName) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        scheduler.runOnMutationContext(() -> scheduler.exclusive(() -> {
            List<Declaration> candidates = symbolResolver.resolveQualifiedName(tree, qualifiedName);
            if (candidates.isEmpty()) {
                LOG.debug("No declaration found for '{}', import not added", qualifiedName);
                return;
            }
            importInserter.insertImport(tree, candidates.get(0));
        }));
    }

    /**
     * Shuts down the scheduler if this processor created it.
     */
    @Override
    public void close() {
        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
    }

    /**
     * Builder for {@link PostProcessor}. Collaborators that are not set fall back to
     * implementations that do nothing.
     */
    public static final class Builder {

        private final RuleRegistry registry;
        private IDiagnosticAnalyzer analyzer = IDiagnosticAnalyzer.NONE;
        private IFormatter formatter = IFormatter.NONE;
        private ISymbolResolver symbolResolver = ISymbolResolver.NONE;
        private IImportInserter importInserter = IImportInserter.NONE;
        private IMutationScheduler scheduler;
        private PostProcessorOptions options = PostProcessorOptions.DEFAULT;

        private Builder(RuleRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder analyzer(IDiagnosticAnalyzer analyzer) {
            this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
            return this;
        }

        public Builder formatter(IFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        public Builder symbolResolver(ISymbolResolver symbolResolver) {
            this.symbolResolver = Objects.requireNonNull(symbolResolver, "symbolResolver");
            return this;
        }

        public Builder importInserter(IImportInserter importInserter) {
            this.importInserter = Objects.requireNonNull(importInserter, "importInserter");
            return this;
        }

        /**
         * Uses a scheduler supplied by the host. The processor will not close it.
         * @param scheduler The scheduler.
         * @return This builder.
         */
        public Builder scheduler(IMutationScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        public Builder options(PostProcessorOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * @param config A configuration containing a {@value PostProcessorOptions#CONFIG_PATH} block.
         * @return This builder.
         */
        public Builder options(Config config) {
            return options(PostProcessorOptions.fromConfig(config));
        }

        public PostProcessor build() {
            return new PostProcessor(this);
        }
    }
}
