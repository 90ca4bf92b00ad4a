package org.treefix.postprocess;

import com.typesafe.config.Config;

/**
 * Options of a {@link PostProcessor}, read from the {@value #CONFIG_PATH} block.
 *
 * <pre>
 * treefix.postprocess {
 *   format-code = true           # reformat the processed code at the end
 *   max-rounds-per-batch = 1000  # 0 disables the limit
 *   read-threads = 2             # threads for diagnostics and action collection
 * }
 * </pre>
 *
 * @param formatCode Whether to reformat the scope or tree after all batches converged.
 * @param maxRoundsPerBatch Upper bound for rounds in one batch; 0 for no bound.
 * @param readThreads Size of the read pool of the default scheduler.
 */
public record PostProcessorOptions(boolean formatCode, int maxRoundsPerBatch, int readThreads) {

    public static final String CONFIG_PATH = "treefix.postprocess";

    public static final PostProcessorOptions DEFAULT = new PostProcessorOptions(true, 1000, 2);

    public PostProcessorOptions {
        if (maxRoundsPerBatch < 0) {
            throw new IllegalArgumentException("max-rounds-per-batch must not be negative, was " + maxRoundsPerBatch);
        }
        if (readThreads < 1) {
            throw new IllegalArgumentException("read-threads must be at least 1, was " + readThreads);
        }
    }

    /**
     * Reads the options from a configuration. Missing keys take their default values.
     * @param config The configuration, typically from {@link org.treefix.config.ConfigLoader#load()}.
     * @return The options.
     */
    public static PostProcessorOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULT;
        }
        Config options = config.getConfig(CONFIG_PATH);
        return new PostProcessorOptions(
                options.hasPath("format-code") ? options.getBoolean("format-code") : DEFAULT.formatCode(),
                options.hasPath("max-rounds-per-batch") ? options.getInt("max-rounds-per-batch") : DEFAULT.maxRoundsPerBatch(),
                options.hasPath("read-threads") ? options.getInt("read-threads") : DEFAULT.readThreads());
    }

    /**
     * @param enabled Whether to format.
     * @return A copy with the given formatting flag.
     */
    public PostProcessorOptions withFormatCode(boolean enabled) {
        return new PostProcessorOptions(enabled, maxRoundsPerBatch, readThreads);
    }
}
