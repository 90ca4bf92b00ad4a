package org.treefix.postprocess.engine;

import org.treefix.postprocess.rules.IPostProcessingRule;

import java.util.List;

/**
 * Rules that are driven to a common fixpoint before the next batch starts.
 *
 * @param name The name of the registry node the batch was derived from.
 * @param rules The rules in registry order.
 */
public record Batch(String name, List<IPostProcessingRule> rules) {

    public Batch {
        rules = List.copyOf(rules);
    }
}
