package org.treefix.postprocess.api;

/**
 * Thrown when the rule registry contains a node that is neither a single rule nor a group.
 */
public class RegistryCorruptedException extends PostProcessingException {

    /**
     * @param message The detail message.
     */
    public RegistryCorruptedException(String message) {
        super(message);
    }
}
