package org.treefix.postprocess.api;

/**
 * Thrown when post-processing cannot be carried out.
 * <p>
 * Failures raised by rules themselves are not wrapped; they reach the caller unchanged.
 */
public class PostProcessingException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public PostProcessingException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public PostProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
