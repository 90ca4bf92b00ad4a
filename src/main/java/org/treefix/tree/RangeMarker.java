package org.treefix.tree;

/**
 * A reference to a text range that survives edits of its tree.
 * The marker becomes invalid when an edit strictly covers it, or when exactly its text
 * is deleted. Replacing exactly its text keeps it valid over the new text.
 */
public interface RangeMarker {

    /**
     * @return {@code true} while the marked range still exists.
     */
    boolean isValid();

    /**
     * @return The current range.
     * @throws IllegalStateException if the marker is no longer valid.
     */
    TextRange range();

    /**
     * Stops tracking edits. A disposed marker is invalid.
     */
    void dispose();
}
