package org.treefix.tree;

/**
 * A half-open range of text offsets, {@code [startOffset, endOffset)}.
 *
 * @param startOffset The first offset covered by the range.
 * @param endOffset The offset just past the last covered character.
 */
public record TextRange(int startOffset, int endOffset) {

    public TextRange {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid text range [" + startOffset + ", " + endOffset + ")");
        }
    }

    /**
     * Creates a new range.
     * @param startOffset The start offset (inclusive).
     * @param endOffset The end offset (exclusive).
     * @return The range.
     */
    public static TextRange of(int startOffset, int endOffset) {
        return new TextRange(startOffset, endOffset);
    }

    /**
     * @return The number of characters covered by this range.
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Checks whether the other range lies completely inside this one.
     * @param other The range to test.
     * @return {@code true} if {@code other} is fully contained.
     */
    public boolean contains(TextRange other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * Checks whether the two ranges share at least one boundary point.
     * Ranges that merely touch are considered intersecting.
     * @param other The range to test.
     * @return {@code true} if the ranges intersect.
     */
    public boolean intersects(TextRange other) {
        return Math.max(startOffset, other.startOffset) <= Math.min(endOffset, other.endOffset);
    }

    @Override
    public String toString() {
        return "[" + startOffset + ", " + endOffset + ")";
    }
}
