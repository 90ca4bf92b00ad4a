package org.treefix.postprocess.imports;

import java.util.Arrays;
import java.util.List;

/**
 * A dot-separated, fully qualified name such as {@code java.util.List}.
 *
 * @param segments The name segments, outermost first.
 */
public record QualifiedName(List<String> segments) {

    public QualifiedName {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Qualified name must have at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank() || !segment.strip().equals(segment)) {
                throw new IllegalArgumentException("Invalid name segment '" + segment + "' in " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dot-separated name.
     * @param text The text, e.g. {@code "kotlin.collections.List"}.
     * @return The qualified name.
     * @throws IllegalArgumentException if a segment is empty or contains surrounding whitespace.
     */
    public static QualifiedName parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Qualified name must not be empty");
        }
        return new QualifiedName(Arrays.asList(text.split("\\.", -1)));
    }

    /**
     * @return The last segment.
     */
    public String shortName() {
        return segments.get(segments.size() - 1);
    }

    /**
     * @return {@code true} if the name has a qualifier.
     */
    public boolean hasParent() {
        return segments.size() > 1;
    }

    /**
     * @return The qualifier of this name.
     * @throws IllegalStateException if the name has a single segment.
     */
    public QualifiedName parent() {
        if (!hasParent()) {
            throw new IllegalStateException("'" + this + "' has no parent");
        }
        return new QualifiedName(segments.subList(0, segments.size() - 1));
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
