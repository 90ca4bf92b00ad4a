package org.treefix.postprocess.diagnostics;

import org.treefix.tree.TextRange;
import org.treefix.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable set of diagnostics computed for one snapshot of a tree.
 * <p>
 * A set is only meaningful for the snapshot it was computed on; any mutation of the
 * tree makes it stale.
 */
public final class DiagnosticSet {

    /** A set without diagnostics. */
    public static final DiagnosticSet EMPTY = new DiagnosticSet(List.of());

    private final List<Diagnostic> diagnostics;

    private DiagnosticSet(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Creates a set from the given diagnostics.
     * @param diagnostics The diagnostics, in reporting order.
     * @return The set.
     */
    public static DiagnosticSet of(Collection<Diagnostic> diagnostics) {
        return diagnostics.isEmpty() ? EMPTY : new DiagnosticSet(List.copyOf(diagnostics));
    }

    /**
     * @return A builder for collecting diagnostics during analysis.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the diagnostics reported exactly on the range of the given node.
     * @param node The node to look up.
     * @return The matching diagnostics, possibly empty.
     */
    public List<Diagnostic> forNode(TreeNode node) {
        TextRange range = node.textRange();
        return diagnostics.stream()
                .filter(d -> d.range().equals(range))
                .collect(Collectors.toList());
    }

    /**
     * @param code The diagnostic code.
     * @return All diagnostics with the given code.
     */
    public List<Diagnostic> withCode(String code) {
        return diagnostics.stream()
                .filter(d -> d.code().equals(code))
                .collect(Collectors.toList());
    }

    /**
     * @return {@code true} if at least one diagnostic has {@link Diagnostic.Severity#ERROR}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * @return All diagnostics in reporting order.
     */
    public List<Diagnostic> all() {
        return diagnostics;
    }

    /**
     * @return All diagnostics as one line each.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "DiagnosticSet" + diagnostics;
    }

    /**
     * Collects diagnostics while an analyzer walks a tree.
     */
    public static final class Builder {

        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Builder() {}

        /**
         * Reports an error.
         * @param code The diagnostic code.
         * @param message The message.
         * @param range The affected range.
         * @return This builder.
         */
        public Builder reportError(String code, String message, TextRange range) {
            return report(Diagnostic.Severity.ERROR, code, message, range);
        }

        /**
         * Reports a warning.
         * @param code The diagnostic code.
         * @param message The message.
         * @param range The affected range.
         * @return This builder.
         */
        public Builder reportWarning(String code, String message, TextRange range) {
            return report(Diagnostic.Severity.WARNING, code, message, range);
        }

        public Builder reportInfo(String code, String message, TextRange range) {
            return report(Diagnostic.Severity.INFO, code, message, range);
        }

        private Builder report(Diagnostic.Severity severity, String code, String message, TextRange range) {
            diagnostics.add(new Diagnostic(severity, code, message, range));
            return this;
        }

        /**
         * @return An immutable set of everything reported so far.
         */
        public DiagnosticSet build() {
            return DiagnosticSet.of(diagnostics);
        }
    }
}
