package org.treefix.postprocess.diagnostics;

import org.treefix.tree.TextRange;

/**
 * A single semantic fact about a tree snapshot, e.g. an unresolved reference
 * or a type mismatch, reported by an {@link IDiagnosticAnalyzer}.
 *
 * @param severity The severity of the diagnostic.
 * @param code A stable identifier that rules match on, e.g. {@code "UNRESOLVED_REFERENCE"}.
 * @param message A human-readable message.
 * @param range The text range the diagnostic refers to.
 */
public record Diagnostic(
        Severity severity,
        String code,
        String message,
        TextRange range
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        /** The code is not valid as it stands. */
        ERROR,
        /** The code is valid but suspicious. */
        WARNING,
        /** Purely informational. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s: %s", severity, code, range, message);
    }
}
