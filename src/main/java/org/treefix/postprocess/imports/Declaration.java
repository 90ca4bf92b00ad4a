package org.treefix.postprocess.imports;

import java.util.Objects;

/**
 * A declaration a qualified name resolves to.
 *
 * @param name The fully qualified name of the declaration.
 * @param kind The declaration kind as reported by the resolver, e.g. {@code "class"} or {@code "function"}.
 */
public record Declaration(QualifiedName name, String kind) {

    public Declaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
