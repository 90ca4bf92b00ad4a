package org.treefix.postprocess.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treefix.tree.MutableNode;
import org.treefix.tree.MutableSyntaxTree;
import org.treefix.tree.TreeFixtures;
import org.treefix.tree.TextRange;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticSetTest {

    @Test
    void builder_shouldKeepReportingOrderAndSeverities() {
        DiagnosticSet set = DiagnosticSet.builder()
                .reportWarning("UNUSED", "unused variable", TextRange.of(0, 2))
                .reportError("UNRESOLVED", "unresolved reference", TextRange.of(2, 4))
                .reportInfo("STYLE", "could be val", TextRange.of(0, 2))
                .build();

        assertThat(set.size()).isEqualTo(3);
        assertThat(set.all()).extracting(Diagnostic::severity).containsExactly(
                Diagnostic.Severity.WARNING, Diagnostic.Severity.ERROR, Diagnostic.Severity.INFO);
        assertThat(set.hasErrors()).isTrue();
    }

    @Test
    void forNode_shouldMatchExactRange() {
        MutableSyntaxTree tree = TreeFixtures.statements("ab", "cd");
        MutableNode first = tree.root().children().get(0);
        DiagnosticSet set = DiagnosticSet.builder()
                .reportWarning("UNUSED", "unused", TextRange.of(0, 2))
                .reportWarning("WIDE", "covers everything", TextRange.of(0, 4))
                .build();

        List<Diagnostic> forFirst = set.forNode(first);

        assertThat(forFirst).extracting(Diagnostic::code).containsExactly("UNUSED");
        assertThat(set.forNode(tree.root())).extracting(Diagnostic::code).containsExactly("WIDE");
    }

    @Test
    void withCode_shouldFilterByCode() {
        DiagnosticSet set = DiagnosticSet.builder()
                .reportWarning("UNUSED", "a", TextRange.of(0, 1))
                .reportWarning("UNUSED", "b", TextRange.of(1, 2))
                .reportWarning("OTHER", "c", TextRange.of(2, 3))
                .build();

        assertThat(set.withCode("UNUSED")).extracting(Diagnostic::message).containsExactly("a", "b");
        assertThat(set.withCode("MISSING")).isEmpty();
    }

    @Test
    void emptyBuilder_shouldYieldSharedEmptySet() {
        DiagnosticSet set = DiagnosticSet.builder().build();

        assertThat(set).isSameAs(DiagnosticSet.EMPTY);
        assertThat(set.isEmpty()).isTrue();
        assertThat(set.hasErrors()).isFalse();
        assertThat(set.summary()).isEmpty();
    }

    @Test
    void summary_shouldListOneDiagnosticPerLine() {
        DiagnosticSet set = DiagnosticSet.builder()
                .reportError("E1", "first", TextRange.of(0, 1))
                .reportWarning("W1", "second", TextRange.of(1, 2))
                .build();

        assertThat(set.summary()).isEqualTo("[ERROR] E1 [0, 1): first\n[WARNING] W1 [1, 2): second");
    }
}
