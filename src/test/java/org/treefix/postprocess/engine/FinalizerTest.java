package org.treefix.postprocess.engine;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.treefix.postprocess.format.IFormatter;
import org.treefix.postprocess.host.InlineMutationScheduler;
import org.treefix.tree.MutableSyntaxTree;
import org.treefix.tree.RangeMarker;
import org.treefix.tree.TreeFixtures;
import org.treefix.tree.TextRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FinalizerTest {

    @Mock
    private IFormatter formatter;

    private final MutableSyntaxTree tree = TreeFixtures.statements("ab", "cd");

    @Test
    void finish_withoutScope_shouldReformatWholeTree() {
        boolean formatted = new Finalizer(new InlineMutationScheduler(), formatter, true).finish(tree, null);

        assertThat(formatted).isTrue();
        verify(formatter).reformat(tree);
    }

    @Test
    void finish_withScope_shouldReformatCurrentScopeRange() {
        RangeMarker scope = tree.createRangeMarker(TextRange.of(2, 4));
        tree.setText(tree.nodesOfKind("identifier").get(0), "a");

        boolean formatted = new Finalizer(new InlineMutationScheduler(), formatter, true).finish(tree, scope);

        assertThat(formatted).isTrue();
        verify(formatter).reformatRange(tree, TextRange.of(1, 3));
    }

    @Test
    void finish_withCollapsedScope_shouldSkipFormatting() {
        RangeMarker scope = mock(RangeMarker.class);
        when(scope.isValid()).thenReturn(false);

        boolean formatted = new Finalizer(new InlineMutationScheduler(), formatter, true).finish(tree, scope);

        assertThat(formatted).isFalse();
        verifyNoInteractions(formatter);
    }

    @Test
    void finish_withFormattingDisabled_shouldDoNothing() {
        boolean formatted = new Finalizer(new InlineMutationScheduler(), formatter, false).finish(tree, null);

        assertThat(formatted).isFalse();
        verifyNoInteractions(formatter);
    }
}
