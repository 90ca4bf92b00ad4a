package org.treefix.postprocess.rules;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treefix.postprocess.diagnostics.DiagnosticSet;
import org.treefix.tree.TreeNode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RuleRegistryTest {

    private static IPostProcessingRule noop() {
        return (node, diagnostics, settings) -> Optional.empty();
    }

    @Test
    void build_shouldAssignPrioritiesInDepthFirstRegistrationOrder() {
        IPostProcessingRule a = noop();
        IPostProcessingRule b = noop();
        IPostProcessingRule c = noop();

        RuleRegistry registry = RuleRegistry.builder()
                .rule(a)
                .group("nested", g -> g.rule(b))
                .rule(c)
                .build();

        assertThat(registry.priority(a)).isEqualTo(0);
        assertThat(registry.priority(b)).isEqualTo(1);
        assertThat(registry.priority(c)).isEqualTo(2);
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void build_explicitPriority_shouldOverridePosition() {
        IPostProcessingRule a = noop();
        IPostProcessingRule b = noop();

        RuleRegistry registry = RuleRegistry.builder().rule(a, 10).rule(b).build();

        assertThat(registry.priority(a)).isEqualTo(10);
        assertThat(registry.priority(b)).isEqualTo(1);
    }

    @Test
    void build_shouldMirrorDeclaredStructure() {
        IPostProcessingRule a = noop();
        IPostProcessingRule b = noop();

        RuleRegistry registry = RuleRegistry.builder()
                .rule(a)
                .group("nested", g -> g.rule(b))
                .build();

        assertThat(registry.root()).isInstanceOf(RuleGroup.class);
        RuleGroup root = (RuleGroup) registry.root();
        assertThat(root.name()).isEqualTo(RuleRegistry.ROOT_GROUP);
        assertThat(root.children()).hasSize(2);
        assertThat(root.children().get(0)).isEqualTo(new SingleRule(a));
        RuleGroup nested = (RuleGroup) root.children().get(1);
        assertThat(nested.name()).isEqualTo("nested");
        assertThat(nested.children()).containsExactly(new SingleRule(b));
    }

    @Test
    void build_duplicateRule_shouldThrow() {
        IPostProcessingRule a = noop();

        assertThatThrownBy(() -> RuleRegistry.builder().rule(a).group("again", g -> g.rule(a)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registered twice");
    }

    @Test
    void of_shouldAssignPositionalPrioritiesToHostTree() {
        IPostProcessingRule a = noop();
        IPostProcessingRule b = noop();
        IPostProcessingRule c = noop();
        RuleGroup root = new RuleGroup("main", List.of(
                new SingleRule(a),
                new RuleGroup("nested", List.of(new SingleRule(b))),
                new SingleRule(c)));

        RuleRegistry registry = RuleRegistry.of(root);

        assertThat(registry.root()).isSameAs(root);
        assertThat(registry.priority(a)).isEqualTo(0);
        assertThat(registry.priority(b)).isEqualTo(1);
        assertThat(registry.priority(c)).isEqualTo(2);
    }

    @Test
    void of_shouldKeepUnknownNodesForThePlanner() {
        IPostProcessingRule a = noop();
        RuleGroup root = new RuleGroup("main", Arrays.asList(new SingleRule(a), null, (IRegistryNode) () -> "alien"));

        RuleRegistry registry = RuleRegistry.of(root);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(((RuleGroup) registry.root()).children()).hasSize(3);
    }

    @Test
    void of_duplicateRule_shouldThrow() {
        IPostProcessingRule a = noop();

        assertThatThrownBy(() -> RuleRegistry.of(new RuleGroup("main", List.of(new SingleRule(a), new SingleRule(a)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registered twice");
    }

    @Test
    void priority_unknownRule_shouldThrow() {
        RuleRegistry registry = RuleRegistry.builder().rule(noop()).build();

        assertThatThrownBy(() -> registry.priority(noop()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not registered");
    }

    @Test
    void ruleGroup_blankName_shouldThrow() {
        assertThatThrownBy(() -> RuleRegistry.builder().group(" ", g -> {}).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void singleRule_shouldBeNamedAfterItsRule() {
        IPostProcessingRule named = new IPostProcessingRule() {
            @Override
            public Optional<Runnable> tryCreateAction(TreeNode node, DiagnosticSet diagnostics, Config settings) {
                return Optional.empty();
            }

            @Override
            public String name() {
                return "RemoveRedundantCast";
            }
        };

        assertThat(new SingleRule(named).name()).isEqualTo("RemoveRedundantCast");
        assertThat(named.requiresExclusiveMutation()).isTrue();
    }
}
