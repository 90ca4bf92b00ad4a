package org.treefix.postprocess;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PostProcessorOptionsTest {

    @Test
    void fromConfig_shouldReadAllKeys() {
        // Given
        Config config = ConfigFactory.parseString("""
                treefix.postprocess {
                  format-code = false
                  max-rounds-per-batch = 50
                  read-threads = 4
                }
                """);

        // When
        PostProcessorOptions options = PostProcessorOptions.fromConfig(config);

        // Then
        assertThat(options).isEqualTo(new PostProcessorOptions(false, 50, 4));
    }

    @Test
    void fromConfig_missingKeys_shouldFallBackToDefaults() {
        Config config = ConfigFactory.parseString("treefix.postprocess.read-threads = 3");

        PostProcessorOptions options = PostProcessorOptions.fromConfig(config);

        assertThat(options.formatCode()).isTrue();
        assertThat(options.maxRoundsPerBatch()).isEqualTo(1000);
        assertThat(options.readThreads()).isEqualTo(3);
    }

    @Test
    void fromConfig_missingBlock_shouldReturnDefaults() {
        assertThat(PostProcessorOptions.fromConfig(ConfigFactory.empty())).isEqualTo(PostProcessorOptions.DEFAULT);
    }

    @Test
    void referenceConf_shouldMatchDefaults() {
        Config reference = ConfigFactory.parseResources("reference.conf");

        assertThat(PostProcessorOptions.fromConfig(reference)).isEqualTo(PostProcessorOptions.DEFAULT);
    }

    @Test
    void invalidValues_shouldBeRejected() {
        assertThatThrownBy(() -> PostProcessorOptions.fromConfig(
                ConfigFactory.parseString("treefix.postprocess.max-rounds-per-batch = -1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-rounds-per-batch");
        assertThatThrownBy(() -> new PostProcessorOptions(true, 10, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("read-threads");
    }

    @Test
    void withFormatCode_shouldOnlyChangeFlag() {
        PostProcessorOptions options = PostProcessorOptions.DEFAULT.withFormatCode(false);

        assertThat(options.formatCode()).isFalse();
        assertThat(options.maxRoundsPerBatch()).isEqualTo(PostProcessorOptions.DEFAULT.maxRoundsPerBatch());
    }
}
