package com.astwriter.core.config;

import com.astwriter.core.config.WriterConfig.FormatterSettings;
import com.astwriter.core.config.WriterConfig.FormatterStyle;
import com.astwriter.core.format.PrettyFormatter;
import com.astwriter.core.format.SourceFormatter;
import com.astwriter.core.format.SpacelessFormatter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WriterConfig}.
 */
class WriterConfigTest {

    @Test
    void defaults_returnsSolidityPrettyConfig() {
        WriterConfig config = WriterConfig.defaults();

        assertThat(config.mapping()).isEqualTo("solidity");
        assertThat(config.targetVersion()).isEqualTo("0.8.20");
        assertThat(config.formatter()).isEqualTo(new FormatterSettings(FormatterStyle.PRETTY, 4, 0));
    }

    @Test
    void constructor_withNulls_fillsDefaults() {
        assertThat(new WriterConfig(null, " ", null)).isEqualTo(WriterConfig.defaults());
    }

    @Test
    void createFormatter_pretty_usesSettings() {
        WriterConfig config = new WriterConfig("solidity", "0.8.20", new FormatterSettings(FormatterStyle.PRETTY, 2, 3));

        SourceFormatter formatter = config.createFormatter();

        assertThat(formatter).isInstanceOf(PrettyFormatter.class);
        assertThat(formatter.renderIndent()).isEqualTo("   ");
        assertThat(formatter.nested().renderIndent()).isEqualTo("     ");
    }

    @Test
    void createFormatter_spaceless_returnsSpacelessFormatter() {
        WriterConfig config = new WriterConfig(null, null, new FormatterSettings(FormatterStyle.SPACELESS, null, null));

        assertThat(config.createFormatter()).isInstanceOf(SpacelessFormatter.class);
    }

    @Test
    void withOverrides_nullKeepsCurrentValue() {
        WriterConfig config = WriterConfig.defaults()
            .withMapping(null)
            .withTargetVersion("0.7.6");

        assertThat(config.mapping()).isEqualTo("solidity");
        assertThat(config.targetVersion()).isEqualTo("0.7.6");
    }

    @Test
    void formatterSettings_negativeOffset_throwsException() {
        assertThatThrownBy(() -> new FormatterSettings(FormatterStyle.PRETTY, 4, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("offset=-1");
    }

    @Test
    void formatterStyle_fromString_isCaseInsensitive() {
        assertThat(FormatterStyle.fromString(" Spaceless ")).isEqualTo(FormatterStyle.SPACELESS);
    }
}
