package io.arbor.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("test");

        assertThat(result).startsWith("\033[1m").contains("test").endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("test")).isEqualTo("test");
        assertThat(styles.warn("careful")).isEqualTo("careful");
        assertThat(styles.arrow()).isEqualTo("→");
        assertThat(styles.checkmark()).isEqualTo("✓");
        assertThat(styles.crossmark()).isEqualTo("✗");
    }

    @Test
    void shouldColorStatusSymbols() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.checkmark()).isEqualTo("\033[0;32m✓\033[0m");
        assertThat(styles.crossmark()).isEqualTo("\033[38;5;167m✗\033[0m");
    }
}
