package io.arbor.cli.ui;

/// ANSI text styling for CLI output.
///
/// All methods return styled strings; with color disabled they return the text unchanged,
/// so output stays readable when piped.
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    public String gray(String text) {
        return style(text, GRAY);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }
}
