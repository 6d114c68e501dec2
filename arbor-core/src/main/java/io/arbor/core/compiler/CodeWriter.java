package io.arbor.core.compiler;

/// Indentation-aware line buffer for generated source, plus literal formatting.
final class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int level;

    CodeWriter(int level) {
        this.level = level;
    }

    CodeWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(level)).append(text);
        }
        out.append('\n');
        return this;
    }

    CodeWriter blank() {
        out.append('\n');
        return this;
    }

    CodeWriter indent() {
        level++;
        return this;
    }

    CodeWriter outdent() {
        level--;
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }

    /// Quotes text as a Java string literal.
    static String stringLiteral(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /// Formats a finite double as a Java literal.
    ///
    /// @throws IllegalArgumentException for NaN or infinite values
    static String doubleLiteral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        return Double.toString(value);
    }

    static String longLiteral(long value) {
        return value + "L";
    }

    /// Makes text safe to embed in a `//` comment.
    static String comment(String text) {
        return text == null ? "" : text.replace('\n', ' ').replace('\r', ' ');
    }
}
