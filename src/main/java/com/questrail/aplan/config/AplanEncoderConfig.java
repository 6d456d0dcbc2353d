package com.questrail.aplan.config;

/**
 * Layout configuration for {@code DefaultAplanEncoder}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>useSeparatorGlyph</b>: when true, elements of vectors, matrices
 *       and namespaces are written on one line joined by {@code " ⋄ "}. When
 *       false (the default), each element goes on its own indented line.</li>
 *   <li><b>indentWidth</b>: number of spaces placed before each element in
 *       the line-based layout. Default 1.</li>
 * </ul>
 */
public record AplanEncoderConfig(
        boolean useSeparatorGlyph,
        int indentWidth
) {
    public static final int DEFAULT_INDENT_WIDTH = 1;

    public AplanEncoderConfig {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be non-negative (was " + indentWidth + ")");
        }
    }

    public static AplanEncoderConfig defaults() {
        return new AplanEncoderConfig(false, DEFAULT_INDENT_WIDTH);
    }

    /**
     * Single-line layout using the diamond separator.
     */
    public static AplanEncoderConfig singleLine() {
        return new AplanEncoderConfig(true, DEFAULT_INDENT_WIDTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean useSeparatorGlyph = false;
        private int indentWidth = DEFAULT_INDENT_WIDTH;

        public Builder withSeparatorGlyph(boolean useSeparatorGlyph) {
            this.useSeparatorGlyph = useSeparatorGlyph;
            return this;
        }

        public Builder withIndentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public AplanEncoderConfig build() {
            return new AplanEncoderConfig(useSeparatorGlyph, indentWidth);
        }
    }
}
