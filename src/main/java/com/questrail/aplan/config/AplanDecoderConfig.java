package com.questrail.aplan.config;

/**
 * Configuration for {@code DefaultAplanDecoder}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxNestingDepth</b>: maximum number of simultaneously open
 *       parentheses and brackets. Input nested deeper is rejected with a parse
 *       error instead of exhausting the call stack.</li>
 * </ul>
 */
public record AplanDecoderConfig(
        int maxNestingDepth
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public AplanDecoderConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be >= 1 (was " + maxNestingDepth + ")");
        }
    }

    public static AplanDecoderConfig defaults() {
        return new AplanDecoderConfig(DEFAULT_MAX_NESTING_DEPTH);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public AplanDecoderConfig build() {
            return new AplanDecoderConfig(maxNestingDepth);
        }
    }
}
