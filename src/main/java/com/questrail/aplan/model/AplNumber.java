package com.questrail.aplan.model;

/**
 * Real scalar.
 *
 * <p>
 * NaN and infinities are constructible so that intermediate results can be
 * represented, but the encoder refuses to serialize them.
 * </p>
 */
public record AplNumber(double value) implements AplValue
{
    /** Numeric zero, also the pad value for ragged matrix rows. */
    public static final AplNumber ZERO = new AplNumber(0);

    public static AplNumber of(double value) {
        return new AplNumber(value);
    }

    /**
     * Returns true if the value is neither NaN nor infinite.
     */
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }
}
