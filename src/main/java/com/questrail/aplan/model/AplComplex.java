package com.questrail.aplan.model;

/**
 * Complex scalar, written {@code <re>J<im>} in Array Notation.
 */
public record AplComplex(double re, double im) implements AplValue
{
    public boolean isFinite() {
        return Double.isFinite(re) && Double.isFinite(im);
    }

    @Override
    public Kind kind() {
        return Kind.COMPLEX;
    }
}
