package com.questrail.aplan.codec.impl;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * AplanNumberFormat
 * -----------------------------------------------------------------------------
 * Renders finite doubles as APL numeric literals.
 *
 * <p>The digits are the shortest decimal that reads back as the same double
 * (see {@link #shortestDecimal(double)}).
 * Layout follows the familiar script-language convention: plain positional
 * notation when the decimal exponent lies in {@code [-6, 21)}, scientific
 * notation otherwise. APL spelling is then applied:</p>
 * <ul>
 *   <li>the sign is the high minus {@code ¯}</li>
 *   <li>the exponent marker is {@code E}, followed by {@code ¯} for a negative
 *       exponent or {@code +} for a positive one</li>
 *   <li>negative zero is written {@code 0}</li>
 * </ul>
 *
 * <pre>
 *   42        → 42
 *   -2.5      → ¯2.5
 *   0.0025    → 0.0025
 *   1e-7      → 1E¯7
 *   1.5e21    → 1.5E+21
 *   1e23      → 1E+23
 * </pre>
 */
final class AplanNumberFormat
{
    /** Largest decimal-point position written without an exponent. */
    private static final int MAX_POSITIONAL = 21;

    /** Smallest decimal-point position written without an exponent. */
    private static final int MIN_POSITIONAL = -5;

    /** Significant digits that always identify a double uniquely. */
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private AplanNumberFormat() {}

    /**
     * Formats a finite double. Callers must reject NaN and infinities first.
     */
    static String format(double value)
    {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Non-finite value: " + value);
        }
        if (value == 0) {
            return "0";
        }

        final StringBuilder out = new StringBuilder();
        if (value < 0) {
            out.append(AplanGlyphs.HIGH_MINUS);
        }

        final BigDecimal decimal = shortestDecimal(Math.abs(value));
        final String digits = decimal.unscaledValue().toString();
        final int k = digits.length();
        final int n = k - decimal.scale();

        if (k <= n && n <= MAX_POSITIONAL) {
            out.append(digits);
            out.append("0".repeat(n - k));
        }
        else if (0 < n && n <= MAX_POSITIONAL) {
            out.append(digits, 0, n).append('.').append(digits, n, k);
        }
        else if (MIN_POSITIONAL <= n && n <= 0) {
            out.append("0.").append("0".repeat(-n)).append(digits);
        }
        else {
            final int exponent = n - 1;
            out.append(digits.charAt(0));
            if (k > 1) {
                out.append('.').append(digits, 1, k);
            }
            out.append(AplanGlyphs.EXPONENT_MARKER);
            out.append(exponent < 0 ? AplanGlyphs.HIGH_MINUS : '+');
            out.append(Math.abs(exponent));
        }
        return out.toString();
    }

    /**
     * Returns the decimal with the fewest significant digits that converts back
     * to {@code value}, trailing zeros stripped.
     *
     * <p>On JDK 17 {@code Double.toString} is not always shortest
     * ({@code 1e23} prints as {@code 9.999999999999999E22}).</p>
     */
    static BigDecimal shortestDecimal(double value)
    {
        final BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
            final BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /**
     * Formats a complex value as {@code <re>J<im>}.
     */
    static String formatComplex(double re, double im)
    {
        return format(re) + AplanGlyphs.COMPLEX_MARKER + format(im);
    }
}
