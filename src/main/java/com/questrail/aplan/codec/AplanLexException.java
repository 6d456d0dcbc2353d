package com.questrail.aplan.codec;

/**
 * Indicates that the source text could not be split into tokens.
 *
 * This typically reflects:
 * <ul>
 *   <li>A character that starts no token</li>
 *   <li>A string literal with no closing quote</li>
 *   <li>A malformed numeric literal (e.g. an exponent marker with no digits)</li>
 * </ul>
 */
public final class AplanLexException extends AplanException
{
    private final int codePoint;

    public AplanLexException(String message, int offset) {
        this(message, offset, -1);
    }

    public AplanLexException(String message, int offset, int codePoint) {
        super(message, offset);
        this.codePoint = codePoint;
    }

    public AplanLexException(String message, int offset, Throwable cause) {
        super(message, offset, cause);
        this.codePoint = -1;
    }

    /**
     * The offending code point, or {@code -1} if the failure is not about a
     * single character.
     */
    public int codePoint() {
        return codePoint;
    }
}
