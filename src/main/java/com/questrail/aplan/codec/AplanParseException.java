package com.questrail.aplan.codec;

/**
 * Indicates that a token stream does not form a valid APLAN literal.
 *
 * This typically reflects:
 * <ul>
 *   <li>A missing closing {@code )} or {@code ]}</li>
 *   <li>A namespace entry without a name or without a colon</li>
 *   <li>A missing value (e.g. {@code (x: )})</li>
 *   <li>Tokens left over after the top-level value</li>
 *   <li>Nesting deeper than the configured limit</li>
 * </ul>
 */
public final class AplanParseException extends AplanException
{
    private final AplanTokenKind expected;
    private final AplanTokenKind actual;

    public AplanParseException(String message, AplanTokenKind expected, AplanTokenKind actual, int offset) {
        super(message, offset);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * The token kind the parser required, or {@code null} if several kinds
     * would have been acceptable.
     */
    public AplanTokenKind expected() {
        return expected;
    }

    /**
     * The token kind actually found, or {@code null} if not applicable.
     */
    public AplanTokenKind actual() {
        return actual;
    }
}
