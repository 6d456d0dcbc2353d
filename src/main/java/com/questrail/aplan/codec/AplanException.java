package com.questrail.aplan.codec;

/**
 * Base type for every failure raised by the APLAN codec.
 *
 * <p>Subtypes identify the stage that failed:</p>
 * <ul>
 *   <li>{@link AplanLexException}: the source text contains a character or
 *       literal that cannot be tokenized</li>
 *   <li>{@link AplanParseException}: the token stream is not a well-formed
 *       literal</li>
 *   <li>{@link AplanSerializeException}: a value cannot be written as
 *       Array Notation</li>
 * </ul>
 *
 * <p>Every failure is fatal to the call that raised it. The codec performs no
 * recovery and never returns a partial result.</p>
 */
public abstract class AplanException extends RuntimeException
{
    private final int offset;

    protected AplanException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    protected AplanException(String message, int offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /**
     * Character offset into the source text at which the failure was detected,
     * or {@code -1} when the failure has no source position.
     */
    public int offset() {
        return offset;
    }
}
