package com.questrail.aplan.codec;

import com.questrail.aplan.model.AplValue;

/**
 * Indicates that a value has no Array Notation rendering.
 *
 * <p>The only such values are numbers (real, or either component of a complex)
 * that are NaN or infinite.</p>
 */
public final class AplanSerializeException extends AplanException
{
    private final AplValue.Kind kind;

    public AplanSerializeException(String message, AplValue.Kind kind) {
        super(message, -1);
        this.kind = kind;
    }

    /**
     * Variant of the value that could not be serialized.
     */
    public AplValue.Kind kind() {
        return kind;
    }
}
