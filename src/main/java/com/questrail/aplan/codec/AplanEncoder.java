package com.questrail.aplan.codec;

import com.questrail.aplan.model.AplValue;

/**
 * AplanEncoder
 * -----------------------------------------------------------------------------
 * Canonical writer for Array Notation.
 *
 * <p>The encoder is a pretty-printer, not an echo of the source text: the
 * separator style and indentation of its output come from configuration, not
 * from whatever source the value was decoded from. Decoding the output yields a
 * value structurally equal to the input.</p>
 */
public interface AplanEncoder
{
    /**
     * Encode a value as Array Notation text.
     *
     * @throws AplanSerializeException if the tree contains a NaN or infinite number
     */
    String encode(AplValue value);
}
