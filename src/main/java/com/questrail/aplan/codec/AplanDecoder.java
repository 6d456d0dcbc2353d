package com.questrail.aplan.codec;

import com.questrail.aplan.model.AplValue;

/**
 * AplanDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for Array Notation.
 *
 * <p>This interface defines the inbound boundary between raw literal text and a
 * structured {@link AplValue} tree.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Tokenizing the source</li>
 *   <li>Resolving grouping, vector, namespace and matrix structure</li>
 *   <li>Unifying matrix row shapes</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Evaluating APL expressions or resolving names</li>
 *   <li>Recovering from malformed input</li>
 *   <li>Reading files or streams</li>
 * </ul>
 */
public interface AplanDecoder
{
    /**
     * Decode exactly one literal.
     *
     * <p>The whole source must be consumed: anything after the top-level value
     * is rejected.</p>
     *
     * @param source Array Notation text
     * @return the decoded value
     * @throws AplanLexException   if the text cannot be tokenized
     * @throws AplanParseException if the tokens do not form a literal
     */
    AplValue decode(String source);
}
