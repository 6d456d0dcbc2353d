/**
 * APLAN Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the library:
 * the decoder and encoder ports, the lexical token kinds, and the exception
 * taxonomy shared by both directions.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String source
 *        → AplanDecoder         (lexing and grammar applied here)
 *            → AplValue         (immutable value tree)
 *                → AplanEncoder (canonical rendering applied here)
 *                    → String
 * </pre>
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>{@link com.questrail.aplan.codec.AplanLexException}: character level</li>
 *   <li>{@link com.questrail.aplan.codec.AplanParseException}: token level</li>
 *   <li>{@link com.questrail.aplan.codec.AplanSerializeException}: value level</li>
 * </ul>
 *
 * <p>All three are unchecked and fatal to the call. Ambiguities in the grammar
 * (grouping versus one-element vector, for example) are resolved
 * deterministically and are never reported as errors.</p>
 */
package com.questrail.aplan.codec;
