/**
 * APLAN Value Model
 * =============================================================================
 *
 * <p>This package defines the closed value type shared by every layer of the
 * library. It has no knowledge of text, tokens or glyph rendering; those live
 * in the codec layer.</p>
 *
 * <pre>
 *   String source
 *        → AplanDecoder
 *            → AplValue tree      (this package)
 *                → AplanEncoder
 *                    → String
 * </pre>
 *
 * <p>All types here are immutable. Invariants (matrix shape/cell agreement,
 * namespace key validity) are checked at construction so that an
 * {@link com.questrail.aplan.model.AplValue} that exists is always well-formed,
 * except for non-finite numbers, which are rejected only when serialized.</p>
 */
package com.questrail.aplan.model;
