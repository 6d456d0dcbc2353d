/**
 * APLAN Codec: Text-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete codec that bridges Array Notation text
 * and the {@link com.questrail.aplan.model.AplValue} model.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String source
 *        → AplanTokenizer.tokenize
 *        → DefaultAplanDecoder          (recursive descent)
 *        → AplanMatrixShapes.rowsToMatrix
 *        → AplValue
 *        → DefaultAplanEncoder          (AplanNumberFormat for numerics)
 *        → String
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>literal-only (no APL evaluation)</li>
 *   <li>I/O-free</li>
 *   <li>fail-fast: the first violation ends the call</li>
 * </ul>
 */
package com.questrail.aplan.codec.impl;
