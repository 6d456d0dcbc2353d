package com.questrail.aplan.model;

/**
 * Canonical in-memory representation of an APL Array Notation literal.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code AplValue} is the closed set of values the codec produces when parsing
 * and accepts when serializing. Every decoded literal is one of:
 * </p>
 * <ul>
 *   <li>{@link AplNumber}: a real scalar</li>
 *   <li>{@link AplComplex}: a complex scalar</li>
 *   <li>{@link AplText}: a character vector (scalar characters collapse into it)</li>
 *   <li>{@link AplVector}: an ordered, heterogeneous vector</li>
 *   <li>{@link AplMatrix}: a rectangular array of rank 1 or more, row-major</li>
 *   <li>{@link AplNamespace}: an ordered name/value mapping</li>
 *   <li>{@link AplZilde}: the canonical empty numeric vector</li>
 * </ul>
 *
 * <p>
 * Matrices and namespaces are distinct variants rather than tagged vectors or
 * maps, so consumers branch on the type and never on side-channel markers.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * Values are immutable and form strict trees. A consumer that wants to change a
 * value builds a new one; neither the decoder nor the encoder ever mutates a
 * tree handed to it.
 * </p>
 */
public sealed interface AplValue
        permits AplNumber, AplComplex, AplText, AplVector, AplMatrix, AplNamespace, AplZilde {

    /**
     * Discriminator used in diagnostics and observability events.
     */
    enum Kind {
        NUMBER,
        COMPLEX,
        TEXT,
        VECTOR,
        MATRIX,
        NAMESPACE,
        ZILDE
    }

    /**
     * Returns the variant of this value.
     */
    Kind kind();

    /**
     * Returns true for the scalar variants (number, complex and text).
     */
    default boolean isScalar() {
        Kind k = kind();
        return k == Kind.NUMBER || k == Kind.COMPLEX || k == Kind.TEXT;
    }
}
