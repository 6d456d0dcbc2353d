package com.questrail.aplan;

import com.questrail.aplan.codec.AplanDecoder;
import com.questrail.aplan.codec.AplanEncoder;
import com.questrail.aplan.codec.impl.DefaultAplanDecoder;
import com.questrail.aplan.codec.impl.DefaultAplanEncoder;
import com.questrail.aplan.compare.StructuralEquality;
import com.questrail.aplan.config.AplanEncoderConfig;
import com.questrail.aplan.model.AplMatrix;
import com.questrail.aplan.model.AplValue;
import com.questrail.aplan.model.AplVector;

import java.util.Arrays;
import java.util.Objects;

/**
 * Aplan
 * =============================================================================
 * Static entry points for the common cases.
 *
 * <p>Each method delegates to a default-configured codec component. Callers
 * that need a nesting limit other than the default, a custom layout reused
 * across calls, or an observability sink should construct
 * {@link DefaultAplanDecoder} and {@link DefaultAplanEncoder} directly.</p>
 *
 * <pre>
 *   AplValue v = Aplan.parse("(x: 1 2 3 ⋄ y: 'hi')");
 *   String s = Aplan.serialize(v, AplanEncoderConfig.singleLine());
 *   Aplan.equal(v, Aplan.parse(s));   // true
 * </pre>
 */
public final class Aplan
{
    private static final AplanDecoder DECODER = new DefaultAplanDecoder();
    private static final AplanEncoder ENCODER = new DefaultAplanEncoder();

    private Aplan() {}

    /**
     * Parses one Array Notation literal.
     *
     * @throws com.questrail.aplan.codec.AplanLexException   on a lexical error
     * @throws com.questrail.aplan.codec.AplanParseException on a structural error
     */
    public static AplValue parse(String source) {
        return DECODER.decode(source);
    }

    /**
     * Serializes with the default line-based layout.
     *
     * @throws com.questrail.aplan.codec.AplanSerializeException on a non-finite number
     */
    public static String serialize(AplValue value) {
        return ENCODER.encode(value);
    }

    public static String serialize(AplValue value, AplanEncoderConfig config) {
        return new DefaultAplanEncoder(config).encode(value);
    }

    /**
     * @see StructuralEquality#equal(AplValue, AplValue)
     */
    public static boolean equal(AplValue a, AplValue b) {
        return StructuralEquality.equal(a, b);
    }

    /**
     * Returns the element of an array at the given index path.
     *
     * <ul>
     *   <li>For a matrix, one index per axis is required and the cell at that
     *       row-major position is returned.</li>
     *   <li>For a vector, each index selects an element and descends into it,
     *       so {@code get(v, 1, 0)} is the first element of the second
     *       element.</li>
     * </ul>
     *
     * @throws IllegalArgumentException  if {@code value} cannot be indexed
     *         (zilde, a scalar or a namespace), if a matrix index path has the
     *         wrong length, or if a vector path descends into a non-vector
     * @throws IndexOutOfBoundsException if an index is outside its axis
     */
    public static AplValue get(AplValue value, int... indices) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(indices, "indices");

        if (value instanceof AplMatrix matrix) {
            return matrixCell(matrix, indices);
        }
        if (value instanceof AplVector vector) {
            return vectorElement(vector, indices);
        }
        if (value.kind() == AplValue.Kind.ZILDE) {
            throw new IllegalArgumentException("Cannot index into zilde (empty array)");
        }
        throw new IllegalArgumentException("Cannot index into value of kind " + value.kind());
    }

    private static AplValue matrixCell(AplMatrix matrix, int[] indices) {
        if (indices.length != matrix.rank()) {
            throw new IllegalArgumentException(
                    "Index rank " + indices.length + " does not match array rank " + matrix.rank());
        }

        int offset = 0;
        for (int axis = 0; axis < indices.length; axis++) {
            int extent = matrix.shape().get(axis);
            int index = indices[axis];
            if (index < 0 || index >= extent) {
                throw new IndexOutOfBoundsException(
                        "Index " + index + " out of bounds for axis " + axis + " with extent " + extent);
            }
            offset = offset * extent + index;
        }
        return matrix.cells().get(offset);
    }

    private static AplValue vectorElement(AplVector vector, int[] indices) {
        AplValue current = vector;
        for (int depth = 0; depth < indices.length; depth++) {
            if (!(current instanceof AplVector level)) {
                throw new IllegalArgumentException(
                        "Cannot index deeper: reached " + current.kind() + " at depth " + depth
                                + " of path " + Arrays.toString(indices));
            }
            int index = indices[depth];
            if (index < 0 || index >= level.size()) {
                throw new IndexOutOfBoundsException(
                        "Index " + index + " out of bounds for vector of length " + level.size());
            }
            current = level.get(index);
        }
        return current;
    }
}
