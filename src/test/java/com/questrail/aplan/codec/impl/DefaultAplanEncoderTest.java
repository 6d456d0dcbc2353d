package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanSerializeException;
import com.questrail.aplan.config.AplanEncoderConfig;
import com.questrail.aplan.model.*;
import com.questrail.aplan.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultAplanEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultAplanEncoder}.
 *
 * <p>Exact output is asserted for both layouts: the default line-based one and
 * the single-line diamond one.</p>
 */
final class DefaultAplanEncoderTest
{
    private final DefaultAplanEncoder lines = new DefaultAplanEncoder();
    private final DefaultAplanEncoder diamonds = new DefaultAplanEncoder(AplanEncoderConfig.singleLine());

    private static AplNumber num(double v)
    {
        return new AplNumber(v);
    }

    private static AplMatrix matrix(List<Integer> shape, double... cells)
    {
        return new AplMatrix(shape, AplVector.ofNumbers(cells).elements());
    }

    // ---------------------------------------------------------------------
    // Scalars
    // ---------------------------------------------------------------------

    @Test
    void numbers()
    {
        assertEquals("42", lines.encode(num(42)));
        assertEquals("¯3.5", lines.encode(num(-3.5)));
        assertEquals("1E¯7", lines.encode(num(1e-7)));
    }

    @Test
    void complexNumber()
    {
        assertEquals("3J¯4", lines.encode(new AplComplex(3, -4)));
    }

    @Test
    void textDoublesEmbeddedQuotes()
    {
        assertEquals("'it''s'", lines.encode(new AplText("it's")));
        assertEquals("''", lines.encode(new AplText("")));
    }

    @Test
    void zildeAndEmptyVectorBothRenderAsZilde()
    {
        assertEquals("⍬", lines.encode(AplZilde.INSTANCE));
        assertEquals("⍬", lines.encode(AplVector.of()));
    }

    // ---------------------------------------------------------------------
    // Vectors
    // ---------------------------------------------------------------------

    @Test
    void numericVectorIsStrand()
    {
        assertEquals("1 2 3", lines.encode(AplVector.ofNumbers(1, 2, 3)));
        assertEquals("¯1 0.5", diamonds.encode(AplVector.ofNumbers(-1, 0.5)));
    }

    @Test
    void mixedVectorIsParenthesized()
    {
        AplVector v = AplVector.of(num(1), new AplText("a"));

        assertEquals("(\n 1\n 'a'\n)", lines.encode(v));
        assertEquals("(1 ⋄ 'a')", diamonds.encode(v));
    }

    /**
     * A lone element must not read back as a grouped scalar.
     */
    @Test
    void singletonVectorKeepsItsSeparator()
    {
        assertEquals("(\n 42\n)", lines.encode(AplVector.ofNumbers(42)));
        assertEquals("(42 ⋄)", diamonds.encode(AplVector.ofNumbers(42)));
        assertEquals("('x' ⋄)", diamonds.encode(AplVector.of(new AplText("x"))));
    }

    @Test
    void multiLineElementForcesDiamondsInParent()
    {
        AplVector v = AplVector.of(AplVector.ofNumbers(1, 2), AplVector.of(num(3), new AplText("x")));

        assertEquals("(1 2 ⋄ (\n 3\n 'x'\n))", lines.encode(v));
    }

    @Test
    void indentWidthIsConfigurable()
    {
        DefaultAplanEncoder wide = new DefaultAplanEncoder(
                AplanEncoderConfig.builder().withIndentWidth(4).build());

        assertEquals("(\n    1\n    'a'\n)", wide.encode(AplVector.of(num(1), new AplText("a"))));
    }

    // ---------------------------------------------------------------------
    // Namespaces
    // ---------------------------------------------------------------------

    @Test
    void namespaceEntriesInInsertionOrder()
    {
        AplNamespace ns = AplNamespace.builder()
                .put("y", num(1))
                .put("x", new AplText("hi"))
                .build();

        assertEquals("(\n y: 1\n x: 'hi'\n)", lines.encode(ns));
        assertEquals("(y: 1 ⋄ x: 'hi')", diamonds.encode(ns));
    }

    @Test
    void emptyNamespace()
    {
        assertEquals("()", lines.encode(AplNamespace.empty()));
        assertEquals("()", diamonds.encode(AplNamespace.empty()));
    }

    // ---------------------------------------------------------------------
    // Matrices
    // ---------------------------------------------------------------------

    @Test
    void rankTwoMatrixOneRowPerLine()
    {
        AplMatrix m = matrix(List.of(2, 2), 1, 2, 3, 4);

        assertEquals("[\n 1 2\n 3 4\n]", lines.encode(m));
        assertEquals("[1 2 ⋄ 3 4]", diamonds.encode(m));
    }

    @Test
    void textCellsFormStrandRows()
    {
        AplMatrix m = new AplMatrix(List.of(2, 2), List.of(
                num(0), new AplText("All"),
                num(1), new AplText("MouseDown")));

        assertEquals("[0 'All' ⋄ 1 'MouseDown']", diamonds.encode(m));
    }

    @Test
    void columnMatrixWritesOneScalarPerRow()
    {
        assertEquals("[1 ⋄ 2 ⋄ 3]", diamonds.encode(matrix(List.of(3, 1), 1, 2, 3)));
    }

    @Test
    void higherRankNestsBrackets()
    {
        AplMatrix m = matrix(List.of(2, 2, 2), 1, 2, 3, 4, 5, 6, 7, 8);

        assertEquals("[[1 2 ⋄ 3 4] ⋄ [5 6 ⋄ 7 8]]", diamonds.encode(m));
        assertEquals("[[\n 1 2\n 3 4\n] ⋄ [\n 5 6\n 7 8\n]]", lines.encode(m));
    }

    @Test
    void emptyMatrix()
    {
        assertEquals("[]", lines.encode(AplMatrix.empty()));
    }

    // ---------------------------------------------------------------------
    // Error Handling
    // ---------------------------------------------------------------------

    @Test
    void nonFiniteNumberIsRejected()
    {
        AplanSerializeException e = assertThrows(AplanSerializeException.class,
                () -> lines.encode(num(Double.NaN)));
        assertEquals(AplValue.Kind.NUMBER, e.kind());
        assertEquals(-1, e.offset());

        assertThrows(AplanSerializeException.class,
                () -> lines.encode(AplVector.ofNumbers(1, Double.POSITIVE_INFINITY)));
    }

    @Test
    void nonFiniteComplexPartIsRejected()
    {
        AplanSerializeException e = assertThrows(AplanSerializeException.class,
                () -> lines.encode(new AplComplex(1, Double.NEGATIVE_INFINITY)));
        assertEquals(AplValue.Kind.COMPLEX, e.kind());
    }

    @Test
    void nonFiniteInsideNamespaceIsRejected()
    {
        AplNamespace ns = AplNamespace.builder().put("bad", num(Double.NaN)).build();
        assertThrows(AplanSerializeException.class, () -> diamonds.encode(ns));
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    @Test
    void encodeIsReported()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultAplanEncoder observed = new DefaultAplanEncoder(AplanEncoderConfig.singleLine(), sink);

        String text = observed.encode(AplVector.ofNumbers(1, 2, 3));

        assertEquals(1, sink.encodes.size());
        assertEquals(AplValue.Kind.VECTOR, sink.encodes.get(0).rootKind());
        assertEquals(text.length(), sink.encodes.get(0).outputLength());
        assertTrue(sink.errors.isEmpty());
    }

    @Test
    void failureIsReportedThenRethrown()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultAplanEncoder observed = new DefaultAplanEncoder(AplanEncoderConfig.defaults(), sink);

        AplanSerializeException e = assertThrows(AplanSerializeException.class,
                () -> observed.encode(num(Double.NaN)));

        assertTrue(sink.encodes.isEmpty());
        assertEquals(1, sink.errors.size());
        assertSame(e, sink.errors.get(0).cause());
    }
}
