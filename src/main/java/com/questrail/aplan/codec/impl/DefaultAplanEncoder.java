package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanEncoder;
import com.questrail.aplan.codec.AplanSerializeException;
import com.questrail.aplan.config.AplanEncoderConfig;
import com.questrail.aplan.model.AplComplex;
import com.questrail.aplan.model.AplMatrix;
import com.questrail.aplan.model.AplNamespace;
import com.questrail.aplan.model.AplNumber;
import com.questrail.aplan.model.AplText;
import com.questrail.aplan.model.AplValue;
import com.questrail.aplan.model.AplVector;
import com.questrail.aplan.observability.AplanEncodeEvent;
import com.questrail.aplan.observability.AplanErrorEvent;
import com.questrail.aplan.observability.AplanObservabilitySink;
import com.questrail.aplan.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultAplanEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AplanEncoder}.
 *
 * <p>This is the canonicalizing inverse of {@link DefaultAplanDecoder}:</p>
 * <ul>
 *   <li>Numbers use {@link AplanNumberFormat}; complex numbers are
 *       {@code <re>J<im>}.</li>
 *   <li>Strings are single-quoted with embedded quotes doubled.</li>
 *   <li>Zilde and every empty vector are written {@code ⍬}.</li>
 *   <li>A vector of two or more plain numbers is a strand ({@code 1 2 3}).
 *       Other vectors are parenthesized.</li>
 *   <li>Matrices are bracketed, one major cell per element.</li>
 *   <li>Namespaces are {@code (name: value ...)} in insertion order;
 *       the empty namespace is {@code ()}.</li>
 * </ul>
 *
 * <p><strong>Layout</strong>: parenthesized and bracketed elements are joined
 * by {@code " ⋄ "} when {@link AplanEncoderConfig#useSeparatorGlyph()} is set
 * or when any element already spans several lines; otherwise each element goes
 * on its own line, indented by {@link AplanEncoderConfig#indentWidth()}.</p>
 */
public final class DefaultAplanEncoder implements AplanEncoder
{
    private static final String ZILDE = String.valueOf(AplanGlyphs.ZILDE);
    private static final String GLYPH_SEPARATOR = " " + AplanGlyphs.DIAMOND + " ";

    private final AplanEncoderConfig config;
    private final AplanObservabilitySink sink;
    private final String indent;

    public DefaultAplanEncoder()
    {
        this(AplanEncoderConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultAplanEncoder(AplanEncoderConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public DefaultAplanEncoder(AplanEncoderConfig config, AplanObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.indent = " ".repeat(config.indentWidth());
    }

    @Override
    public String encode(AplValue value)
    {
        Objects.requireNonNull(value, "value");

        try {
            final String text = render(value);
            sink.onEncoded(new AplanEncodeEvent(Instant.now(), value.kind(), text.length()));
            return text;
        }
        catch (AplanSerializeException e) {
            sink.onError(new AplanErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    private String render(AplValue value)
    {
        return switch (value.kind()) {
            case NUMBER -> renderNumber((AplNumber) value);
            case COMPLEX -> renderComplex((AplComplex) value);
            case TEXT -> renderText((AplText) value);
            case ZILDE -> ZILDE;
            case VECTOR -> renderVector((AplVector) value);
            case MATRIX -> renderMatrix((AplMatrix) value);
            case NAMESPACE -> renderNamespace((AplNamespace) value);
        };
    }

    // ========================================================================
    // Scalars
    // ========================================================================

    private static String renderNumber(AplNumber number)
    {
        if (!number.isFinite()) {
            throw new AplanSerializeException(
                    "Cannot serialize non-finite number: " + number.value(), AplValue.Kind.NUMBER);
        }
        return AplanNumberFormat.format(number.value());
    }

    private static String renderComplex(AplComplex complex)
    {
        if (!complex.isFinite()) {
            throw new AplanSerializeException(
                    "Cannot serialize non-finite complex number: " + complex.re() + "J" + complex.im(),
                    AplValue.Kind.COMPLEX);
        }
        return AplanNumberFormat.formatComplex(complex.re(), complex.im());
    }

    private static String renderText(AplText text)
    {
        final String quote = String.valueOf(AplanGlyphs.QUOTE);
        return quote + text.value().replace(quote, quote + quote) + quote;
    }

    // ========================================================================
    // Arrays
    // ========================================================================

    private String renderVector(AplVector vector)
    {
        if (vector.isEmpty()) {
            return ZILDE;
        }

        // A lone number written as a strand would read back as a scalar.
        if (vector.size() > 1 && allNumbers(vector.elements())) {
            return strand(vector.elements());
        }

        final List<String> items = new ArrayList<>(vector.size());
        for (AplValue element : vector.elements()) {
            items.add(render(element));
        }
        return wrap("(", ")", items, true);
    }

    private String renderMatrix(AplMatrix matrix)
    {
        if (matrix.rowCount() == 0) {
            return "[]";
        }

        final List<String> rows = new ArrayList<>(matrix.rowCount());
        for (int i = 0; i < matrix.rowCount(); i++) {
            rows.add(renderMajorCell(matrix, i));
        }
        return wrap("[", "]", rows, false);
    }

    /**
     * Renders one major cell so that the decoder rebuilds the same row.
     */
    private String renderMajorCell(AplMatrix matrix, int index)
    {
        final List<AplValue> cells = matrix.row(index);

        if (matrix.rank() > 2) {
            List<Integer> cellShape = matrix.shape().subList(1, matrix.rank());
            return renderMatrix(new AplMatrix(cellShape, cells));
        }
        // Numbers, complex numbers and strings re-read as a strand.
        if (allScalars(cells)) {
            return strand(cells);
        }
        if (cells.size() == 1) {
            return render(cells.get(0));
        }
        return renderVector(new AplVector(cells));
    }

    private String renderNamespace(AplNamespace namespace)
    {
        if (namespace.isEmpty()) {
            return "()";
        }

        final List<String> items = new ArrayList<>(namespace.size());
        for (Map.Entry<String, AplValue> entry : namespace.entries().entrySet()) {
            items.add(entry.getKey() + ": " + render(entry.getValue()));
        }
        return wrap("(", ")", items, false);
    }

    // ========================================================================
    // Layout
    // ========================================================================

    /**
     * Joins rendered elements inside a pair of delimiters.
     *
     * @param markSingleton append a trailing separator to a one-element list
     *        written on one line, so that {@code (x ⋄)} is not read back as a
     *        grouping of {@code x}
     */
    private String wrap(String open, String close, List<String> items, boolean markSingleton)
    {
        final boolean inline = config.useSeparatorGlyph() || items.stream().anyMatch(i -> i.indexOf('\n') >= 0);

        final StringBuilder out = new StringBuilder(open);
        if (inline) {
            out.append(String.join(GLYPH_SEPARATOR, items));
            if (markSingleton && items.size() == 1) {
                out.append(' ').append(AplanGlyphs.DIAMOND);
            }
        }
        else {
            out.append('\n');
            for (String item : items) {
                out.append(indent).append(item).append('\n');
            }
        }
        return out.append(close).toString();
    }

    private String strand(List<AplValue> scalars)
    {
        final StringBuilder out = new StringBuilder();
        for (AplValue scalar : scalars) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(render(scalar));
        }
        return out.toString();
    }

    private static boolean allNumbers(List<AplValue> values)
    {
        for (AplValue value : values) {
            if (!(value instanceof AplNumber)) {
                return false;
            }
        }
        return true;
    }

    private static boolean allScalars(List<AplValue> values)
    {
        for (AplValue value : values) {
            if (!value.isScalar()) {
                return false;
            }
        }
        return true;
    }
}
