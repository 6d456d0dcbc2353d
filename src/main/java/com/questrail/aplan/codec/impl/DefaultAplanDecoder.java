package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanDecoder;
import com.questrail.aplan.codec.AplanException;
import com.questrail.aplan.codec.AplanParseException;
import com.questrail.aplan.codec.AplanTokenKind;
import com.questrail.aplan.config.AplanDecoderConfig;
import com.questrail.aplan.model.AplMatrix;
import com.questrail.aplan.model.AplNamespace;
import com.questrail.aplan.model.AplValue;
import com.questrail.aplan.model.AplVector;
import com.questrail.aplan.model.AplZilde;
import com.questrail.aplan.observability.AplanDecodeEvent;
import com.questrail.aplan.observability.AplanErrorEvent;
import com.questrail.aplan.observability.AplanObservabilitySink;
import com.questrail.aplan.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultAplanDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AplanDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Tokenizing ({@link AplanTokenizer})</li>
 *   <li>Recursive-descent parsing, one method per construct</li>
 *   <li>Matrix row unification ({@link AplanMatrixShapes})</li>
 * </ol>
 *
 * <p><strong>Disambiguation rules</strong>:</p>
 * <ul>
 *   <li>Adjacent numbers and strings form a strand: one token is a scalar,
 *       more are a vector.</li>
 *   <li>{@code ()} is an empty namespace.</li>
 *   <li>{@code (} followed by {@code name :} starts a namespace.</li>
 *   <li>Any other {@code ( ... )} is a vector, unless it holds exactly one value
 *       and no separator at all, in which case the parentheses only group:
 *       {@code (42)} is {@code 42} while {@code (42 ⋄)} and {@code (⋄ 42)}
 *       are one-element vectors.</li>
 *   <li>{@code [ ... ]} is always a matrix; {@code []} has shape {@code [0]}.</li>
 * </ul>
 *
 * <p>Separators before the top-level value and after it are ignored. Any other
 * token after the top-level value is an error.</p>
 *
 * <p>Instances are immutable and may be shared between threads if the
 * configured sink can be.</p>
 */
public final class DefaultAplanDecoder implements AplanDecoder
{
    private final AplanDecoderConfig config;
    private final AplanObservabilitySink sink;

    public DefaultAplanDecoder()
    {
        this(AplanDecoderConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultAplanDecoder(AplanDecoderConfig config)
    {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public DefaultAplanDecoder(AplanDecoderConfig config, AplanObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public AplValue decode(String source)
    {
        Objects.requireNonNull(source, "source");

        try {
            final List<AplanToken> tokens = AplanTokenizer.tokenize(source);
            final AplValue value = new Parser(tokens, config.maxNestingDepth()).parseDocument();

            sink.onDecoded(new AplanDecodeEvent(Instant.now(), source.length(), tokens.size(), value.kind()));
            return value;
        }
        catch (AplanException e) {
            sink.onError(new AplanErrorEvent(Instant.now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Single-use cursor over one token stream.
     */
    private static final class Parser
    {
        private final List<AplanToken> tokens;
        private final int maxDepth;
        private int pos;
        private int depth;

        Parser(List<AplanToken> tokens, int maxDepth)
        {
            this.tokens = tokens;
            this.maxDepth = maxDepth;
        }

        AplValue parseDocument()
        {
            final AplValue value = parseValue();
            skipSeparators();

            if (!check(AplanTokenKind.END_OF_INPUT)) {
                throw error("Unexpected token after value", AplanTokenKind.END_OF_INPUT);
            }
            return value;
        }

        // ====================================================================
        // Values
        // ====================================================================

        private AplValue parseValue()
        {
            skipSeparators();
            final AplanToken token = peek();

            return switch (token.kind()) {
                case NUMBER, STRING -> parseStrand();
                case ZILDE -> {
                    advance();
                    yield AplZilde.INSTANCE;
                }
                case LPAREN -> parseParenthesized();
                case LBRACKET -> parseBracketed();
                case NAME -> throw error(
                        "Unexpected name '" + token.text() + "' (names are only allowed as namespace keys)",
                        null);
                default -> throw error("Expected a value", null);
            };
        }

        /**
         * Adjacent numbers and strings: one is a scalar, several are a vector.
         */
        private AplValue parseStrand()
        {
            final List<AplValue> items = new ArrayList<>();
            while (check(AplanTokenKind.NUMBER) || check(AplanTokenKind.STRING)) {
                items.add(advance().literal());
            }
            return items.size() == 1 ? items.get(0) : new AplVector(items);
        }

        private AplValue parseParenthesized()
        {
            enter(expect(AplanTokenKind.LPAREN, "Expected '('"));

            final boolean leadingSeparator = skipSeparators();
            final AplValue result;

            if (check(AplanTokenKind.RPAREN)) {
                advance();
                result = AplNamespace.empty();
            }
            else if (check(AplanTokenKind.NAME) && peekKind(1) == AplanTokenKind.COLON) {
                result = parseNamespace();
            }
            else {
                result = parseVector(leadingSeparator);
            }

            depth--;
            return result;
        }

        private AplNamespace parseNamespace()
        {
            final AplNamespace.Builder namespace = AplNamespace.builder();

            while (!check(AplanTokenKind.RPAREN) && !check(AplanTokenKind.END_OF_INPUT)) {
                skipSeparators();
                if (check(AplanTokenKind.RPAREN)) {
                    break;
                }

                final AplanToken name = expect(AplanTokenKind.NAME, "Expected name in namespace");
                expect(AplanTokenKind.COLON, "Expected ':' after name '" + name.text() + "'");
                final AplValue value = parseValue();

                // Duplicate names: last write wins.
                namespace.put(name.text(), value);

                skipSeparators();
            }

            expect(AplanTokenKind.RPAREN, "Expected ')' to close namespace");
            return namespace.build();
        }

        private AplValue parseVector(boolean leadingSeparator)
        {
            final List<AplValue> elements = new ArrayList<>();
            boolean separated = leadingSeparator;

            while (!check(AplanTokenKind.RPAREN) && !check(AplanTokenKind.END_OF_INPUT)) {
                elements.add(parseValue());
                if (skipSeparators()) {
                    separated = true;
                }
            }

            expect(AplanTokenKind.RPAREN, "Expected ')' to close vector");

            // No separator anywhere and a single value: the parentheses only group.
            if (!separated && elements.size() == 1) {
                return elements.get(0);
            }
            return new AplVector(elements);
        }

        private AplMatrix parseBracketed()
        {
            enter(expect(AplanTokenKind.LBRACKET, "Expected '['"));
            skipSeparators();

            if (check(AplanTokenKind.RBRACKET)) {
                advance();
                depth--;
                return AplMatrix.empty();
            }

            final List<AplValue> rows = new ArrayList<>();
            while (!check(AplanTokenKind.RBRACKET) && !check(AplanTokenKind.END_OF_INPUT)) {
                rows.add(parseValue());
                skipSeparators();
            }

            expect(AplanTokenKind.RBRACKET, "Expected ']' to close matrix");
            depth--;
            return AplanMatrixShapes.rowsToMatrix(rows);
        }

        // ====================================================================
        // Cursor
        // ====================================================================

        private void enter(AplanToken opener)
        {
            if (++depth > maxDepth) {
                throw new AplanParseException(
                        "Nesting depth exceeds limit of " + maxDepth + " at offset " + opener.offset(),
                        null,
                        opener.kind(),
                        opener.offset());
            }
        }

        /**
         * Consumes a run of separator tokens and reports whether there was one.
         */
        private boolean skipSeparators()
        {
            boolean any = false;
            while (check(AplanTokenKind.SEPARATOR)) {
                advance();
                any = true;
            }
            return any;
        }

        private AplanToken expect(AplanTokenKind kind, String message)
        {
            if (check(kind)) {
                return advance();
            }
            throw error(message, kind);
        }

        private AplanParseException error(String message, AplanTokenKind expected)
        {
            final AplanToken actual = peek();
            return new AplanParseException(
                    message + " (got " + actual.kind() + " at offset " + actual.offset() + ")",
                    expected,
                    actual.kind(),
                    actual.offset());
        }

        private boolean check(AplanTokenKind kind)
        {
            return peek().is(kind);
        }

        private AplanTokenKind peekKind(int ahead)
        {
            final int index = Math.min(pos + ahead, tokens.size() - 1);
            return tokens.get(index).kind();
        }

        private AplanToken peek()
        {
            return tokens.get(pos);
        }

        private AplanToken advance()
        {
            final AplanToken token = tokens.get(pos);
            if (!token.is(AplanTokenKind.END_OF_INPUT)) {
                pos++;
            }
            return token;
        }
    }
}
