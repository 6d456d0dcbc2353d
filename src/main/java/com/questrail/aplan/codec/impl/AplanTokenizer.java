package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanLexException;
import com.questrail.aplan.codec.AplanTokenKind;
import com.questrail.aplan.model.AplComplex;
import com.questrail.aplan.model.AplNames;
import com.questrail.aplan.model.AplNumber;
import com.questrail.aplan.model.AplText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AplanTokenizer
 * -----------------------------------------------------------------------------
 * Converts Array Notation source text into a flat token stream.
 *
 * <p>Lexical rules:</p>
 * <ul>
 *   <li>Spaces and tabs between tokens are dropped.</li>
 *   <li>A run of diamonds and line breaks (LF, CR, NEL), with any blanks
 *       between them, becomes a single {@code SEPARATOR}.</li>
 *   <li>Numbers: optional {@code ¯}, digits, optional {@code .digits},
 *       optional exponent {@code E}/{@code e} with optional sign
 *       ({@code ¯ - +}) and digits, optional complex suffix {@code J}/{@code j}
 *       followed by a second number of the same form, whose integer digits
 *       may be omitted ({@code 1J.5}). A literal too large for a double is
 *       malformed.</li>
 *   <li>Strings are single-quoted; {@code ''} inside a string is one quote.</li>
 *   <li>{@code ⍬} is its own token.</li>
 *   <li>Names follow {@link AplNames}.</li>
 * </ul>
 *
 * <p>The returned list always ends with exactly one {@code END_OF_INPUT}.</p>
 */
public final class AplanTokenizer
{
    private final String source;
    private final List<AplanToken> tokens = new ArrayList<>();
    private int pos;

    private AplanTokenizer(String source)
    {
        this.source = source;
    }

    /**
     * Tokenize a complete source string.
     *
     * @throws AplanLexException on an unrecognized character, an unterminated
     *         string, or a malformed number
     */
    public static List<AplanToken> tokenize(String source)
    {
        Objects.requireNonNull(source, "source");
        return new AplanTokenizer(source).run();
    }

    private List<AplanToken> run()
    {
        while (!atEnd()) {
            skipBlanks();
            if (atEnd()) {
                break;
            }

            final int start = pos;
            final char ch = peek();

            if (AplanGlyphs.isSeparator(ch)) {
                pos++;
                while (!atEnd() && (AplanGlyphs.isSeparator(peek()) || AplanGlyphs.isBlank(peek()))) {
                    pos++;
                }
                tokens.add(AplanToken.of(AplanTokenKind.SEPARATOR, start));
            }
            else if (ch == AplanGlyphs.QUOTE) {
                tokens.add(readString());
            }
            else if (AplanGlyphs.isDigit(ch)
                    || (ch == AplanGlyphs.HIGH_MINUS && AplanGlyphs.isDigit(peek(1)))) {
                tokens.add(readNumber());
            }
            else if (ch == AplanGlyphs.ZILDE) {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.ZILDE, start));
            }
            else if (ch == '(') {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.LPAREN, start));
            }
            else if (ch == ')') {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.RPAREN, start));
            }
            else if (ch == '[') {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.LBRACKET, start));
            }
            else if (ch == ']') {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.RBRACKET, start));
            }
            else if (ch == ':') {
                pos++;
                tokens.add(AplanToken.of(AplanTokenKind.COLON, start));
            }
            else if (AplNames.isNameStart(ch)) {
                tokens.add(readName());
            }
            else {
                final int codePoint = source.codePointAt(pos);
                throw new AplanLexException(
                        String.format("Unexpected character '%s' (U+%04X) at offset %d",
                                new String(Character.toChars(codePoint)), codePoint, pos),
                        pos,
                        codePoint);
            }
        }

        tokens.add(AplanToken.of(AplanTokenKind.END_OF_INPUT, source.length()));
        return Collections.unmodifiableList(tokens);
    }

    // ========================================================================
    // Literals
    // ========================================================================

    private AplanToken readString()
    {
        final int start = pos;
        pos++; // opening quote

        StringBuilder value = new StringBuilder();
        while (!atEnd()) {
            char ch = source.charAt(pos++);
            if (ch != AplanGlyphs.QUOTE) {
                value.append(ch);
                continue;
            }
            if (!atEnd() && peek() == AplanGlyphs.QUOTE) {
                value.append(AplanGlyphs.QUOTE);
                pos++;
                continue;
            }
            return AplanToken.literal(AplanTokenKind.STRING, new AplText(value.toString()), start);
        }
        throw new AplanLexException("Unterminated string starting at offset " + start, start);
    }

    private AplanToken readNumber()
    {
        final int start = pos;
        final double re = parseDecimal(readDecimal(start, false), start);

        if (!atEnd() && (peek() == 'J' || peek() == 'j')) {
            pos++;
            final double im = parseDecimal(readDecimal(start, true), start);
            return AplanToken.literal(AplanTokenKind.NUMBER, new AplComplex(re, im), start);
        }
        return AplanToken.literal(AplanTokenKind.NUMBER, new AplNumber(re), start);
    }

    /**
     * Reads one signed decimal with optional fraction and exponent and returns
     * it in the form accepted by {@link Double#parseDouble(String)}.
     *
     * @param bareFraction accept {@code .digits} with no integer digits
     */
    private String readDecimal(int numberStart, boolean bareFraction)
    {
        StringBuilder text = new StringBuilder();

        if (!atEnd() && peek() == AplanGlyphs.HIGH_MINUS) {
            text.append('-');
            pos++;
        }

        final boolean integerDigits = readDigits(text);
        if (!integerDigits && !(bareFraction && peek(0) == '.' && AplanGlyphs.isDigit(peek(1)))) {
            throw malformedNumber(numberStart);
        }

        if (!atEnd() && peek() == '.' && AplanGlyphs.isDigit(peek(1))) {
            text.append('.');
            pos++;
            readDigits(text);
        }

        if (!atEnd() && (peek() == 'E' || peek() == 'e')) {
            text.append('e');
            pos++;
            if (!atEnd() && (peek() == AplanGlyphs.HIGH_MINUS || peek() == '-')) {
                text.append('-');
                pos++;
            }
            else if (!atEnd() && peek() == '+') {
                pos++;
            }
            if (!readDigits(text)) {
                throw malformedNumber(numberStart);
            }
        }

        return text.toString();
    }

    private boolean readDigits(StringBuilder text)
    {
        final int before = pos;
        while (!atEnd() && AplanGlyphs.isDigit(peek())) {
            text.append(source.charAt(pos++));
        }
        return pos > before;
    }

    private static double parseDecimal(String text, int numberStart)
    {
        final double value;
        try {
            value = Double.parseDouble(text);
        }
        catch (NumberFormatException e) {
            throw new AplanLexException("Malformed number at offset " + numberStart, numberStart, e);
        }
        if (!Double.isFinite(value)) {
            throw new AplanLexException(
                    "Malformed number at offset " + numberStart + ": magnitude exceeds the double range",
                    numberStart);
        }
        return value;
    }

    private AplanLexException malformedNumber(int numberStart)
    {
        return new AplanLexException(
                "Malformed number at offset " + numberStart
                        + ": '" + source.substring(numberStart, Math.min(pos + 1, source.length())) + "'",
                numberStart);
    }

    private AplanToken readName()
    {
        final int start = pos;
        while (!atEnd() && AplNames.isNamePart(peek())) {
            pos++;
        }
        return AplanToken.name(source.substring(start, pos), start);
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    private void skipBlanks()
    {
        while (!atEnd() && AplanGlyphs.isBlank(peek())) {
            pos++;
        }
    }

    private boolean atEnd()
    {
        return pos >= source.length();
    }

    private char peek()
    {
        return source.charAt(pos);
    }

    private char peek(int ahead)
    {
        int index = pos + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }
}
