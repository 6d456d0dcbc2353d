package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanLexException;
import com.questrail.aplan.codec.AplanTokenKind;
import com.questrail.aplan.model.AplComplex;
import com.questrail.aplan.model.AplNumber;
import com.questrail.aplan.model.AplText;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.questrail.aplan.codec.AplanTokenKind.*;
import static org.junit.jupiter.api.Assertions.*;

final class AplanTokenizerTest
{
    private static List<AplanTokenKind> kinds(String source)
    {
        return AplanTokenizer.tokenize(source).stream()
                .map(AplanToken::kind)
                .collect(Collectors.toList());
    }

    private static double number(String source)
    {
        AplanToken token = AplanTokenizer.tokenize(source).get(0);
        assertEquals(NUMBER, token.kind());
        return ((AplNumber) token.literal()).value();
    }

    // ---------------------------------------------------------------------
    // Structure
    // ---------------------------------------------------------------------

    @Test
    void emptySourceYieldsOnlyEndOfInput()
    {
        assertEquals(List.of(END_OF_INPUT), kinds(""));
        assertEquals(List.of(END_OF_INPUT), kinds("  \t "));
    }

    @Test
    void punctuationTokens()
    {
        assertEquals(
                List.of(LPAREN, NAME, COLON, NUMBER, RPAREN, LBRACKET, RBRACKET, ZILDE, END_OF_INPUT),
                kinds("(x:1)[]⍬"));
    }

    @Test
    void blanksProduceNoTokens()
    {
        assertEquals(List.of(NUMBER, NUMBER, NUMBER, END_OF_INPUT), kinds("  1 \t2   3 "));
    }

    /**
     * Diamonds, LF, CR and NEL with blanks between them collapse to one token.
     */
    @Test
    void separatorRunCollapsesToOneToken()
    {
        assertEquals(List.of(NUMBER, SEPARATOR, NUMBER, END_OF_INPUT), kinds("1 ⋄ \n\r\n ⋄\u0085 2"));
        assertEquals(List.of(LPAREN, SEPARATOR, NUMBER, SEPARATOR, RPAREN, END_OF_INPUT), kinds("(⋄⋄1\n\n)"));
    }

    @Test
    void tokensRecordSourceOffsets()
    {
        List<AplanToken> tokens = AplanTokenizer.tokenize("( 'ab' ⋄ x");
        assertEquals(0, tokens.get(0).offset());
        assertEquals(2, tokens.get(1).offset());
        assertEquals(7, tokens.get(2).offset());
        assertEquals(9, tokens.get(3).offset());
        assertEquals(10, tokens.get(4).offset());
    }

    // ---------------------------------------------------------------------
    // Numbers
    // ---------------------------------------------------------------------

    @Test
    void integersAndDecimals()
    {
        assertEquals(42, number("42"));
        assertEquals(0, number("0"));
        assertEquals(3.14, number("3.14"));
    }

    @Test
    void highMinusIsNegativeSign()
    {
        assertEquals(-5, number("¯5"));
        assertEquals(-2.5, number("¯2.5"));
    }

    @Test
    void exponents()
    {
        assertEquals(100000, number("1E5"));
        assertEquals(0.0025, number("2.5E¯3"));
        assertEquals(0.0025, number("2.5e-3"));
        assertEquals(1e10, number("1E+10"));
        assertEquals(-2500, number("¯2.5E3"));
    }

    @Test
    void complexLiterals()
    {
        assertEquals(new AplComplex(3, 4), AplanTokenizer.tokenize("3J4").get(0).literal());
        assertEquals(new AplComplex(-2, -3), AplanTokenizer.tokenize("¯2J¯3").get(0).literal());
        assertEquals(new AplComplex(100, 30), AplanTokenizer.tokenize("1E2j3E1").get(0).literal());
        assertEquals(new AplComplex(1.5, 2.5), AplanTokenizer.tokenize("1.5J2.5").get(0).literal());
    }

    @Test
    void imaginaryPartMayOmitIntegerDigits()
    {
        assertEquals(new AplComplex(1, 0.5), AplanTokenizer.tokenize("1J.5").get(0).literal());
        assertEquals(new AplComplex(1, -0.25), AplanTokenizer.tokenize("1J¯.25").get(0).literal());
        assertEquals(new AplComplex(2, 50), AplanTokenizer.tokenize("2j.5E2").get(0).literal());
    }

    @Test
    void realPartStillNeedsIntegerDigits()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize(".5"));
        assertEquals('.', e.codePoint());
        assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1J."));
    }

    @Test
    void literalBeyondDoubleRangeIsMalformed()
    {
        AplanLexException real = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1 1E400"));
        assertEquals(2, real.offset());

        AplanLexException imaginary = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1J1E400"));
        assertEquals(0, imaginary.offset());

        assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("¯1E400"));
    }

    @Test
    void underflowReadsAsZero()
    {
        assertEquals(0, number("1E¯400"));
    }

    @Test
    void highMinusWithoutDigitIsNotANumber()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("¯ 1"));
        assertEquals(0, e.offset());
        assertEquals('¯', e.codePoint());
    }

    @Test
    void exponentWithoutDigitsIsMalformed()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1 2E"));
        assertEquals(2, e.offset());
    }

    @Test
    void complexSuffixWithoutDigitsIsMalformed()
    {
        assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("3J"));
    }

    /**
     * A dot not followed by a digit is not part of the number.
     */
    @Test
    void trailingDotIsNotConsumed()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("3."));
        assertEquals(1, e.offset());
        assertEquals('.', e.codePoint());
    }

    // ---------------------------------------------------------------------
    // Strings
    // ---------------------------------------------------------------------

    @Test
    void doubledQuoteDecodesToOneQuote()
    {
        AplanToken token = AplanTokenizer.tokenize("'it''s'").get(0);
        assertEquals(STRING, token.kind());
        assertEquals(new AplText("it's"), token.literal());
    }

    @Test
    void stringsMayContainSeparatorsAndGlyphs()
    {
        AplanToken token = AplanTokenizer.tokenize("'a⋄b\nc⍬'").get(0);
        assertEquals(new AplText("a⋄b\nc⍬"), token.literal());
        assertEquals(2, AplanTokenizer.tokenize("'a⋄b\nc⍬'").size());
    }

    @Test
    void emptyAndQuoteOnlyStrings()
    {
        assertEquals(new AplText(""), AplanTokenizer.tokenize("''").get(0).literal());
        assertEquals(new AplText("'"), AplanTokenizer.tokenize("''''").get(0).literal());
    }

    @Test
    void unterminatedStringReportsOpeningQuote()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1 'abc"));
        assertEquals(2, e.offset());
        assertTrue(e.getMessage().contains("Unterminated"));
    }

    // ---------------------------------------------------------------------
    // Names
    // ---------------------------------------------------------------------

    @Test
    void namesIncludeAplAndLatinCharacters()
    {
        List<AplanToken> tokens = AplanTokenizer.tokenize("∆x1 ⍙ab _z Ⓐb café");
        assertEquals("∆x1", tokens.get(0).text());
        assertEquals("⍙ab", tokens.get(1).text());
        assertEquals("_z", tokens.get(2).text());
        assertEquals("Ⓐb", tokens.get(3).text());
        assertEquals("café", tokens.get(4).text());
    }

    @Test
    void nameStopsAtColon()
    {
        assertEquals(List.of(NAME, COLON, NUMBER, END_OF_INPUT), kinds("abc:5"));
    }

    // ---------------------------------------------------------------------
    // Error Handling
    // ---------------------------------------------------------------------

    @Test
    void unknownCharacterCarriesCodePointAndOffset()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("1 + 2"));
        assertEquals('+', e.codePoint());
        assertEquals(2, e.offset());
        assertTrue(e.getMessage().contains("U+002B"));
    }

    @Test
    void supplementaryCharacterIsReportedWhole()
    {
        AplanLexException e = assertThrows(AplanLexException.class, () -> AplanTokenizer.tokenize("😀"));
        assertEquals(0x1F600, e.codePoint());
    }
}
