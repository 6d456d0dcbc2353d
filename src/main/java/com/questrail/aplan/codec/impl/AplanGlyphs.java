package com.questrail.aplan.codec.impl;

/**
 * AplanGlyphs
 * -----------------------------------------------------------------------------
 * Characters with lexical meaning in Array Notation.
 *
 * <p>Shared by the tokenizer (which recognizes them) and the encoder (which
 * emits them), so both directions agree on a single definition.</p>
 */
final class AplanGlyphs
{
    /** High minus: the sign of a negative literal, distinct from subtraction. */
    static final char HIGH_MINUS = '¯';

    /** Diamond: explicit element separator. */
    static final char DIAMOND = '⋄';

    /** Zilde: the empty numeric vector. */
    static final char ZILDE = '⍬';

    /** Next line (U+0085), accepted as a line break. */
    static final char NEL = '\u0085';

    static final char QUOTE = '\'';

    /** Complex-number infix marker as written by the encoder. */
    static final char COMPLEX_MARKER = 'J';

    /** Exponent marker as written by the encoder. */
    static final char EXPONENT_MARKER = 'E';

    private AplanGlyphs() {}

    /**
     * Returns true for characters that end an element: diamond, LF, CR, NEL.
     */
    static boolean isSeparator(char ch)
    {
        return ch == DIAMOND || ch == '\n' || ch == '\r' || ch == NEL;
    }

    /**
     * Returns true for insignificant blanks between tokens.
     */
    static boolean isBlank(char ch)
    {
        return ch == ' ' || ch == '\t';
    }

    static boolean isDigit(char ch)
    {
        return ch >= '0' && ch <= '9';
    }
}
