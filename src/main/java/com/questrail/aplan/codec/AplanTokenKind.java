package com.questrail.aplan.codec;

/**
 * Lexical categories of Array Notation.
 *
 * <p>Whitespace never produces a token. A run of separators (diamonds, line
 * breaks and the blanks between them) produces exactly one {@link #SEPARATOR}.</p>
 */
public enum AplanTokenKind
{
    NUMBER,
    STRING,
    ZILDE,
    NAME,
    COLON,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    SEPARATOR,
    END_OF_INPUT
}
