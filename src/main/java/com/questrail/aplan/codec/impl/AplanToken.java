package com.questrail.aplan.codec.impl;

import com.questrail.aplan.codec.AplanTokenKind;
import com.questrail.aplan.model.AplValue;

import java.util.Objects;

/**
 * AplanToken
 * -----------------------------------------------------------------------------
 * One lexical unit of Array Notation.
 *
 * <ul>
 *   <li>{@code NUMBER} tokens carry an {@code AplNumber} or {@code AplComplex}
 *       literal</li>
 *   <li>{@code STRING} tokens carry an {@code AplText} literal with quotes
 *       already decoded</li>
 *   <li>{@code NAME} tokens carry the identifier in {@code text}</li>
 * </ul>
 *
 * <p>{@code literal} and {@code text} are null for every other kind.
 * {@code offset} is the character index of the first character of the token.</p>
 */
public record AplanToken(AplanTokenKind kind, AplValue literal, String text, int offset)
{
    public AplanToken {
        Objects.requireNonNull(kind, "kind");
    }

    static AplanToken of(AplanTokenKind kind, int offset)
    {
        return new AplanToken(kind, null, null, offset);
    }

    static AplanToken literal(AplanTokenKind kind, AplValue literal, int offset)
    {
        return new AplanToken(kind, Objects.requireNonNull(literal, "literal"), null, offset);
    }

    static AplanToken name(String text, int offset)
    {
        return new AplanToken(AplanTokenKind.NAME, null, Objects.requireNonNull(text, "text"), offset);
    }

    public boolean is(AplanTokenKind candidate)
    {
        return kind == candidate;
    }
}
