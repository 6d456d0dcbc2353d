package com.questrail.aplan.model;

/**
 * The canonical empty numeric vector, written {@code ⍬}.
 *
 * <p>
 * Zilde is structurally equal to any {@link AplVector} with no elements, but it
 * is a separate variant so that it always serializes back to the zilde glyph.
 * </p>
 */
public enum AplZilde implements AplValue
{
    INSTANCE;

    @Override
    public Kind kind() {
        return Kind.ZILDE;
    }

    @Override
    public String toString() {
        return "AplZilde";
    }
}
