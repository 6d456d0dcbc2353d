package com.questrail.aplan.model;

/**
 * Identifier rules for namespace keys.
 *
 * <p>
 * A name starts with an ASCII letter, {@code _}, {@code ∆}, {@code ⍙}, a
 * circled capital letter {@code Ⓐ}–{@code Ⓩ}, or a character in the Latin-1
 * range {@code À}–{@code ü}; it continues with any of those or an ASCII digit.
 * </p>
 */
public final class AplNames
{
    /** Delta, APL's underscore-equivalent name character. */
    public static final char DELTA = '∆';

    /** Delta underbar. */
    public static final char DELTA_UNDERBAR = '⍙';

    private static final char CIRCLED_A = 'Ⓐ';
    private static final char CIRCLED_Z = 'Ⓩ';
    private static final char LATIN_FIRST = 'À';
    private static final char LATIN_LAST = 'ü';

    private AplNames() {}

    public static boolean isNameStart(char ch) {
        return (ch >= 'A' && ch <= 'Z')
                || (ch >= 'a' && ch <= 'z')
                || ch == '_'
                || ch == DELTA
                || ch == DELTA_UNDERBAR
                || (ch >= CIRCLED_A && ch <= CIRCLED_Z)
                || (ch >= LATIN_FIRST && ch <= LATIN_LAST);
    }

    public static boolean isNamePart(char ch) {
        return isNameStart(ch) || (ch >= '0' && ch <= '9');
    }

    /**
     * Returns true if {@code name} is non-empty and every character obeys the
     * start/continuation rules.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || !isNameStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isNamePart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
