package com.questrail.aplan.model;

import java.util.Objects;

/**
 * Character vector.
 *
 * <p>
 * Array Notation does not distinguish a single character from a string of
 * length one, so both are represented by this type.
 * </p>
 */
public record AplText(String value) implements AplValue
{
    public AplText {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }
}
