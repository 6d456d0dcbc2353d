package com.questrail.aplan.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, heterogeneous vector.
 *
 * <p>
 * The element list is copied on construction and is unmodifiable. A vector with
 * no elements is structurally equal to {@link AplZilde} but is a different
 * variant.
 * </p>
 */
public record AplVector(List<AplValue> elements) implements AplValue
{
    public AplVector {
        Objects.requireNonNull(elements, "elements");
        elements = List.copyOf(elements);
    }

    public static AplVector of(AplValue... elements) {
        return new AplVector(List.of(elements));
    }

    /**
     * Builds a vector of real scalars.
     */
    public static AplVector ofNumbers(double... values) {
        AplValue[] numbers = new AplValue[values.length];
        for (int i = 0; i < values.length; i++) {
            numbers[i] = new AplNumber(values[i]);
        }
        return new AplVector(List.of(numbers));
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public AplValue get(int index) {
        return elements.get(index);
    }

    @Override
    public Kind kind() {
        return Kind.VECTOR;
    }
}
