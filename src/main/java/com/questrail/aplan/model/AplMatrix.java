package com.questrail.aplan.model;

import java.util.List;
import java.util.Objects;

/**
 * Rectangular array of rank one or more, cells stored in row-major order.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code shape} is non-empty; its size is the rank</li>
 *   <li>every dimension is {@code >= 0}</li>
 *   <li>{@code cells.size()} equals the product of {@code shape}</li>
 * </ul>
 *
 * <p>
 * The rank-1 shape {@code [0]} is the bracketed empty literal {@code []}, an
 * explicitly empty matrix that is not a vector.
 * </p>
 */
public record AplMatrix(List<Integer> shape, List<AplValue> cells) implements AplValue
{
    private static final AplMatrix EMPTY = new AplMatrix(List.of(0), List.of());

    public AplMatrix {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(cells, "cells");
        shape = List.copyOf(shape);
        cells = List.copyOf(cells);

        if (shape.isEmpty()) {
            throw new IllegalArgumentException("Matrix shape must have rank >= 1");
        }

        int expected = 1;
        for (int dimension : shape) {
            if (dimension < 0) {
                throw new IllegalArgumentException(
                        "Matrix dimensions must be >= 0 (shape was " + shape + ")");
            }
            expected = Math.multiplyExact(expected, dimension);
        }

        if (cells.size() != expected) {
            throw new IllegalArgumentException(
                    "Matrix of shape " + shape + " requires " + expected
                            + " cells (was " + cells.size() + ")");
        }
    }

    /**
     * Returns the explicitly empty matrix {@code []}, shape {@code [0]}.
     */
    public static AplMatrix empty() {
        return EMPTY;
    }

    public int rank() {
        return shape.size();
    }

    /**
     * Number of major cells (the extent of the first axis).
     */
    public int rowCount() {
        return shape.get(0);
    }

    /**
     * Number of cells in one major cell: the product of all axes but the first.
     */
    public int rowSize() {
        int size = 1;
        for (int i = 1; i < shape.size(); i++) {
            size *= shape.get(i);
        }
        return size;
    }

    /**
     * Returns the cells of major cell {@code index} as a contiguous slice.
     */
    public List<AplValue> row(int index) {
        Objects.checkIndex(index, rowCount());
        int size = rowSize();
        return cells.subList(index * size, (index + 1) * size);
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    @Override
    public Kind kind() {
        return Kind.MATRIX;
    }
}
