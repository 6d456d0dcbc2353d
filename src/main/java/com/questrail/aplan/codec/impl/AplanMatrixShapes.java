package com.questrail.aplan.codec.impl;

import com.questrail.aplan.model.AplMatrix;
import com.questrail.aplan.model.AplNumber;
import com.questrail.aplan.model.AplValue;
import com.questrail.aplan.model.AplVector;

import java.util.ArrayList;
import java.util.List;

/**
 * AplanMatrixShapes
 * -----------------------------------------------------------------------------
 * Builds a matrix from the major cells of a bracketed literal.
 *
 * <p>Each row written between {@code [} and {@code ]} may have a different
 * shape. Rows are unified as follows:</p>
 * <ol>
 *   <li>Row shape: scalar and namespace {@code []}, vector {@code [n]},
 *       zilde {@code [0]}, matrix its own shape.</li>
 *   <li>{@code maxRank = max(1, rank of every row)}; a scalar row is a
 *       one-element vector.</li>
 *   <li>Axis {@code i} of the unified cell shape is the largest extent of any
 *       row on that axis, where a missing or zero extent counts as 1.</li>
 *   <li>Every row is flattened and right-padded with numeric zero to the
 *       unified cell size. Non-numeric rows are padded with numeric zero too.</li>
 * </ol>
 *
 * <p>The result has shape {@code [rowCount, ...unifiedCellShape]}.</p>
 */
final class AplanMatrixShapes
{
    private AplanMatrixShapes() {}

    static AplMatrix rowsToMatrix(List<AplValue> rows)
    {
        if (rows.isEmpty()) {
            return AplMatrix.empty();
        }

        List<List<Integer>> rowShapes = new ArrayList<>(rows.size());
        int maxRank = 1;
        for (AplValue row : rows) {
            List<Integer> shape = shapeOf(row);
            rowShapes.add(shape);
            maxRank = Math.max(maxRank, shape.size());
        }

        List<Integer> cellShape = new ArrayList<>(maxRank + 1);
        int cellSize = 1;
        for (int axis = 0; axis < maxRank; axis++) {
            int extent = 1;
            for (List<Integer> shape : rowShapes) {
                extent = Math.max(extent, extentOn(shape, axis));
            }
            cellShape.add(extent);
            cellSize = Math.multiplyExact(cellSize, extent);
        }

        List<AplValue> cells = new ArrayList<>(Math.multiplyExact(cellSize, rows.size()));
        for (AplValue row : rows) {
            List<AplValue> flat = new ArrayList<>();
            flatten(row, flat);

            // Nested vector rows can flatten past the unified size; keep the
            // leading cells so that the shape invariant holds.
            if (flat.size() > cellSize) {
                flat = flat.subList(0, cellSize);
            }
            cells.addAll(flat);
            for (int i = flat.size(); i < cellSize; i++) {
                cells.add(AplNumber.ZERO);
            }
        }

        List<Integer> shape = new ArrayList<>(maxRank + 1);
        shape.add(rows.size());
        shape.addAll(cellShape);
        return new AplMatrix(shape, cells);
    }

    /**
     * Shape of a value as seen by row unification.
     */
    static List<Integer> shapeOf(AplValue value)
    {
        return switch (value.kind()) {
            case NUMBER, COMPLEX, TEXT, NAMESPACE -> List.of();
            case ZILDE -> List.of(0);
            case VECTOR -> List.of(((AplVector) value).size());
            case MATRIX -> ((AplMatrix) value).shape();
        };
    }

    /**
     * Appends the scalar contents of {@code value} to {@code out} in row-major
     * order. Vectors are flattened recursively; matrices contribute their
     * cells; every other value contributes itself.
     */
    static void flatten(AplValue value, List<AplValue> out)
    {
        switch (value.kind()) {
            case VECTOR -> {
                for (AplValue element : ((AplVector) value).elements()) {
                    flatten(element, out);
                }
            }
            case MATRIX -> out.addAll(((AplMatrix) value).cells());
            case ZILDE -> {
                // contributes nothing
            }
            default -> out.add(value);
        }
    }

    private static int extentOn(List<Integer> shape, int axis)
    {
        if (axis >= shape.size()) {
            return 1;
        }
        int extent = shape.get(axis);
        return extent == 0 ? 1 : extent;
    }
}
