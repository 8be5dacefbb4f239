/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.geophysics.ubc.grid;

import com.hellblazer.geophysics.geometry.CellCounts;

/**
 * The permutation between the storage order of UBC model files and the cell order of the grid.
 * <p>
 * A model file of {@code (n1, n2, n3)} cells is read as an array of that shape, last index fastest. The grid order is
 * obtained by swapping axes 0 and 1, then axes 0 and 2, and flattening:
 * <pre>
 *   grid[(k * n1 + i) * n2 + j] = file[(i * n2 + j) * n3 + k]
 * </pre>
 * The reordered array has the shape {@code (n3, n1, n2)}, see {@link #gridShape(CellCounts)}. Both sides have the
 * same length, so a wrong permutation never fails; it silently moves every value into another cell.
 *
 * @author hal.hildebrand
 */
public final class CellOrdering {

    private CellOrdering() {
    }

    /**
     * Flat file index of cell {@code (i, j, k)}.
     */
    public static int fileIndex(CellCounts cells, int i, int j, int k) {
        return (i * cells.n2 + j) * cells.n3 + k;
    }

    /**
     * Flat grid index of cell {@code (i, j, k)}.
     */
    public static int gridIndex(CellCounts cells, int i, int j, int k) {
        return (k * cells.n1 + i) * cells.n2 + j;
    }

    /**
     * Shape of the reordered array, {@code (n3, n1, n2)}.
     */
    public static CellCounts gridShape(CellCounts cells) {
        return new CellCounts(cells.n3, cells.n1, cells.n2);
    }

    /**
     * @return {@code p} with {@code p[fileIndex] = gridIndex} for every cell
     */
    public static int[] permutation(CellCounts cells) {
        var permutation = new int[Math.toIntExact(cells.total())];
        for (int i = 0; i < cells.n1; i++) {
            for (int j = 0; j < cells.n2; j++) {
                for (int k = 0; k < cells.n3; k++) {
                    permutation[fileIndex(cells, i, j, k)] = gridIndex(cells, i, j, k);
                }
            }
        }
        return permutation;
    }

    /**
     * Reorder values from file order to grid order.
     *
     * @throws IllegalArgumentException if the length of {@code fileOrder} is not the number of cells
     */
    public static double[] toGridOrder(CellCounts cells, double[] fileOrder) {
        checkLength(cells, fileOrder);
        var gridOrder = new double[fileOrder.length];
        for (int i = 0; i < cells.n1; i++) {
            for (int j = 0; j < cells.n2; j++) {
                for (int k = 0; k < cells.n3; k++) {
                    gridOrder[gridIndex(cells, i, j, k)] = fileOrder[fileIndex(cells, i, j, k)];
                }
            }
        }
        return gridOrder;
    }

    /**
     * Inverse of {@link #toGridOrder(CellCounts, double[])}.
     *
     * @throws IllegalArgumentException if the length of {@code gridOrder} is not the number of cells
     */
    public static double[] toFileOrder(CellCounts cells, double[] gridOrder) {
        checkLength(cells, gridOrder);
        var fileOrder = new double[gridOrder.length];
        for (int i = 0; i < cells.n1; i++) {
            for (int j = 0; j < cells.n2; j++) {
                for (int k = 0; k < cells.n3; k++) {
                    fileOrder[fileIndex(cells, i, j, k)] = gridOrder[gridIndex(cells, i, j, k)];
                }
            }
        }
        return fileOrder;
    }

    private static void checkLength(CellCounts cells, double[] values) {
        if (values.length != cells.total()) {
            throw new IllegalArgumentException(
            String.format("%d values for %s = %d cells", values.length, cells, cells.total()));
        }
    }
}
