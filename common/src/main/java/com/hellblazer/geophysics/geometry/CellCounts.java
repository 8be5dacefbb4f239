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

package com.hellblazer.geophysics.geometry;

import java.util.Objects;

/**
 * Immutable triple of per-axis counts for a structured grid. Depending on context the triple holds cell counts (a
 * mesh header, an extent) or node counts (the dimensions handed to a grid for allocation); {@link #nodes()} and
 * {@link #cells()} convert between the two.
 *
 * @author hal.hildebrand
 */
public final class CellCounts {

    /** Count along the first axis (Easting) */
    public final int n1;

    /** Count along the second axis (Northing) */
    public final int n2;

    /** Count along the third axis (Elevation) */
    public final int n3;

    /**
     * Create a new count triple.
     *
     * @param n1 count along axis 0
     * @param n2 count along axis 1
     * @param n3 count along axis 2
     * @throws IllegalArgumentException if any count is not positive
     */
    public CellCounts(int n1, int n2, int n3) {
        if (n1 <= 0 || n2 <= 0 || n3 <= 0) {
            throw new IllegalArgumentException(
            String.format("Counts must be positive: (%d, %d, %d)", n1, n2, n3));
        }
        this.n1 = n1;
        this.n2 = n2;
        this.n3 = n3;
    }

    /**
     * Create counts from an array [n1, n2, n3].
     *
     * @param array Array with at least 3 elements
     * @return counts from array
     * @throws IllegalArgumentException if array length < 3
     */
    public static CellCounts fromArray(int[] array) {
        if (array.length < 3) {
            throw new IllegalArgumentException("Array must have at least 3 elements");
        }
        return new CellCounts(array[0], array[1], array[2]);
    }

    /**
     * Count along the given axis.
     *
     * @param axis 0, 1 or 2
     */
    public int get(int axis) {
        return switch (axis) {
            case 0 -> n1;
            case 1 -> n2;
            case 2 -> n3;
            default -> throw new IndexOutOfBoundsException("Axis must be 0, 1 or 2: " + axis);
        };
    }

    /**
     * @return n1 * n2 * n3
     * @throws ArithmeticException if the product does not fit in a long
     */
    public long total() {
        return Math.multiplyExact(Math.multiplyFull(n1, n2), (long) n3);
    }

    /**
     * Node counts for cell counts: one more node than cells on every axis.
     */
    public CellCounts nodes() {
        return new CellCounts(n1 + 1, n2 + 1, n3 + 1);
    }

    /**
     * Cell counts for node counts. Every axis must carry at least two nodes.
     */
    public CellCounts cells() {
        return new CellCounts(n1 - 1, n2 - 1, n3 - 1);
    }

    /**
     * @return true if all three counts are equal
     */
    public boolean isCubic() {
        return n1 == n2 && n2 == n3;
    }

    public int[] toArray() {
        return new int[] { n1, n2, n3 };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CellCounts other)) return false;
        return n1 == other.n1 && n2 == other.n2 && n3 == other.n3;
    }

    @Override
    public int hashCode() {
        return Objects.hash(n1, n2, n3);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d)", n1, n2, n3);
    }
}
