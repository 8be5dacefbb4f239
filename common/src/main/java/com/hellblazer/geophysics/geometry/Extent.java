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

/**
 * Whole extent of a grid, {@code (0, n1, 0, n2, 0, n3)}.
 * <p>
 * The upper bounds are <em>cell</em> counts. A rectilinear grid built from the same mesh allocates
 * {@code n + 1} nodes per axis, so an extent used as a node-based allocation size is one short on every axis. Use
 * {@link #cellCounts()} and then {@link CellCounts#nodes()} when node dimensions are needed.
 *
 * @author hal.hildebrand
 */
public record Extent(int n1, int n2, int n3) {

    public Extent {
        if (n1 <= 0 || n2 <= 0 || n3 <= 0) {
            throw new IllegalArgumentException(
            String.format("Extent bounds must be positive: (%d, %d, %d)", n1, n2, n3));
        }
    }

    public static Extent of(CellCounts cells) {
        return new Extent(cells.n1, cells.n2, cells.n3);
    }

    public CellCounts cellCounts() {
        return new CellCounts(n1, n2, n3);
    }

    /**
     * @return {@code [0, n1, 0, n2, 0, n3]}
     */
    public int[] toArray() {
        return new int[] { 0, n1, 0, n2, 0, n3 };
    }

    @Override
    public String toString() {
        return String.format("(0, %d, 0, %d, 0, %d)", n1, n2, n3);
    }
}
