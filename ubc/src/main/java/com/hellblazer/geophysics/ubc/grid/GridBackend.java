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
import com.hellblazer.geophysics.geometry.CoordinateAxis;

/**
 * The grid implementation the readers hand their results to. The readers only allocate grids, set their axes and
 * attach cell arrays; they never inspect a grid handle.
 *
 * @param <G> the grid handle type
 * @author hal.hildebrand
 */
public interface GridBackend<G> {

    /**
     * Allocate a rectilinear grid.
     *
     * @param nodeDimensions number of nodes along each axis
     */
    G allocateRectilinearGrid(CellCounts nodeDimensions);

    /**
     * Set the node coordinates of one axis of a rectilinear grid.
     *
     * @param axis 0 (Easting), 1 (Northing) or 2 (Elevation)
     */
    void setAxisCoordinates(G grid, int axis, CoordinateAxis coordinates);

    /**
     * Attach a named per-cell array, in the grid's cell order.
     */
    void attachCellArray(G grid, String name, double[] values);

    G allocateUnstructuredGrid();
}
