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

import java.util.Objects;

/**
 * {@link GridBackend} holding grids as plain Java objects. Every allocation returns a fresh grid.
 *
 * @author hal.hildebrand
 */
public class InMemoryGridBackend implements GridBackend<InMemoryGrid> {

    @Override
    public InMemoryGrid allocateRectilinearGrid(CellCounts nodeDimensions) {
        if (nodeDimensions.n1 < 2 || nodeDimensions.n2 < 2 || nodeDimensions.n3 < 2) {
            throw new IllegalArgumentException("A rectilinear grid needs at least 2 nodes per axis: " + nodeDimensions);
        }
        return new InMemoryGrid(InMemoryGrid.Kind.RECTILINEAR, nodeDimensions);
    }

    @Override
    public void setAxisCoordinates(InMemoryGrid grid, int axis, CoordinateAxis coordinates) {
        Objects.requireNonNull(coordinates, "coordinates");
        var dimensions = grid.getDimensions()
                             .orElseThrow(() -> new IllegalStateException("Unstructured grids have no axes"));
        int expected = dimensions.get(axis);
        if (!coordinates.isDegenerate() && coordinates.size() != expected) {
            throw new IllegalArgumentException(
            String.format("Axis %d needs %d coordinates, got %d", axis, expected, coordinates.size()));
        }
        grid.setAxis(axis, coordinates);
    }

    @Override
    public void attachCellArray(InMemoryGrid grid, String name, double[] values) {
        Objects.requireNonNull(name, "name");
        if (grid.getKind() == InMemoryGrid.Kind.RECTILINEAR && values.length != grid.getNumberOfCells()) {
            throw new IllegalArgumentException(
            String.format("Cell array '%s' has %d values for %d cells", name, values.length,
                          grid.getNumberOfCells()));
        }
        grid.putCellArray(name, values);
    }

    @Override
    public InMemoryGrid allocateUnstructuredGrid() {
        return new InMemoryGrid(InMemoryGrid.Kind.UNSTRUCTURED, null);
    }
}
