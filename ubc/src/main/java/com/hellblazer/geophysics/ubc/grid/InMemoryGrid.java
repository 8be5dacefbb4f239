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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Grid built by {@link InMemoryGridBackend}. Rectilinear grids carry node dimensions and one coordinate axis per
 * dimension; unstructured grids carry cell arrays only.
 *
 * @author hal.hildebrand
 */
public final class InMemoryGrid {

    public enum Kind {
        RECTILINEAR, UNSTRUCTURED
    }

    private final Kind                  kind;
    private final CellCounts            dimensions;
    private final CoordinateAxis[]      axes      = new CoordinateAxis[3];
    private final Map<String, double[]> cellData  = new LinkedHashMap<>();

    InMemoryGrid(Kind kind, CellCounts dimensions) {
        this.kind = kind;
        this.dimensions = dimensions;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Node dimensions, empty for an unstructured grid.
     */
    public Optional<CellCounts> getDimensions() {
        return Optional.ofNullable(dimensions);
    }

    /**
     * @return the axis, or null when it has not been set
     */
    public CoordinateAxis getAxis(int axis) {
        return axes[axis];
    }

    /**
     * @return a copy of the named cell array, if attached
     */
    public Optional<double[]> getCellArray(String name) {
        return Optional.ofNullable(cellData.get(name)).map(double[]::clone);
    }

    public Map<String, double[]> getCellData() {
        return Collections.unmodifiableMap(cellData);
    }

    /**
     * Number of cells of a rectilinear grid; a degenerate axis counts as one cell thick.
     */
    public long getNumberOfCells() {
        if (dimensions == null) {
            return 0;
        }
        return dimensions.cells().total();
    }

    void setAxis(int axis, CoordinateAxis coordinates) {
        axes[axis] = coordinates;
    }

    void putCellArray(String name, double[] values) {
        cellData.put(name, values.clone());
    }
}
