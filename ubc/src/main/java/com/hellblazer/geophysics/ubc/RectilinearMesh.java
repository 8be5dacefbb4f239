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

package com.hellblazer.geophysics.ubc;

import com.hellblazer.geophysics.geometry.CellCounts;
import com.hellblazer.geophysics.geometry.CoordinateAxis;

import java.util.Objects;

/**
 * Geometry of a rectilinear UBC mesh: the node dimensions used to allocate a grid and one coordinate axis per
 * dimension.
 * <p>
 * A degenerate (single-node) axis stands for a flat dimension one cell thick; its node dimension is 2, as for the Y
 * axis of a 2D mesh.
 *
 * @param source     mesh file name
 * @param dimensions node counts per axis
 * @param x          Easting axis
 * @param y          Northing axis
 * @param z          Elevation axis, down positive
 * @author hal.hildebrand
 */
public record RectilinearMesh(String source, CellCounts dimensions, CoordinateAxis x, CoordinateAxis y,
                              CoordinateAxis z) {

    public RectilinearMesh {
        Objects.requireNonNull(dimensions, "dimensions");
        var axes = new CoordinateAxis[] { x, y, z };
        for (int i = 0; i < 3; i++) {
            var axis = Objects.requireNonNull(axes[i], "axis " + i);
            int expected = dimensions.get(i);
            boolean consistent = axis.isDegenerate() ? expected == 2 : axis.size() == expected;
            if (!consistent) {
                throw new IllegalArgumentException(
                String.format("Axis %d has %d nodes but the dimensions are %s", i, axis.size(), dimensions));
            }
        }
    }

    /**
     * @param axis 0, 1 or 2
     */
    public CoordinateAxis axis(int axis) {
        return switch (axis) {
            case 0 -> x;
            case 1 -> y;
            case 2 -> z;
            default -> throw new IndexOutOfBoundsException("Axis must be 0, 1 or 2: " + axis);
        };
    }

    /**
     * Number of cells along each axis.
     */
    public CellCounts cellCounts() {
        return dimensions.cells();
    }
}
