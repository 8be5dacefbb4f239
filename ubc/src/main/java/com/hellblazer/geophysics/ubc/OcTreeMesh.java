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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Header and index table of a UBC OcTree mesh.
 *
 * @param source     mesh file name
 * @param coreCells  cells of the core mesh, equal on all axes
 * @param padding    the six padding values of the header, or empty when the header has none
 * @param origin     southwest top corner
 * @param coreWidths core cell widths along Easting, Northing and Elevation
 * @param cellCount  declared number of OcTree cells
 * @param rows       one index row per cell
 * @author hal.hildebrand
 */
public record OcTreeMesh(String source, CellCounts coreCells, List<Integer> padding, Point3d origin,
                         Vector3d coreWidths, int cellCount, List<IndexRow> rows) {

    public OcTreeMesh {
        padding = List.copyOf(padding);
        rows = List.copyOf(rows);
        origin = new Point3d(origin);
        coreWidths = new Vector3d(coreWidths);
    }

    @Override
    public Point3d origin() {
        return new Point3d(origin);
    }

    @Override
    public Vector3d coreWidths() {
        return new Vector3d(coreWidths);
    }

    /**
     * Hexahedral cell topology for the index table.
     *
     * @throws UnsupportedOperationException always; the encoding of the index rows into cells is not yet defined
     */
    public List<int[]> toCells() {
        throw new UnsupportedOperationException(
        "OcTree cell topology is not implemented: " + source + " has " + cellCount + " cells");
    }

    /**
     * One row of the index table: a corner cell index and a size, in core cells.
     */
    public record IndexRow(int i, int j, int k, int size) {
    }
}
