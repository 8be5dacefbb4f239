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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryGridBackend.
 *
 * @author hal.hildebrand
 */
public class InMemoryGridBackendTest {

    private final InMemoryGridBackend backend = new InMemoryGridBackend();

    @Test
    void testRectilinearGrid() {
        var grid = backend.allocateRectilinearGrid(new CellCounts(3, 2, 2));
        backend.setAxisCoordinates(grid, 0, CoordinateAxis.of(0, 1, 2));
        backend.setAxisCoordinates(grid, 1, CoordinateAxis.of(0, 5));
        backend.setAxisCoordinates(grid, 2, CoordinateAxis.of(0, 3));
        backend.attachCellArray(grid, "values", new double[] { 1, 2 });

        assertEquals(InMemoryGrid.Kind.RECTILINEAR, grid.getKind());
        assertEquals(2, grid.getNumberOfCells());
        assertEquals(CoordinateAxis.of(0, 5), grid.getAxis(1));
        assertArrayEquals(new double[] { 1, 2 }, grid.getCellArray("values").orElseThrow());
        assertTrue(grid.getCellArray("missing").isEmpty());
    }

    @Test
    void testFreshGridPerAllocation() {
        var a = backend.allocateRectilinearGrid(new CellCounts(2, 2, 2));
        var b = backend.allocateRectilinearGrid(new CellCounts(2, 2, 2));
        backend.attachCellArray(a, "values", new double[] { 1 });
        assertNotSame(a, b);
        assertTrue(b.getCellData().isEmpty());
    }

    @Test
    void testAxisLengthChecked() {
        var grid = backend.allocateRectilinearGrid(new CellCounts(3, 2, 2));
        assertThrows(IllegalArgumentException.class, () -> backend.setAxisCoordinates(grid, 0, CoordinateAxis.of(0, 1)));
        backend.setAxisCoordinates(grid, 1, CoordinateAxis.degenerate(0));
        assertTrue(grid.getAxis(1).isDegenerate());
    }

    @Test
    void testCellArrayLengthChecked() {
        var grid = backend.allocateRectilinearGrid(new CellCounts(3, 3, 2));
        assertThrows(IllegalArgumentException.class, () -> backend.attachCellArray(grid, "values", new double[3]));
    }

    @Test
    void testTooFewNodes() {
        assertThrows(IllegalArgumentException.class, () -> backend.allocateRectilinearGrid(new CellCounts(1, 2, 2)));
    }

    @Test
    void testUnstructuredGrid() {
        var grid = backend.allocateUnstructuredGrid();
        assertEquals(InMemoryGrid.Kind.UNSTRUCTURED, grid.getKind());
        assertTrue(grid.getDimensions().isEmpty());
        assertEquals(0, grid.getNumberOfCells());
        assertThrows(IllegalStateException.class, () -> backend.setAxisCoordinates(grid, 0, CoordinateAxis.of(0, 1)));
    }
}
