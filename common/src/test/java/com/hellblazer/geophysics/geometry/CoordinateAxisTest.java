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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CoordinateAxis and Extent.
 *
 * @author hal.hildebrand
 */
public class CoordinateAxisTest {

    @Test
    public void testAccumulate() {
        var axis = CoordinateAxis.accumulate(100.0, new double[] { 10.0, 20.0, 5.0 });
        assertArrayEquals(new double[] { 100.0, 110.0, 130.0, 135.0 }, axis.toArray());
        assertEquals(4, axis.size());
        assertEquals(3, axis.cellCount());
        assertEquals(100.0, axis.first());
        assertEquals(135.0, axis.last());
        assertTrue(axis.isIncreasing());
    }

    @Test
    public void testDecreasingAxis() {
        var axis = CoordinateAxis.accumulate(0.0, new double[] { -1.0, -2.0 });
        assertArrayEquals(new double[] { 0.0, -1.0, -3.0 }, axis.toArray());
        assertFalse(axis.isIncreasing());
    }

    @Test
    public void testNotMonotonic() {
        assertThrows(IllegalArgumentException.class, () -> CoordinateAxis.of(0.0, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> CoordinateAxis.of(0.0, 2.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> CoordinateAxis.accumulate(0.0, new double[] { 1.0, -1.0 }));
    }

    @Test
    public void testInvalidCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> CoordinateAxis.of());
        assertThrows(IllegalArgumentException.class, () -> CoordinateAxis.of(0.0, Double.NaN));
    }

    @Test
    public void testDegenerate() {
        var axis = CoordinateAxis.degenerate(0.0);
        assertTrue(axis.isDegenerate());
        assertEquals(1, axis.size());
        assertEquals(0, axis.cellCount());
        assertFalse(axis.isIncreasing());
    }

    @Test
    public void testImmutable() {
        var source = new double[] { 0.0, 1.0 };
        var axis = CoordinateAxis.of(source);
        source[1] = 5.0;
        assertEquals(1.0, axis.get(1));
        axis.toArray()[0] = 9.0;
        assertEquals(0.0, axis.get(0));
        assertEquals(CoordinateAxis.of(0.0, 1.0), axis);
    }

    @Test
    public void testExtent() {
        var extent = Extent.of(new CellCounts(2, 3, 4));
        assertArrayEquals(new int[] { 0, 2, 0, 3, 0, 4 }, extent.toArray());
        assertEquals(new CellCounts(2, 3, 4), extent.cellCounts());
        assertEquals(new CellCounts(3, 4, 5), extent.cellCounts().nodes());
        assertEquals("(0, 2, 0, 3, 0, 4)", extent.toString());
        assertThrows(IllegalArgumentException.class, () -> new Extent(0, 1, 1));
    }
}
