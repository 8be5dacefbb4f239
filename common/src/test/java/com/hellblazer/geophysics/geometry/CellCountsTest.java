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
 * Tests for CellCounts.
 *
 * @author hal.hildebrand
 */
public class CellCountsTest {

    @Test
    public void testConstruction() {
        var counts = new CellCounts(2, 3, 4);
        assertEquals(2, counts.n1);
        assertEquals(3, counts.n2);
        assertEquals(4, counts.n3);
        assertEquals(24, counts.total());
    }

    @Test
    public void testNonPositiveRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CellCounts(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new CellCounts(1, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new CellCounts(1, 1, 0));
    }

    @Test
    public void testNodesAndCells() {
        var cells = new CellCounts(2, 2, 1);
        assertEquals(new CellCounts(3, 3, 2), cells.nodes());
        assertEquals(cells, cells.nodes().cells());
        assertThrows(IllegalArgumentException.class, () -> new CellCounts(1, 2, 2).cells());
    }

    @Test
    public void testAxisAccess() {
        var counts = new CellCounts(5, 6, 7);
        assertEquals(5, counts.get(0));
        assertEquals(6, counts.get(1));
        assertEquals(7, counts.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> counts.get(3));
    }

    @Test
    public void testCubic() {
        assertTrue(new CellCounts(4, 4, 4).isCubic());
        assertFalse(new CellCounts(4, 4, 5).isCubic());
    }

    @Test
    public void testTotalBeyondInt() {
        assertEquals(4_000_000_000L, new CellCounts(2000, 2000, 1000).total());
        assertEquals(10_000_000_000L, new CellCounts(100_000, 100_000, 1).total());
    }

    @Test
    public void testTotalOverflow() {
        var max = Integer.MAX_VALUE;
        assertThrows(ArithmeticException.class, () -> new CellCounts(max, max, max).total());
    }

    @Test
    public void testArrayConversion() {
        var counts = CellCounts.fromArray(new int[] { 7, 8, 9 });
        assertArrayEquals(new int[] { 7, 8, 9 }, counts.toArray());
        assertThrows(IllegalArgumentException.class, () -> CellCounts.fromArray(new int[] { 1, 2 }));
    }

    @Test
    public void testEqualsAndHashCode() {
        var a = new CellCounts(1, 2, 3);
        var b = new CellCounts(1, 2, 3);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new CellCounts(3, 2, 1));
        assertEquals("(1, 2, 3)", a.toString());
    }
}
