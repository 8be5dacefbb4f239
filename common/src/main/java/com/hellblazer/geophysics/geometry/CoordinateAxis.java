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

import java.util.Arrays;

/**
 * Immutable, strictly monotonic sequence of node coordinates along one axis of a rectilinear grid. An axis with
 * {@code n} cells has {@code n + 1} nodes. A single-node axis is degenerate and describes a grid that is flat along
 * that axis.
 *
 * @author hal.hildebrand
 */
public final class CoordinateAxis {

    private final double[] coordinates;

    private CoordinateAxis(double[] coordinates) {
        this.coordinates = coordinates;
    }

    /**
     * Create an axis from explicit node coordinates.
     *
     * @param coordinates node coordinates, copied
     * @return the axis
     * @throws IllegalArgumentException if empty, not finite, or not strictly monotonic
     */
    public static CoordinateAxis of(double... coordinates) {
        var copy = coordinates.clone();
        validate(copy);
        return new CoordinateAxis(copy);
    }

    /**
     * Create an axis by accumulating cell widths from an origin: node 0 is the origin and node {@code i} is node
     * {@code i - 1} plus width {@code i - 1}.
     *
     * @param origin first node coordinate
     * @param widths cell widths, one per cell
     * @return the axis, with {@code widths.length + 1} nodes
     * @throws IllegalArgumentException if the widths do not produce a strictly monotonic axis
     */
    public static CoordinateAxis accumulate(double origin, double[] widths) {
        var nodes = new double[widths.length + 1];
        nodes[0] = origin;
        for (int i = 1; i < nodes.length; i++) {
            nodes[i] = nodes[i - 1] + widths[i - 1];
        }
        validate(nodes);
        return new CoordinateAxis(nodes);
    }

    /**
     * A single-node axis.
     */
    public static CoordinateAxis degenerate(double coordinate) {
        return of(coordinate);
    }

    private static void validate(double[] nodes) {
        if (nodes.length == 0) {
            throw new IllegalArgumentException("Axis must have at least one node");
        }
        for (double node : nodes) {
            if (!Double.isFinite(node)) {
                throw new IllegalArgumentException("Axis coordinates must be finite: " + Arrays.toString(nodes));
            }
        }
        if (nodes.length < 2) {
            return;
        }
        boolean increasing = nodes[1] > nodes[0];
        for (int i = 1; i < nodes.length; i++) {
            double delta = nodes[i] - nodes[i - 1];
            if (increasing ? delta <= 0 : delta >= 0) {
                throw new IllegalArgumentException(
                String.format("Axis is not strictly monotonic at node %d: %s then %s", i, nodes[i - 1], nodes[i]));
            }
        }
    }

    public int size() {
        return coordinates.length;
    }

    /**
     * @return number of cells spanned by this axis, zero when degenerate
     */
    public int cellCount() {
        return coordinates.length - 1;
    }

    public double get(int index) {
        return coordinates[index];
    }

    public double first() {
        return coordinates[0];
    }

    public double last() {
        return coordinates[coordinates.length - 1];
    }

    public boolean isDegenerate() {
        return coordinates.length == 1;
    }

    public boolean isIncreasing() {
        return coordinates.length > 1 && coordinates[1] > coordinates[0];
    }

    /**
     * @return a copy of the node coordinates
     */
    public double[] toArray() {
        return coordinates.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CoordinateAxis other)) return false;
        return Arrays.equals(coordinates, other.coordinates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coordinates);
    }

    @Override
    public String toString() {
        return "CoordinateAxis" + Arrays.toString(coordinates);
    }
}
