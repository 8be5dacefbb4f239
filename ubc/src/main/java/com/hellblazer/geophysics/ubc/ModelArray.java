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

import java.util.Arrays;
import java.util.Objects;

/**
 * Cell values of a model file, flat and in file order.
 *
 * @param source model file name, the default name of the placed attribute
 * @param values cell values
 * @author hal.hildebrand
 */
public record ModelArray(String source, double[] values) {

    public ModelArray {
        Objects.requireNonNull(source, "source");
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ModelArray other)) return false;
        return source.equals(other.source) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("ModelArray[source=%s, size=%d]", source, values.length);
    }
}
