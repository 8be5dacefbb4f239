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

/**
 * Sealed exception hierarchy for reading UBC mesh and model files.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link FormatException} - file contents do not match the expected token counts, shapes or numeric types</li>
 * <li>{@link SizeMismatchException} - model value count differs from the mesh cell count</li>
 * <li>{@link UnsupportedGeometryException} - a mesh the reader cannot represent, such as a non-cubic OcTree core</li>
 * </ul>
 * I/O failures are reported separately as {@link java.io.IOException}.
 *
 * @author hal.hildebrand
 */
public sealed class MeshException extends RuntimeException
permits MeshException.FormatException, MeshException.SizeMismatchException,
        MeshException.UnsupportedGeometryException {

    public MeshException(String message) {
        super(message);
    }

    public MeshException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Malformed file contents. The message names the source, the location (line or axis) and the violated
     * expectation.
     */
    public static final class FormatException extends MeshException {
        private final String source;
        private final String location;

        public FormatException(String source, String location, String expectation) {
            super(String.format("%s, %s: %s", source, location, expectation));
            this.source = source;
            this.location = location;
        }

        public FormatException(String source, String location, String expectation, Throwable cause) {
            super(String.format("%s, %s: %s", source, location, expectation), cause);
            this.source = source;
            this.location = location;
        }

        /**
         * @return the file the error was found in
         */
        public String getSource() {
            return source;
        }

        /**
         * @return the line or axis the error was found at
         */
        public String getLocation() {
            return location;
        }
    }

    /**
     * Model value count does not match the number of cells in the mesh.
     */
    public static final class SizeMismatchException extends MeshException {

        public enum Kind {
            /** more values than cells */
            SURPLUS,
            /** fewer values than cells */
            DEFICIT
        }

        private final Kind kind;
        private final long expected;
        private final long actual;

        public SizeMismatchException(String source, long expected, long actual) {
            super(message(source, expected, actual));
            if (expected == actual) {
                throw new IllegalArgumentException("No mismatch: " + expected);
            }
            this.kind = actual > expected ? Kind.SURPLUS : Kind.DEFICIT;
            this.expected = expected;
            this.actual = actual;
        }

        private static String message(String source, long expected, long actual) {
            if (actual > expected) {
                return String.format("Model %s has more data than the given mesh has cells to hold: %,d values for %,d cells",
                                     source, actual, expected);
            }
            return String.format("Model %s does not have enough data to fill the given mesh's cells: %,d values for %,d cells",
                                 source, actual, expected);
        }

        public Kind getKind() {
            return kind;
        }

        public long getExpected() {
            return expected;
        }

        public long getActual() {
            return actual;
        }
    }

    /**
     * Mesh geometry the reader does not support.
     */
    public static final class UnsupportedGeometryException extends MeshException {

        public UnsupportedGeometryException(String message) {
            super(message);
        }
    }
}
