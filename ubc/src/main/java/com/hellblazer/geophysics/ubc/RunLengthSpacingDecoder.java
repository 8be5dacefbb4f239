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

import com.hellblazer.geophysics.ubc.MeshException.FormatException;

import java.util.Arrays;
import java.util.List;

/**
 * Expands the run-length notation of UBC spacing lines. A token is either a plain cell width or
 * {@code <count>*<width>}, meaning {@code count} consecutive cells of that width:
 * <pre>
 *   3*2.0 4.0   ->   2.0 2.0 2.0 4.0
 * </pre>
 * Runs are expanded in place, so the widths keep the left-to-right order of the tokens.
 *
 * @author hal.hildebrand
 */
public final class RunLengthSpacingDecoder {

    private static final char RUN_SEPARATOR = '*';

    private RunLengthSpacingDecoder() {
    }

    /**
     * Expand a whitespace-separated spacing line.
     */
    public static double[] expand(String spacingLine) {
        var trimmed = spacingLine.trim();
        var tokens = trimmed.isEmpty() ? List.<String>of() : List.of(trimmed.split("\\s+"));
        return expand(tokens, "spacing", "line");
    }

    /**
     * Expand spacing tokens into explicit cell widths.
     *
     * @param tokens   spacing tokens
     * @param source   file name for error messages
     * @param location line or axis for error messages
     * @return one width per cell
     * @throws FormatException if a token is malformed
     */
    public static double[] expand(List<String> tokens, String source, String location) {
        int total = 0;
        for (var token : tokens) {
            total = Math.addExact(total, runLength(token, source, location));
        }
        var widths = new double[total];
        int next = 0;
        for (var token : tokens) {
            int separator = token.indexOf(RUN_SEPARATOR);
            if (separator < 0) {
                widths[next++] = width(token, token, source, location);
            } else {
                int count = runLength(token, source, location);
                double width = width(token.substring(separator + 1), token, source, location);
                Arrays.fill(widths, next, next + count, width);
                next += count;
            }
        }
        return widths;
    }

    /**
     * Expand the spacing tokens of one axis and check them against the axis cell count.
     *
     * @param tokens        spacing tokens
     * @param expectedCells declared number of cells along the axis
     * @param axis          axis index, 0 to 2
     * @param source        file name for error messages
     * @return {@code expectedCells} widths
     * @throws FormatException if a token is malformed or the expanded length differs from {@code expectedCells}
     */
    public static double[] decode(List<String> tokens, int expectedCells, int axis, String source) {
        var location = "axis " + axis;
        var widths = expand(tokens, source, location);
        if (widths.length != expectedCells) {
            throw new FormatException(source, location,
                                      String.format("%d spacings specified but the declared extent allows %d cells",
                                                    widths.length, expectedCells));
        }
        return widths;
    }

    private static int runLength(String token, String source, String location) {
        int separator = token.indexOf(RUN_SEPARATOR);
        if (separator < 0) {
            return 1;
        }
        if (separator != token.lastIndexOf(RUN_SEPARATOR) || separator == 0 || separator == token.length() - 1) {
            throw new FormatException(source, location, "malformed run-length token '" + token + "'");
        }
        var count = token.substring(0, separator);
        try {
            int value = Integer.parseInt(count);
            if (value <= 0) {
                throw new FormatException(source, location, "run-length count must be positive in '" + token + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new FormatException(source, location, "run-length count must be an integer in '" + token + "'", e);
        }
    }

    private static double width(String value, String token, String source, String location) {
        try {
            var width = MeshLines.parseDecimal(value);
            if (!Double.isFinite(width)) {
                throw new FormatException(source, location, "cell width must be finite in '" + token + "'");
            }
            return width;
        } catch (NumberFormatException e) {
            throw new FormatException(source, location, "cell width must be a number in '" + token + "'", e);
        }
    }
}
