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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parser for UBC model files. The two model formats differ in their headers:
 * <ul>
 * <li>2D: a first line {@code rows cols}, then a table of values, one table row per line</li>
 * <li>3D: no header, every token of the file is a cell value</li>
 * </ul>
 * Both produce values in file order; placing them on a grid is the job of
 * {@link com.hellblazer.geophysics.ubc.grid.GridDataPlacer}.
 *
 * @author hal.hildebrand
 */
public class ModelParser {
    private static final Logger log = LoggerFactory.getLogger(ModelParser.class);

    private final UbcReaderConfiguration config;

    public ModelParser() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public ModelParser(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Parse a UBC 2D model file. The table is valid when its line count matches the declared second dimension or its
     * width matches the declared first dimension. Values are flattened column by column.
     *
     * @throws IOException     if the file cannot be read
     * @throws FormatException if the header or table is malformed
     */
    public ModelArray parse2D(Path modelFile) throws IOException {
        return parse2D(MeshLines.read(modelFile, config));
    }

    /**
     * Parse a UBC 3D model file.
     *
     * @throws IOException     if the file cannot be read
     * @throws FormatException if a token is not a number or the file holds no values
     */
    public ModelArray parse3D(Path modelFile) throws IOException {
        return parse3D(MeshLines.read(modelFile, config));
    }

    ModelArray parse2D(MeshLines lines) {
        var header = lines.line(0, "model dimensions");
        header.expectTokens(2, "model dimensions");
        int declaredFirst = header.positiveIntAt(0, "first model dimension");
        int declaredSecond = header.positiveIntAt(1, "second model dimension");

        var tableLines = lines.from(1);
        if (tableLines.isEmpty()) {
            throw improperlyFormatted(lines.source(), "model values", "no values after the header");
        }
        int rows = tableLines.size();
        int cols = tableLines.get(0).size();
        var table = new double[rows][];
        for (int i = 0; i < rows; i++) {
            var line = tableLines.get(i);
            if (line.size() != cols) {
                throw improperlyFormatted(lines.source(), line.location(),
                                          String.format("expected %d values per line, found %d", cols, line.size()));
            }
            table[i] = new double[cols];
            for (int j = 0; j < cols; j++) {
                table[i][j] = line.doubleAt(j, "model value");
            }
        }
        if (rows != declaredSecond && cols != declaredFirst) {
            throw improperlyFormatted(lines.source(), header.location(),
                                      String.format("declared %d x %d but found %d lines of %d values", declaredFirst,
                                                    declaredSecond, rows, cols));
        }

        var values = new double[Math.multiplyExact(rows, cols)];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows; i++) {
                values[j * rows + i] = table[i][j];
            }
        }
        log.info("Read UBC 2D model {}: {} x {} values", lines.source(), rows, cols);
        return new ModelArray(lines.source(), values);
    }

    ModelArray parse3D(MeshLines lines) {
        int count = 0;
        for (var line : lines.from(0)) {
            count = Math.addExact(count, line.size());
        }
        if (count == 0) {
            throw improperlyFormatted(lines.source(), "end of file", "no model values");
        }
        var values = new double[count];
        int next = 0;
        for (var line : lines.from(0)) {
            for (int i = 0; i < line.size(); i++) {
                values[next++] = line.doubleAt(i, "model value");
            }
        }
        log.info("Read UBC 3D model {}: {} values", lines.source(), count);
        return new ModelArray(lines.source(), values);
    }

    private static FormatException improperlyFormatted(String source, String location, String detail) {
        return new FormatException(source, location, "model file improperly formatted, " + detail);
    }
}
