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
import com.hellblazer.geophysics.ubc.MeshException.UnsupportedGeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the header and index table of UBC OcTree mesh files.
 *
 * <p>File format:
 * <pre>
 *   n1 n2 n3 [p1 .. p6] - core mesh cells, equal on all axes, and optional padding
 *   e n z               - origin, the southwest top corner
 *   we wn wz            - core cell widths
 *   count               - number of OcTree cells
 *   i j k size          - one index row per cell
 * </pre>
 * Building cell topology from the index table is not supported, see {@link OcTreeMesh#toCells()}.
 *
 * @author hal.hildebrand
 */
public class OcTreeHeaderParser {
    private static final Logger log = LoggerFactory.getLogger(OcTreeHeaderParser.class);

    private static final int PADDING_VALUES = 6;

    private final UbcReaderConfiguration config;

    public OcTreeHeaderParser() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public OcTreeHeaderParser(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Parse a UBC OcTree mesh file.
     *
     * @throws IOException                  if the file cannot be read
     * @throws UnsupportedGeometryException if the core mesh is not cubic
     * @throws FormatException              if the header or index table is malformed
     */
    public OcTreeMesh parse(Path meshFile) throws IOException {
        return parse(MeshLines.read(meshFile, config));
    }

    OcTreeMesh parse(MeshLines lines) {
        var header = lines.line(0, "mesh dimensions");
        var core = Mesh3DParser.cellCounts(header);
        if (!core.isCubic()) {
            throw new UnsupportedGeometryException(
            String.format("OcTree meshes must have the same number of cells in all directions: %s has %s",
                          lines.source(), core));
        }
        var padding = padding(header);

        var origin = Mesh3DParser.origin(lines.line(1, "origin"));
        var widths = coreWidths(lines.line(2, "core cell widths"));
        var countLine = lines.line(3, "cell count");
        countLine.expectTokens(1, "cell count");
        int cellCount = countLine.positiveIntAt(0, "cell count");
        log.debug("UBC OcTree mesh {}: core {}, origin {}, widths {}, {} cells", lines.source(), core, origin, widths,
                  cellCount);

        var indexLines = lines.from(4);
        if (indexLines.size() != cellCount) {
            throw new FormatException(lines.source(), "index table",
                                      String.format("declared %d cells but found %d index rows", cellCount,
                                                    indexLines.size()));
        }
        var rows = new ArrayList<OcTreeMesh.IndexRow>(cellCount);
        for (var line : indexLines) {
            line.expectAtLeast(4, "index row");
            rows.add(new OcTreeMesh.IndexRow(line.intAt(0, "i"), line.intAt(1, "j"), line.intAt(2, "k"),
                                             line.positiveIntAt(3, "size")));
        }

        log.info("Read UBC OcTree mesh {}: {} cells", lines.source(), cellCount);
        return new OcTreeMesh(lines.source(), core, padding, origin, widths, cellCount, rows);
    }

    private static List<Integer> padding(MeshLines.Line header) {
        int extra = header.size() - 3;
        if (extra == 0) {
            return List.of();
        }
        if (extra != PADDING_VALUES) {
            throw new FormatException(header.source(), header.location(),
                                      String.format("expected 3 core dimensions and %d padding values, found %d values",
                                                    PADDING_VALUES, header.size()));
        }
        var padding = new ArrayList<Integer>(PADDING_VALUES);
        for (int i = 0; i < PADDING_VALUES; i++) {
            padding.add(header.intAt(3 + i, "padding " + (i + 1)));
        }
        return padding;
    }

    private static Vector3d coreWidths(MeshLines.Line line) {
        line.expectTokens(3, "core cell widths");
        var widths = new Vector3d(line.doubleAt(0, "Easting width"), line.doubleAt(1, "Northing width"),
                                  line.doubleAt(2, "Elevation width"));
        if (widths.x <= 0 || widths.y <= 0 || widths.z <= 0) {
            throw new FormatException(line.source(), line.location(), "core cell widths must be positive: " + widths);
        }
        return widths;
    }
}
