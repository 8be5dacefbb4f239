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
import com.hellblazer.geophysics.geometry.CoordinateAxis;
import com.hellblazer.geophysics.geometry.Extent;
import com.hellblazer.geophysics.ubc.MeshException.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parser for UBC 2D mesh files.
 *
 * <p>File format:
 * <pre>
 *   nx                  - number of X segments
 *   x0 x1 d1            - origin, first control point, subdivisions of the first segment
 *   x2 d2               - next control point, subdivisions of the segment ending there
 *   ...                 - nx segment lines in total
 *   nz                  - number of Z segments
 *   z0 z1 d1
 *   ...                 - nz segment lines in total
 * </pre>
 * Each segment is divided into equal cells. The mesh is one cell thick along Y, represented by the degenerate
 * Y axis {@code [0]}.
 *
 * @author hal.hildebrand
 * @see <a href="https://giftoolscookbook.readthedocs.io/en/latest/content/fileFormats/mesh2Dfile.html">UBC 2D mesh
 * format</a>
 */
public class Mesh2DParser {
    private static final Logger log = LoggerFactory.getLogger(Mesh2DParser.class);

    private final UbcReaderConfiguration config;

    public Mesh2DParser() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public Mesh2DParser(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Parse a UBC 2D mesh file.
     *
     * @param meshFile the mesh file
     * @return the mesh, with node dimensions {@code (nx, 2, nz)}
     * @throws IOException     if the file cannot be read
     * @throws FormatException if a segment block is malformed
     */
    public RectilinearMesh parse(Path meshFile) throws IOException {
        return parse(MeshLines.read(meshFile, config));
    }

    /**
     * Cell-count extent of a UBC 2D mesh, {@code (0, cx, 0, 1, 0, cz)}. Unlike the 3D header the segment blocks must
     * be parsed to know the cell counts.
     */
    public Extent extent(Path meshFile) throws IOException {
        return Extent.of(parse(meshFile).cellCounts());
    }

    RectilinearMesh parse(MeshLines lines) {
        int nx = segmentCount(lines.line(0, "X segment count"), "X segment count");
        var x = axis(lines, 1, nx, "X");
        int nz = segmentCount(lines.line(nx + 1, "Z segment count"), "Z segment count");
        var z = axis(lines, nx + 2, nz, "Z");
        int trailing = lines.size() - (nx + 2 + nz);
        if (trailing > 0) {
            throw new FormatException(lines.source(), lines.line(nx + 2 + nz, "trailing line").location(),
                                      trailing + " unexpected lines after the Z segments");
        }

        var mesh = new RectilinearMesh(lines.source(), new CellCounts(x.size(), 2, z.size()), x,
                                       CoordinateAxis.degenerate(0.0), z);
        log.info("Read UBC 2D mesh {}: {} nodes", lines.source(), mesh.dimensions());
        return mesh;
    }

    private static int segmentCount(MeshLines.Line line, String what) {
        line.expectTokens(1, what);
        return line.positiveIntAt(0, what);
    }

    /**
     * Build one axis from {@code segments} segment lines starting at content line {@code start}.
     */
    private static CoordinateAxis axis(MeshLines lines, int start, int segments, String name) {
        int nodes = 1;
        var controlPoints = new double[segments + 1];
        var subdivisions = new int[segments];
        for (int i = 0; i < segments; i++) {
            var line = lines.line(start + i, name + " segment " + (i + 1));
            int offset = 0;
            if (i == 0) {
                line.expectTokens(3, name + " origin segment");
                controlPoints[0] = line.doubleAt(0, name + " origin");
                offset = 1;
            } else {
                line.expectTokens(2, name + " segment");
            }
            controlPoints[i + 1] = line.doubleAt(offset, name + " control point");
            subdivisions[i] = line.positiveIntAt(offset + 1, name + " subdivisions");
            nodes = Math.addExact(nodes, subdivisions[i]);
        }

        var coordinates = new double[nodes];
        coordinates[0] = controlPoints[0];
        int next = 1;
        for (int i = 0; i < segments; i++) {
            double begin = controlPoints[i];
            double end = controlPoints[i + 1];
            double width = (end - begin) / subdivisions[i];
            for (int j = 1; j < subdivisions[i]; j++) {
                coordinates[next++] = begin + j * width;
            }
            // the segment always ends exactly on its control point
            coordinates[next++] = end;
        }

        try {
            var axis = CoordinateAxis.of(coordinates);
            log.debug("UBC 2D mesh {}: {} axis, {} segments, {} nodes", lines.source(), name, segments, nodes);
            return axis;
        } catch (IllegalArgumentException e) {
            throw new FormatException(lines.source(), name + " axis", e.getMessage(), e);
        }
    }
}
