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
import com.hellblazer.geophysics.ubc.MeshException.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Parser for UBC 3D mesh files.
 *
 * <p>File format:
 * <pre>
 *   n1 n2 n3            - cell counts (Easting, Northing, Elevation); trailing integers are ignored
 *   e n z               - origin, the southwest top corner
 *   w w w ...           - Easting cell widths
 *   w w w ...           - Northing cell widths
 *   w w w ...           - Elevation cell widths, down positive
 * </pre>
 * A width token may be a run {@code count*width}, see {@link RunLengthSpacingDecoder}.
 *
 * @author hal.hildebrand
 * @see <a href="https://giftoolscookbook.readthedocs.io/en/latest/content/fileFormats/mesh3Dfile.html">UBC 3D mesh
 * format</a>
 */
public class Mesh3DParser {
    private static final Logger log = LoggerFactory.getLogger(Mesh3DParser.class);

    private static final String[] AXIS_NAMES = { "Easting", "Northing", "Elevation" };

    private final UbcReaderConfiguration config;

    public Mesh3DParser() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public Mesh3DParser(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Parse a UBC 3D mesh file.
     *
     * @param meshFile the mesh file
     * @return the mesh, with node dimensions {@code (n1 + 1, n2 + 1, n3 + 1)}
     * @throws IOException     if the file cannot be read
     * @throws FormatException if the header, origin or any spacing line is malformed, or lines follow the spacings
     */
    public RectilinearMesh parse(Path meshFile) throws IOException {
        return parse(MeshLines.read(meshFile, config));
    }

    RectilinearMesh parse(MeshLines lines) {
        var cells = cellCounts(lines.line(0, "mesh dimensions"));
        var origin = origin(lines.line(1, "origin"));
        log.debug("UBC 3D mesh {}: {} cells, origin {}", lines.source(), cells, origin);

        var originComponents = new double[] { origin.x, origin.y, origin.z };
        var axes = new CoordinateAxis[3];
        for (int axis = 0; axis < 3; axis++) {
            var spacing = lines.line(axis + 2, AXIS_NAMES[axis] + " spacing");
            var widths = RunLengthSpacingDecoder.decode(spacing.tokens(), cells.get(axis), axis, lines.source());
            axes[axis] = accumulate(lines.source(), axis, originComponents[axis], widths);
        }
        int trailing = lines.size() - 5;
        if (trailing > 0) {
            throw new FormatException(lines.source(), lines.line(5, "trailing line").location(),
                                      trailing + " unexpected lines after the Elevation spacing");
        }

        var mesh = new RectilinearMesh(lines.source(), cells.nodes(), axes[0], axes[1], axes[2]);
        log.info("Read UBC 3D mesh {}: {} nodes", lines.source(), mesh.dimensions());
        return mesh;
    }

    static CellCounts cellCounts(MeshLines.Line header) {
        header.expectAtLeast(3, "mesh dimensions");
        return new CellCounts(header.positiveIntAt(0, "n1"), header.positiveIntAt(1, "n2"),
                              header.positiveIntAt(2, "n3"));
    }

    static Point3d origin(MeshLines.Line line) {
        line.expectTokens(3, "origin");
        return new Point3d(line.doubleAt(0, "Easting origin"), line.doubleAt(1, "Northing origin"),
                           line.doubleAt(2, "Elevation origin"));
    }

    /**
     * Accumulate widths from the origin component. Elevation uses the same additive rule as the horizontal axes
     * because the format counts down as positive.
     */
    private static CoordinateAxis accumulate(String source, int axis, double origin, double[] widths) {
        var location = "axis " + axis;
        boolean negative = widths[0] < 0;
        for (int i = 0; i < widths.length; i++) {
            if (widths[i] == 0.0 || (widths[i] < 0) != negative) {
                throw new FormatException(source, location,
                                          String.format("cell widths must be non-zero and share one sign, cell %d is %s",
                                                        i, widths[i]));
            }
        }
        try {
            return CoordinateAxis.accumulate(origin, widths);
        } catch (IllegalArgumentException e) {
            throw new FormatException(source, location, e.getMessage(), e);
        }
    }
}
