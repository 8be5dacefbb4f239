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

import com.hellblazer.geophysics.geometry.Extent;
import com.hellblazer.geophysics.ubc.MeshException.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Discovers the whole extent of a UBC 3D or OcTree mesh from its header line alone, without reading the rest of the
 * file.
 * <p>
 * The result carries <em>cell</em> counts, {@code (0, n1, 0, n2, 0, n3)}. Full parsing of the same mesh allocates
 * {@code n + 1} nodes per axis (see {@link Extent}).
 *
 * @author hal.hildebrand
 */
public class ExtentReader {
    private static final Logger log = LoggerFactory.getLogger(ExtentReader.class);

    private final UbcReaderConfiguration config;

    public ExtentReader() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public ExtentReader(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Read the cell-count extent from the first content line of a mesh file.
     *
     * @param meshFile UBC 3D or OcTree mesh file
     * @return {@code (0, n1, 0, n2, 0, n3)}
     * @throws IOException     if the file cannot be read
     * @throws FormatException if the header line does not start with three positive integers
     */
    public Extent readExtent(Path meshFile) throws IOException {
        var source = MeshLines.sourceName(meshFile);
        var header = MeshLines.readFirst(meshFile, config)
                              .orElseThrow(() -> new FormatException(source, "line 1", "missing mesh dimensions"));
        header.expectAtLeast(3, "mesh dimensions");
        var extent = new Extent(header.positiveIntAt(0, "n1"), header.positiveIntAt(1, "n2"),
                                header.positiveIntAt(2, "n3"));
        log.debug("Extent of {}: {}", source, extent);
        return extent;
    }
}
