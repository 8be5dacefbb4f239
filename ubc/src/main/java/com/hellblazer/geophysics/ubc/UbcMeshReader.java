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
import com.hellblazer.geophysics.ubc.MeshException.SizeMismatchException;
import com.hellblazer.geophysics.ubc.grid.CellAttribute;
import com.hellblazer.geophysics.ubc.grid.GridBackend;
import com.hellblazer.geophysics.ubc.grid.GridDataPlacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads UBC meshes and models into grids of a {@link GridBackend}.
 * <p>
 * UBC models use a two file format: the mesh file describes how space is discretized and the model file lists one
 * value per cell. A model file is meaningless without its mesh. Both files are parsed and checked before the first
 * backend call, so a failed read never leaves a half-built grid behind.
 *
 * @param <G> grid handle type of the backend
 * @author hal.hildebrand
 */
public class UbcMeshReader<G> {
    private static final Logger log = LoggerFactory.getLogger(UbcMeshReader.class);

    private final GridBackend<G>     backend;
    private final ExtentReader       extentReader;
    private final Mesh2DParser       mesh2DParser;
    private final Mesh3DParser       mesh3DParser;
    private final OcTreeHeaderParser ocTreeParser;
    private final ModelParser        modelParser;
    private final GridDataPlacer     placer;

    public UbcMeshReader(GridBackend<G> backend) {
        this(backend, UbcReaderConfiguration.defaultConfig());
    }

    public UbcMeshReader(GridBackend<G> backend, UbcReaderConfiguration config) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.extentReader = new ExtentReader(config);
        this.mesh2DParser = new Mesh2DParser(config);
        this.mesh3DParser = new Mesh3DParser(config);
        this.ocTreeParser = new OcTreeHeaderParser(config);
        this.modelParser = new ModelParser(config);
        this.placer = new GridDataPlacer(config);
    }

    /**
     * Cell-count extent of a UBC 3D or OcTree mesh, read from its header line only.
     */
    public Extent readExtent3D(Path meshFile) throws IOException {
        return extentReader.readExtent(meshFile);
    }

    /**
     * Cell-count extent of a UBC 2D mesh.
     */
    public Extent readExtent2D(Path meshFile) throws IOException {
        return mesh2DParser.extent(meshFile);
    }

    /**
     * Build an empty rectilinear grid from a UBC 2D mesh.
     */
    public G readMesh2D(Path meshFile) throws IOException {
        return build(mesh2DParser.parse(meshFile));
    }

    /**
     * Build an empty rectilinear grid from a UBC 3D mesh.
     */
    public G readMesh3D(Path meshFile) throws IOException {
        return build(mesh3DParser.parse(meshFile));
    }

    /**
     * Build a rectilinear grid from a UBC 2D mesh and attach a 2D model as cell data.
     *
     * @param dataName attribute name; when null or blank the model file name is used
     * @throws FormatException       if either file is malformed
     * @throws SizeMismatchException if the model does not have one value per mesh cell
     */
    public G readMeshData2D(Path meshFile, Path modelFile, String dataName) throws IOException {
        var mesh = mesh2DParser.parse(meshFile);
        var model = modelParser.parse2D(modelFile);
        return build(mesh, placer.place(mesh.cellCounts(), model, dataName));
    }

    /**
     * Build a rectilinear grid from a UBC 3D mesh and attach a 3D model as cell data.
     *
     * @param dataName attribute name; when null or blank the model file name is used
     * @throws FormatException       if either file is malformed
     * @throws SizeMismatchException if the model does not have one value per mesh cell
     */
    public G readMeshData3D(Path meshFile, Path modelFile, String dataName) throws IOException {
        var mesh = mesh3DParser.parse(meshFile);
        var model = modelParser.parse3D(modelFile);
        return build(mesh, placer.place(mesh.cellCounts(), model, dataName));
    }

    /**
     * Attach a model to a grid already built from {@code mesh}.
     *
     * @throws SizeMismatchException if the model does not have one value per mesh cell
     */
    public G placeModelOnMesh(G grid, RectilinearMesh mesh, ModelArray model, String dataName) {
        var attribute = placer.place(mesh.cellCounts(), model, dataName);
        backend.attachCellArray(grid, attribute.name(), attribute.values());
        return grid;
    }

    /**
     * Parse a UBC OcTree mesh and allocate an unstructured grid for it. The grid has no cells: building topology from
     * the index table is not supported, see {@link #buildOcTreeGrid(OcTreeMesh)}.
     */
    public OcTreeGrid<G> readOcTree(Path meshFile) throws IOException {
        var mesh = ocTreeParser.parse(meshFile);
        log.warn("OcTree cell topology is not implemented, {} is returned with an empty grid", mesh.source());
        return new OcTreeGrid<>(backend.allocateUnstructuredGrid(), mesh);
    }

    /**
     * Build the cells of an OcTree mesh.
     *
     * @throws UnsupportedOperationException always, see {@link OcTreeMesh#toCells()}
     */
    public G buildOcTreeGrid(OcTreeMesh mesh) {
        throw new UnsupportedOperationException(
        "OcTree cell topology is not implemented: " + mesh.source() + " has " + mesh.cellCount() + " cells");
    }

    private G build(RectilinearMesh mesh) {
        var grid = backend.allocateRectilinearGrid(mesh.dimensions());
        for (int axis = 0; axis < 3; axis++) {
            backend.setAxisCoordinates(grid, axis, mesh.axis(axis));
        }
        return grid;
    }

    private G build(RectilinearMesh mesh, CellAttribute attribute) {
        var grid = build(mesh);
        backend.attachCellArray(grid, attribute.name(), attribute.values());
        log.info("Placed '{}' on {}: {} cells", attribute.name(), mesh.source(), attribute.size());
        return grid;
    }

    /**
     * An unstructured grid allocated for an OcTree mesh, with the parsed mesh.
     */
    public record OcTreeGrid<G>(G grid, OcTreeMesh mesh) {
    }
}
