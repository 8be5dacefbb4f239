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

package com.hellblazer.geophysics.ubc.grid;

import com.hellblazer.geophysics.geometry.CellCounts;
import com.hellblazer.geophysics.ubc.MeshException.SizeMismatchException;
import com.hellblazer.geophysics.ubc.ModelArray;
import com.hellblazer.geophysics.ubc.UbcReaderConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places model values on the cells of a mesh: checks the value count against the cell count, reorders from file
 * order to grid order with {@link CellOrdering} and names the result.
 *
 * @author hal.hildebrand
 */
public class GridDataPlacer {
    private static final Logger log = LoggerFactory.getLogger(GridDataPlacer.class);

    private final UbcReaderConfiguration config;

    public GridDataPlacer() {
        this(UbcReaderConfiguration.defaultConfig());
    }

    public GridDataPlacer(UbcReaderConfiguration config) {
        this.config = config;
    }

    /**
     * Place a model on a mesh, naming the attribute after the model file.
     */
    public CellAttribute place(CellCounts cells, ModelArray model) {
        return place(cells, model, null);
    }

    /**
     * Place a model on a mesh.
     *
     * @param cells number of cells along each axis of the mesh
     * @param model values in file order
     * @param name  attribute name; when null or blank the model file name is used
     * @return the values in grid order
     * @throws SizeMismatchException if the model does not have exactly one value per cell
     */
    public CellAttribute place(CellCounts cells, ModelArray model, String name) {
        long expected = cellCount(cells);
        if (model.size() != expected) {
            throw new SizeMismatchException(model.source(), expected, model.size());
        }
        var attributeName = attributeName(model, name);
        var values = CellOrdering.toGridOrder(cells, model.values());
        log.debug("Placed {} values of {} on {} cells as '{}'", model.size(), model.source(), cells, attributeName);
        return new CellAttribute(attributeName, values);
    }

    private static long cellCount(CellCounts cells) {
        try {
            return cells.total();
        } catch (ArithmeticException e) {
            // beyond long, so beyond any model
            return Long.MAX_VALUE;
        }
    }

    /**
     * The explicit name, else the model file name, else the configured default.
     */
    public String attributeName(ModelArray model, String name) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (!model.source().isBlank()) {
            return model.source();
        }
        return config.getDefaultDataName();
    }
}
