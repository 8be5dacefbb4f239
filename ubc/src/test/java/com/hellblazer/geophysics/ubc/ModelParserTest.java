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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the UBC model parsers.
 *
 * @author hal.hildebrand
 */
public class ModelParserTest {

    @TempDir
    Path tempDir;

    private final ModelParser parser = new ModelParser();

    @Test
    void testModel2DColumnMajor() throws IOException {
        var model = parser.parse2D(write("model2d.den", """
                                         3 2
                                         1 2 3
                                         4 5 6
                                         """));
        assertArrayEquals(new double[] { 1, 4, 2, 5, 3, 6 }, model.values());
        assertEquals("model2d.den", model.source());
    }

    @Test
    void testModel2DEitherDimensionValidates() throws IOException {
        var model = parser.parse2D(write("wide.den", "3 7\n1 2 3\n4 5 6\n"));
        assertEquals(6, model.size());
        model = parser.parse2D(write("tall.den", "9 2\n1 2 3\n4 5 6\n"));
        assertEquals(6, model.size());
    }

    @Test
    void testModel2DImproperlyFormatted() throws IOException {
        var e = assertThrows(FormatException.class, () -> parser.parse2D(write("bad.den", "4 4\n1 2 3\n4 5 6\n")));
        assertTrue(e.getMessage().contains("model file improperly formatted"), e.getMessage());
    }

    @Test
    void testModel2DRaggedTable() throws IOException {
        var e = assertThrows(FormatException.class, () -> parser.parse2D(write("ragged.den", "3 2\n1 2 3\n4 5\n")));
        assertEquals("line 3", e.getLocation());
    }

    @Test
    void testModel2DHeaderRequired() throws IOException {
        assertThrows(FormatException.class, () -> parser.parse2D(write("noheader.den", "1.5 2\n1 2\n")));
        assertThrows(FormatException.class, () -> parser.parse2D(write("nodata.den", "2 2\n")));
    }

    @Test
    void testModel3DFlat() throws IOException {
        var model = parser.parse3D(write("model3d.den", """
                                         1.0 2.0
                                         3.0        ! comment
                                         4e-1
                                         """));
        assertArrayEquals(new double[] { 1.0, 2.0, 3.0, 0.4 }, model.values());
    }

    @Test
    void testModel3DHasNoHeader() throws IOException {
        var model = parser.parse3D(write("model3d.den", "2 2\n5\n"));
        assertArrayEquals(new double[] { 2, 2, 5 }, model.values());
    }

    @Test
    void testModel3DNonNumeric() throws IOException {
        var e = assertThrows(FormatException.class, () -> parser.parse3D(write("text.den", "1.0\n2.0 abc\n")));
        assertEquals("line 2", e.getLocation());
    }

    @Test
    void testModelTypeSuffixRejected() throws IOException {
        var e = assertThrows(FormatException.class, () -> parser.parse3D(write("suffix.den", "1f 2d\n")));
        assertEquals("line 1", e.getLocation());
        assertThrows(FormatException.class, () -> parser.parse2D(write("suffix2d.den", "2 1\n1.0D 2\n")));
    }

    @Test
    void testModel3DEmpty() throws IOException {
        assertThrows(FormatException.class, () -> parser.parse3D(write("empty.den", "! no values\n")));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
