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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UbcReaderConfiguration.
 *
 * @author hal.hildebrand
 */
public class UbcReaderConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultConfiguration() {
        var config = UbcReaderConfiguration.defaultConfig();
        assertEquals('!', config.getCommentMarker());
        assertEquals("Data", config.getDefaultDataName());
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
    }

    @Test
    void testClasspathConfiguration() {
        var config = UbcReaderConfiguration.load();
        assertEquals('!', config.getCommentMarker());
        assertEquals("Model", config.getDefaultDataName());
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
    }

    @Test
    void testJsonConfiguration() throws IOException {
        var config = UbcReaderConfiguration.load(json("""
                                                      {"commentMarker": "#", "charset": "ISO-8859-1"}
                                                      """));
        assertEquals('#', config.getCommentMarker());
        assertEquals("Data", config.getDefaultDataName());
        assertEquals(StandardCharsets.ISO_8859_1, config.getCharset());
    }

    @Test
    void testInvalidJsonConfiguration() {
        assertThrows(IOException.class, () -> UbcReaderConfiguration.load(json("[1, 2]")));
        assertThrows(IOException.class, () -> UbcReaderConfiguration.load(json("{ not json")));
        assertThrows(IllegalArgumentException.class,
                     () -> UbcReaderConfiguration.load(json("{\"commentMarker\": \"//\"}")));
        assertThrows(IllegalArgumentException.class,
                     () -> UbcReaderConfiguration.load(json("{\"charset\": \"no-such-charset\"}")));
    }

    @Test
    void testBuilderValidation() {
        var builder = new UbcReaderConfiguration.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withCommentMarker(' '));
        assertThrows(IllegalArgumentException.class, () -> builder.withCommentMarker('7'));
        assertThrows(IllegalArgumentException.class, () -> builder.withDefaultDataName(" "));
        assertThrows(NullPointerException.class, () -> builder.withCharset(null));
    }

    @Test
    void testCommentMarkerUsedByParsers() throws IOException {
        var config = new UbcReaderConfiguration.Builder().withCommentMarker('#').build();
        var file = Files.writeString(tempDir.resolve("hash.msh"), """
                                     # comment
                                     1 1 1 # cells
                                     0 0 0
                                     2
                                     2
                                     2
                                     """);
        var mesh = new Mesh3DParser(config).parse(file);
        assertArrayEquals(new double[] { 0, 2 }, mesh.x().toArray());
        assertEquals(1, new ExtentReader(config).readExtent(file).n1());
    }

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
