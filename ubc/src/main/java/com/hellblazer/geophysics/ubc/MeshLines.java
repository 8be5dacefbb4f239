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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The content lines of a UBC text file. A trailing comment is stripped from every line and lines that are empty
 * afterwards are dropped; each kept line remembers its physical line number for error reporting.
 *
 * @author hal.hildebrand
 */
final class MeshLines {

    // plain decimal or scientific notation, no type suffix or hex
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String     source;
    private final List<Line> lines;

    private MeshLines(String source, List<Line> lines) {
        this.source = source;
        this.lines = lines;
    }

    /**
     * Parse a plain decimal number.
     *
     * @throws NumberFormatException if the token is not a decimal or carries a type suffix such as {@code 1f}
     */
    static double parseDecimal(String token) {
        if (!DECIMAL.matcher(token).matches()) {
            throw new NumberFormatException("not a decimal number: '" + token + "'");
        }
        return Double.parseDouble(token);
    }

    /**
     * Read every content line of a file.
     */
    static MeshLines read(Path path, UbcReaderConfiguration config) throws IOException {
        var source = sourceName(path);
        var lines = new ArrayList<Line>();
        try (var reader = Files.newBufferedReader(path, config.getCharset())) {
            String raw;
            int number = 0;
            while ((raw = reader.readLine()) != null) {
                number++;
                var tokens = tokenize(raw, config.getCommentMarker());
                if (!tokens.isEmpty()) {
                    lines.add(new Line(source, number, tokens));
                }
            }
        }
        return new MeshLines(source, List.copyOf(lines));
    }

    /**
     * Read only up to the first content line of a file.
     */
    static Optional<Line> readFirst(Path path, UbcReaderConfiguration config) throws IOException {
        var source = sourceName(path);
        try (BufferedReader reader = Files.newBufferedReader(path, config.getCharset())) {
            String raw;
            int number = 0;
            while ((raw = reader.readLine()) != null) {
                number++;
                var tokens = tokenize(raw, config.getCommentMarker());
                if (!tokens.isEmpty()) {
                    return Optional.of(new Line(source, number, tokens));
                }
            }
        }
        return Optional.empty();
    }

    static List<String> tokenize(String raw, char commentMarker) {
        int comment = raw.indexOf(commentMarker);
        var content = (comment >= 0 ? raw.substring(0, comment) : raw).trim();
        if (content.isEmpty()) {
            return List.of();
        }
        return List.of(content.split("\\s+"));
    }

    static String sourceName(Path path) {
        var name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    String source() {
        return source;
    }

    int size() {
        return lines.size();
    }

    /**
     * The content line at {@code index}.
     *
     * @param what description of the expected line, used when it is missing
     */
    Line line(int index, String what) {
        if (index >= lines.size()) {
            var location = lines.isEmpty() ? "end of file" : "after line " + lines.get(lines.size() - 1).number();
            throw new FormatException(source, location, "missing " + what);
        }
        return lines.get(index);
    }

    /**
     * All content lines from {@code index} to the end.
     */
    List<Line> from(int index) {
        return index >= lines.size() ? List.of() : lines.subList(index, lines.size());
    }

    /**
     * One content line, split into tokens. Each typed accessor either returns a parsed value or throws a
     * {@link FormatException} naming the line and the field.
     */
    record Line(String source, int number, List<String> tokens) {

        int size() {
            return tokens.size();
        }

        String location() {
            return "line " + number;
        }

        String token(int index, String field) {
            if (index >= tokens.size()) {
                throw new FormatException(source, location(), "missing " + field);
            }
            return tokens.get(index);
        }

        int intAt(int index, String field) {
            var token = token(index, field);
            try {
                return Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new FormatException(source, location(), field + " must be an integer: '" + token + "'", e);
            }
        }

        int positiveIntAt(int index, String field) {
            int value = intAt(index, field);
            if (value <= 0) {
                throw new FormatException(source, location(), field + " must be positive: " + value);
            }
            return value;
        }

        double doubleAt(int index, String field) {
            var token = token(index, field);
            try {
                var value = parseDecimal(token);
                if (!Double.isFinite(value)) {
                    throw new FormatException(source, location(), field + " must be finite: '" + token + "'");
                }
                return value;
            } catch (NumberFormatException e) {
                throw new FormatException(source, location(), field + " must be a number: '" + token + "'", e);
            }
        }

        void expectTokens(int count, String what) {
            if (tokens.size() != count) {
                throw new FormatException(source, location(),
                                          String.format("%s expects %d values, found %d", what, count, tokens.size()));
            }
        }

        void expectAtLeast(int count, String what) {
            if (tokens.size() < count) {
                throw new FormatException(source, location(),
                                          String.format("%s expects at least %d values, found %d", what, count,
                                                        tokens.size()));
            }
        }
    }
}
