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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable options for the UBC readers.
 * <p>
 * Options can be built programmatically or loaded from the classpath resource {@value #CONFIG_RESOURCE}:
 * <pre>
 * {
 *   "commentMarker": "!",
 *   "defaultDataName": "Data",
 *   "charset": "UTF-8"
 * }
 * </pre>
 * Missing keys keep their defaults.
 *
 * @author hal.hildebrand
 */
public final class UbcReaderConfiguration {
    public static final  String CONFIG_RESOURCE = "/ubc-reader.json";
    private static final Logger log             = LoggerFactory.getLogger(UbcReaderConfiguration.class);

    private final char    commentMarker;
    private final String  defaultDataName;
    private final Charset charset;

    private UbcReaderConfiguration(Builder builder) {
        this.commentMarker = builder.commentMarker;
        this.defaultDataName = builder.defaultDataName;
        this.charset = builder.charset;
    }

    /**
     * {@code !} comments, {@code Data} as the fallback attribute name, UTF-8.
     */
    public static UbcReaderConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Load the configuration resource from the classpath, falling back to {@link #defaultConfig()} when it is absent
     * or unreadable.
     */
    public static UbcReaderConfiguration load() {
        try (InputStream is = UbcReaderConfiguration.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                log.debug("Reader configuration {} not found, using defaults", CONFIG_RESOURCE);
                return defaultConfig();
            }
            var config = load(is);
            log.info("Loaded reader configuration {}: {}", CONFIG_RESOURCE, config);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load reader configuration {}, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
            return defaultConfig();
        }
    }

    /**
     * Parse a JSON configuration document.
     *
     * @throws IOException              if the stream is not valid JSON
     * @throws IllegalArgumentException if a value is invalid
     */
    public static UbcReaderConfiguration load(InputStream json) throws IOException {
        var root = new ObjectMapper().readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Reader configuration must be a JSON object");
        }
        var builder = new Builder();
        var marker = text(root, "commentMarker");
        if (marker != null) {
            if (marker.length() != 1) {
                throw new IllegalArgumentException("commentMarker must be a single character: '" + marker + "'");
            }
            builder.withCommentMarker(marker.charAt(0));
        }
        var dataName = text(root, "defaultDataName");
        if (dataName != null) {
            builder.withDefaultDataName(dataName);
        }
        var charset = text(root, "charset");
        if (charset != null) {
            builder.withCharset(Charset.forName(charset));
        }
        return builder.build();
    }

    private static String text(JsonNode root, String field) {
        var node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    public char getCommentMarker() {
        return commentMarker;
    }

    public String getDefaultDataName() {
        return defaultDataName;
    }

    public Charset getCharset() {
        return charset;
    }

    @Override
    public String toString() {
        return String.format("UbcReaderConfiguration[commentMarker=%s, defaultDataName=%s, charset=%s]", commentMarker,
                             defaultDataName, charset);
    }

    public static class Builder {
        private char    commentMarker   = '!';
        private String  defaultDataName = "Data";
        private Charset charset         = StandardCharsets.UTF_8;

        public Builder withCommentMarker(char commentMarker) {
            if (Character.isWhitespace(commentMarker) || Character.isDigit(commentMarker)) {
                throw new IllegalArgumentException("Invalid comment marker: '" + commentMarker + "'");
            }
            this.commentMarker = commentMarker;
            return this;
        }

        public Builder withDefaultDataName(String defaultDataName) {
            if (defaultDataName == null || defaultDataName.isBlank()) {
                throw new IllegalArgumentException("Default data name must not be blank");
            }
            this.defaultDataName = defaultDataName;
            return this;
        }

        public Builder withCharset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public UbcReaderConfiguration build() {
            return new UbcReaderConfiguration(this);
        }
    }
}
