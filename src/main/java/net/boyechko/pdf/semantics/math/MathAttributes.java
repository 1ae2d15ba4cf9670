/*
 * PDF-Semantics - Accessible roles and MathML from tagged PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.semantics.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Which MathML attributes are copied for each element name. Loaded once from a YAML table; see
 * {@code /mathml-attributes.yaml}.
 */
public final class MathAttributes {
    private static final String DEFAULT_TABLE_RESOURCE = "/mathml-attributes.yaml";
    private static final Logger logger = LoggerFactory.getLogger(MathAttributes.class);

    private static volatile MathAttributes defaultTable;

    private final List<String> universal;
    private final Map<String, List<String>> perElement;

    /** Bean shape of the YAML resource. */
    public static final class Table {
        public List<String> universal;
        public Map<String, List<String>> elements;
    }

    private MathAttributes(List<String> universal, Map<String, List<String>> perElement) {
        this.universal = universal;
        this.perElement = perElement;
    }

    /**
     * Load a table from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static MathAttributes fromResource(String resourcePath) {
        try (var inputStream = MathAttributes.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(Table.class, new LoaderOptions()));
            Table table = yaml.load(inputStream);
            MathAttributes attributes = fromTable(table);

            logger.debug(
                    "Loaded MathML attributes for {} elements from resource {}",
                    attributes.elements().size(),
                    resourcePath);
            return attributes;
        } catch (Exception e) {
            logger.error(
                    "Failed to load MathML attributes from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load MathML attributes from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Returns the bundled table, loading it on first use. */
    public static MathAttributes loadDefault() {
        MathAttributes table = defaultTable;
        if (table == null) {
            synchronized (MathAttributes.class) {
                table = defaultTable;
                if (table == null) {
                    table = fromResource(DEFAULT_TABLE_RESOURCE);
                    defaultTable = table;
                }
            }
        }
        return table;
    }

    static MathAttributes fromTable(Table table) {
        if (table == null) {
            throw new IllegalArgumentException("Attribute table is empty");
        }
        List<String> universal = table.universal != null ? table.universal : List.of();
        Map<String, List<String>> perElement = new LinkedHashMap<>();
        if (table.elements != null) {
            for (Map.Entry<String, List<String>> entry : table.elements.entrySet()) {
                List<String> names = entry.getValue() != null ? entry.getValue() : List.of();
                perElement.put(entry.getKey(), List.copyOf(names));
            }
        }
        return new MathAttributes(List.copyOf(universal), Collections.unmodifiableMap(perElement));
    }

    /** Attributes queried on every element, in output order. */
    public List<String> universal() {
        return universal;
    }

    /** Element-specific attributes for {@code tagName}, in output order; empty if none. */
    public List<String> specificTo(String tagName) {
        return perElement.getOrDefault(tagName, List.of());
    }

    /** Every attribute that may appear on {@code tagName}, universal ones first. */
    public List<String> allowedOn(String tagName) {
        List<String> all = new ArrayList<>(universal);
        all.addAll(specificTo(tagName));
        return all;
    }

    /** Element name to its specific attributes, in table order. */
    Map<String, List<String>> elements() {
        return perElement;
    }
}
