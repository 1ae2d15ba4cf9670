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

import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;
import net.boyechko.pdf.semantics.dom.DomNode;

/**
 * Serializes a tree of MathML-tagged structure elements back into MathML.
 *
 * <p>Elements whose own tag cannot be read are dropped together with their subtree; any other
 * failed query just leaves that piece out. The output therefore always stays well-formed.
 */
public class MathMarkupBuilder {

    /** Owner name for attributes that belong to a namespace (PDF 2.0 NSO). */
    public static final String ATTRIBUTE_NAMESPACE = "NSO";

    private final MathAttributes attributes;

    public MathMarkupBuilder() {
        this(MathAttributes.loadDefault());
    }

    public MathMarkupBuilder(MathAttributes attributes) {
        this.attributes = attributes;
    }

    /**
     * Builds the markup for {@code element} and its descendants.
     *
     * @return the markup, or empty if the element's tag name cannot be read
     */
    public Optional<String> build(DomElement element) {
        String tag;
        try {
            tag = element.tagName();
        } catch (DomAccessException e) {
            return Optional.empty();
        }
        if (!MarkupText.isPresent(tag)) {
            return Optional.empty();
        }

        StringBuilder sb = new StringBuilder();
        sb.append('<').append(tag);

        String id = readId(element);
        if (MarkupText.isPresent(id)) {
            appendAttribute(sb, "id", id);
        }
        // The tree has no way to list attributes, so only the known ones are queried.
        appendAttributes(sb, element, attributes.allowedOn(tag));
        sb.append('>');

        String value = readValue(element);
        if (MarkupText.isPresent(value)) {
            sb.append(value);
        } else {
            appendChildren(sb, element);
        }

        return Optional.of(sb.append("</").append(tag).append('>').toString());
    }

    private void appendChildren(StringBuilder sb, DomElement element) {
        int count;
        try {
            count = element.childCount();
        } catch (DomAccessException e) {
            return;
        }
        for (int i = 0; i < count; i++) {
            DomElement child;
            try {
                DomNode node = element.childAt(i);
                child = node != null ? node.asElement() : null;
            } catch (DomAccessException e) {
                continue;
            }
            if (child != null) {
                build(child).ifPresent(sb::append);
            }
        }
    }

    private void appendAttributes(StringBuilder sb, DomElement element, List<String> names) {
        for (String name : names) {
            String value;
            try {
                value = element.attribute(name, ATTRIBUTE_NAMESPACE);
            } catch (DomAccessException e) {
                continue;
            }
            if (MarkupText.isPresent(value)) {
                appendAttribute(sb, name, value);
            }
        }
    }

    private static void appendAttribute(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"").append(MarkupText.escape(value)).append('"');
    }

    private static String readId(DomElement element) {
        try {
            return element.elementId();
        } catch (DomAccessException e) {
            return null;
        }
    }

    private static String readValue(DomElement element) {
        try {
            return element.value();
        } catch (DomAccessException e) {
            return null;
        }
    }
}
