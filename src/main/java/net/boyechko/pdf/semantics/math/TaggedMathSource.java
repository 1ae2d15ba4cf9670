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

import java.util.Optional;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;
import net.boyechko.pdf.semantics.dom.DomNode;

/**
 * MathML expressed as nested structure elements, one per MathML element, under a {@code math}
 * child of the Formula tag.
 */
public class TaggedMathSource implements MathSource {
    public static final String MATH_TAG = "math";

    private final MathMarkupBuilder builder;

    public TaggedMathSource(MathMarkupBuilder builder) {
        this.builder = builder;
    }

    @Override
    public String name() {
        return "Tagged MathML";
    }

    @Override
    public Optional<MathMarkup> extract(DomElement formula) {
        int count;
        try {
            count = formula.childCount();
        } catch (DomAccessException e) {
            return Optional.empty();
        }

        for (int i = 0; i < count; i++) {
            DomElement child = elementAt(formula, i);
            if (child != null && MATH_TAG.equals(tagOf(child))) {
                // Only the first math child counts.
                return builder.build(child).map(m -> new MathMarkup(m, MathEncoding.TAGGED_TREE));
            }
        }
        return Optional.empty();
    }

    private static DomElement elementAt(DomElement parent, int index) {
        try {
            DomNode node = parent.childAt(index);
            return node != null ? node.asElement() : null;
        } catch (DomAccessException e) {
            return null;
        }
    }

    private static String tagOf(DomElement element) {
        try {
            return element.tagName();
        } catch (DomAccessException e) {
            return null;
        }
    }
}
