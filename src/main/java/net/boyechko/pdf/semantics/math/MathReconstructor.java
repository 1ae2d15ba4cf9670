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
import net.boyechko.pdf.semantics.dom.DomElement;

/**
 * Produces the MathML for a Formula element.
 *
 * <p>A tagged PDF can carry math in three ways, tried in this order:
 *
 * <ol>
 *   <li>as the MSFT_MathML attribute written by Microsoft Office;
 *   <li>as nested structure elements named after MathML elements;
 *   <li>as the Formula's value, either MathML (from an associated file) or plain alt text.
 * </ol>
 *
 * The first source that yields markup wins.
 */
public class MathReconstructor {
    private final List<MathSource> sources;

    public MathReconstructor() {
        this(MathAttributes.loadDefault());
    }

    public MathReconstructor(MathAttributes attributes) {
        this(defaultSources(new MathMarkupBuilder(attributes)));
    }

    public MathReconstructor(List<MathSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public static List<MathSource> defaultSources(MathMarkupBuilder builder) {
        return List.of(
                new VendorAttributeSource(),
                new TaggedMathSource(builder),
                new ValueFallbackSource());
    }

    /**
     * Reconstructs the MathML of {@code formula}.
     *
     * @param formula a Formula-tagged element; may be null
     * @return the markup and its encoding, or empty if the node is null or no source applies
     */
    public Optional<MathMarkup> reconstruct(DomElement formula) {
        if (formula == null) {
            return Optional.empty();
        }
        for (MathSource source : sources) {
            Optional<MathMarkup> markup = source.extract(formula);
            if (markup.isPresent()) {
                return markup;
            }
        }
        return Optional.empty();
    }

    /** Same as {@link #reconstruct} but returns the markup string alone. */
    public Optional<String> reconstructMath(DomElement formula) {
        return reconstruct(formula).map(MathMarkup::markup);
    }

    public List<MathSource> sources() {
        return sources;
    }
}
