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
import net.boyechko.pdf.semantics.dom.DomElement;

/** One way a Formula element can carry its MathML. */
public interface MathSource {

    String name();

    /**
     * Extracts MathML from a Formula element. Must not throw: failures to query the tree mean
     * "not found here".
     *
     * @return the markup, or empty to let the next source try
     */
    Optional<MathMarkup> extract(DomElement formula);
}
