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
package net.boyechko.pdf.semantics.dom;

/**
 * Handle to a node of a tagged document tree. The tree is owned elsewhere and may change between
 * calls, so every query can fail.
 */
public interface DomNode {

    /**
     * Narrows this node to a structure element.
     *
     * @throws DomAccessException if the node is not an element or no longer resolves
     */
    DomElement asElement() throws DomAccessException;

    /** Brings the node's location into view. */
    void scrollIntoView() throws DomAccessException;
}
