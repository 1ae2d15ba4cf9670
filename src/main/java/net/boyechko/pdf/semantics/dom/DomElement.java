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
 * A structure element of a tagged document tree.
 *
 * <p>String queries return null or an empty string when the element has no such data; they only
 * throw when the element itself cannot be queried.
 */
public interface DomElement extends DomNode {

    /** Returns the element's own tag name, e.g. "Formula" or "mi". */
    String tagName() throws DomAccessException;

    /** Returns the tag name after role mapping to a standard structure type. */
    String stdName() throws DomAccessException;

    /** Returns the value of attribute {@code name} owned by {@code namespace}. */
    String attribute(String name, String namespace) throws DomAccessException;

    int childCount() throws DomAccessException;

    /**
     * Returns the child at {@code index}. The child may be content rather than an element, in
     * which case {@link DomNode#asElement()} on it fails.
     */
    DomNode childAt(int index) throws DomAccessException;

    /** Returns the element's textual value (replacement text or its own content). */
    String value() throws DomAccessException;

    String elementId() throws DomAccessException;

    @Override
    default DomElement asElement() {
        return this;
    }
}
