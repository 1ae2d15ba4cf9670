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
package net.boyechko.pdf.semantics.role;

/** Accessibility-facing roles that structure tags can be classified into. */
public enum SemanticRole {
    SECTION("section"),
    BLOCKQUOTE("block quote"),
    CAPTION("caption"),
    LIST("list"),
    LISTITEM("list item"),
    LABEL("label"),
    PARAGRAPH("paragraph"),
    HEADING("heading"),
    MATH("math");

    private final String label;

    SemanticRole(String label) {
        this.label = label;
    }

    /** Returns the human-readable name, as a screen reader would announce it. */
    public String label() {
        return label;
    }
}
