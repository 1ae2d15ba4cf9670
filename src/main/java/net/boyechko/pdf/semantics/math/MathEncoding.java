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

/** Where the MathML of a formula was found. */
public enum MathEncoding {
    /** Microsoft Office's MSFT_MathML attribute on the Formula tag. */
    VENDOR_ATTRIBUTE("Office MathML attribute"),

    /** A tree of structure elements tagged with MathML element names. */
    TAGGED_TREE("tagged MathML"),

    /** MathML carried as the Formula's value, e.g. from an associated file. */
    EMBEDDED_MATHML("embedded MathML"),

    /** No MathML at all; the value was wrapped as alternative text. */
    ALT_TEXT("alt text");

    private final String label;

    MathEncoding(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
