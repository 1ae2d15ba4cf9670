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

import java.util.Map;
import java.util.Optional;

/**
 * Maps standard structure type names onto semantic roles.
 *
 * <p>Only the tags below are recognized. Table, TR, TH, TD, form fields and the inline types
 * (Span, Quote, Note, Reference, Code, Figure...) are left to the caller's own role source.
 */
public final class RoleClassifier {

    // Part, Art, TOC, TOCI, Index, NonStruct, Private and LBody are deliberately absent.
    private static final Map<String, SemanticRole> STANDARD_ROLES =
            Map.of(
                    "Sect", SemanticRole.SECTION,
                    "Div", SemanticRole.SECTION,
                    "BlockQuote", SemanticRole.BLOCKQUOTE,
                    "Caption", SemanticRole.CAPTION,
                    "L", SemanticRole.LIST,
                    "LI", SemanticRole.LISTITEM,
                    "Lbl", SemanticRole.LABEL,
                    "P", SemanticRole.PARAGRAPH,
                    "H", SemanticRole.HEADING,
                    "Formula", SemanticRole.MATH);

    private RoleClassifier() {}

    /**
     * Classifies a standard structure type name.
     *
     * @param stdName the structure type, after role mapping; may be null or empty
     * @return the role, with a heading level for names from H1 to H6; empty if the tag is not recognized
     */
    public static Optional<RoleInfo> classify(String stdName) {
        if (stdName == null || stdName.isEmpty()) {
            return Optional.empty();
        }
        // Checked before the table so that H1..H6 never fall through to the bare "H" entry.
        if (isNumberedHeading(stdName)) {
            return Optional.of(RoleInfo.heading(stdName.substring(1, 2)));
        }
        SemanticRole role = STANDARD_ROLES.get(stdName);
        return role != null ? Optional.of(RoleInfo.of(role)) : Optional.empty();
    }

    /** Lexicographic range check, so "H10" and "H1a" count as level-1 headings. */
    private static boolean isNumberedHeading(String name) {
        return name.compareTo("H1") >= 0 && name.compareTo("H6") <= 0;
    }
}
