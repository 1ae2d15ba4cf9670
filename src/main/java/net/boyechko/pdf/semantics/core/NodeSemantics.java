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
package net.boyechko.pdf.semantics.core;

import java.util.Optional;
import net.boyechko.pdf.semantics.math.MathMarkup;
import net.boyechko.pdf.semantics.role.RoleInfo;
import net.boyechko.pdf.semantics.role.SemanticRole;

/**
 * What was learned about one structure element.
 *
 * @param path position in the tree, e.g. {@code /Document[1].H2[2]}
 * @param tag structure type as written in the document
 * @param stdName structure type after role mapping
 * @param depth 0 for direct children of the root
 * @param index 1-based traversal order
 * @param roleInfo classification, or null if the element has no semantic role
 * @param math reconstructed MathML, or null for non-formulas and formulas with no recoverable math
 * @param page 1-based page number, or 0 if unknown or not located
 */
public record NodeSemantics(
        String path,
        String tag,
        String stdName,
        int depth,
        int index,
        RoleInfo roleInfo,
        MathMarkup math,
        int page) {

    public Optional<RoleInfo> role() {
        return Optional.ofNullable(roleInfo);
    }

    public Optional<MathMarkup> mathMarkup() {
        return Optional.ofNullable(math);
    }

    public boolean isClassified() {
        return roleInfo != null;
    }

    public boolean is(SemanticRole role) {
        return roleInfo != null && roleInfo.is(role);
    }

    public boolean isFormula() {
        return is(SemanticRole.MATH);
    }

    public String roleLabel() {
        return roleInfo != null ? roleInfo.toString() : "-";
    }
}
