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

import java.util.Optional;

/**
 * Result of classifying a structure tag.
 *
 * @param role the semantic role
 * @param headingLevel single digit "1" to "6" for numbered headings; null otherwise
 */
public record RoleInfo(SemanticRole role, String headingLevel) {

    public RoleInfo {
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        if (headingLevel != null && role != SemanticRole.HEADING) {
            throw new IllegalArgumentException("Only headings carry a level, not " + role);
        }
    }

    public static RoleInfo of(SemanticRole role) {
        return new RoleInfo(role, null);
    }

    public static RoleInfo heading(String level) {
        return new RoleInfo(SemanticRole.HEADING, level);
    }

    public Optional<String> level() {
        return Optional.ofNullable(headingLevel);
    }

    public boolean is(SemanticRole other) {
        return role == other;
    }

    @Override
    public String toString() {
        return headingLevel == null ? role.label() : role.label() + " level " + headingLevel;
    }
}
