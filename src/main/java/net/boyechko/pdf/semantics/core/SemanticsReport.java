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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.semantics.role.SemanticRole;

/** The semantics of every structure element in a document, in traversal order. */
public class SemanticsReport {
    private final List<NodeSemantics> nodes;
    private final boolean tagged;

    public SemanticsReport(List<NodeSemantics> nodes, boolean tagged) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.tagged = tagged;
    }

    /** A report for a document without a structure tree. */
    public static SemanticsReport untagged() {
        return new SemanticsReport(List.of(), false);
    }

    public boolean isTagged() {
        return tagged;
    }

    public List<NodeSemantics> nodes() {
        return nodes;
    }

    public int elementCount() {
        return nodes.size();
    }

    public List<NodeSemantics> formulas() {
        return nodes.stream().filter(NodeSemantics::isFormula).toList();
    }

    /** Formulas for which no MathML could be produced. */
    public List<NodeSemantics> unresolvedFormulas() {
        return nodes.stream().filter(n -> n.isFormula() && n.math() == null).toList();
    }

    public List<NodeSemantics> withRole(SemanticRole role) {
        return nodes.stream().filter(n -> n.is(role)).toList();
    }

    /** Counts of classified elements per role, in role declaration order. */
    public Map<SemanticRole, Integer> countsByRole() {
        Map<SemanticRole, Integer> counts = new EnumMap<>(SemanticRole.class);
        for (NodeSemantics node : nodes) {
            node.role().ifPresent(info -> counts.merge(info.role(), 1, Integer::sum));
        }
        return counts;
    }

    public int unclassifiedCount() {
        return (int) nodes.stream().filter(n -> !n.isClassified()).count();
    }
}
