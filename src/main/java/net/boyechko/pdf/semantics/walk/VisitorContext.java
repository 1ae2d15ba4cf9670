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
package net.boyechko.pdf.semantics.walk;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.List;
import net.boyechko.pdf.semantics.document.DocContext;
import net.boyechko.pdf.semantics.document.StructElemNode;
import net.boyechko.pdf.semantics.document.StructureTree;

/**
 * Immutable context passed to visitors during structure tree traversal. Contains pre-computed
 * information about the current node and its position in the tree.
 */
public record VisitorContext(
        PdfStructElem node,
        StructElemNode element,
        String path,
        /** Structure type as written in /S. */
        String tag,
        /** Structure type after role mapping. */
        String stdName,
        List<PdfStructElem> children,
        /** Depth in the tree (0 = direct child of root). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex,
        DocContext docCtx) {

    public static VisitorContext fromNode(
            PdfStructElem node, String parentPath, int depth, int globalIndex, DocContext docCtx) {
        String tag = node.getRole() != null ? node.getRole().getValue() : "?";
        String stdName = docCtx.standardRole(node.getRole());
        String path = parentPath + tag + "[" + globalIndex + "]";

        return new VisitorContext(
                node,
                new StructElemNode(node, docCtx),
                path,
                tag,
                stdName,
                StructureTree.structKidsOf(node),
                depth,
                globalIndex,
                docCtx);
    }

    public PdfDocument doc() {
        return docCtx.doc();
    }

    public int getPageNumber() {
        return StructureTree.determinePageNumber(docCtx, node);
    }

    public boolean hasStdName(String name) {
        return name.equals(stdName);
    }
}
