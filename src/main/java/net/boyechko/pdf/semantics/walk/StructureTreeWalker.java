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

import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.semantics.document.DocContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks the PDF structure tree once, invoking multiple visitors at each node. */
public class StructureTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(StructureTreeWalker.class);

    private final List<StructureTreeVisitor> visitors = new ArrayList<>();

    private DocContext docCtx;
    private int globalIndex;

    public StructureTreeWalker addVisitor(StructureTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    /** Returns the number of structure elements visited. */
    public int walk(PdfStructTreeRoot root, DocContext docCtx) {
        this.docCtx = docCtx;
        this.globalIndex = 0;

        for (StructureTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        List<IStructureNode> kids = root != null ? root.getKids() : null;
        if (kids != null) {
            for (IStructureNode kid : kids) {
                if (kid instanceof PdfStructElem elem) {
                    walkElement(elem, "/", 0);
                }
            }
        }

        for (StructureTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
        }
        return globalIndex;
    }

    private void walkElement(PdfStructElem node, String parentPath, int depth) {
        globalIndex++;

        VisitorContext ctx = VisitorContext.fromNode(node, parentPath, depth, globalIndex, docCtx);

        // Any visitor can keep the walker out of the children
        boolean continueToChildren = true;
        for (StructureTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            for (PdfStructElem child : ctx.children()) {
                walkElement(child, ctx.path() + ".", depth + 1);
            }
        }

        for (StructureTreeVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
