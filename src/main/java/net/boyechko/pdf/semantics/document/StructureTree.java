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
package net.boyechko.pdf.semantics.document;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfMcr;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.ArrayList;
import java.util.List;

/** Utilities for navigating the PDF structure tree. */
public final class StructureTree {

    private StructureTree() {}

    /** Returns the PDF object number for a structure element, or -1 if unavailable. */
    public static int objNumber(PdfStructElem elem) {
        var ref = elem.getPdfObject().getIndirectReference();
        return ref != null ? ref.getObjNumber() : -1;
    }

    /**
     * Returns the children of a structure element, or an empty list if no children are available.
     */
    public static List<PdfStructElem> structKidsOf(IStructureNode n) {
        List<IStructureNode> kids = n.getKids();
        if (kids == null) return List.of();

        List<PdfStructElem> out = new ArrayList<>();
        for (IStructureNode k : kids) {
            if (k instanceof PdfStructElem) {
                out.add((PdfStructElem) k);
            }
        }
        return out;
    }

    /** Returns the element's own marked-content references, skipping object references. */
    public static List<PdfMcr> directMcrs(PdfStructElem elem) {
        List<IStructureNode> kids = elem.getKids();
        if (kids == null) return List.of();

        List<PdfMcr> out = new ArrayList<>();
        for (IStructureNode kid : kids) {
            if (kid instanceof PdfMcr mcr && !(kid instanceof PdfObjRef) && mcr.getMcid() >= 0) {
                out.add(mcr);
            }
        }
        return out;
    }

    /** Returns the page number of a marked-content reference, or 0 if unknown. */
    public static int pageOf(PdfMcr mcr, PdfDocument doc) {
        PdfDictionary pageDict = mcr.getPageObject();
        return pageDict != null ? Math.max(doc.getPageNumber(pageDict), 0) : 0;
    }

    /** Determines the page number for a structure element, using cache then recursion. */
    public static int determinePageNumber(DocContext ctx, PdfStructElem elem) {
        PdfDictionary pg = elem.getPdfObject().getAsDictionary(PdfName.Pg);
        if (pg != null) {
            int pageNum = ctx.doc().getPageNumber(pg);
            if (pageNum > 0) return pageNum;
        }

        int objNum = objNumber(elem);
        if (objNum >= 0) {
            int pageNum = ctx.getPageNumber(objNum);
            if (pageNum > 0) return pageNum;
        }

        List<IStructureNode> kids = elem.getKids();
        if (kids == null) return 0;

        // First kid that knows its page wins
        for (IStructureNode kid : kids) {
            int pageNum = 0;
            if (kid instanceof PdfStructElem childElem) {
                pageNum = determinePageNumber(ctx, childElem);
            } else if (kid instanceof PdfMcr mcr) {
                pageNum = pageOf(mcr, ctx.doc());
            }
            if (pageNum > 0) return pageNum;
        }
        return 0;
    }
}
