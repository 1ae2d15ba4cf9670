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

import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfMcr;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;
import net.boyechko.pdf.semantics.dom.DomNode;

/** A marked-content or object reference kid. It has a location but is not an element. */
public class MarkedContentNode implements DomNode {
    private final IStructureNode kid;
    private final DocContext ctx;

    public MarkedContentNode(IStructureNode kid, DocContext ctx) {
        this.kid = kid;
        this.ctx = ctx;
    }

    @Override
    public DomElement asElement() throws DomAccessException {
        throw new DomAccessException(describe() + " is not a structure element");
    }

    @Override
    public void scrollIntoView() throws DomAccessException {
        int page = 0;
        if (kid instanceof PdfMcr mcr) {
            try {
                page = StructureTree.pageOf(mcr, ctx.doc());
            } catch (RuntimeException e) {
                throw new DomAccessException("Failed to resolve page of " + describe(), e);
            }
        }
        if (page <= 0) {
            throw new DomAccessException("Cannot determine the page of " + describe());
        }
        ctx.navigator().showPage(page);
    }

    private String describe() {
        if (kid instanceof PdfObjRef) {
            return "Object reference";
        } else if (kid instanceof PdfMcr mcr) {
            return "Marked content MCID " + mcr.getMcid();
        }
        return "Unknown structure kid";
    }
}
