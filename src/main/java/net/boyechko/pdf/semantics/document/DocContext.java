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
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Provides access to the document, its role map and per-page caches. */
public class DocContext {
    /** Role maps may chain (custom -> custom -> standard); longer chains are treated as broken. */
    private static final int MAX_ROLE_MAP_DEPTH = 16;

    private final PdfDocument doc;
    private final Map<Integer, Integer> objectToPageMapping;
    private final Map<Integer, Map<Integer, String>> mcidTextCache;
    private PageNavigator navigator = PageNavigator.NONE;

    public DocContext(PdfDocument doc) {
        this.doc = doc;
        this.objectToPageMapping = buildObjectToPageMapping(doc);
        this.mcidTextCache = new HashMap<>();
    }

    public PdfDocument doc() {
        return doc;
    }

    public PageNavigator navigator() {
        return navigator;
    }

    public DocContext withNavigator(PageNavigator navigator) {
        this.navigator = navigator != null ? navigator : PageNavigator.NONE;
        return this;
    }

    /** Returns the page number for a given object number based on the object-to-page mapping. */
    public int getPageNumber(int objectNumber) {
        return objectToPageMapping.getOrDefault(objectNumber, 0);
    }

    /** Returns all MCID text for a page, extracting on first access. */
    public Map<Integer, String> getMcidText(int pageNum) {
        return mcidTextCache.computeIfAbsent(
                pageNum, k -> McidTextExtractor.extractTextForPage(doc.getPage(pageNum)));
    }

    /**
     * Resolves a structure type through the role map until it is no longer mapped. Returns the
     * last name reached if the map loops or is too deep.
     */
    public String standardRole(PdfName role) {
        if (role == null) {
            return null;
        }
        PdfStructTreeRoot root = doc.getStructTreeRoot();
        PdfDictionary roleMap = root != null ? root.getRoleMap() : null;
        if (roleMap == null) {
            return role.getValue();
        }

        PdfName current = role;
        Set<PdfName> seen = new HashSet<>();
        for (int i = 0; i < MAX_ROLE_MAP_DEPTH && seen.add(current); i++) {
            PdfName mapped = roleMap.getAsName(current);
            if (mapped == null) {
                break;
            }
            current = mapped;
        }
        return current.getValue();
    }

    private Map<Integer, Integer> buildObjectToPageMapping(PdfDocument document) {
        Map<Integer, Integer> mapping = new HashMap<>();
        PdfStructTreeRoot root = document.getStructTreeRoot();

        if (root != null && root.getKids() != null) {
            for (IStructureNode child : root.getKids()) {
                buildMappingRecursive(child, document, mapping);
            }
        }

        return mapping;
    }

    private void buildMappingRecursive(
            IStructureNode node, PdfDocument document, Map<Integer, Integer> mapping) {
        if (node instanceof PdfStructElem structElem) {
            // Children first so their page info is available
            if (structElem.getKids() != null) {
                for (IStructureNode child : structElem.getKids()) {
                    buildMappingRecursive(child, document, mapping);
                }
            }

            int objNum = StructureTree.objNumber(structElem);
            int pageNum = pageFromDictionaries(structElem, document);
            if (objNum >= 0 && pageNum > 0) {
                mapping.put(objNum, pageNum);
            }
        }
    }

    private int pageFromDictionaries(PdfStructElem node, PdfDocument document) {
        PdfDictionary pg = node.getPdfObject().getAsDictionary(PdfName.Pg);
        if (pg != null) {
            return document.getPageNumber(pg);
        }

        if (node.getKids() != null) {
            for (IStructureNode child : node.getKids()) {
                if (child instanceof PdfStructElem childElem) {
                    int childPage = pageFromDictionaries(childElem, document);
                    if (childPage > 0) {
                        return childPage;
                    }
                }
            }
        }

        return 0;
    }
}
