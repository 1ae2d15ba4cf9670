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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfMcr;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;
import net.boyechko.pdf.semantics.dom.DomNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A PDF structure element seen through the {@link DomElement} interface. */
public class StructElemNode implements DomElement {
    private static final Logger logger = LoggerFactory.getLogger(StructElemNode.class);

    static final PdfName NSO = new PdfName("NSO");
    static final PdfName NS = new PdfName("NS");
    static final PdfName AF = new PdfName("AF");
    static final String MATHML_MIME_TYPE = "application/mathml+xml";
    static final String FORMULA = "Formula";

    private final PdfStructElem elem;
    private final DocContext ctx;

    public StructElemNode(PdfStructElem elem, DocContext ctx) {
        this.elem = elem;
        this.ctx = ctx;
    }

    /** Wraps any kid of the structure tree; non-element kids cannot be narrowed. */
    public static DomNode wrap(IStructureNode kid, DocContext ctx) {
        if (kid instanceof PdfStructElem structElem) {
            return new StructElemNode(structElem, ctx);
        }
        return new MarkedContentNode(kid, ctx);
    }

    @Override
    public String tagName() throws DomAccessException {
        PdfName role = read("tag name", elem::getRole);
        if (role == null) {
            throw new DomAccessException("Structure element has no /S entry");
        }
        return role.getValue();
    }

    @Override
    public String stdName() throws DomAccessException {
        PdfName role = read("tag name", elem::getRole);
        return read("role map", () -> ctx.standardRole(role));
    }

    @Override
    public String attribute(String name, String namespace) throws DomAccessException {
        PdfName key = new PdfName(name);
        return read(
                "attribute " + name,
                () -> {
                    for (PdfDictionary attributes : attributeDictionaries()) {
                        if (isOwnedBy(attributes, namespace)) {
                            String value = asText(attributes.get(key));
                            if (value != null) {
                                return value;
                            }
                        }
                    }
                    return null;
                });
    }

    @Override
    public int childCount() throws DomAccessException {
        return read(
                "child count",
                () -> {
                    List<IStructureNode> kids = elem.getKids();
                    return kids != null ? kids.size() : 0;
                });
    }

    @Override
    public DomNode childAt(int index) throws DomAccessException {
        IStructureNode kid =
                read(
                        "child " + index,
                        () -> {
                            List<IStructureNode> kids = elem.getKids();
                            if (kids == null || index < 0 || index >= kids.size()) {
                                return null;
                            }
                            return kids.get(index);
                        });
        if (kid == null) {
            throw new DomAccessException("No resolvable child at index " + index);
        }
        return wrap(kid, ctx);
    }

    /**
     * Returns, in order of preference: /ActualText, MathML from an associated file, /Alt for a
     * Formula, the text of the element's own marked content, or /Alt for elements without
     * element children.
     */
    @Override
    public String value() throws DomAccessException {
        return read(
                "value",
                () -> {
                    String actualText = text(elem.getActualText());
                    if (isPresent(actualText)) return actualText;

                    String associated = associatedMathMl();
                    if (isPresent(associated)) return associated;

                    // Formulas prefer their alternate description over glyph text
                    if (FORMULA.equals(ctx.standardRole(elem.getRole()))) {
                        String alt = text(elem.getAlt());
                        if (isPresent(alt)) return alt;
                    }

                    String content = markedContentText();
                    if (isPresent(content)) return content;

                    if (StructureTree.structKidsOf(elem).isEmpty()) {
                        return text(elem.getAlt());
                    }
                    return null;
                });
    }

    @Override
    public String elementId() throws DomAccessException {
        return read("element id", () -> text(elem.getPdfObject().getAsString(PdfName.ID)));
    }

    @Override
    public void scrollIntoView() throws DomAccessException {
        int page = read("page", () -> StructureTree.determinePageNumber(ctx, elem));
        if (page <= 0) {
            throw new DomAccessException("Cannot determine the page of obj #" + objNumber());
        }
        ctx.navigator().showPage(page);
    }

    public int objNumber() {
        return StructureTree.objNumber(elem);
    }

    // --- Attributes ---

    /** /A may be a dictionary or an array of dictionaries, optionally followed by revisions. */
    private List<PdfDictionary> attributeDictionaries() {
        PdfObject attributes = elem.getAttributes(false);
        List<PdfDictionary> out = new ArrayList<>();
        if (attributes instanceof PdfDictionary dict) {
            out.add(dict);
        } else if (attributes instanceof PdfArray array) {
            for (int i = 0; i < array.size(); i++) {
                PdfDictionary dict = array.getAsDictionary(i);
                if (dict != null) {
                    out.add(dict);
                }
            }
        }
        return out;
    }

    /**
     * An attribute dictionary belongs to {@code namespace} if its owner has that name, or if it
     * is owned by NSO and its namespace dictionary has that URI.
     */
    private static boolean isOwnedBy(PdfDictionary attributes, String namespace) {
        PdfName owner = attributes.getAsName(PdfName.O);
        if (owner == null) {
            return false;
        }
        if (owner.getValue().equals(namespace)) {
            return true;
        }
        if (NSO.equals(owner)) {
            PdfDictionary ns = attributes.getAsDictionary(NS);
            String uri = ns != null ? text(ns.getAsString(NS)) : null;
            return namespace.equals(uri);
        }
        return false;
    }

    private static String asText(PdfObject obj) {
        if (obj instanceof PdfString str) {
            return str.toUnicodeString();
        } else if (obj instanceof PdfName name) {
            return name.getValue();
        } else if (obj instanceof PdfNumber number) {
            double d = number.doubleValue();
            return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
        } else if (obj instanceof PdfBoolean bool) {
            return String.valueOf(bool.getValue());
        }
        return null;
    }

    // --- Value ---

    /** Returns MathML from the first associated file that holds MathML, or null. */
    private String associatedMathMl() {
        PdfArray files = elem.getPdfObject().getAsArray(AF);
        if (files == null) {
            return null;
        }
        for (int i = 0; i < files.size(); i++) {
            PdfDictionary fileSpec = files.getAsDictionary(i);
            String math = fileSpec != null ? mathMlFrom(fileSpec) : null;
            if (math != null) {
                return math;
            }
        }
        return null;
    }

    private static String mathMlFrom(PdfDictionary fileSpec) {
        PdfDictionary embedded = fileSpec.getAsDictionary(PdfName.EF);
        if (embedded == null) {
            return null;
        }
        PdfStream stream = embedded.getAsStream(PdfName.UF);
        if (stream == null) {
            stream = embedded.getAsStream(PdfName.F);
        }
        if (stream == null) {
            return null;
        }

        String content = stripXmlDeclaration(new String(stream.getBytes(), StandardCharsets.UTF_8));
        PdfName mimeType = stream.getAsName(PdfName.Subtype);
        String fileName = text(fileSpec.getAsString(PdfName.UF));
        if (fileName == null) {
            fileName = text(fileSpec.getAsString(PdfName.F));
        }

        boolean isMathMl =
                (mimeType != null && MATHML_MIME_TYPE.equals(mimeType.getValue()))
                        || (fileName != null
                                && fileName.toLowerCase(Locale.ROOT).endsWith(".mml"))
                        || content.startsWith("<math");
        return isMathMl ? content : null;
    }

    static String stripXmlDeclaration(String content) {
        String trimmed = content.strip();
        if (trimmed.startsWith("﻿")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.startsWith("<?xml")) {
            int end = trimmed.indexOf("?>");
            if (end >= 0) {
                trimmed = trimmed.substring(end + 2).strip();
            }
        }
        return trimmed;
    }

    private String markedContentText() {
        List<PdfMcr> mcrs = StructureTree.directMcrs(elem);
        if (mcrs.isEmpty()) {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        for (PdfMcr mcr : mcrs) {
            int page = StructureTree.pageOf(mcr, ctx.doc());
            if (page <= 0) {
                continue;
            }
            Map<Integer, String> pageText = ctx.getMcidText(page);
            String text = pageText.get(mcr.getMcid());
            if (isPresent(text)) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(text);
            }
        }
        return sb.toString();
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface PdfQuery<T> {
        T run();
    }

    /** Runs a query against the underlying PDF objects, translating iText failures. */
    private <T> T read(String what, PdfQuery<T> query) throws DomAccessException {
        try {
            return query.run();
        } catch (RuntimeException e) {
            logger.debug("Failed to read {} of obj #{}: {}", what, objNumber(), e.getMessage());
            throw new DomAccessException("Failed to read " + what + ": " + e.getMessage(), e);
        }
    }

    private static String text(PdfString str) {
        return str != null ? str.toUnicodeString() : null;
    }

    private static boolean isPresent(String s) {
        return s != null && !s.isEmpty();
    }

    @Override
    public String toString() {
        PdfName role = elem.getRole();
        return (role != null ? role.getValue() : "?") + " (obj #" + objNumber() + ")";
    }
}
