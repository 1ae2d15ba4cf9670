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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import net.boyechko.pdf.semantics.PdfTestBase;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;
import net.boyechko.pdf.semantics.dom.DomNode;
import net.boyechko.pdf.semantics.math.MathEncoding;
import net.boyechko.pdf.semantics.math.MathMarkup;
import net.boyechko.pdf.semantics.math.MathReconstructor;
import org.junit.jupiter.api.Test;

class StructElemNodeTest extends PdfTestBase {

    private static StructElemNode node(PdfDocument pdfDoc, String role) {
        PdfStructElem elem = findFirstByRole(pdfDoc.getStructTreeRoot(), role);
        assertNotNull(elem, "No " + role + " element in test PDF");
        return new StructElemNode(elem, new DocContext(pdfDoc));
    }

    @Test
    void tagNameIsTheRawTypeAndStdNameFollowsTheRoleMap() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            pdfDoc.getStructTreeRoot().addRoleMapping("Equation", "MathBlock");
                            pdfDoc.getStructTreeRoot().addRoleMapping("MathBlock", "Formula");
                            addElement(pdfDoc, document, "Equation");
                            addElement(pdfDoc, document, "P");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            StructElemNode equation = node(pdfDoc, "Equation");
            assertEquals("Equation", equation.tagName());
            assertEquals("Formula", equation.stdName());
            assertEquals("P", node(pdfDoc, "P").stdName());
        }
    }

    @Test
    void attributesAreMatchedByOwnerOrNamespaceUri() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem mi = addLeaf(pdfDoc, document, "mi", "x");
                            setMathAttributes(mi, "mathvariant", "bold", "intent", "velocity");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            StructElemNode mi = node(pdfDoc, "mi");
            assertEquals("bold", mi.attribute("mathvariant", "NSO"));
            assertEquals("velocity", mi.attribute("intent", MATHML_NS));
            assertNull(mi.attribute("mathvariant", "Layout"));
            assertNull(mi.attribute("arg", "NSO"));
        }
    }

    @Test
    void attributeArraysSkipRevisionNumbersAndConvertScalars() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem mspace = addElement(pdfDoc, document, "mspace");
                            PdfDictionary layout = new PdfDictionary();
                            layout.put(PdfName.O, PdfName.Layout);
                            layout.put(new PdfName("width"), new PdfNumber(10));
                            PdfDictionary nso = new PdfDictionary();
                            nso.put(PdfName.O, new PdfName("NSO"));
                            nso.put(new PdfName("width"), new PdfNumber(2.5));
                            nso.put(new PdfName("depth"), new PdfNumber(3));
                            nso.put(new PdfName("linebreak"), new PdfName("newline"));
                            nso.put(new PdfName("displaystyle"), PdfBoolean.TRUE);
                            mspace.setAttributes(
                                    new PdfArray(List.of(layout, new PdfNumber(0), nso)));
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            StructElemNode mspace = node(pdfDoc, "mspace");
            assertEquals("2.5", mspace.attribute("width", "NSO"));
            assertEquals("3", mspace.attribute("depth", "NSO"));
            assertEquals("newline", mspace.attribute("linebreak", "NSO"));
            assertEquals("true", mspace.attribute("displaystyle", "NSO"));
            assertEquals("10", mspace.attribute("width", "Layout"));
        }
    }

    @Test
    void vendorAttributeIsReadFromItsOwner() throws Exception {
        String office = "<mml:math><mml:mi>x</mml:mi></mml:math>";
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            PdfDictionary msft = new PdfDictionary();
                            msft.put(PdfName.O, new PdfName("MSFT_Office"));
                            msft.put(new PdfName("MSFT_MathML"), new PdfString(office));
                            formula.setAttributes(msft);
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals(office, node(pdfDoc, "Formula").attribute("MSFT_MathML", "MSFT_Office"));
        }
    }

    @Test
    void actualTextWinsOverEverythingElse() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            formula.setActualText(new PdfString("x squared"));
                            formula.setAlt(new PdfString("alt"));
                            addMarkedText(page, formula, "x2", 700);
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("x squared", node(pdfDoc, "Formula").value());
        }
    }

    @Test
    void markedContentTextIsTheValueOfItsOwner() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem mi = addElement(pdfDoc, document, "mi");
                            addMarkedText(page, mi, "Hypotenuse", 700);
                            mi.setAlt(new PdfString("ignored"));
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("Hypotenuse", node(pdfDoc, "mi").value());
        }
    }

    @Test
    void formulaAltWinsOverItsGlyphs() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            pdfDoc.getStructTreeRoot().addRoleMapping("Equation", "Formula");
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            formula.setAlt(new PdfString("x squared"));
                            addMarkedText(page, formula, "x2", 700);
                            PdfStructElem equation = addElement(pdfDoc, document, "Equation");
                            equation.setAlt(new PdfString("y cubed"));
                            addMarkedText(page, equation, "y3", 680);
                            PdfStructElem unlabeled = addElement(pdfDoc, document, "Formula");
                            addMarkedText(page, unlabeled, "z4", 660);
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            StructElemNode formula = node(pdfDoc, "Formula");
            assertEquals("x squared", formula.value());
            assertEquals(
                    "<math><mtext>x squared</mtext></math>",
                    new MathReconstructor().reconstruct(formula).orElseThrow().markup());
            assertEquals("y cubed", node(pdfDoc, "Equation").value());

            PdfStructElem unlabeled =
                    findAllByRole(pdfDoc.getStructTreeRoot(), "Formula").get(1);
            assertEquals("z4", new StructElemNode(unlabeled, new DocContext(pdfDoc)).value());
        }
    }

    @Test
    void altIsUsedOnlyWithoutStructureChildren() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem leaf = addElement(pdfDoc, document, "Formula");
                            leaf.setAlt(new PdfString("E equals m c squared"));
                            PdfStructElem parent = addElement(pdfDoc, document, "Div");
                            parent.setAlt(new PdfString("container"));
                            addElement(pdfDoc, parent, "P");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("E equals m c squared", node(pdfDoc, "Formula").value());
            assertNull(node(pdfDoc, "Div").value());
        }
    }

    @Test
    void associatedMathMlFileBecomesTheValue() throws Exception {
        String mathml =
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                        + "<math xmlns:mml=\"http://www.w3.org/1998/Math/MathML\"><mi>y</mi></math>";
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            formula.setAlt(new PdfString("y"));
                            attachFile(pdfDoc, formula, "formula.mml", mathml, null);
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            StructElemNode formula = node(pdfDoc, "Formula");
            assertEquals(
                    "<math xmlns:mml=\"http://www.w3.org/1998/Math/MathML\"><mi>y</mi></math>",
                    formula.value());

            MathMarkup markup = new MathReconstructor().reconstruct(formula).orElseThrow();
            assertEquals("<math ><mi>y</mi></math>", markup.markup());
            assertEquals(MathEncoding.EMBEDDED_MATHML, markup.encoding());
        }
    }

    @Test
    void mathMlFileNameMatchIgnoresCaseAndDefaultLocale() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            attachFile(pdfDoc, formula, "EQUATION.MML", "<mrow/>", null);
                        });

        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("<mrow/>", node(pdfDoc, "Formula").value());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void associatedFilesThatAreNotMathMlAreIgnored() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            formula.setAlt(new PdfString("y"));
                            attachFile(pdfDoc, formula, "source.tex", "y", "application/x-tex");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("y", node(pdfDoc, "Formula").value());
        }
    }

    @Test
    void elementIdIsReadFromId() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem mi = addLeaf(pdfDoc, document, "mi", "x");
                            mi.getPdfObject().put(PdfName.ID, new PdfString("eq-1"));
                            addLeaf(pdfDoc, document, "mo", "+");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            assertEquals("eq-1", node(pdfDoc, "mi").elementId());
            assertNull(node(pdfDoc, "mo").elementId());
        }
    }

    @Test
    void markedContentKidsAreNodesButNotElements() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem p = addElement(pdfDoc, document, "P");
                            addMarkedText(page, p, "before", 700);
                            addElement(pdfDoc, p, "Span");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            List<Integer> shown = new ArrayList<>();
            DocContext ctx = new DocContext(pdfDoc).withNavigator(shown::add);
            StructElemNode p =
                    new StructElemNode(findFirstByRole(pdfDoc.getStructTreeRoot(), "P"), ctx);

            assertEquals(2, p.childCount());
            DomNode mcr = p.childAt(0);
            assertThrows(DomAccessException.class, mcr::asElement);
            mcr.scrollIntoView();
            assertEquals(List.of(1), shown);

            DomElement span = p.childAt(1).asElement();
            assertEquals("Span", span.tagName());
            assertThrows(DomAccessException.class, () -> p.childAt(2));
        }
    }

    @Test
    void scrollIntoViewShowsThePageOrFails() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem p = addElement(pdfDoc, document, "P");
                            addMarkedText(page, p, "located", 700);
                            addElement(pdfDoc, document, "Div");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            List<Integer> shown = new ArrayList<>();
            DocContext ctx = new DocContext(pdfDoc).withNavigator(shown::add);

            new StructElemNode(findFirstByRole(pdfDoc.getStructTreeRoot(), "P"), ctx)
                    .scrollIntoView();
            assertEquals(List.of(1), shown);

            StructElemNode nowhere =
                    new StructElemNode(findFirstByRole(pdfDoc.getStructTreeRoot(), "Div"), ctx);
            assertThrows(DomAccessException.class, nowhere::scrollIntoView);
        }
    }

    @Test
    void taggedMathMlIsReconstructedFromAPdf() throws Exception {
        Path pdf =
                createStructuredPdf(
                        (pdfDoc, page, document) -> {
                            PdfStructElem formula = addElement(pdfDoc, document, "Formula");
                            formula.setAlt(new PdfString("x squared plus one"));
                            PdfStructElem math = addElement(pdfDoc, formula, "math");
                            PdfStructElem mrow = addElement(pdfDoc, math, "mrow");
                            PdfStructElem msup = addElement(pdfDoc, mrow, "msup");
                            PdfStructElem mi = addLeaf(pdfDoc, msup, "mi", "x");
                            setMathAttributes(mi, "mathvariant", "italic", "color", "red");
                            addLeaf(pdfDoc, msup, "mn", "2");
                            PdfStructElem mo = addElement(pdfDoc, mrow, "mo");
                            addMarkedText(page, mo, "+", 700);
                            addLeaf(pdfDoc, mrow, "mn", "1");
                        });

        try (PdfDocument pdfDoc = openForReading(pdf)) {
            Optional<MathMarkup> markup =
                    new MathReconstructor().reconstruct(node(pdfDoc, "Formula"));

            assertEquals(
                    "<math><mrow><msup><mi mathvariant=\"italic\">x</mi><mn>2</mn></msup>"
                            + "<mo>+</mo><mn>1</mn></mrow></math>",
                    markup.orElseThrow().markup());
            assertEquals(MathEncoding.TAGGED_TREE, markup.get().encoding());
        }
    }

    private static void attachFile(
            PdfDocument pdfDoc, PdfStructElem elem, String name, String content, String mime) {
        PdfStream stream = new PdfStream(content.getBytes(StandardCharsets.UTF_8));
        stream.put(PdfName.Type, PdfName.EmbeddedFile);
        if (mime != null) {
            stream.put(PdfName.Subtype, new PdfName(mime));
        }
        stream.makeIndirect(pdfDoc);

        PdfDictionary embedded = new PdfDictionary();
        embedded.put(PdfName.F, stream);
        embedded.put(PdfName.UF, stream);

        PdfDictionary fileSpec = new PdfDictionary();
        fileSpec.put(PdfName.Type, PdfName.Filespec);
        fileSpec.put(PdfName.F, new PdfString(name));
        fileSpec.put(PdfName.UF, new PdfString(name));
        fileSpec.put(PdfName.EF, embedded);
        fileSpec.makeIndirect(pdfDoc);

        elem.getPdfObject().put(new PdfName("AF"), new PdfArray(fileSpec));
    }
}
