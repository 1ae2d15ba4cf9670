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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.io.IOException;
import net.boyechko.pdf.semantics.document.DocContext;
import net.boyechko.pdf.semantics.document.PdfCustodian;
import net.boyechko.pdf.semantics.math.MathReconstructor;
import net.boyechko.pdf.semantics.ui.LoggingListener;
import net.boyechko.pdf.semantics.visitors.SemanticsVisitor;
import net.boyechko.pdf.semantics.visitors.VerboseOutputVisitor;
import net.boyechko.pdf.semantics.walk.StructureTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates role classification and MathML reconstruction over a tagged PDF. */
public class SemanticsService {
    private static final Logger logger = LoggerFactory.getLogger(SemanticsService.class);

    private final PdfCustodian custodian;
    private final ProcessingListener listener;
    private final MathReconstructor reconstructor;
    private final boolean printStructureTree;
    private final boolean locatePages;
    private final boolean mathOnly;

    public static class SemanticsServiceBuilder {
        private PdfCustodian custodian;
        private ProcessingListener listener;
        private MathReconstructor reconstructor;
        private boolean printStructureTree;
        private boolean locatePages;
        private boolean mathOnly;

        public SemanticsServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public SemanticsServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public SemanticsServiceBuilder withMathReconstructor(MathReconstructor reconstructor) {
            this.reconstructor = reconstructor;
            return this;
        }

        public SemanticsServiceBuilder withPrintStructureTree(boolean printStructureTree) {
            this.printStructureTree = printStructureTree;
            return this;
        }

        public SemanticsServiceBuilder withLocatePages(boolean locatePages) {
            this.locatePages = locatePages;
            return this;
        }

        /** Reports formulas only; roles are still classified. */
        public SemanticsServiceBuilder withMathOnly(boolean mathOnly) {
            this.mathOnly = mathOnly;
            return this;
        }

        public SemanticsService build() {
            if (custodian == null) {
                throw new IllegalStateException(
                        "PdfCustodian must be provided via withPdfCustodian(...) before building SemanticsService");
            }
            return new SemanticsService(this);
        }
    }

    private SemanticsService(SemanticsServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.listener = builder.listener != null ? builder.listener : new LoggingListener();
        this.reconstructor =
                builder.reconstructor != null ? builder.reconstructor : new MathReconstructor();
        this.printStructureTree = builder.printStructureTree;
        this.locatePages = builder.locatePages;
        this.mathOnly = builder.mathOnly;
    }

    public SemanticsReport analyze() throws IOException {
        try (PdfDocument pdfDoc = custodian.openForReading()) {
            return analyze(pdfDoc);
        }
    }

    /** Analyzes an already open document. The caller keeps ownership of it. */
    public SemanticsReport analyze(PdfDocument pdfDoc) {
        listener.onPhaseStart("Reading structure tree");

        PdfStructTreeRoot root = pdfDoc.getStructTreeRoot();
        if (root == null || root.getKids() == null || root.getKids().isEmpty()) {
            listener.onError("No structure tree");
            SemanticsReport report = SemanticsReport.untagged();
            listener.onSummary(report);
            return report;
        }

        DocContext docCtx = new DocContext(pdfDoc);
        SemanticsVisitor semantics = new SemanticsVisitor(reconstructor, locatePages);
        if (locatePages) {
            docCtx.withNavigator(semantics);
        }

        StructureTreeWalker walker = new StructureTreeWalker().addVisitor(semantics);
        if (printStructureTree) {
            walker.addVisitor(new VerboseOutputVisitor(listener::onVerboseOutput));
        }
        int visited = walker.walk(root, docCtx);
        logger.debug("Visited {} structure elements", visited);

        SemanticsReport report = new SemanticsReport(semantics.getNodes(), true);
        listener.onSuccess("Read " + report.elementCount() + " structure elements");

        if (!mathOnly) {
            listener.onPhaseStart("Semantic roles");
            for (NodeSemantics node : report.nodes()) {
                if (node.isClassified()) {
                    listener.onElement(node);
                }
            }
        }

        listener.onPhaseStart("Formulas");
        if (report.formulas().isEmpty()) {
            listener.onInfo("No formulas found");
        }
        for (NodeSemantics formula : report.formulas()) {
            listener.onFormula(formula);
        }

        listener.onSummary(report);
        return report;
    }
}
