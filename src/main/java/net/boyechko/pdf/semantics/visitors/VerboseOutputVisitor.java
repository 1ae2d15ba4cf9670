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
package net.boyechko.pdf.semantics.visitors;

import java.util.function.Consumer;
import net.boyechko.pdf.semantics.document.McidTextExtractor;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.role.RoleClassifier;
import net.boyechko.pdf.semantics.walk.StructureTreeVisitor;
import net.boyechko.pdf.semantics.walk.VisitorContext;

/** Outputs a tabular listing of the structure tree and each element's role. */
public class VerboseOutputVisitor implements StructureTreeVisitor {

    private static final String INDENT = "  ";
    private static final int INDEX_WIDTH = 5;
    private static final int ELEMENT_NAME_WIDTH = 30;
    private static final int PAGE_NUM_WIDTH = 10;
    private static final int ROLE_WIDTH = 18;
    private static final int CONTENT_SUMMARY_WIDTH = 30;

    private static final String ROW_FORMAT =
            String.format(
                    "%%-%ds %%-%ds %%-%ds %%-%ds %%s%%n",
                    INDEX_WIDTH, ELEMENT_NAME_WIDTH, PAGE_NUM_WIDTH, ROLE_WIDTH);

    private final Consumer<String> output;
    private boolean headerPrinted = false;

    public VerboseOutputVisitor(Consumer<String> output) {
        this.output = output;
    }

    @Override
    public String name() {
        return "Structure Tree Listing";
    }

    @Override
    public void beforeTraversal() {
        printHeader();
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        printElement(ctx);
        return true;
    }

    private void printHeader() {
        if (headerPrinted) return;
        headerPrinted = true;

        output.accept(String.format(ROW_FORMAT, "Index", "Element", "Page", "Role", "Content"));
        output.accept(
                String.format(
                        ROW_FORMAT,
                        "-".repeat(INDEX_WIDTH),
                        "-".repeat(ELEMENT_NAME_WIDTH),
                        "-".repeat(PAGE_NUM_WIDTH),
                        "-".repeat(ROLE_WIDTH),
                        "-".repeat(CONTENT_SUMMARY_WIDTH)));
    }

    private void printElement(VisitorContext ctx) {
        String paddedIndex = String.format("%" + INDEX_WIDTH + "d", ctx.globalIndex());
        String elementName = INDENT.repeat(ctx.depth()) + "- " + ctx.tag();
        if (!ctx.tag().equals(ctx.stdName())) {
            elementName += " -> " + ctx.stdName();
        }
        int pageNum = ctx.getPageNumber();
        String pageString = (pageNum == 0) ? "" : "(p. " + pageNum + ")";
        String role =
                RoleClassifier.classify(ctx.stdName()).map(Object::toString).orElse("");

        output.accept(
                String.format(
                        ROW_FORMAT, paddedIndex, elementName, pageString, role, summary(ctx)));
    }

    private static String summary(VisitorContext ctx) {
        String value;
        try {
            value = ctx.element().value();
        } catch (DomAccessException e) {
            return "";
        }
        if (value == null || value.isEmpty()) {
            return "";
        }
        return McidTextExtractor.truncateText(value.replaceAll("\\s+", " "));
    }
}
