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

import java.io.PrintStream;
import java.util.Map;
import net.boyechko.pdf.semantics.math.MathMarkup;
import net.boyechko.pdf.semantics.role.SemanticRole;

public class OutputFormatter {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "✗";
    private static final String WARNING = "▸";
    private static final String INFO = "ℹ";

    private static final String INDENT = "│ ";
    private static final int PHASE_WIDTH = 68;
    private static final int SUMMARY_WIDTH = PHASE_WIDTH + 2;

    private boolean phaseOpen = false;

    public OutputFormatter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    public void printPhase(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            int filler = Math.max(0, PHASE_WIDTH - phaseName.length() - 1);
            output.println("┌─ " + phaseName + " " + "─".repeat(filler) + "┐");
            output.println("│" + " ".repeat(PHASE_WIDTH + 2) + "│");
            phaseOpen = true;
        }
    }

    /** One line per classified element, shown from VERBOSE up. */
    public void printElement(NodeSemantics node) {
        if (!verbosity.isAtLeast(VerbosityLevel.VERBOSE)) return;
        printLine(node.path() + ": " + node.roleLabel() + pageSuffix(node.page()), INFO);
    }

    /**
     * Prints a formula and its MathML. In QUIET mode only the markup itself is printed, one formula
     * per line.
     */
    public void printFormula(NodeSemantics node) {
        MathMarkup math = node.math();
        if (verbosity == VerbosityLevel.QUIET) {
            if (math != null) {
                output.println(math.markup());
            }
            return;
        }
        if (math == null) {
            printWarning(node.path() + pageSuffix(node.page()) + ": no MathML recovered");
            return;
        }
        printSuccess(
                node.path() + pageSuffix(node.page()) + " from " + math.encoding().label());
        printDetail(math.markup());
    }

    public void printSummary(SemanticsReport report) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) return;

        closePhaseBoxIfOpen();
        String title = "Summary";
        int pad = Math.max(0, SUMMARY_WIDTH - ("┏━ " + title).length());
        output.println(INDENT + "┏━ " + title + " " + "━".repeat(pad) + "┓");

        if (!report.isTagged()) {
            printLine("Document is not tagged", ERROR);
        } else {
            printLine("Structure elements: " + report.elementCount(), INFO);
            for (Map.Entry<SemanticRole, Integer> entry : report.countsByRole().entrySet()) {
                printLine(entry.getKey().label() + ": " + entry.getValue(), SUCCESS);
            }
            printLine("Without semantic role: " + report.unclassifiedCount(), INFO);
            int unresolved = report.unresolvedFormulas().size();
            if (unresolved > 0) {
                printLine("Formulas without MathML: " + unresolved, WARNING);
            }
        }
        output.println(INDENT + "┗" + "━".repeat(SUMMARY_WIDTH) + "┛");
    }

    public void printSuccess(String message) {
        printLine(message, SUCCESS);
    }

    public void printError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    public void printWarning(String message) {
        printLine(message, WARNING);
    }

    public void printInfo(String message) {
        printLine(message, INFO);
    }

    public void printDetail(String message) {
        printLine(INDENT + "  " + message, null); // Extra 2 spaces for detail indentation
    }

    public PrintStream getStream() {
        return output;
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            output.println("│" + " ".repeat(PHASE_WIDTH + 2) + "│");
            output.println("└" + "─".repeat(PHASE_WIDTH + 2) + "┘");
            phaseOpen = false;
        }
    }

    private void printLine(String message, String icon, VerbosityLevel level) {
        if (verbosity.isAtLeast(level)) {
            output.println(icon == null ? message : INDENT + icon + " " + message);
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private static String pageSuffix(int page) {
        return page > 0 ? " (page " + page + ")" : "";
    }
}
