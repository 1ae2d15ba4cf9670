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
package net.boyechko.pdf.semantics.ui.cli;

import java.io.PrintStream;
import net.boyechko.pdf.semantics.core.NodeSemantics;
import net.boyechko.pdf.semantics.core.OutputFormatter;
import net.boyechko.pdf.semantics.core.ProcessingListener;
import net.boyechko.pdf.semantics.core.SemanticsReport;
import net.boyechko.pdf.semantics.core.VerbosityLevel;

public class CliProcessingListener implements ProcessingListener {
    private final OutputFormatter formatter;

    public CliProcessingListener(PrintStream output, VerbosityLevel verbosity) {
        this.formatter = new OutputFormatter(output, verbosity);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        formatter.printPhase(phaseName);
    }

    @Override
    public void onSuccess(String message) {
        formatter.printSuccess(message);
    }

    @Override
    public void onWarning(String message) {
        formatter.printWarning(message);
    }

    @Override
    public void onError(String message) {
        formatter.printError(message);
    }

    @Override
    public void onInfo(String message) {
        formatter.printInfo(message);
    }

    @Override
    public void onVerboseOutput(String message) {
        formatter.getStream().print(message);
    }

    @Override
    public void onElement(NodeSemantics node) {
        formatter.printElement(node);
    }

    @Override
    public void onFormula(NodeSemantics node) {
        formatter.printFormula(node);
    }

    @Override
    public void onSummary(SemanticsReport report) {
        formatter.printSummary(report);
    }
}
