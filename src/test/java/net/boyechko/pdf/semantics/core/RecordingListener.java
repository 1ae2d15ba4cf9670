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

import java.util.ArrayList;
import java.util.List;

/** Collects listener events for assertions. */
public class RecordingListener implements ProcessingListener {
    final List<String> phases = new ArrayList<>();
    final List<String> errors = new ArrayList<>();
    final List<String> verboseOutput = new ArrayList<>();
    final List<NodeSemantics> elements = new ArrayList<>();
    final List<NodeSemantics> formulas = new ArrayList<>();
    SemanticsReport summary;

    @Override
    public void onPhaseStart(String phaseName) {
        phases.add(phaseName);
    }

    @Override
    public void onSuccess(String message) {}

    @Override
    public void onWarning(String message) {}

    @Override
    public void onError(String message) {
        errors.add(message);
    }

    @Override
    public void onVerboseOutput(String message) {
        verboseOutput.add(message);
    }

    @Override
    public void onElement(NodeSemantics node) {
        elements.add(node);
    }

    @Override
    public void onFormula(NodeSemantics node) {
        formulas.add(node);
    }

    @Override
    public void onSummary(SemanticsReport report) {
        summary = report;
    }
}
