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

/** Interface for reporting progress and results of the analysis. */
public interface ProcessingListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(String message);

    void onSummary(SemanticsReport report);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    /** Called once per classified element, in traversal order. */
    default void onElement(NodeSemantics node) {}

    /** Called once per formula, whether or not MathML was recovered. */
    default void onFormula(NodeSemantics node) {
        if (node.math() == null) {
            onWarning("No MathML for " + node.path());
        }
    }
}
