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
package net.boyechko.pdf.semantics.math;

import java.util.Optional;
import net.boyechko.pdf.semantics.dom.DomAccessException;
import net.boyechko.pdf.semantics.dom.DomElement;

/**
 * Uses the Formula's value: MathML from an associated file when the value is MathML, otherwise
 * the value is taken to be alt text and wrapped in {@code <mtext>}. Always produces markup.
 */
public class ValueFallbackSource implements MathSource {

    /**
     * Declaration some producers leave on the root element. Only this exact spelling is removed;
     * a prefixed math element ({@code <mml:math>}) is not recognized as MathML at all.
     */
    static final String MML_NAMESPACE_DECLARATION =
            "xmlns:mml=\"http://www.w3.org/1998/Math/MathML\"";

    @Override
    public String name() {
        return "Value fallback";
    }

    @Override
    public Optional<MathMarkup> extract(DomElement formula) {
        String value = readValue(formula);

        if (value.startsWith("<math")) {
            return Optional.of(
                    new MathMarkup(
                            value.replace(MML_NAMESPACE_DECLARATION, ""),
                            MathEncoding.EMBEDDED_MATHML));
        }

        return Optional.of(new MathMarkup(wrapAsText(value), MathEncoding.ALT_TEXT));
    }

    /** Wraps plain text as a MathML text run. */
    public static String wrapAsText(String text) {
        return "<math><mtext>" + MarkupText.escape(text) + "</mtext></math>";
    }

    // Missing alt text is not an error; it just yields an empty mtext.
    private static String readValue(DomElement formula) {
        try {
            String value = formula.value();
            return value != null ? value : "";
        } catch (DomAccessException e) {
            return "";
        }
    }
}
