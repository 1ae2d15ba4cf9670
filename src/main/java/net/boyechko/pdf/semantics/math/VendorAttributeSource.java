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

/** MathML that Microsoft Office stores as a custom attribute on the Formula tag. */
public class VendorAttributeSource implements MathSource {
    public static final String ATTRIBUTE = "MSFT_MathML";
    public static final String NAMESPACE = "MSFT_Office";

    @Override
    public String name() {
        return "Vendor attribute";
    }

    @Override
    public Optional<MathMarkup> extract(DomElement formula) {
        String math;
        try {
            math = formula.attribute(ATTRIBUTE, NAMESPACE);
        } catch (DomAccessException e) {
            return Optional.empty();
        }
        // Returned as is; Office writes complete MathML here.
        return MarkupText.isPresent(math)
                ? Optional.of(new MathMarkup(math, MathEncoding.VENDOR_ATTRIBUTE))
                : Optional.empty();
    }
}
