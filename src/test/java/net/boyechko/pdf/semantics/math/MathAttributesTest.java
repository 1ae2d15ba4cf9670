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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MathAttributesTest {

    @Test
    void defaultTableMatchesTheMathMlWhitelist() {
        MathAttributes attributes = MathAttributes.loadDefault();

        assertEquals(List.of("intent", "arg"), attributes.universal());
        Map<String, List<String>> expected =
                Map.ofEntries(
                        Map.entry("mi", List.of("mathvariant")),
                        Map.entry("mn", List.of("mathvariant")),
                        Map.entry("mo", List.of("mathvariant")),
                        Map.entry("mtext", List.of("mathvariant")),
                        Map.entry("mfenced", List.of("open", "close", "separators")),
                        Map.entry("menclose", List.of("notation", "notationtype")),
                        Map.entry("annotation-xml", List.of("encoding")),
                        Map.entry("annotation", List.of("encoding")),
                        Map.entry("ms", List.of("open", "close")),
                        Map.entry("mspace", List.of("width")),
                        Map.entry("msgroup", List.of("position", "shift")),
                        Map.entry("msrow", List.of("position")),
                        Map.entry("msline", List.of("position", "length")),
                        Map.entry("mscarries", List.of("position", "crossout")),
                        Map.entry("mscarry", List.of("crossout")),
                        Map.entry("mstack", List.of("align", "stackalign")),
                        Map.entry("mlongdiv", List.of("longdivstyle")));
        assertEquals(expected, attributes.elements());
    }

    @Test
    void defaultTableIsLoadedOnce() {
        assertSame(MathAttributes.loadDefault(), MathAttributes.loadDefault());
    }

    @Test
    void unlistedElementsGetOnlyUniversalAttributes() {
        MathAttributes attributes = MathAttributes.loadDefault();

        assertEquals(List.of(), attributes.specificTo("mrow"));
        assertEquals(List.of("intent", "arg"), attributes.allowedOn("mrow"));
        assertEquals(List.of("intent", "arg", "open", "close"), attributes.allowedOn("ms"));
    }

    @Test
    void missingResourceFailsFast() {
        IllegalStateException e =
                assertThrows(
                        IllegalStateException.class,
                        () -> MathAttributes.fromResource("/no-such-table.yaml"));
        assertTrue(e.getMessage().contains("/no-such-table.yaml"));
    }

    @Test
    void tableIsImmutable() {
        MathAttributes attributes = MathAttributes.loadDefault();
        assertThrows(
                UnsupportedOperationException.class, () -> attributes.universal().add("href"));
        assertThrows(
                UnsupportedOperationException.class,
                () -> attributes.elements().put("mrow", List.of()));
    }
}
