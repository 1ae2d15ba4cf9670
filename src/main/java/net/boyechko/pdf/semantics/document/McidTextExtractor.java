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

import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Extracts the text shown inside each marked-content sequence (MCID) of a page. */
public final class McidTextExtractor {
    private static final Logger logger = LoggerFactory.getLogger(McidTextExtractor.class);
    private static final int MAX_DISPLAY_LENGTH = 30;

    private McidTextExtractor() {}

    /**
     * Returns the text of every MCID on the page, keyed by MCID. Returns an empty map if the page
     * content cannot be parsed.
     */
    public static Map<Integer, String> extractTextForPage(PdfPage page) {
        try {
            McidTextListener listener = new McidTextListener();
            new PdfCanvasProcessor(listener).processPageContent(page);

            Map<Integer, String> cleaned = new HashMap<>();
            for (Map.Entry<Integer, StringBuilder> entry : listener.textByMcid.entrySet()) {
                cleaned.put(entry.getKey(), cleanExtractedText(entry.getValue().toString()));
            }
            return cleaned;
        } catch (Exception e) {
            logger.debug("Failed to extract marked content text: {}", e.getMessage());
            return Map.of();
        }
    }

    /** Collects rendered text per MCID. */
    private static class McidTextListener implements IEventListener {
        private final Map<Integer, StringBuilder> textByMcid = new LinkedHashMap<>();

        @Override
        public void eventOccurred(IEventData data, EventType type) {
            if (type != EventType.RENDER_TEXT) {
                return;
            }
            TextRenderInfo textInfo = (TextRenderInfo) data;
            int mcid = textInfo.getMcid();
            if (mcid < 0) {
                return;
            }
            String text = textInfo.getText();
            if (text == null || text.trim().isEmpty()) {
                return;
            }
            StringBuilder sb = textByMcid.computeIfAbsent(mcid, k -> new StringBuilder());
            if (sb.length() > 0) {
                sb.append(" ");
            }
            sb.append(text);
        }

        @Override
        public Set<EventType> getSupportedEvents() {
            return Set.of(EventType.RENDER_TEXT);
        }
    }

    /** Removes replacement characters and normalizes whitespace. */
    static String cleanExtractedText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        // Single-character words are common in math, so spacing is not collapsed further.
        return text.replace("�", "").replaceAll("\\s+", " ").trim();
    }

    /** Truncates text to a reasonable display length for listings. */
    public static String truncateText(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 1) + "…";
    }

    public static String truncateText(String text) {
        return truncateText(text, MAX_DISPLAY_LENGTH);
    }
}
