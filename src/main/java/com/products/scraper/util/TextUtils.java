package com.products.scraper.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/**
 * Free-text cleanup for review fields.
 */
public final class TextUtils {

    private static final Document.OutputSettings RAW_OUTPUT =
            new Document.OutputSettings().prettyPrint(false);

    private TextUtils() {
    }

    /**
     * Removes every tag, unescapes HTML entities and trims.
     *
     * @param text raw value, possibly {@code null}
     * @return plain text, never {@code null}
     */
    public static String clean(final String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String stripped = Jsoup.clean(text, "", Safelist.none(), RAW_OUTPUT);
        return Parser.unescapeEntities(stripped, false).trim();
    }
}
