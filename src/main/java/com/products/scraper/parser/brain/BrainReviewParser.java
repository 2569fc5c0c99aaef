package com.products.scraper.parser.brain;

import com.products.scraper.model.Comment;
import com.products.scraper.parser.ParseContext;
import com.products.scraper.parser.RecordParser;
import com.products.scraper.util.DateUtils;
import com.products.scraper.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h2>Brain Comments Parser</h2>
 *
 * <p>Parses the {@code commentsTpl} HTML fragment returned by
 * {@code /api/v1/product_comments/{id}}. Only top-level comments are read;
 * replies are nested deeper and carry a different depth class.</p>
 *
 * <pre>
 * div.br-pt-bc-item.br-ct-bc-item-out.br-pt-bc-item-in.deep-1[data-cid]
 *   div.br-pt-bc-date                       "15 березня 2024"
 *   div.br-comment-text                     body
 *   div.br-pt-bc-rating[data-comment-mark]  0..5
 * </pre>
 *
 * <p>Brain has no separate pros/cons sections, so those stay empty.</p>
 */
@Slf4j
@Component("brainReviewParser")
public class BrainReviewParser implements RecordParser<String, Comment> {

    static final String ITEM_SELECTOR = "div.br-pt-bc-item.br-ct-bc-item-out.br-pt-bc-item-in.deep-1";
    static final String DATE_SELECTOR = "div.br-pt-bc-date";
    static final String TEXT_SELECTOR = "div.br-comment-text";
    static final String RATING_SELECTOR = "div.br-pt-bc-rating[data-comment-mark]";

    @Override
    public Map<String, Comment> parse(final String html, final ParseContext context) {
        if (StringUtils.isBlank(html)) {
            return Map.of();
        }
        Document doc = Jsoup.parseBodyFragment(html);
        Map<String, Comment> out = new LinkedHashMap<>();

        for (Element item : doc.select(ITEM_SELECTOR)) {
            String id = item.attr("data-cid").trim();
            if (id.isEmpty()) {
                log.debug("Skipping brain comment without data-cid");
                continue;
            }
            Element dateEl = item.selectFirst(DATE_SELECTOR);
            Long createdAt = dateEl == null ? null : DateUtils.parseUkrainianDate(dateEl.text());
            if (createdAt == null) {
                log.debug("Skipping brain comment {} with unreadable date", id);
                continue;
            }
            if (!context.accepts(createdAt)) {
                continue;
            }
            Element textEl = item.selectFirst(TEXT_SELECTOR);
            Element ratingEl = item.selectFirst(RATING_SELECTOR);

            out.put(id, new Comment(
                    id,
                    ratingEl == null ? 0.0 : NumberUtils.toDouble(ratingEl.attr("data-comment-mark").trim(), 0.0),
                    "",
                    "",
                    textEl == null ? "" : TextUtils.clean(textEl.text()),
                    createdAt,
                    context.parsedAt()));
        }
        return Collections.unmodifiableMap(out);
    }
}
