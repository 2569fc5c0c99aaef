package com.products.scraper.parser.comfy;

import com.fasterxml.jackson.databind.JsonNode;
import com.products.scraper.model.Comment;
import com.products.scraper.parser.ParseContext;
import com.products.scraper.parser.RecordParser;
import com.products.scraper.util.DateUtils;
import com.products.scraper.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the {@code reviews} array of one comfy reviews page.
 * <p>
 * Ratings come on a 0&ndash;100 scale and are divided by 20. Reviews without an
 * id or with an unreadable {@code createdAt} are dropped, as are reviews newer
 * than the cutoff.
 */
@Slf4j
@Component("comfyReviewParser")
public class ComfyReviewParser implements RecordParser<JsonNode, Comment> {

    /** Comfy rating scale divided by this gives stars. */
    static final double RATING_DIVISOR = 20.0;

    @Override
    public Map<String, Comment> parse(final JsonNode reviews, final ParseContext context) {
        if (reviews == null || !reviews.isArray()) {
            return Map.of();
        }
        Map<String, Comment> out = new LinkedHashMap<>();
        for (JsonNode review : reviews) {
            String id = textOrNull(review, "reviewId");
            if (StringUtils.isBlank(id)) {
                log.debug("Skipping comfy review without id");
                continue;
            }
            Long createdAt = DateUtils.parseTimestamp(textOrNull(review, "createdAt"));
            if (createdAt == null) {
                log.debug("Skipping comfy review {} with unreadable date", id);
                continue;
            }
            if (!context.accepts(createdAt)) {
                continue;
            }
            out.put(id, new Comment(
                    id,
                    review.path("productRating").asDouble(0.0) / RATING_DIVISOR,
                    TextUtils.clean(textOrNull(review, "advantages")),
                    TextUtils.clean(textOrNull(review, "disadvantages")),
                    TextUtils.clean(textOrNull(review, "detail")),
                    createdAt,
                    context.parsedAt()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static String textOrNull(final JsonNode node, final String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
