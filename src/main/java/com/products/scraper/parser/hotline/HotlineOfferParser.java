package com.products.scraper.parser.hotline;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h2>Hotline GraphQL Parser</h2>
 *
 * <p>Reads the two hotline frontend-api answers the offer adapter needs:</p>
 * <ul>
 *   <li>{@code data.urlTypeDefiner.token}: session token of a product path,</li>
 *   <li>{@code data.byPathQueryProduct.offers.edges[*].node}: the offer list.</li>
 * </ul>
 *
 * <p>Offer nodes map as follows:</p>
 * <pre>
 * _id             → id (default "unknown")
 * conversionUrl   → url, joined to the site root, trailing "/" removed
 * descriptionFull → title
 * firmTitle       → shop
 * price           → price
 * conditionId == 1 → used
 * </pre>
 */
@Slf4j
@Component("hotlineOfferParser")
public class HotlineOfferParser {

    /** Hotline condition id of second-hand goods. */
    static final int USED_CONDITION_ID = 1;

    static final String UNKNOWN_ID = "unknown";

    /**
     * @param root token query answer
     * @return the token, or {@code null} when the answer carries none
     */
    public String token(final JsonNode root) {
        if (root == null) {
            return null;
        }
        String token = textOrNull(root.path("data").path("urlTypeDefiner"), "token");
        return StringUtils.isBlank(token) ? null : token;
    }

    /**
     * @param root    offers query answer
     * @param siteUrl site root used to absolutise conversion links
     * @return candidates in listing order; empty when the payload has no edges
     */
    public List<OfferCandidate> candidates(final JsonNode root, final String siteUrl) {
        if (root == null) {
            return List.of();
        }
        JsonNode edges = root.path("data").path("byPathQueryProduct").path("offers").path("edges");
        if (!edges.isArray()) {
            log.warn("Hotline answer has no offer edges");
            return List.of();
        }

        List<OfferCandidate> out = new ArrayList<>();
        for (JsonNode edge : edges) {
            JsonNode node = edge.path("node");
            if (!node.isObject()) {
                continue;
            }
            String link = absolute(siteUrl, StringUtils.defaultString(textOrNull(node, "conversionUrl")));
            if (link == null) {
                log.debug("Skipping offer with malformed conversion link: {}", node.path("conversionUrl"));
                continue;
            }
            String id = StringUtils.defaultIfBlank(textOrNull(node, "_id"), UNKNOWN_ID);
            out.add(new OfferCandidate(
                    id,
                    link,
                    textOrNull(node, "descriptionFull"),
                    textOrNull(node, "firmTitle"),
                    node.path("price").asDouble(0.0),
                    node.path("conditionId").asInt(-1) == USED_CONDITION_ID));
        }
        return Collections.unmodifiableList(out);
    }

    static String absolute(final String siteUrl, final String link) {
        try {
            String root = StringUtils.appendIfMissing(siteUrl, "/");
            String joined = URI.create(root).resolve(link.trim()).toString();
            return StringUtils.stripEnd(joined, "/");
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static String textOrNull(final JsonNode node, final String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
