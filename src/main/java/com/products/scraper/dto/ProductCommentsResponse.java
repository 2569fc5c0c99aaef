package com.products.scraper.dto;

import com.products.scraper.model.Comment;
import com.products.scraper.model.ProductRecords;

import java.util.List;

/**
 * Body of {@code GET /product/comments}.
 *
 * @param url      canonical product URL (raw input when it was not a valid product URL)
 * @param comments reviews in source order
 */
public record ProductCommentsResponse(String url, List<CommentResponse> comments) {

    public static ProductCommentsResponse from(final ProductRecords<Comment> records) {
        return new ProductCommentsResponse(records.url(),
                records.records().values().stream().map(CommentResponse::from).toList());
    }
}
