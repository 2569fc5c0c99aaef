package com.products.scraper.dto;

import com.products.scraper.model.Comment;

/**
 * Public view of one review.
 *
 * @param rating       0&ndash;5
 * @param advantages   pros, may be empty
 * @param shortcomings cons, may be empty
 * @param comment      review body
 */
public record CommentResponse(
        double rating,
        String advantages,
        String shortcomings,
        String comment
) {

    public static CommentResponse from(final Comment comment) {
        return new CommentResponse(comment.rating(), comment.advantages(),
                comment.shortcomings(), comment.comment());
    }
}
