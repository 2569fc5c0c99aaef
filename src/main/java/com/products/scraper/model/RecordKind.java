package com.products.scraper.model;

/**
 * What a source produces, and where the merge store keeps it.
 */
public enum RecordKind {

    OFFERS("products", "offers"),
    COMMENTS("reviews", "comments");

    private final String collection;
    private final String field;

    RecordKind(final String collection, final String field) {
        this.collection = collection;
        this.field = field;
    }

    /** MongoDB collection holding one document per product URL. */
    public String collection() {
        return collection;
    }

    /** Document field holding the id → record mapping. */
    public String field() {
        return field;
    }
}
