package com.products.scraper.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.MongoException;
import com.products.scraper.model.RecordKind;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h2>MongoDB merge store</h2>
 *
 * <p>One document per product URL and record kind:</p>
 * <pre>
 * products: { url: "https://hotline.ua/...", offers:   { "&lt;id&gt;": {...}, ... } }
 * reviews:  { url: "https://comfy.ua/...",   comments: { "&lt;id&gt;": {...}, ... } }
 * </pre>
 *
 * <p>A write reads the stored map, overlays the new records and upserts the
 * result. Records are stored in their snake_case JSON form. The store is
 * pinged first; when MongoDB is unreachable the write is skipped with a
 * warning and the caller carries on.</p>
 *
 * <p>Read-modify-write is not atomic: two concurrent merges of the same URL
 * can lose one side's new ids.</p>
 */
@Slf4j
@Component
public class MongoMergeStore implements MergeStore {

    static final String URL_FIELD = "url";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongo;
    private final ObjectMapper mapper;

    public MongoMergeStore(final MongoTemplate mongo,
                           @Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        this.mongo = mongo;
        this.mapper = mapper;
    }

    @Override
    public boolean merge(final String url, final RecordKind kind, final Map<String, ?> records) {
        if (!isAvailable()) {
            log.warn("MongoDB unreachable, {} of {} not saved", kind.field(), url);
            return false;
        }
        try {
            Query byUrl = Query.query(Criteria.where(URL_FIELD).is(url));
            Document stored = mongo.findOne(byUrl, Document.class, kind.collection());

            Map<String, Object> merged = RecordMerger.merge(storedRecords(stored, kind), toDocuments(records));
            mongo.upsert(byUrl, new Update().set(kind.field(), new Document(merged)), kind.collection());

            log.info("Saved {} {} for {} ({} stored in total)", records.size(), kind.field(), url, merged.size());
            return true;
        } catch (DataAccessException | MongoException ex) {
            log.warn("Saving {} of {} failed: {}", kind.field(), url, ex.getMessage());
            return false;
        }
    }

    /**
     * @return {@code true} when MongoDB answers a {@code ping}
     */
    public boolean isAvailable() {
        try {
            mongo.executeCommand(new Document("ping", 1));
            return true;
        } catch (DataAccessException | MongoException ex) {
            log.debug("MongoDB ping failed: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * Creates the unique {@code url} index of every collection once the
     * application is up. Failure only costs the uniqueness guarantee.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        for (RecordKind kind : RecordKind.values()) {
            try {
                String name = mongo.indexOps(kind.collection())
                        .ensureIndex(new Index().on(URL_FIELD, Sort.Direction.ASC).unique());
                log.info("Index {} ready on {}", name, kind.collection());
            } catch (DataAccessException | MongoException ex) {
                log.warn("Could not create url index on {}: {}", kind.collection(), ex.getMessage());
            }
        }
    }

    private static Map<String, Object> storedRecords(final Document stored, final RecordKind kind) {
        if (stored == null || !(stored.get(kind.field()) instanceof Map<?, ?> field)) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        field.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private Map<String, Object> toDocuments(final Map<String, ?> records) {
        Map<String, Object> out = new LinkedHashMap<>();
        records.forEach((id, record) -> out.put(id, new Document(mapper.convertValue(record, DOCUMENT_TYPE))));
        return out;
    }
}
