package com.fightsync.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fightsync.domain.model.ScrapeRunRecord;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB implementation of ScrapeRunRepository.
 *
 * Run records expire through a TTL index on {@code createdAt} so the audit
 * trail does not grow without bound.
 */
public class MongoScrapeRunRepository implements ScrapeRunRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoScrapeRunRepository.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static final String COLLECTION = "scrape_runs";

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoScrapeRunRepository(MongoClient mongoClient, String databaseName, int retentionDays) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;

        initializeIndexes(retentionDays);
    }

    private void initializeIndexes(int retentionDays) {
        try {
            collection().createIndex(
                Indexes.ascending("createdAt"),
                new IndexOptions().expireAfter((long) retentionDays, TimeUnit.DAYS).background(true));
            logger.info("MongoDB TTL index initialized for {} ({} days)", COLLECTION, retentionDays);
        } catch (MongoException e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public void start(ScrapeRunRecord record) {
        collection().insertOne(toDocument(record));
        logger.debug("Recorded start of run {}", record.getId());
    }

    @Override
    public void finish(ScrapeRunRecord record) {
        collection().replaceOne(Filters.eq("_id", record.getId()), toDocument(record), new ReplaceOptions().upsert(true));
        logger.debug("Recorded end of run {} with status {}", record.getId(), record.getStatus());
    }

    @Override
    public Optional<ScrapeRunRecord> findLatest() {
        Document doc = collection().find().sort(Sorts.descending("createdAt")).first();
        if (doc == null) {
            return Optional.empty();
        }
        Map<String, Object> map = new HashMap<>(doc);
        map.put("id", map.remove("_id"));
        map.remove("createdAt");
        return Optional.of(OBJECT_MAPPER.convertValue(map, ScrapeRunRecord.class));
    }

    private Document toDocument(ScrapeRunRecord record) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(record, Map.class);
        Document doc = new Document(map);
        doc.put("_id", doc.remove("id"));
        doc.put("createdAt", Date.from(record.getStartTime()));
        return doc;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(COLLECTION);
    }
}
