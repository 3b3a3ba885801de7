package com.fightsync.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fightsync.domain.exception.CatalogUnavailableException;
import com.fightsync.domain.exception.CatalogWriteException;
import com.fightsync.domain.model.Event;
import com.fightsync.domain.model.EventUpdate;
import com.fightsync.domain.model.FieldChange;
import com.fightsync.domain.model.Fight;
import com.fightsync.domain.model.Fighter;
import com.fightsync.domain.model.NewEventWrite;
import com.fightsync.domain.model.WriteCounts;
import com.fightsync.domain.ports.CatalogStore;
import com.mongodb.MongoException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.UpdateOneModel;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.model.WriteModel;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MongoDB implementation of CatalogStore.
 *
 * Collections:
 * - events: one document per card, keyed by event id, date stored as ISO yyyy-MM-dd
 * - fights: one document per bout, unique on (eventId, pairKey)
 * - fighters: one document per fighter, keyed by fighter id
 *
 * Every write for one card runs inside a single multi-document transaction,
 * so the target deployment must be a replica set.
 */
public class MongoCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoCatalogStore.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static final String EVENTS = "events";
    static final String FIGHTS = "fights";
    static final String FIGHTERS = "fighters";

    // Scheduling fields the reconciler owns; prediction fields are never part of an update.
    private static final List<String> FIGHT_SCHEDULING_FIELDS = List.of(
        "fighter1Id", "fighter2Id", "fighter1Name", "fighter2Name", "pairKey",
        "weightClass", "titleFight", "mainEvent", "cardPosition", "scheduledRounds", "fightNumber");

    private static final Set<String> EVENT_FIELDS = Set.of("date", "location", "venue");

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final int fighterBatchSize;
    private final long fighterBatchPauseMs;

    public MongoCatalogStore(MongoClient mongoClient, String databaseName, int fighterBatchSize, long fighterBatchPauseMs) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.fighterBatchSize = Math.max(1, fighterBatchSize);
        this.fighterBatchPauseMs = Math.max(0, fighterBatchPauseMs);

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            MongoDatabase database = database();
            database.getCollection(EVENTS).createIndex(
                Indexes.compoundIndex(Indexes.ascending("completed"), Indexes.ascending("date")),
                new IndexOptions().background(true));
            database.getCollection(FIGHTS).createIndex(
                Indexes.compoundIndex(Indexes.ascending("eventId"), Indexes.ascending("pairKey")),
                new IndexOptions().unique(true).background(true));

            logger.info("MongoDB indexes initialized for database: {}", databaseName);
        } catch (MongoException e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public List<Event> findUpcomingEvents(LocalDate from) throws CatalogUnavailableException {
        try {
            MongoDatabase database = database();
            List<Event> events = new ArrayList<>();
            database.getCollection(EVENTS)
                .find(Filters.and(Filters.ne("completed", true), Filters.gte("date", from.toString())))
                .sort(Sorts.ascending("date"))
                .forEach(doc -> events.add(fromDocument(doc, Event.class)));

            if (events.isEmpty()) {
                return events;
            }

            List<String> eventIds = events.stream().map(Event::getId).collect(Collectors.toList());
            Map<String, List<Fight>> fightsByEvent = new HashMap<>();
            database.getCollection(FIGHTS)
                .find(Filters.in("eventId", eventIds))
                .sort(Sorts.ascending("fightNumber"))
                .forEach(doc -> {
                    Fight fight = fromDocument(doc, Fight.class);
                    fightsByEvent.computeIfAbsent(fight.getEventId(), id -> new ArrayList<>()).add(fight);
                });

            for (Event event : events) {
                event.setFights(fightsByEvent.getOrDefault(event.getId(), new ArrayList<>()));
            }
            return events;
        } catch (MongoException e) {
            throw new CatalogUnavailableException("Failed to load upcoming events: " + e.getMessage(), e);
        }
    }

    @Override
    public WriteCounts createEvent(NewEventWrite write) throws CatalogWriteException {
        Event event = write.event();
        return inTransaction(event.getId(), session -> {
            int fightersAdded = upsertFighters(session, write.fighters());

            Document eventDoc = toDocument(event);
            eventDoc.remove("fights");
            eventDoc.put("completed", false);
            eventDoc.put("createdAt", Date.from(Instant.now()));
            database().getCollection(EVENTS).insertOne(session, eventDoc);

            int fightsAdded = insertFights(session, write.fights());
            return new WriteCounts(fightersAdded, fightsAdded, 0, 0);
        });
    }

    @Override
    public WriteCounts applyEventUpdate(EventUpdate update) throws CatalogWriteException {
        return inTransaction(update.getEventId(), session -> {
            int fightersAdded = upsertFighters(session, update.getFighters());

            if (!update.getFieldChanges().isEmpty()) {
                List<Bson> sets = new ArrayList<>();
                for (FieldChange change : update.getFieldChanges()) {
                    if (!EVENT_FIELDS.contains(change.field())) {
                        throw new IllegalArgumentException("Unsupported event field: " + change.field());
                    }
                    Object value = change.newValue() instanceof LocalDate ? change.newValue().toString() : change.newValue();
                    sets.add(Updates.set(change.field(), value));
                }
                sets.add(Updates.set("updatedAt", Date.from(Instant.now())));
                database().getCollection(EVENTS).updateOne(session, Filters.eq("_id", update.getEventId()), Updates.combine(sets));
            }

            int fightsAdded = insertFights(session, update.getFightsToInsert());

            int fightsUpdated = 0;
            MongoCollection<Document> fights = database().getCollection(FIGHTS);
            for (Fight fight : update.getFightsToUpdate()) {
                Document doc = toDocument(fight);
                List<Bson> sets = new ArrayList<>();
                for (String field : FIGHT_SCHEDULING_FIELDS) {
                    sets.add(Updates.set(field, doc.get(field)));
                }
                sets.add(Updates.set("updatedAt", Date.from(Instant.now())));
                fightsUpdated += (int) fights.updateOne(session, Filters.eq("_id", fight.getId()), Updates.combine(sets))
                    .getMatchedCount();
            }

            int fightsRemoved = 0;
            if (!update.getFightIdsToRemove().isEmpty()) {
                fightsRemoved = (int) fights.deleteMany(session, Filters.in("_id", update.getFightIdsToRemove()))
                    .getDeletedCount();
            }

            return new WriteCounts(fightersAdded, fightsAdded, fightsUpdated, fightsRemoved);
        });
    }

    @Override
    public void markEventCompleted(String eventId) throws CatalogWriteException {
        inTransaction(eventId, session -> {
            database().getCollection(EVENTS).updateOne(session, Filters.eq("_id", eventId),
                Updates.combine(Updates.set("completed", true), Updates.set("updatedAt", Date.from(Instant.now()))));
            return WriteCounts.NONE;
        });
    }

    private WriteCounts inTransaction(String eventId, CatalogWork work) throws CatalogWriteException {
        try (ClientSession session = mongoClient.startSession()) {
            return session.withTransaction(() -> work.apply(session));
        } catch (MongoException | IllegalArgumentException e) {
            throw new CatalogWriteException(eventId, "Transaction failed: " + e.getMessage(), e);
        }
    }

    /**
     * Upserts fighters in chunks with a pause in between so large cards do not
     * hold the transaction's write set in one burst. Fighters without a record
     * string were synthesized from a card entry and never overwrite stats.
     */
    private int upsertFighters(ClientSession session, List<Fighter> fighters) {
        if (fighters.isEmpty()) {
            return 0;
        }
        MongoCollection<Document> collection = database().getCollection(FIGHTERS);
        int inserted = 0;

        for (int i = 0; i < fighters.size(); i += fighterBatchSize) {
            if (i > 0 && fighterBatchPauseMs > 0) {
                pause();
            }
            List<Fighter> batch = fighters.subList(i, Math.min(i + fighterBatchSize, fighters.size()));
            List<WriteModel<Document>> writes = new ArrayList<>();
            for (Fighter fighter : batch) {
                writes.add(new UpdateOneModel<>(
                    Filters.eq("_id", fighter.getId()),
                    fighterUpsert(fighter),
                    new UpdateOptions().upsert(true)));
            }
            BulkWriteResult result = collection.bulkWrite(session, writes, new BulkWriteOptions().ordered(true));
            inserted += result.getUpserts().size();
        }

        logger.debug("Upserted {} fighters ({} new) in chunks of {}", fighters.size(), inserted, fighterBatchSize);
        return inserted;
    }

    private static Bson fighterUpsert(Fighter fighter) {
        Date now = Date.from(Instant.now());
        List<Bson> updates = new ArrayList<>();
        updates.add(Updates.set("name", fighter.getName()));
        updates.add(Updates.set("weightClass", fighter.getWeightClass()));
        updates.add(Updates.set("updatedAt", now));
        updates.add(Updates.setOnInsert("createdAt", now));

        boolean synthesized = fighter.getRecord() == null;
        Bson nickname = synthesized ? Updates.setOnInsert("nickname", fighter.getNickname()) : Updates.set("nickname", fighter.getNickname());
        Bson wins = synthesized ? Updates.setOnInsert("wins", fighter.getWins()) : Updates.set("wins", fighter.getWins());
        Bson losses = synthesized ? Updates.setOnInsert("losses", fighter.getLosses()) : Updates.set("losses", fighter.getLosses());
        Bson draws = synthesized ? Updates.setOnInsert("draws", fighter.getDraws()) : Updates.set("draws", fighter.getDraws());
        Bson record = synthesized ? Updates.setOnInsert("record", null) : Updates.set("record", fighter.getRecord());
        updates.add(nickname);
        updates.add(wins);
        updates.add(losses);
        updates.add(draws);
        updates.add(record);
        return Updates.combine(updates);
    }

    /**
     * Inserts new fights, skipping any whose id or (eventId, pairKey) already
     * exists. Existing rows are looked up inside the session first: a
     * duplicate-key error would abort the whole transaction.
     */
    private int insertFights(ClientSession session, List<Fight> fights) {
        if (fights.isEmpty()) {
            return 0;
        }
        Date now = Date.from(Instant.now());
        List<Document> docs = new ArrayList<>();
        for (Fight fight : fights) {
            Document doc = toDocument(fight);
            doc.put("createdAt", now);
            docs.add(doc);
        }

        MongoCollection<Document> collection = database().getCollection(FIGHTS);
        List<Object> ids = docs.stream().map(doc -> doc.get("_id")).collect(Collectors.toList());
        Set<Object> eventIds = docs.stream().map(doc -> doc.get("eventId")).collect(Collectors.toSet());
        Set<String> takenIds = new HashSet<>();
        Set<String> takenSlots = new HashSet<>();
        collection.find(session, Filters.or(Filters.in("_id", ids), Filters.in("eventId", eventIds)))
            .projection(Projections.include("eventId", "pairKey"))
            .forEach(doc -> {
                takenIds.add(String.valueOf(doc.get("_id")));
                takenSlots.add(pairSlot(doc));
            });

        List<Document> fresh = withoutExisting(docs, takenIds, takenSlots);
        if (fresh.size() < docs.size()) {
            logger.debug("Skipped {} fights that already exist", docs.size() - fresh.size());
        }
        if (fresh.isEmpty()) {
            return 0;
        }
        collection.insertMany(session, fresh);
        return fresh.size();
    }

    /**
     * Drops documents whose id or (eventId, pairKey) slot is already taken,
     * either in the collection or by an earlier document of the same batch.
     */
    static List<Document> withoutExisting(List<Document> docs, Set<String> takenIds, Set<String> takenSlots) {
        Set<String> ids = new HashSet<>(takenIds);
        Set<String> slots = new HashSet<>(takenSlots);
        List<Document> fresh = new ArrayList<>();
        for (Document doc : docs) {
            String id = String.valueOf(doc.get("_id"));
            String slot = pairSlot(doc);
            if (ids.contains(id) || slots.contains(slot)) {
                continue;
            }
            ids.add(id);
            slots.add(slot);
            fresh.add(doc);
        }
        return fresh;
    }

    static String pairSlot(Document doc) {
        return doc.get("eventId") + "|" + doc.get("pairKey");
    }

    private void pause() {
        try {
            Thread.sleep(fighterBatchPauseMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MongoInterruptedException("Interrupted between fighter batches", e);
        }
    }

    private MongoDatabase database() {
        return mongoClient.getDatabase(databaseName);
    }

    private static Document toDocument(Object value) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(value, Map.class);
        Document doc = new Document(map);
        doc.put("_id", doc.remove("id"));
        return doc;
    }

    private static <T> T fromDocument(Document doc, Class<T> type) {
        Map<String, Object> map = new HashMap<>(doc);
        map.put("id", map.remove("_id"));
        map.remove("createdAt");
        map.remove("updatedAt");
        return OBJECT_MAPPER.convertValue(map, type);
    }

    @FunctionalInterface
    private interface CatalogWork {
        WriteCounts apply(ClientSession session);
    }
}
