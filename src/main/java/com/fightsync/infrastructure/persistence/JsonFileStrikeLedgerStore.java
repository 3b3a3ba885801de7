package com.fightsync.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fightsync.domain.model.StrikeEntry;
import com.fightsync.domain.ports.StrikeLedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Strike ledger kept in two JSON files:
 * <pre>
 * missing-events.json  {"eventId": {"count": 2, "lastSeen": "2025-10-18T04:00:00Z"}}
 * missing-fights.json  {"eventId": {"fighterA-fighterB": {"count": 1, "lastSeen": "..."}}}
 * </pre>
 * Deleting either file resets the corresponding strikes.
 */
public class JsonFileStrikeLedgerStore implements StrikeLedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileStrikeLedgerStore.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static final String EVENTS_FILE = "missing-events.json";
    static final String FIGHTS_FILE = "missing-fights.json";

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private final Path eventsFile;
    private final Path fightsFile;

    private Map<String, StrikeEntry> events = new TreeMap<>();
    private Map<String, Map<String, StrikeEntry>> fights = new TreeMap<>();

    public JsonFileStrikeLedgerStore(Path directory) {
        this.eventsFile = directory.resolve(EVENTS_FILE);
        this.fightsFile = directory.resolve(FIGHTS_FILE);
    }

    @Override
    public void load() throws IOException {
        events = new TreeMap<>();
        fights = new TreeMap<>();

        if (Files.exists(eventsFile)) {
            Map<String, StrikeEntry> loaded = OBJECT_MAPPER.readValue(
                eventsFile.toFile(), new TypeReference<Map<String, StrikeEntry>>() {});
            if (loaded != null) {
                events.putAll(loaded);
            }
        }
        if (Files.exists(fightsFile)) {
            Map<String, Map<String, StrikeEntry>> loaded = OBJECT_MAPPER.readValue(
                fightsFile.toFile(), new TypeReference<Map<String, Map<String, StrikeEntry>>>() {});
            if (loaded != null) {
                loaded.forEach((eventId, entries) -> fights.put(eventId, new TreeMap<>(entries)));
            }
        }

        logger.debug("Loaded strike ledger: {} events, {} events with fight strikes", events.size(), fights.size());
    }

    @Override
    public Optional<StrikeEntry> getEvent(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public void setEvent(String eventId, StrikeEntry entry) {
        events.put(eventId, entry);
    }

    @Override
    public boolean deleteEvent(String eventId) {
        return events.remove(eventId) != null;
    }

    @Override
    public Optional<StrikeEntry> getFight(String eventId, String fightKey) {
        Map<String, StrikeEntry> entries = fights.get(eventId);
        return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(fightKey));
    }

    @Override
    public void setFight(String eventId, String fightKey, StrikeEntry entry) {
        fights.computeIfAbsent(eventId, id -> new TreeMap<>()).put(fightKey, entry);
    }

    @Override
    public boolean deleteFight(String eventId, String fightKey) {
        Map<String, StrikeEntry> entries = fights.get(eventId);
        if (entries == null) {
            return false;
        }
        boolean removed = entries.remove(fightKey) != null;
        if (entries.isEmpty()) {
            fights.remove(eventId);
        }
        return removed;
    }

    @Override
    public void deleteFightsForEvent(String eventId) {
        fights.remove(eventId);
    }

    @Override
    public Map<String, StrikeEntry> eventEntries() {
        return Collections.unmodifiableMap(new TreeMap<>(events));
    }

    @Override
    public Map<String, Map<String, StrikeEntry>> fightEntries() {
        Map<String, Map<String, StrikeEntry>> copy = new TreeMap<>();
        fights.forEach((eventId, entries) -> copy.put(eventId, Collections.unmodifiableMap(new TreeMap<>(entries))));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public void flush() throws IOException {
        Files.createDirectories(eventsFile.toAbsolutePath().getParent());
        writeAtomically(eventsFile, events);
        writeAtomically(fightsFile, fights);
        logger.debug("Flushed strike ledger to {}", eventsFile.toAbsolutePath().getParent());
    }

    private static void writeAtomically(Path target, Object state) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        OBJECT_MAPPER.writeValue(temp.toFile(), state);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
