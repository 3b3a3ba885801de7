package com.fightsync.application.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fightsync.domain.exception.CatalogUnavailableException;
import com.fightsync.domain.exception.CatalogWriteException;
import com.fightsync.domain.exception.RunInProgressException;
import com.fightsync.domain.exception.SourceBlockedException;
import com.fightsync.domain.exception.SourceException;
import com.fightsync.domain.ledger.StrikeDecision;
import com.fightsync.domain.ledger.StrikeLedger;
import com.fightsync.domain.matching.EventMatcher;
import com.fightsync.domain.matching.FightKeys;
import com.fightsync.domain.matching.MatchRule;
import com.fightsync.domain.matching.NameNormalizer;
import com.fightsync.domain.model.AuditLevel;
import com.fightsync.domain.model.CatalogChange;
import com.fightsync.domain.model.ChangeType;
import com.fightsync.domain.model.Event;
import com.fightsync.domain.model.EventListing;
import com.fightsync.domain.model.EventUpdate;
import com.fightsync.domain.model.FieldChange;
import com.fightsync.domain.model.Fight;
import com.fightsync.domain.model.Fighter;
import com.fightsync.domain.model.NewEventWrite;
import com.fightsync.domain.model.RunStatus;
import com.fightsync.domain.model.ScrapeRunRecord;
import com.fightsync.domain.model.ScrapedEvent;
import com.fightsync.domain.model.ScrapedFight;
import com.fightsync.domain.model.SourcePayload;
import com.fightsync.domain.model.WriteCounts;
import com.fightsync.domain.ports.AuditSink;
import com.fightsync.domain.ports.CatalogStore;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.fightsync.domain.ports.SourceAdapter;
import com.fightsync.domain.ports.StrikeLedgerStore;
import com.fightsync.domain.validation.RecordValidator;
import com.fightsync.domain.validation.ScrapedRecordMapper;
import com.fightsync.domain.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Use case for reconciling the catalog against all enabled sources.
 *
 * One run fetches every source, validates the records, matches scraped cards
 * to stored ones, writes the differences one card per transaction and routes
 * anything missing through the strike ledger. Only one run may be active at
 * a time in this process.
 */
public class ReconcileCatalogUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ReconcileCatalogUseCase.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final List<SourceAdapter> sources;
    private final CatalogStore catalogStore;
    private final StrikeLedgerStore ledgerStore;
    private final ScrapeRunRepository runRepository;
    private final AuditSink auditSink;
    private final EventMatcher matcher;
    private final RecordValidator validator;
    private final ScrapedRecordMapper recordMapper = new ScrapedRecordMapper();
    private final FightAssembler fightAssembler = new FightAssembler();
    private final StrikeLedger ledger;
    private final ReconciliationSettings settings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReconcileCatalogUseCase(
            List<SourceAdapter> sources,
            CatalogStore catalogStore,
            StrikeLedgerStore ledgerStore,
            ScrapeRunRepository runRepository,
            AuditSink auditSink,
            EventMatcher matcher,
            RecordValidator validator,
            ReconciliationSettings settings,
            Clock clock) {
        this.sources = List.copyOf(sources);
        this.catalogStore = catalogStore;
        this.ledgerStore = ledgerStore;
        this.runRepository = runRepository;
        this.auditSink = auditSink;
        this.matcher = matcher;
        this.validator = validator;
        this.settings = settings;
        this.clock = clock;
        this.ledger = new StrikeLedger(ledgerStore, settings.eventCancelThreshold(), settings.fightCancelThreshold());
    }

    /**
     * Runs one full reconciliation pass.
     *
     * @return Summary of the run, including partial failures
     * @throws CatalogUnavailableException if the stored catalog could not be read; nothing was written
     * @throws RunInProgressException if another run is active
     */
    public ReconciliationSummary execute() throws CatalogUnavailableException {
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException("A reconciliation run is already in progress");
        }
        try {
            return runOnce();
        } finally {
            running.set(false);
        }
    }

    private ReconciliationSummary runOnce() throws CatalogUnavailableException {
        long startNanos = System.nanoTime();
        Instant startedAt = clock.instant();
        LocalDate today = LocalDate.ofInstant(startedAt, settings.zone());
        Run run = new Run(new ScrapeRunRecord(UUID.randomUUID().toString(), startedAt), startNanos);

        logger.info("Starting reconciliation run {} with {} sources", run.record.getId(), sources.size());
        safely("start run record", () -> runRepository.start(run.record));

        try {
            return reconcile(run, today);
        } catch (RuntimeException e) {
            logger.error("Reconciliation run {} aborted during {}", run.record.getId(), run.phase, e);
            run.errors.add("Aborted during " + run.phase + ": " + e.getMessage());
            finish(run, RunStatus.FAILED, RunPhase.ABORTED);
            throw e;
        }
    }

    private ReconciliationSummary reconcile(Run run, LocalDate today) throws CatalogUnavailableException {
        List<Event> persisted;
        try {
            persisted = catalogStore.findUpcomingEvents(today);
        } catch (CatalogUnavailableException e) {
            logger.error("Could not read catalog baseline, aborting before any write", e);
            run.errors.add("Catalog unavailable: " + e.getMessage());
            finish(run, RunStatus.FAILED, RunPhase.ABORTED);
            throw e;
        }
        logger.info("Loaded {} upcoming events from catalog", persisted.size());

        run.phase = RunPhase.FETCHING;
        List<SourcePayload> payloads = new ArrayList<>();
        try {
            fetchAll(run, payloads);
        } catch (SourceBlockedException e) {
            String message = String.format(
                "Source %s is blocking requests (HTTP %d). Skipping run and leaving strike counters unchanged.",
                e.getSourceName(), e.getStatusCode());
            logger.warn(message);
            run.warnings.add(message);
            audit(AuditLevel.WARNING, "Source blocked, reconciliation skipped", context(
                "type", "source_blocked",
                "source", e.getSourceName(),
                "statusCode", e.getStatusCode()));
            return finish(run, RunStatus.BLOCKED, RunPhase.BLOCKED_SKIP);
        }

        if (payloads.isEmpty()) {
            run.errors.add("No source returned data; skipping reconciliation");
            logger.error("No source returned data; catalog and strike ledger left untouched");
            return finish(run, RunStatus.FAILED, RunPhase.ABORTED);
        }

        loadLedger(run);

        run.phase = RunPhase.VALIDATING;
        Map<String, Fighter> fightersById = validateFighters(payloads);
        List<EventListing> listings = validateListings(run, payloads, today);

        run.phase = RunPhase.MATCHING;
        List<EventListing> merged = mergeAcrossSources(listings);
        merged.sort(Comparator.comparing(EventListing::getDate));
        run.record.setEventsFound(merged.size());
        run.eventsProcessed = merged.size();
        logger.info("Scraped {} distinct events:", merged.size());
        for (EventListing listing : merged) {
            logger.info("   • {} from {}", listing, listing.getSources());
            run.fightsProcessed += listing.getFightsByKey().size();
        }

        run.phase = RunPhase.DIFFING;
        Set<String> seen = new HashSet<>();
        for (EventListing listing : merged) {
            reconcileListing(run, listing, persisted, seen, fightersById);
        }

        run.phase = RunPhase.WRITING;
        for (Event event : persisted) {
            if (!seen.contains(event.getId())) {
                handleMissingEvent(run, event);
            }
        }

        run.phase = RunPhase.LEDGER_PERSIST;
        persistLedger(run);

        boolean partial = !run.failedSources.isEmpty() || run.outcomes.stream().anyMatch(EventOutcome::isFailed);
        return finish(run, partial ? RunStatus.PARTIAL : RunStatus.SUCCESS, RunPhase.DONE);
    }

    private void fetchAll(Run run, List<SourcePayload> payloads) throws SourceBlockedException {
        for (SourceAdapter source : sources) {
            String name = source.getSourceName();
            logger.info("Fetching upcoming events from {}", name);
            try {
                SourcePayload payload = source.fetchUpcoming(settings.fetchLimit());
                payloads.add(payload);
                run.eventsBySource.put(name, payload.events().size());
                logger.info("Source {} returned {} events and {} fighters",
                    name, payload.events().size(), payload.fighters().size());
            } catch (SourceBlockedException e) {
                throw e;
            } catch (SourceException | RuntimeException e) {
                logger.error("Source {} failed, continuing with remaining sources", name, e);
                run.failedSources.put(name, e.getMessage());
                run.errors.add("Source " + name + " failed: " + e.getMessage());
            }
        }
    }

    private void loadLedger(Run run) {
        try {
            ledgerStore.load();
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not load strike ledger, counting from empty state without saving: {}", e.getMessage());
            run.warnings.add("Strike ledger unreadable: " + e.getMessage());
            run.ledgerUnreadable = true;
        }
    }

    private Map<String, Fighter> validateFighters(List<SourcePayload> payloads) {
        Map<String, Fighter> fightersById = new LinkedHashMap<>();
        for (SourcePayload payload : payloads) {
            int rejected = 0;
            for (JsonNode node : payload.fighters()) {
                ValidationResult result = validator.validateFighter(node);
                if (!result.valid()) {
                    rejected++;
                    logger.warn("⚠️ Skipping invalid fighter data from {}: {}",
                        payload.sourceName(), String.join(", ", result.errors()));
                    continue;
                }
                Fighter fighter;
                try {
                    fighter = recordMapper.toFighter(node);
                } catch (IllegalArgumentException e) {
                    rejected++;
                    logger.warn("⚠️ Skipping unmappable fighter data from {}: {}", payload.sourceName(), e.getMessage());
                    continue;
                }
                fightersById.putIfAbsent(fighter.getId(), fighter);
            }
            if (rejected > 0) {
                logger.info("Rejected {}/{} fighter records from {}", rejected, payload.fighters().size(), payload.sourceName());
            }
        }
        return fightersById;
    }

    private List<EventListing> validateListings(Run run, List<SourcePayload> payloads, LocalDate today) {
        List<EventListing> listings = new ArrayList<>();
        for (SourcePayload payload : payloads) {
            for (ScrapedEvent scraped : payload.events()) {
                if (scraped.getName() == null || scraped.getName().isBlank() || scraped.getDate() == null) {
                    logger.warn("⚠️ Skipping listing without name or date from {}: {}", payload.sourceName(), scraped.getId());
                    run.outcomes.add(EventOutcome.skipped(scraped.getId(), scraped.getName(), "missing name or date"));
                    continue;
                }
                if (scraped.getDate().isBefore(today)) {
                    logger.debug("Ignoring past event {} ({})", scraped.getName(), scraped.getDate());
                    continue;
                }

                EventListing listing = new EventListing(
                    resolveEventId(scraped),
                    scraped.getName(),
                    scraped.getDate(),
                    scraped.getLocation(),
                    scraped.getVenue());
                listing.getSources().add(payload.sourceName());

                int accepted = 0;
                for (JsonNode node : scraped.getFightCard()) {
                    ValidationResult result = validator.validateFight(node);
                    if (!result.valid()) {
                        logger.warn("⚠️ Skipping invalid fight data in {}: {}", scraped.getName(), String.join(", ", result.errors()));
                        continue;
                    }
                    ScrapedFight fight;
                    try {
                        fight = recordMapper.toFight(node);
                    } catch (IllegalArgumentException e) {
                        logger.warn("⚠️ Skipping unmappable fight data in {}: {}", scraped.getName(), e.getMessage());
                        continue;
                    }
                    if (listing.addFight(FightKeys.of(fight), fight)) {
                        accepted++;
                    } else {
                        logger.debug("Duplicate bout {} vs {} in {}", fight.getFighter1Name(), fight.getFighter2Name(), scraped.getName());
                    }
                }
                if (accepted < scraped.getFightCard().size()) {
                    logger.info("Accepted {}/{} fights for {}", accepted, scraped.getFightCard().size(), scraped.getName());
                }
                listings.add(listing);
            }
        }
        return listings;
    }

    /**
     * Collapses listings of the same card reported by different sources.
     * Earlier sources take precedence for scalar fields.
     */
    private List<EventListing> mergeAcrossSources(List<EventListing> listings) {
        List<EventListing> merged = new ArrayList<>();
        for (EventListing listing : listings) {
            Optional<EventListing> same = merged.stream()
                .filter(m -> matcher.sameEvent(m.getName(), m.getDate(), listing.getName(), listing.getDate()))
                .findFirst();
            if (same.isPresent()) {
                logger.debug("Merging {} into {}", listing, same.get());
                same.get().mergeFrom(listing);
            } else {
                merged.add(listing);
            }
        }
        return merged;
    }

    private void reconcileListing(Run run, EventListing listing, List<Event> persisted, Set<String> seen,
                                  Map<String, Fighter> fightersById) {
        Event match = null;
        MatchRule rule = null;
        boolean alreadyClaimed = false;
        // A stable id wins over name matching so a rescheduled card keeps its row
        Optional<Event> sameId = persisted.stream()
            .filter(candidate -> candidate.getId().equals(listing.getId()))
            .findFirst();
        if (sameId.isPresent()) {
            match = sameId.get();
            rule = MatchRule.SAME_ID;
            alreadyClaimed = seen.contains(match.getId());
        } else {
            for (Event candidate : persisted) {
                Optional<MatchRule> result = matcher.match(candidate, listing);
                if (result.isEmpty()) {
                    continue;
                }
                if (!seen.contains(candidate.getId())) {
                    match = candidate;
                    rule = result.get();
                    alreadyClaimed = false;
                    break;
                }
                if (match == null) {
                    match = candidate;
                    alreadyClaimed = true;
                }
            }
        }

        if (match == null) {
            handleNewEvent(run, listing, fightersById);
            return;
        }
        if (alreadyClaimed) {
            logger.warn("Listing {} matches {} which was already reconciled this run; skipping", listing, match);
            run.outcomes.add(EventOutcome.skipped(match.getId(), listing.getName(), "duplicate listing"));
            return;
        }

        logger.debug("Matched {} to {} via {}", listing, match, rule);
        seen.add(match.getId());
        if (ledger.clearEvent(match.getId())) {
            logger.info("✅ Event restored after temporary absence: {}", match.getName());
        }
        handleMatchedEvent(run, match, listing, fightersById);
    }

    private void handleNewEvent(Run run, EventListing listing, Map<String, Fighter> fightersById) {
        logger.info("Adding new event: {}", listing);
        Event event = new Event(listing.getId(), listing.getName(), listing.getDate(), listing.getLocation(), listing.getVenue());

        List<Fight> fights = new ArrayList<>();
        for (ScrapedFight scraped : listing.getFights()) {
            fights.add(fightAssembler.newFight(event.getId(), scraped));
        }
        List<Fighter> fighters = referencedFighters(fights, fightersById);

        try {
            WriteCounts counts = catalogStore.createEvent(new NewEventWrite(event, fighters, fights));
            run.record.addCounts(counts);
            run.record.setEventsAdded(run.record.getEventsAdded() + 1);
            ledger.clearEvent(event.getId());
            ledgerStore.deleteFightsForEvent(event.getId());
            run.changes.add(change(ChangeType.ADDED, event.getId(), event.getName(),
                fights.size() + " fights, " + fighters.size() + " fighters"));
            run.outcomes.add(EventOutcome.ok(event.getId(), event.getName(), "added"));
            logger.info("✅ Created event {} with {} fighters and {} fights", event.getName(), fighters.size(), fights.size());
        } catch (CatalogWriteException e) {
            logger.error("❌ Transaction failed for event {}", event.getName(), e);
            run.errors.add("Transaction failed for event " + event.getName() + ": " + e.getMessage());
            run.outcomes.add(EventOutcome.failed(event.getId(), event.getName(), e));
        }
    }

    private void handleMatchedEvent(Run run, Event existing, EventListing listing, Map<String, Fighter> fightersById) {
        EventUpdate update = new EventUpdate(existing.getId());
        detectFieldChanges(existing, listing, update);

        Map<String, Fight> storedByKey = new LinkedHashMap<>();
        for (Fight fight : existing.getFights()) {
            storedByKey.putIfAbsent(FightKeys.of(fight), fight);
        }

        List<Fight> written = new ArrayList<>();
        for (Map.Entry<String, ScrapedFight> entry : listing.getFightsByKey().entrySet()) {
            Fight stored = storedByKey.get(entry.getKey());
            if (stored == null) {
                Fight added = fightAssembler.newFight(existing.getId(), entry.getValue());
                update.getFightsToInsert().add(added);
                written.add(added);
                continue;
            }
            ledger.clearFight(existing.getId(), entry.getKey());
            Fight merged = fightAssembler.merge(stored, entry.getValue());
            if (fightAssembler.schedulingChanged(stored, merged)) {
                update.getFightsToUpdate().add(merged);
                written.add(merged);
            }
        }

        Map<String, Fight> removals = new LinkedHashMap<>();
        if (listing.getFightsByKey().isEmpty()) {
            logger.debug("No bouts listed for {} yet; not counting fight misses", existing.getName());
        } else {
            for (Map.Entry<String, Fight> entry : storedByKey.entrySet()) {
                if (listing.getFightsByKey().containsKey(entry.getKey())) {
                    continue;
                }
                Fight missing = entry.getValue();
                StrikeDecision decision = ledger.recordFightMiss(existing.getId(), entry.getKey(), clock.instant());
                if (decision.thresholdReached()) {
                    update.getFightIdsToRemove().add(missing.getId());
                    removals.put(entry.getKey(), missing);
                } else {
                    warnFightMissing(run, existing, missing, decision);
                }
            }
        }

        update.getFighters().addAll(referencedFighters(written, fightersById));

        if (update.isEmpty()) {
            run.outcomes.add(EventOutcome.ok(existing.getId(), existing.getName(), "unchanged"));
            return;
        }

        logger.info("Updating event: {} - {} field changes, +{} fights, ~{} fights, -{} fights",
            existing.getName(), update.getFieldChanges().size(), update.getFightsToInsert().size(),
            update.getFightsToUpdate().size(), update.getFightIdsToRemove().size());
        try {
            WriteCounts counts = catalogStore.applyEventUpdate(update);
            run.record.addCounts(counts);
        } catch (CatalogWriteException e) {
            logger.error("Failed to update event {}", existing.getName(), e);
            run.errors.add("Failed to update event " + existing.getName() + ": " + e.getMessage());
            run.outcomes.add(EventOutcome.failed(existing.getId(), existing.getName(), e));
            return;
        }

        for (Map.Entry<String, Fight> removed : removals.entrySet()) {
            ledger.consumeFight(existing.getId(), removed.getKey());
            Fight fight = removed.getValue();
            logger.error("Fight auto-removed after repeated misses in {}: {}", existing.getName(), fight.label());
            audit(AuditLevel.ERROR, "Fight auto-removed after repeated misses", context(
                "eventId", existing.getId(),
                "fightId", fight.getId(),
                "fight", fight.label(),
                "threshold", ledger.getFightThreshold()));
            run.changes.add(change(ChangeType.FIGHT_REMOVED, existing.getId(), existing.getName(), fight.label()));
        }

        if (!update.getFieldChanges().isEmpty() || !update.getFightsToInsert().isEmpty() || !update.getFightsToUpdate().isEmpty()) {
            run.changes.add(change(ChangeType.MODIFIED, existing.getId(), existing.getName(), describe(update)));
        }
        run.outcomes.add(EventOutcome.ok(existing.getId(), existing.getName(), "updated"));
    }

    private void detectFieldChanges(Event existing, EventListing listing, EventUpdate update) {
        if (!Objects.equals(existing.getDate(), listing.getDate())) {
            update.getFieldChanges().add(new FieldChange("date", existing.getDate(), listing.getDate()));
        }
        if (supplied(listing.getLocation()) && !listing.getLocation().equals(existing.getLocation())) {
            update.getFieldChanges().add(new FieldChange("location", existing.getLocation(), listing.getLocation()));
        }
        if (supplied(listing.getVenue()) && !listing.getVenue().equals(existing.getVenue())) {
            update.getFieldChanges().add(new FieldChange("venue", existing.getVenue(), listing.getVenue()));
        }
    }

    private void handleMissingEvent(Run run, Event event) {
        StrikeDecision decision = ledger.recordEventMiss(event.getId(), clock.instant());
        if (!decision.thresholdReached()) {
            String message = String.format("⚠️ Event missing from scrape (%d/%d): %s",
                decision.count(), decision.threshold(), event.getName());
            logger.warn(message);
            run.warnings.add(message);
            audit(AuditLevel.WARNING, "Event missing from scrape", context(
                "type", "event_missing_warning",
                "eventId", event.getId(),
                "eventName", event.getName(),
                "missingCount", decision.count(),
                "threshold", decision.threshold()));
            run.outcomes.add(EventOutcome.skipped(event.getId(), event.getName(),
                "missing " + decision.count() + "/" + decision.threshold()));
            return;
        }

        try {
            catalogStore.markEventCompleted(event.getId());
        } catch (CatalogWriteException e) {
            logger.error("Failed to cancel event {}; strikes kept for next run", event.getName(), e);
            run.errors.add("Failed to cancel event " + event.getName() + ": " + e.getMessage());
            run.outcomes.add(EventOutcome.failed(event.getId(), event.getName(), e));
            return;
        }

        ledger.consumeEvent(event.getId());
        run.record.setEventsCancelled(run.record.getEventsCancelled() + 1);
        logger.error("Event cancelled after {} consecutive misses: {}", decision.count(), event.getName());
        audit(AuditLevel.ERROR, "Event auto-cancelled after repeated misses", context(
            "eventId", event.getId(),
            "eventName", event.getName(),
            "missingCount", decision.count(),
            "threshold", decision.threshold()));
        run.changes.add(change(ChangeType.CANCELLED, event.getId(), event.getName(),
            "missing " + decision.count() + " consecutive runs"));
        run.outcomes.add(EventOutcome.ok(event.getId(), event.getName(), "cancelled"));
    }

    private void warnFightMissing(Run run, Event event, Fight fight, StrikeDecision decision) {
        String message = String.format("⚠️ Fight missing from scrape (%d/%d) in %s: %s",
            decision.count(), decision.threshold(), event.getName(), fight.label());
        logger.warn(message);
        run.warnings.add(message);
        audit(AuditLevel.WARNING, "Fight missing from scrape", context(
            "type", "fight_missing_warning",
            "eventId", event.getId(),
            "fightId", fight.getId(),
            "fight", fight.label(),
            "missingCount", decision.count(),
            "threshold", decision.threshold()));
    }

    private void persistLedger(Run run) {
        if (run.ledgerUnreadable) {
            // Keep the existing files so stored strikes survive; deleting them resets the ledger
            logger.warn("Strike ledger was unreadable at start of run; leaving ledger files untouched");
            return;
        }
        try {
            ledgerStore.flush();
        } catch (IOException | RuntimeException e) {
            String message = "Failed to persist strike ledger: " + e.getMessage();
            logger.warn(message);
            run.warnings.add(message);
        }
    }

    private ReconciliationSummary finish(Run run, RunStatus status, RunPhase phase) {
        run.phase = phase;
        ScrapeRunRecord record = run.record;
        record.setStatus(status);
        record.setEndTime(clock.instant());
        if (!run.errors.isEmpty()) {
            String joined = String.join("; ", run.errors);
            record.setErrorMessage(joined.length() > MAX_ERROR_MESSAGE_LENGTH
                ? joined.substring(0, MAX_ERROR_MESSAGE_LENGTH) + "..."
                : joined);
        }
        safely("finish run record", () -> runRepository.finish(record));

        long elapsedMs = (System.nanoTime() - run.startNanos) / 1_000_000;
        logger.info("Reconciliation {} finished with status {}: {} events, {} fights, {} changes, {} errors in {}ms",
            record.getId(), status, run.eventsProcessed, run.fightsProcessed, run.changes.size(), run.errors.size(), elapsedMs);

        return new ReconciliationSummary(
            record.getId(),
            status,
            phase,
            run.eventsProcessed,
            run.fightsProcessed,
            Map.copyOf(run.eventsBySource),
            List.copyOf(run.changes),
            List.copyOf(run.outcomes),
            List.copyOf(run.warnings),
            List.copyOf(run.errors),
            elapsedMs);
    }

    private List<Fighter> referencedFighters(List<Fight> fights, Map<String, Fighter> fightersById) {
        Map<String, Fighter> referenced = new LinkedHashMap<>();
        for (Fight fight : fights) {
            referenced.computeIfAbsent(fight.getFighter1Id(), id ->
                fightAssembler.resolveFighter(id, fight.getFighter1Name(), fight.getWeightClass(), fightersById));
            referenced.computeIfAbsent(fight.getFighter2Id(), id ->
                fightAssembler.resolveFighter(id, fight.getFighter2Name(), fight.getWeightClass(), fightersById));
        }
        return new ArrayList<>(referenced.values());
    }

    private String resolveEventId(ScrapedEvent scraped) {
        if (supplied(scraped.getId())) {
            return scraped.getId();
        }
        String slug = NameNormalizer.normalizeNameSpan(scraped.getName()).replace(' ', '-');
        return slug + "-" + scraped.getDate();
    }

    private void audit(AuditLevel level, String message, Map<String, Object> context) {
        try {
            auditSink.record(level, message, context);
        } catch (RuntimeException e) {
            logger.warn("Audit sink rejected '{}': {}", message, e.getMessage());
        }
    }

    private void safely(String action, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            logger.warn("Could not {}: {}", action, e.getMessage());
        }
    }

    private CatalogChange change(ChangeType type, String eventId, String eventName, String detail) {
        return new CatalogChange(type, eventId, eventName, detail, clock.instant());
    }

    private static String describe(EventUpdate update) {
        List<String> parts = new ArrayList<>();
        update.getFieldChanges().forEach(c -> parts.add(c.toString()));
        if (update.hasFightCardChanges()) {
            parts.add("fightCard: +" + update.getFightsToInsert().size()
                + " ~" + update.getFightsToUpdate().size()
                + " -" + update.getFightIdsToRemove().size());
        }
        return String.join(", ", parts);
    }

    private static boolean supplied(String value) {
        return value != null && !value.isBlank();
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return context;
    }

    /**
     * Mutable state of the run in progress.
     */
    private static final class Run {
        private final ScrapeRunRecord record;
        private final long startNanos;
        private final Map<String, Integer> eventsBySource = new LinkedHashMap<>();
        private final Map<String, String> failedSources = new LinkedHashMap<>();
        private final List<CatalogChange> changes = new ArrayList<>();
        private final List<EventOutcome> outcomes = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private RunPhase phase = RunPhase.FETCHING;
        private int eventsProcessed;
        private int fightsProcessed;
        private boolean ledgerUnreadable;

        private Run(ScrapeRunRecord record, long startNanos) {
            this.record = record;
            this.startNanos = startNanos;
        }
    }
}
