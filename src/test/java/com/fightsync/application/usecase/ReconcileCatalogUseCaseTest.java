package com.fightsync.application.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fightsync.domain.exception.CatalogUnavailableException;
import com.fightsync.domain.exception.CatalogWriteException;
import com.fightsync.domain.exception.RunInProgressException;
import com.fightsync.domain.exception.SourceBlockedException;
import com.fightsync.domain.exception.SourceException;
import com.fightsync.domain.matching.DefaultEventMatcher;
import com.fightsync.domain.matching.FightKeys;
import com.fightsync.domain.model.AuditLevel;
import com.fightsync.domain.model.ChangeType;
import com.fightsync.domain.model.Event;
import com.fightsync.domain.model.EventUpdate;
import com.fightsync.domain.model.FieldChange;
import com.fightsync.domain.model.Fight;
import com.fightsync.domain.model.Fighter;
import com.fightsync.domain.model.NewEventWrite;
import com.fightsync.domain.model.RunStatus;
import com.fightsync.domain.model.ScrapeRunRecord;
import com.fightsync.domain.model.ScrapedEvent;
import com.fightsync.domain.model.SourcePayload;
import com.fightsync.domain.model.StrikeEntry;
import com.fightsync.domain.model.WriteCounts;
import com.fightsync.domain.ports.AuditSink;
import com.fightsync.domain.ports.CatalogStore;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.fightsync.domain.ports.SourceAdapter;
import com.fightsync.domain.validation.RecordValidator;
import com.fightsync.domain.validation.ValidationResult;
import com.fightsync.infrastructure.persistence.JsonFileStrikeLedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReconcileCatalogUseCase.
 */
class ReconcileCatalogUseCaseTest {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate OCT_18 = LocalDate.of(2025, 10, 18);
    private static final LocalDate OCT_25 = LocalDate.of(2025, 10, 25);

    @TempDir
    Path ledgerDir;

    private TestCatalogStore catalog;
    private JsonFileStrikeLedgerStore ledgerStore;
    private TestRunRepository runs;
    private RecordingAuditSink audit;
    private TestSource primary;

    @BeforeEach
    void setUp() {
        catalog = new TestCatalogStore();
        ledgerStore = new JsonFileStrikeLedgerStore(ledgerDir);
        runs = new TestRunRepository();
        audit = new RecordingAuditSink();
        primary = new TestSource("primary");
    }

    private ReconcileCatalogUseCase useCase(SourceAdapter... sources) {
        return useCase(new RecordValidator(), sources);
    }

    private ReconcileCatalogUseCase useCase(RecordValidator validator, SourceAdapter... sources) {
        return new ReconcileCatalogUseCase(
            List.of(sources),
            catalog,
            ledgerStore,
            runs,
            audit,
            new DefaultEventMatcher(List.of("ufc")),
            validator,
            new ReconciliationSettings(3, 2, 15, ZoneOffset.UTC),
            CLOCK);
    }

    @Test
    void testNewEventCreatedWithFightersAndFights() throws Exception {
        primary.respond(List.of(card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
                fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"),
                fight("b2", "f3", "Jean Silva", "f4", "Diego Lopes"))),
            fighter("f1", "Reinier de Ridder"));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertEquals(RunPhase.DONE, summary.finalPhase());
        assertEquals(1, summary.eventsProcessed());
        assertEquals(2, summary.fightsProcessed());
        assertEquals(1, summary.eventsBySource().get("primary"));
        assertEquals(ChangeType.ADDED, summary.changes().get(0).type());

        assertTrue(catalog.events.containsKey("e1"));
        assertEquals(2, catalog.fightsFor("e1").size());
        assertEquals(4, catalog.fighters.size());
        assertEquals("27-1-0", catalog.fighters.get("f1").getRecord());
        assertEquals("Diego Lopes", catalog.fighters.get("f4").getName());

        ScrapeRunRecord record = runs.finished.get(0);
        assertEquals(RunStatus.SUCCESS, record.getStatus());
        assertEquals(1, record.getEventsFound());
        assertEquals(1, record.getEventsAdded());
        assertEquals(2, record.getFightsAdded());
        assertEquals(4, record.getFightersAdded());
        assertNotNull(record.getEndTime());
    }

    @Test
    void testRepeatedRunWithSameDataWritesNothing() throws Exception {
        primary.respond(List.of(card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
            fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"))));
        ReconcileCatalogUseCase useCase = useCase(primary);
        useCase.execute();
        int writesAfterFirstRun = catalog.writes;

        ReconciliationSummary second = useCase.execute();

        assertEquals(writesAfterFirstRun, catalog.writes);
        assertTrue(second.changes().isEmpty());
        assertEquals(1, catalog.events.size());
        assertTrue(ledgerStore.eventEntries().isEmpty());
    }

    @Test
    void testHeaderVariantFromSecondSourceCollapsesIntoOneEvent() throws Exception {
        primary.respond(List.of(card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
            fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"))));
        TestSource secondary = new TestSource("secondary");
        secondary.respond(List.of(card("other-id", "UFC Fight Night 262 - De Ridder vs. Allen", OCT_18,
            fight("x1", "f1", "Reinier De Ridder", "f2", "Brendan Allen"),
            fight("x2", "f5", "Tim Elliott", "f6", "Kai Asakura"))));

        ReconciliationSummary summary = useCase(primary, secondary).execute();

        assertEquals(1, summary.eventsProcessed());
        assertEquals(Set.of("e1"), catalog.events.keySet());
        assertEquals(2, catalog.fightsFor("e1").size());
        assertEquals(Set.of("b1", "x2"), catalog.fightsFor("e1").stream().map(Fight::getId).collect(Collectors.toSet()));
    }

    @Test
    void testEventCancelledOnlyOnThirdConsecutiveMiss() throws Exception {
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        primary.respond(List.of(card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));
        ReconcileCatalogUseCase useCase = useCase(primary);

        useCase.execute();
        useCase.execute();
        assertFalse(catalog.events.get("old").isCompleted());
        assertEquals(2, audit.count(AuditLevel.WARNING));
        assertEquals(2, ledgerStore.getEvent("old").orElseThrow().count());

        ReconciliationSummary third = useCase.execute();

        assertTrue(catalog.events.get("old").isCompleted());
        assertTrue(third.changes().stream().anyMatch(c -> c.type() == ChangeType.CANCELLED && c.eventId().equals("old")));
        assertEquals(1, audit.count(AuditLevel.ERROR));
        assertEquals(1, runs.finished.get(2).getEventsCancelled());
        ledgerStore.load();
        assertTrue(ledgerStore.getEvent("old").isEmpty());
    }

    @Test
    void testReappearanceResetsEventStrikes() throws Exception {
        Event stored = event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        catalog.seed(stored);
        ScrapedEvent other = card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25);
        ScrapedEvent present = card("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        ReconcileCatalogUseCase useCase = useCase(primary);

        primary.respond(List.of(other));
        useCase.execute();
        useCase.execute();
        primary.respond(List.of(other, present));
        useCase.execute();
        assertTrue(ledgerStore.getEvent("old").isEmpty());

        primary.respond(List.of(other));
        useCase.execute();
        useCase.execute();

        assertFalse(catalog.events.get("old").isCompleted());
        assertEquals(2, ledgerStore.getEvent("old").orElseThrow().count());
    }

    @Test
    void testBlockedSourceSkipsRunWithoutTouchingLedger() throws Exception {
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        ledgerStore.setEvent("old", new StrikeEntry(2, Instant.parse("2025-09-30T00:00:00Z")));
        ledgerStore.flush();
        TestSource secondary = new TestSource("secondary");
        secondary.respond(List.of(card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));
        primary.fail(new SourceBlockedException("primary", 403, "Access refused with HTTP 403"));

        ReconciliationSummary summary = useCase(primary, secondary).execute();

        assertEquals(RunStatus.BLOCKED, summary.status());
        assertEquals(RunPhase.BLOCKED_SKIP, summary.finalPhase());
        assertEquals(0, catalog.writes);
        assertFalse(catalog.events.get("old").isCompleted());
        assertEquals(0, secondary.calls);
        assertEquals(1, audit.count(AuditLevel.WARNING));
        assertEquals("source_blocked", audit.entries.get(0).context().get("type"));

        JsonFileStrikeLedgerStore reloaded = new JsonFileStrikeLedgerStore(ledgerDir);
        reloaded.load();
        assertEquals(2, reloaded.getEvent("old").orElseThrow().count());
        assertEquals(RunStatus.BLOCKED, runs.finished.get(0).getStatus());
    }

    @Test
    void testAllSourcesFailingCountsNoMisses() throws Exception {
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        primary.fail(new SourceException("primary", "connection reset"));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.FAILED, summary.status());
        assertFalse(summary.errors().isEmpty());
        assertTrue(ledgerStore.eventEntries().isEmpty());
        assertEquals(0, catalog.writes);
        assertNotNull(runs.finished.get(0).getErrorMessage());
    }

    @Test
    void testOneFailingSourceMakesRunPartial() throws Exception {
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        TestSource broken = new TestSource("broken");
        broken.fail(new SourceException("broken", "HTTP request failed with status 500"));
        primary.respond(List.of(card("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18)));

        ReconciliationSummary summary = useCase(broken, primary).execute();

        assertEquals(RunStatus.PARTIAL, summary.status());
        assertTrue(ledgerStore.eventEntries().isEmpty());
        assertTrue(summary.errors().get(0).contains("broken"));
    }

    @Test
    void testMatchedEventAppliesOnlySuppliedFieldChanges() throws Exception {
        Event stored = event("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        stored.setLocation("Las Vegas, NV");
        stored.setVenue("Old Arena");
        catalog.seed(stored);

        ScrapedEvent scraped = card("source-id", "UFC 320", OCT_18);
        scraped.setVenue("T-Mobile Arena");
        primary.respond(List.of(scraped));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals("T-Mobile Arena", catalog.events.get("e1").getVenue());
        assertEquals("Las Vegas, NV", catalog.events.get("e1").getLocation());
        assertEquals(ChangeType.MODIFIED, summary.changes().get(0).type());
        assertFalse(catalog.events.containsKey("source-id"));
    }

    @Test
    void testFightUpdatePreservesPredictionFields() throws Exception {
        Event stored = event("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        Fight existing = storedFight("e1", "b1", "f1", "Magomed Ankalaev", "f2", "Alex Pereira");
        existing.setFunFactor(8);
        existing.setAiDescription("Rematch of a close title fight");
        existing.setPredictedFunScore(7.5);
        stored.getFights().add(existing);
        catalog.seed(stored);

        ObjectNode changed = fight("new-id", "f1", "Magomed Ankalaev", "f2", "Alex Pereira");
        changed.put("scheduledRounds", 5);
        changed.put("titleFight", true);
        primary.respond(List.of(card("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18, changed)));

        ReconciliationSummary summary = useCase(primary).execute();

        Fight after = catalog.fights.get("b1");
        assertEquals(5, after.getScheduledRounds());
        assertTrue(after.isTitleFight());
        assertEquals(8, after.getFunFactor());
        assertEquals("Rematch of a close title fight", after.getAiDescription());
        assertEquals(7.5, after.getPredictedFunScore());
        assertEquals("light heavyweight", after.getWeightClass());
        assertFalse(catalog.fights.containsKey("new-id"));
        assertEquals(1, runs.finished.get(0).getFightsUpdated());
        assertEquals(ChangeType.MODIFIED, summary.changes().get(0).type());
    }

    @Test
    void testFightRemovedOnSecondConsecutiveMiss() throws Exception {
        Event stored = event("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        stored.getFights().add(storedFight("e1", "b1", "f1", "Magomed Ankalaev", "f2", "Alex Pereira"));
        stored.getFights().add(storedFight("e1", "b2", "f3", "Jiri Prochazka", "f4", "Khalil Rountree"));
        catalog.seed(stored);
        primary.respond(List.of(card("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18,
            fight("b1", "f1", "Magomed Ankalaev", "f2", "Alex Pereira"))));
        ReconcileCatalogUseCase useCase = useCase(primary);
        String key = FightKeys.pairKey("Jiri Prochazka", "Khalil Rountree");

        ReconciliationSummary first = useCase.execute();
        assertTrue(catalog.fights.containsKey("b2"));
        assertEquals(1, ledgerStore.getFight("e1", key).orElseThrow().count());
        assertEquals(1, audit.count(AuditLevel.WARNING));
        assertTrue(first.warnings().get(0).contains("(1/2)"));

        ReconciliationSummary second = useCase.execute();

        assertFalse(catalog.fights.containsKey("b2"));
        assertTrue(catalog.fights.containsKey("b1"));
        assertTrue(ledgerStore.getFight("e1", key).isEmpty());
        assertTrue(second.changes().stream().anyMatch(c -> c.type() == ChangeType.FIGHT_REMOVED));
        assertEquals(1, audit.count(AuditLevel.ERROR));
        assertEquals(1, runs.finished.get(1).getFightsRemoved());
    }

    @Test
    void testEmptyScrapedCardCountsNoFightMisses() throws Exception {
        Event stored = event("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18);
        stored.getFights().add(storedFight("e1", "b1", "f1", "Magomed Ankalaev", "f2", "Alex Pereira"));
        catalog.seed(stored);
        primary.respond(List.of(card("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18)));
        ReconcileCatalogUseCase useCase = useCase(primary);

        useCase.execute();
        useCase.execute();

        assertTrue(catalog.fights.containsKey("b1"));
        assertTrue(ledgerStore.fightEntries().isEmpty());
    }

    @Test
    void testPastAndInvalidRecordsAreDropped() throws Exception {
        ObjectNode sameFighter = fight("bad", "f9", "Someone", "f9", "Someone");
        ObjectNode missingName = fight("bad2", "f7", null, "f8", "Other");
        primary.respond(List.of(
            card("past", "UFC 319: Du Plessis vs. Chimaev", LocalDate.of(2025, 8, 16)),
            card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
                fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"), sameFighter, missingName)),
            MAPPER.createObjectNode().put("name", "No id"));

        useCase(primary).execute();

        assertFalse(catalog.events.containsKey("past"));
        assertEquals(List.of("b1"), catalog.fightsFor("e1").stream().map(Fight::getId).collect(Collectors.toList()));
        assertEquals(2, catalog.fighters.size());
    }

    @Test
    void testOversizedNumbersRejectOnlyTheirRecord() throws Exception {
        ObjectNode oversized = fight("b2", "f3", "Jean Silva", "f4", "Diego Lopes");
        oversized.put("scheduledRounds", 3000000000L);
        primary.respond(List.of(card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
                fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"), oversized)),
            MAPPER.createObjectNode().put("id", "f1").put("name", "Reinier de Ridder")
                .put("wins", 5000000000L).put("record", "5000000000-0-0"));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertEquals(List.of("b1"), catalog.fightsFor("e1").stream().map(Fight::getId).collect(Collectors.toList()));
        assertNull(catalog.fighters.get("f1").getRecord());
        assertEquals(0, catalog.fighters.get("f1").getWins());
    }

    @Test
    void testUnmappableRecordIsSkippedEvenIfValidatorAcceptsIt() throws Exception {
        RecordValidator acceptAll = new RecordValidator() {
            @Override
            public ValidationResult validateFight(JsonNode fight) {
                return ValidationResult.of(List.of());
            }

            @Override
            public ValidationResult validateFighter(JsonNode fighter) {
                return ValidationResult.of(List.of());
            }
        };
        ObjectNode oversized = fight("b2", "f3", "Jean Silva", "f4", "Diego Lopes");
        oversized.put("scheduledRounds", 3000000000L);
        primary.respond(List.of(card("e1", "UFC Fight Night: de Ridder vs. Allen", OCT_18,
                fight("b1", "f1", "Reinier de Ridder", "f2", "Brendan Allen"), oversized)),
            MAPPER.createObjectNode().put("id", "f1").put("name", "Reinier de Ridder").put("wins", 5000000000L));

        ReconciliationSummary summary = useCase(acceptAll, primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertEquals(RunStatus.SUCCESS, runs.finished.get(0).getStatus());
        assertEquals(List.of("b1"), catalog.fightsFor("e1").stream().map(Fight::getId).collect(Collectors.toList()));
    }

    @Test
    void testRescheduledEventWithSameIdIsMovedNotDuplicated() throws Exception {
        catalog.seed(event("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        primary.respond(List.of(card("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_25)));
        ReconcileCatalogUseCase useCase = useCase(primary);

        ReconciliationSummary first = useCase.execute();

        assertEquals(RunStatus.SUCCESS, first.status());
        assertEquals(OCT_25, catalog.events.get("e1").getDate());
        assertEquals(ChangeType.MODIFIED, first.changes().get(0).type());
        assertTrue(first.changes().get(0).detail().contains("date"));

        useCase.execute();
        ReconciliationSummary third = useCase.execute();

        assertEquals(RunStatus.SUCCESS, third.status());
        assertTrue(third.changes().isEmpty());
        assertFalse(catalog.events.get("e1").isCompleted());
        assertEquals(1, catalog.events.size());
        assertTrue(ledgerStore.eventEntries().isEmpty());
        assertEquals(0, audit.count(AuditLevel.WARNING));
    }

    @Test
    void testUnreadableLedgerIsNotOverwritten() throws Exception {
        Path eventsFile = ledgerDir.resolve("missing-events.json");
        Files.writeString(eventsFile, "{\"old\": {\"count\": 2, ");
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        primary.respond(List.of(card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertTrue(summary.warnings().stream().anyMatch(w -> w.startsWith("Strike ledger unreadable")));
        assertEquals("{\"old\": {\"count\": 2, ", Files.readString(eventsFile));
        assertFalse(catalog.events.get("old").isCompleted());
        assertTrue(catalog.events.containsKey("e2"));
    }

    @Test
    void testBlankEventIdGetsStableSlug() throws Exception {
        primary.respond(List.of(card(null, "UFC Fight Night: de Ridder vs. Allen", OCT_18)));

        useCase(primary).execute();

        assertTrue(catalog.events.containsKey("ufc-fight-night-de-ridder-vs-allen-2025-10-18"));
    }

    @Test
    void testCatalogReadFailureAbortsBeforeFetching() {
        catalog.failReads = true;
        primary.respond(List.of(card("e1", "UFC 320", OCT_18)));

        assertThrows(CatalogUnavailableException.class, () -> useCase(primary).execute());

        assertEquals(0, primary.calls);
        assertEquals(0, catalog.writes);
        assertEquals(RunStatus.FAILED, runs.finished.get(0).getStatus());
    }

    @Test
    void testWriteFailureIsIsolatedToOneEvent() throws Exception {
        catalog.failingEvents.add("e1");
        primary.respond(List.of(
            card("e1", "UFC 320: Ankalaev vs. Pereira 2", OCT_18),
            card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.PARTIAL, summary.status());
        assertEquals(1, summary.failedCount());
        assertFalse(catalog.events.containsKey("e1"));
        assertTrue(catalog.events.containsKey("e2"));
    }

    @Test
    void testFailedCancellationIsRetriedNextRun() throws Exception {
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        ledgerStore.setEvent("old", new StrikeEntry(2, Instant.parse("2025-09-30T00:00:00Z")));
        ledgerStore.flush();
        primary.respond(List.of(card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));
        catalog.failingEvents.add("old");
        ReconcileCatalogUseCase useCase = useCase(primary);

        ReconciliationSummary failed = useCase.execute();
        assertEquals(RunStatus.PARTIAL, failed.status());
        assertFalse(catalog.events.get("old").isCompleted());
        assertEquals(3, ledgerStore.getEvent("old").orElseThrow().count());

        catalog.failingEvents.clear();
        useCase.execute();

        assertTrue(catalog.events.get("old").isCompleted());
        assertTrue(ledgerStore.getEvent("old").isEmpty());
    }

    @Test
    void testLedgerFlushFailureIsOnlyAWarning() throws Exception {
        ledgerStore = new JsonFileStrikeLedgerStore(ledgerDir) {
            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }
        };
        primary.respond(List.of(card("e1", "UFC 320", OCT_18)));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertTrue(summary.warnings().stream().anyMatch(w -> w.contains("disk full")));
        assertTrue(catalog.events.containsKey("e1"));
    }

    @Test
    void testAuditSinkFailureDoesNotFailRun() throws Exception {
        audit.broken = true;
        catalog.seed(event("old", "UFC 320: Ankalaev vs. Pereira 2", OCT_18));
        ledgerStore.setEvent("old", new StrikeEntry(2, Instant.parse("2025-09-30T00:00:00Z")));
        ledgerStore.flush();
        primary.respond(List.of(card("e2", "UFC Fight Night: Oliveira vs. Fiziev", OCT_25)));

        ReconciliationSummary summary = useCase(primary).execute();

        assertEquals(RunStatus.SUCCESS, summary.status());
        assertTrue(catalog.events.get("old").isCompleted());
    }

    @Test
    void testConcurrentRunIsRejected() throws Exception {
        primary.respond(List.of(card("e1", "UFC 320", OCT_18)));
        List<RuntimeException> nested = new ArrayList<>();
        ReconcileCatalogUseCase[] holder = new ReconcileCatalogUseCase[1];
        SourceAdapter reentrant = new SourceAdapter() {
            @Override
            public String getSourceName() {
                return "reentrant";
            }

            @Override
            public SourcePayload fetchUpcoming(int limit) {
                try {
                    holder[0].execute();
                } catch (RunInProgressException e) {
                    nested.add(e);
                } catch (CatalogUnavailableException e) {
                    fail(e);
                }
                return new SourcePayload("reentrant", List.of(), List.of());
            }
        };
        holder[0] = useCase(reentrant, primary);

        ReconciliationSummary summary = holder[0].execute();

        assertEquals(1, nested.size());
        assertEquals(RunStatus.SUCCESS, summary.status());

        // The guard is released once the run ends
        assertEquals(RunStatus.SUCCESS, holder[0].execute().status());
    }

    // Fixtures

    private static ScrapedEvent card(String id, String name, LocalDate date, JsonNode... fights) {
        ScrapedEvent event = new ScrapedEvent(id, name, date);
        event.setFightCard(new ArrayList<>(List.of(fights)));
        return event;
    }

    private static ObjectNode fight(String id, String fighter1Id, String fighter1Name, String fighter2Id, String fighter2Name) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", id);
        node.put("fighter1Id", fighter1Id);
        node.put("fighter1Name", fighter1Name);
        node.put("fighter2Id", fighter2Id);
        node.put("fighter2Name", fighter2Name);
        return node;
    }

    private static JsonNode fighter(String id, String name) {
        return MAPPER.createObjectNode()
            .put("id", id)
            .put("name", name)
            .put("wins", 27)
            .put("losses", 1)
            .put("draws", 0)
            .put("record", "27-1-0");
    }

    private static Event event(String id, String name, LocalDate date) {
        return new Event(id, name, date, null, null);
    }

    private static Fight storedFight(String eventId, String id, String fighter1Id, String fighter1Name,
                                     String fighter2Id, String fighter2Name) {
        Fight fight = new Fight();
        fight.setId(id);
        fight.setEventId(eventId);
        fight.setFighter1Id(fighter1Id);
        fight.setFighter1Name(fighter1Name);
        fight.setFighter2Id(fighter2Id);
        fight.setFighter2Name(fighter2Name);
        fight.setPairKey(FightKeys.pairKey(fighter1Name, fighter2Name));
        fight.setWeightClass("light heavyweight");
        fight.setCardPosition("main");
        fight.setScheduledRounds(3);
        return fight;
    }

    /**
     * Source that returns a canned payload or throws.
     */
    private static class TestSource implements SourceAdapter {
        private final String name;
        private List<ScrapedEvent> events = List.of();
        private List<JsonNode> fighters = List.of();
        private SourceException failure;
        private int calls;

        TestSource(String name) {
            this.name = name;
        }

        void respond(List<ScrapedEvent> events, JsonNode... fighters) {
            this.events = events;
            this.fighters = List.of(fighters);
            this.failure = null;
        }

        void fail(SourceException failure) {
            this.failure = failure;
        }

        @Override
        public String getSourceName() {
            return name;
        }

        @Override
        public SourcePayload fetchUpcoming(int limit) throws SourceException {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return new SourcePayload(name, events, fighters);
        }
    }

    /**
     * In-memory catalog. Reads return copies so the engine never aliases stored rows.
     */
    private static class TestCatalogStore implements CatalogStore {
        private final Map<String, Event> events = new LinkedHashMap<>();
        private final Map<String, Fight> fights = new LinkedHashMap<>();
        private final Map<String, Fighter> fighters = new LinkedHashMap<>();
        private final Set<String> failingEvents = new HashSet<>();
        private boolean failReads;
        private int writes;

        void seed(Event event) {
            events.put(event.getId(), copy(event, Event.class));
            event.getFights().forEach(f -> fights.put(f.getId(), copy(f, Fight.class)));
        }

        List<Fight> fightsFor(String eventId) {
            return fights.values().stream().filter(f -> f.getEventId().equals(eventId)).collect(Collectors.toList());
        }

        @Override
        public List<Event> findUpcomingEvents(LocalDate from) throws CatalogUnavailableException {
            if (failReads) {
                throw new CatalogUnavailableException("connection refused", new IllegalStateException("down"));
            }
            List<Event> result = new ArrayList<>();
            for (Event stored : events.values()) {
                if (stored.isCompleted() || stored.getDate().isBefore(from)) {
                    continue;
                }
                Event event = copy(stored, Event.class);
                event.setFights(fightsFor(stored.getId()).stream().map(f -> copy(f, Fight.class)).collect(Collectors.toList()));
                result.add(event);
            }
            return result;
        }

        @Override
        public WriteCounts createEvent(NewEventWrite write) throws CatalogWriteException {
            String eventId = write.event().getId();
            checkWritable(eventId);
            if (events.containsKey(eventId)) {
                throw new CatalogWriteException(eventId, "Transaction failed: duplicate key _id " + eventId, new IllegalStateException());
            }
            writes++;
            int newFighters = 0;
            for (Fighter fighter : write.fighters()) {
                if (fighters.put(fighter.getId(), fighter) == null) {
                    newFighters++;
                }
            }
            events.put(eventId, copy(write.event(), Event.class));
            write.fights().forEach(f -> fights.putIfAbsent(f.getId(), copy(f, Fight.class)));
            return new WriteCounts(newFighters, write.fights().size(), 0, 0);
        }

        @Override
        public WriteCounts applyEventUpdate(EventUpdate update) throws CatalogWriteException {
            checkWritable(update.getEventId());
            writes++;
            Event event = events.get(update.getEventId());
            for (FieldChange change : update.getFieldChanges()) {
                if (change.field().equals("date")) {
                    event.setDate((LocalDate) change.newValue());
                } else if (change.field().equals("location")) {
                    event.setLocation((String) change.newValue());
                } else if (change.field().equals("venue")) {
                    event.setVenue((String) change.newValue());
                }
            }
            int newFighters = 0;
            for (Fighter fighter : update.getFighters()) {
                if (fighters.put(fighter.getId(), fighter) == null) {
                    newFighters++;
                }
            }
            update.getFightsToInsert().forEach(f -> fights.put(f.getId(), copy(f, Fight.class)));
            for (Fight fight : update.getFightsToUpdate()) {
                Fight stored = fights.get(fight.getId());
                stored.setFighter1Id(fight.getFighter1Id());
                stored.setFighter2Id(fight.getFighter2Id());
                stored.setWeightClass(fight.getWeightClass());
                stored.setTitleFight(fight.isTitleFight());
                stored.setMainEvent(fight.isMainEvent());
                stored.setCardPosition(fight.getCardPosition());
                stored.setScheduledRounds(fight.getScheduledRounds());
                stored.setFightNumber(fight.getFightNumber());
            }
            update.getFightIdsToRemove().forEach(fights::remove);
            return new WriteCounts(newFighters, update.getFightsToInsert().size(),
                update.getFightsToUpdate().size(), update.getFightIdsToRemove().size());
        }

        @Override
        public void markEventCompleted(String eventId) throws CatalogWriteException {
            checkWritable(eventId);
            writes++;
            events.get(eventId).setCompleted(true);
        }

        private void checkWritable(String eventId) throws CatalogWriteException {
            if (failingEvents.contains(eventId)) {
                throw new CatalogWriteException(eventId, "Transaction failed: write conflict", new IllegalStateException());
            }
        }

        private static <T> T copy(T value, Class<T> type) {
            return MAPPER.convertValue(value, type);
        }
    }

    /**
     * Audit sink that records entries, or fails when broken.
     */
    private static class RecordingAuditSink implements AuditSink {
        private final List<Entry> entries = new ArrayList<>();
        private boolean broken;

        record Entry(AuditLevel level, String message, Map<String, Object> context) {
        }

        @Override
        public void record(AuditLevel level, String message, Map<String, Object> context) {
            if (broken) {
                throw new IllegalStateException("audit channel down");
            }
            entries.add(new Entry(level, message, context));
        }

        long count(AuditLevel level) {
            return entries.stream().filter(e -> e.level() == level).count();
        }
    }

    private static class TestRunRepository implements ScrapeRunRepository {
        private final List<ScrapeRunRecord> started = new ArrayList<>();
        private final List<ScrapeRunRecord> finished = new ArrayList<>();

        @Override
        public void start(ScrapeRunRecord record) {
            started.add(record);
        }

        @Override
        public void finish(ScrapeRunRecord record) {
            finished.add(record);
        }

        @Override
        public Optional<ScrapeRunRecord> findLatest() {
            return finished.isEmpty() ? Optional.empty() : Optional.of(finished.get(finished.size() - 1));
        }
    }
}
