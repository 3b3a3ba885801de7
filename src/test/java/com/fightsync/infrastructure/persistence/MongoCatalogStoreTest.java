package com.fightsync.infrastructure.persistence;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the fight de-duplication done before inserts in MongoCatalogStore.
 */
class MongoCatalogStoreTest {

    private static Document fight(String id, String eventId, String pairKey) {
        return new Document("_id", id).append("eventId", eventId).append("pairKey", pairKey);
    }

    private static List<Object> ids(List<Document> docs) {
        return docs.stream().map(doc -> doc.get("_id")).collect(Collectors.toList());
    }

    @Test
    void testExistingIdsAndPairsAreSkipped() {
        List<Document> docs = List.of(
            fight("b1", "e1", "alex pereira|magomed ankalaev"),
            fight("b2", "e1", "jiri prochazka|khalil rountree"),
            fight("b3", "e1", "diego lopes|jean silva"));

        List<Document> fresh = MongoCatalogStore.withoutExisting(docs,
            Set.of("b1"),
            Set.of("e1|jiri prochazka|khalil rountree"));

        assertEquals(List.of("b3"), ids(fresh));
    }

    @Test
    void testDuplicatesWithinOneBatchKeepFirst() {
        List<Document> docs = List.of(
            fight("b1", "e1", "alex pereira|magomed ankalaev"),
            fight("b1", "e1", "diego lopes|jean silva"),
            fight("b4", "e1", "alex pereira|magomed ankalaev"),
            fight("b5", "e2", "alex pereira|magomed ankalaev"));

        List<Document> fresh = MongoCatalogStore.withoutExisting(docs, Set.of(), Set.of());

        assertEquals(List.of("b1", "b5"), ids(fresh));
    }

    @Test
    void testPairSlotIsScopedToEvent() {
        assertEquals("e1|a|b", MongoCatalogStore.pairSlot(fight("x", "e1", "a|b")));
        assertNotEquals(MongoCatalogStore.pairSlot(fight("x", "e1", "a|b")),
            MongoCatalogStore.pairSlot(fight("x", "e2", "a|b")));
    }
}
