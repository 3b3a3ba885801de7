package com.fightsync.domain.matching;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultEventMatcher.
 */
class DefaultEventMatcherTest {

    private static final LocalDate OCT_18 = LocalDate.of(2025, 10, 18);
    private static final LocalDate OCT_19 = LocalDate.of(2025, 10, 19);

    private DefaultEventMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new DefaultEventMatcher(List.of("UFC"));
    }

    @Test
    void testFightNightHeaderVariantsMatch() {
        Optional<MatchRule> rule = matcher.match(
            "UFC Fight Night: de Ridder vs. Allen", OCT_18,
            "UFC Fight Night 262 - De Ridder vs. Allen", OCT_18);

        assertEquals(Optional.of(MatchRule.EXACT_NORMALIZED), rule);
    }

    @Test
    void testSameNameDifferentDateNeverMatches() {
        assertFalse(matcher.sameEvent(
            "UFC Fight Night: de Ridder vs. Allen", OCT_18,
            "UFC Fight Night: de Ridder vs. Allen", OCT_19));
        assertFalse(matcher.sameEvent(
            "UFC Fight Night: de Ridder vs. Allen", OCT_18,
            "UFC Fight Night 262 - De Ridder vs. Allen", OCT_19));
    }

    @Test
    void testDifferentCardsDoNotMatch() {
        assertFalse(matcher.sameEvent(
            "UFC 320: Ankalaev vs. Pereira 2", LocalDate.of(2025, 10, 4),
            "UFC Fight Night: Ulberg vs. Reyes", LocalDate.of(2025, 9, 28)));

        // Even on the same date
        assertFalse(matcher.sameEvent(
            "UFC 320: Ankalaev vs. Pereira 2", OCT_18,
            "UFC Fight Night: Ulberg vs. Reyes", OCT_18));
    }

    @Test
    void testPromotionCasingAndPunctuation() {
        assertEquals(Optional.of(MatchRule.EXACT_NORMALIZED), matcher.match(
            "UFC 320: Ankalaev vs. Pereira", OCT_18,
            "ufc 320 - ankalaev vs pereira", OCT_18));
    }

    @Test
    void testNumberedEvent() {
        assertEquals(Optional.of(MatchRule.NUMBERED_EVENT), matcher.match(
            "UFC 320: Ankalaev vs. Pereira 2", OCT_18,
            "UFC 320", OCT_18));
    }

    @Test
    void testContainment() {
        assertEquals(Optional.of(MatchRule.CONTAINMENT), matcher.match(
            "UFC 320: Ankalaev vs. Pereira 2", OCT_18,
            "Ankalaev vs Pereira 2", OCT_18));
    }

    @Test
    void testContainmentIgnoresShortNames() {
        assertTrue(matcher.match("UFC Abc", OCT_18, "UFC Abc Def", OCT_18).isEmpty());
    }

    @Test
    void testMainEventPairInEitherOrder() {
        assertEquals(Optional.of(MatchRule.MAIN_EVENT_PAIR), matcher.match(
            "UFC Fight Night: Oliveira vs. Fiziev", OCT_18,
            "UFC Fight Night 261 - Fiziev vs Oliveira", OCT_18));
    }

    @Test
    void testFightNightPairToleratesSpellingDrift() {
        assertEquals(Optional.of(MatchRule.MAIN_EVENT_PAIR), matcher.match(
            "UFC Fight Night: Della Maddalena vs. Makhachev", OCT_18,
            "UFC Fight Night 270 - Dela Madalena vs Makhachev", OCT_18));
    }

    @Test
    void testWholeNameSimilarity() {
        assertEquals(Optional.of(MatchRule.SIMILARITY), matcher.match(
            "UFC Noche Mexico City", OCT_18,
            "UFC Noche Mexico Cty", OCT_18));
    }

    @Test
    void testMainEventPairExtraction() {
        assertEquals("ankalaev | pereira 2", matcher.mainEventPair("UFC 320: Ankalaev vs. Pereira 2"));
        assertEquals("allen | de ridder", matcher.mainEventPair("UFC Fight Night 262 - De Ridder vs. Allen"));
        assertEquals("allen | de ridder", matcher.mainEventPair("UFC Fight Night: de Ridder v. Allen"));
        assertNull(matcher.mainEventPair("UFC Noche Mexico City"));
        assertNull(matcher.mainEventPair("UFC 320: A vs B"));
    }

    @Test
    void testNullInputsNeverMatch() {
        assertTrue(matcher.match(null, OCT_18, "UFC 320", OCT_18).isEmpty());
        assertTrue(matcher.match("UFC 320", null, "UFC 320", OCT_18).isEmpty());
    }
}
