package com.fightsync.domain.matching;

import com.fightsync.domain.model.Event;
import com.fightsync.domain.model.EventListing;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Decides whether two listings describe the same real-world card. Fights are
 * matched separately by {@link FightKeys}.
 *
 * Contract for events, evaluated in order with the first hit winning:
 * <ol>
 *   <li>equal normalized names</li>
 *   <li>same leading event number</li>
 *   <li>one normalized name contains the other</li>
 *   <li>same main-event fighter pair (fuzzy for fight-night names)</li>
 *   <li>whole-name similarity of at least 0.9</li>
 * </ol>
 * Every step requires both listings to be on the same calendar date.
 */
public interface EventMatcher {

    Optional<MatchRule> match(String nameA, LocalDate dateA, String nameB, LocalDate dateB);

    default boolean sameEvent(String nameA, LocalDate dateA, String nameB, LocalDate dateB) {
        return match(nameA, dateA, nameB, dateB).isPresent();
    }

    default Optional<MatchRule> match(Event persisted, EventListing scraped) {
        return match(persisted.getName(), persisted.getDate(), scraped.getName(), scraped.getDate());
    }
}
