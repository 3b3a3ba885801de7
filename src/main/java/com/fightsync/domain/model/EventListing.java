package com.fightsync.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A scraped card after validation, possibly merged from several sources.
 * Fights are keyed by their normalized fighter-pair key.
 */
public class EventListing {

    private final String id;
    private final String name;
    private final LocalDate date;
    private String location;
    private String venue;
    private final Map<String, ScrapedFight> fightsByKey = new LinkedHashMap<>();
    private final Set<String> sources = new LinkedHashSet<>();

    public EventListing(String id, String name, LocalDate date, String location, String venue) {
        this.id = id;
        this.name = name;
        this.date = date;
        this.location = location;
        this.venue = venue;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getLocation() {
        return location;
    }

    public String getVenue() {
        return venue;
    }

    public Set<String> getSources() {
        return sources;
    }

    public Map<String, ScrapedFight> getFightsByKey() {
        return fightsByKey;
    }

    public List<ScrapedFight> getFights() {
        return new ArrayList<>(fightsByKey.values());
    }

    /**
     * Adds a fight unless one with the same pair key is already on the card.
     *
     * @return true if the fight was added
     */
    public boolean addFight(String pairKey, ScrapedFight fight) {
        return fightsByKey.putIfAbsent(pairKey, fight) == null;
    }

    /**
     * Folds another source's view of the same card into this one. Scalar
     * fields already set here win; missing ones are filled in.
     */
    public void mergeFrom(EventListing other) {
        if (isBlank(location)) {
            location = other.location;
        }
        if (isBlank(venue)) {
            venue = other.venue;
        }
        other.fightsByKey.forEach(fightsByKey::putIfAbsent);
        sources.addAll(other.sources);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return name + " (" + date + ")";
    }
}
