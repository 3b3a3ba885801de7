package com.fightsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * An upcoming card as reported by one source, before validation.
 * Fight-card entries stay untyped until they pass the record validator.
 */
public class ScrapedEvent {

    /** Id proposed by the source; becomes the catalog id if the card is new. */
    private String id;

    private String name;

    private LocalDate date;

    private String location;

    private String venue;

    private List<JsonNode> fightCard = new ArrayList<>();

    public ScrapedEvent() {
    }

    public ScrapedEvent(String id, String name, LocalDate date) {
        this.id = id;
        this.name = name;
        this.date = date;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getVenue() {
        return venue;
    }

    public void setVenue(String venue) {
        this.venue = venue;
    }

    public List<JsonNode> getFightCard() {
        return fightCard;
    }

    public void setFightCard(List<JsonNode> fightCard) {
        this.fightCard = fightCard != null ? fightCard : new ArrayList<>();
    }
}
