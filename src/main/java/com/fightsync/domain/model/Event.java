package com.fightsync.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A persisted fight card as stored in the catalog.
 */
public class Event {

    /** Stable catalog id. */
    private String id;

    /** Display name as first stored (e.g. "UFC 320: Ankalaev vs. Pereira 2"). */
    private String name;

    /** Calendar date of the card. Time of day is not reliable across sources. */
    private LocalDate date;

    private String location;

    private String venue;

    /** True once the card took place or was cancelled. */
    private boolean completed;

    /** Fights currently on the card, fighter names resolved. */
    private List<Fight> fights = new ArrayList<>();

    public Event() {
    }

    public Event(String id, String name, LocalDate date, String location, String venue) {
        this.id = id;
        this.name = name;
        this.date = date;
        this.location = location;
        this.venue = venue;
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

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public List<Fight> getFights() {
        return fights;
    }

    public void setFights(List<Fight> fights) {
        this.fights = fights != null ? fights : new ArrayList<>();
    }

    @Override
    public String toString() {
        return name + " (" + date + ")";
    }
}
