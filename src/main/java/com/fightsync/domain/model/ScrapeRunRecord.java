package com.fightsync.domain.model;

import java.time.Instant;

/**
 * Audit row for one reconciliation run. Inserted when the run starts and
 * finalized exactly once when it ends.
 */
public class ScrapeRunRecord {

    private String id;

    private Instant startTime;

    private Instant endTime;

    private RunStatus status = RunStatus.RUNNING;

    private int eventsFound;

    private int eventsAdded;

    private int eventsCancelled;

    private int fightsAdded;

    private int fightsUpdated;

    private int fightsRemoved;

    private int fightersAdded;

    private String errorMessage;

    public ScrapeRunRecord() {
    }

    public ScrapeRunRecord(String id, Instant startTime) {
        this.id = id;
        this.startTime = startTime;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public int getEventsFound() {
        return eventsFound;
    }

    public void setEventsFound(int eventsFound) {
        this.eventsFound = eventsFound;
    }

    public int getEventsAdded() {
        return eventsAdded;
    }

    public void setEventsAdded(int eventsAdded) {
        this.eventsAdded = eventsAdded;
    }

    public int getEventsCancelled() {
        return eventsCancelled;
    }

    public void setEventsCancelled(int eventsCancelled) {
        this.eventsCancelled = eventsCancelled;
    }

    public int getFightsAdded() {
        return fightsAdded;
    }

    public void setFightsAdded(int fightsAdded) {
        this.fightsAdded = fightsAdded;
    }

    public int getFightsUpdated() {
        return fightsUpdated;
    }

    public void setFightsUpdated(int fightsUpdated) {
        this.fightsUpdated = fightsUpdated;
    }

    public int getFightsRemoved() {
        return fightsRemoved;
    }

    public void setFightsRemoved(int fightsRemoved) {
        this.fightsRemoved = fightsRemoved;
    }

    public int getFightersAdded() {
        return fightersAdded;
    }

    public void setFightersAdded(int fightersAdded) {
        this.fightersAdded = fightersAdded;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public void addCounts(WriteCounts counts) {
        fightersAdded += counts.fightersAdded();
        fightsAdded += counts.fightsAdded();
        fightsUpdated += counts.fightsUpdated();
        fightsRemoved += counts.fightsRemoved();
    }
}
