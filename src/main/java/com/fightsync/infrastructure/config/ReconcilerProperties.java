package com.fightsync.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code reconciler} section of application.yml.
 */
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

    public static final int DEFAULT_EVENT_CANCEL_THRESHOLD = 3;
    public static final int DEFAULT_FIGHT_CANCEL_THRESHOLD = 2;

    private int eventCancelThreshold = DEFAULT_EVENT_CANCEL_THRESHOLD;
    private int fightCancelThreshold = DEFAULT_FIGHT_CANCEL_THRESHOLD;
    private String ledgerDirectory = "logs";
    private int fetchLimit = 15;
    private String zone = "UTC";
    private String scheduleCron = "0 0 */4 * * *";
    private int fighterBatchSize = 10;
    private long fighterBatchPauseMs = 100;
    private int runRetentionDays = 30;
    private int httpMaxAttempts = 3;
    private long httpBackoffMs = 2000;
    private List<String> promotionPrefixes = new ArrayList<>(List.of("ufc"));
    private List<Source> sources = new ArrayList<>();

    /**
     * Event threshold in effect. Values below 1 fall back to the default.
     */
    public int effectiveEventCancelThreshold() {
        return eventCancelThreshold >= 1 ? eventCancelThreshold : DEFAULT_EVENT_CANCEL_THRESHOLD;
    }

    /**
     * Fight threshold in effect. Values below 1 fall back to the default.
     */
    public int effectiveFightCancelThreshold() {
        return fightCancelThreshold >= 1 ? fightCancelThreshold : DEFAULT_FIGHT_CANCEL_THRESHOLD;
    }

    public int getEventCancelThreshold() {
        return eventCancelThreshold;
    }

    public void setEventCancelThreshold(int eventCancelThreshold) {
        this.eventCancelThreshold = eventCancelThreshold;
    }

    public int getFightCancelThreshold() {
        return fightCancelThreshold;
    }

    public void setFightCancelThreshold(int fightCancelThreshold) {
        this.fightCancelThreshold = fightCancelThreshold;
    }

    public String getLedgerDirectory() {
        return ledgerDirectory;
    }

    public void setLedgerDirectory(String ledgerDirectory) {
        this.ledgerDirectory = ledgerDirectory;
    }

    public int getFetchLimit() {
        return fetchLimit;
    }

    public void setFetchLimit(int fetchLimit) {
        this.fetchLimit = fetchLimit;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getScheduleCron() {
        return scheduleCron;
    }

    public void setScheduleCron(String scheduleCron) {
        this.scheduleCron = scheduleCron;
    }

    public int getFighterBatchSize() {
        return fighterBatchSize;
    }

    public void setFighterBatchSize(int fighterBatchSize) {
        this.fighterBatchSize = fighterBatchSize;
    }

    public long getFighterBatchPauseMs() {
        return fighterBatchPauseMs;
    }

    public void setFighterBatchPauseMs(long fighterBatchPauseMs) {
        this.fighterBatchPauseMs = fighterBatchPauseMs;
    }

    public int getRunRetentionDays() {
        return runRetentionDays;
    }

    public void setRunRetentionDays(int runRetentionDays) {
        this.runRetentionDays = runRetentionDays;
    }

    public int getHttpMaxAttempts() {
        return httpMaxAttempts;
    }

    public void setHttpMaxAttempts(int httpMaxAttempts) {
        this.httpMaxAttempts = httpMaxAttempts;
    }

    public long getHttpBackoffMs() {
        return httpBackoffMs;
    }

    public void setHttpBackoffMs(long httpBackoffMs) {
        this.httpBackoffMs = httpBackoffMs;
    }

    public List<String> getPromotionPrefixes() {
        return promotionPrefixes;
    }

    public void setPromotionPrefixes(List<String> promotionPrefixes) {
        this.promotionPrefixes = promotionPrefixes;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    /**
     * One upstream endpoint serving the JSON payload format.
     */
    public static class Source {

        private String name;
        private String url;
        private boolean enabled = true;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }
}
