package com.fightsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Everything one source returned for a fetch: upcoming cards plus the raw
 * fighter records they reference.
 */
public record SourcePayload(String sourceName, List<ScrapedEvent> events, List<JsonNode> fighters) {

    public SourcePayload {
        events = events != null ? events : List.of();
        fighters = fighters != null ? fighters : List.of();
    }
}
