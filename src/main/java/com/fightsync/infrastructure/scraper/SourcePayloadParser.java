package com.fightsync.infrastructure.scraper;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fightsync.domain.model.ScrapedEvent;
import com.fightsync.domain.model.SourcePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a source's JSON document into a {@link SourcePayload}.
 *
 * Expected shape:
 * <pre>
 * {
 *   "events":   [{"id", "name", "date", "location", "venue", "fightCard": [...]}],
 *   "fighters": [{"id", "name", "nickname", "wins", "losses", "draws", "weightClass", "record"}]
 * }
 * </pre>
 * Fight-card entries and fighters are passed through untouched for the
 * validator. Dates may be plain ISO dates or ISO date-times; date-times are
 * converted to the configured zone before the time is dropped.
 */
public class SourcePayloadParser {

    private static final Logger logger = LoggerFactory.getLogger(SourcePayloadParser.class);

    // NaN and Infinity must reach the validator so they are rejected there, not here
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS);

    private final ZoneId zone;

    public SourcePayloadParser(ZoneId zone) {
        this.zone = zone;
    }

    public SourcePayload parse(String sourceName, String json, int limit) throws JsonProcessingException {
        JsonNode root = OBJECT_MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new JsonProcessingException("Expected a JSON object at the document root") {
            };
        }

        List<ScrapedEvent> events = new ArrayList<>();
        for (JsonNode node : root.path("events")) {
            if (events.size() >= limit) {
                break;
            }
            events.add(toScrapedEvent(sourceName, node));
        }

        List<JsonNode> fighters = new ArrayList<>();
        root.path("fighters").forEach(fighters::add);

        return new SourcePayload(sourceName, events, fighters);
    }

    private ScrapedEvent toScrapedEvent(String sourceName, JsonNode node) {
        ScrapedEvent event = new ScrapedEvent();
        event.setId(text(node, "id"));
        event.setName(text(node, "name"));
        event.setDate(parseDate(sourceName, text(node, "date")));
        event.setLocation(text(node, "location"));
        event.setVenue(text(node, "venue"));

        List<JsonNode> fightCard = new ArrayList<>();
        node.path("fightCard").forEach(fightCard::add);
        event.setFightCard(fightCard);
        return event;
    }

    LocalDate parseDate(String sourceName, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            if (raw.length() <= 10) {
                return LocalDate.parse(raw);
            }
            return OffsetDateTime.parse(raw).atZoneSameInstant(zone).toLocalDate();
        } catch (DateTimeParseException e) {
            logger.warn("Unparseable date '{}' from {}", raw, sourceName);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
