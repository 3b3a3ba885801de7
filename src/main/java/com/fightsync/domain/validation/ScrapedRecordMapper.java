package com.fightsync.domain.validation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fightsync.domain.model.Fighter;
import com.fightsync.domain.model.ScrapedFight;

/**
 * Converts records that passed {@link RecordValidator} into typed objects.
 */
public class ScrapedRecordMapper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Fighter toFighter(JsonNode node) {
        return OBJECT_MAPPER.convertValue(node, Fighter.class);
    }

    public ScrapedFight toFight(JsonNode node) {
        return OBJECT_MAPPER.convertValue(node, ScrapedFight.class);
    }
}
