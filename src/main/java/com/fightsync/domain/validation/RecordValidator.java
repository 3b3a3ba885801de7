package com.fightsync.domain.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on raw fighter and fight records before they can reach
 * the catalog. Never throws; every problem found is reported.
 */
public class RecordValidator {

    public ValidationResult validateFighter(JsonNode fighter) {
        List<String> errors = new ArrayList<>();
        if (fighter == null || !fighter.isObject()) {
            errors.add("Fighter data is required and must be an object");
            return ValidationResult.of(errors);
        }

        requireString(fighter, "id", "Fighter ID", errors);
        requireString(fighter, "name", "Fighter name", errors);
        optionalString(fighter, "nickname", "Nickname", errors);
        optionalString(fighter, "weightClass", "Weight class", errors);
        optionalString(fighter, "record", "Record", errors);
        optionalNonNegative(fighter, "wins", "Wins", errors);
        optionalNonNegative(fighter, "losses", "Losses", errors);
        optionalNonNegative(fighter, "draws", "Draws", errors);

        return ValidationResult.of(errors);
    }

    public ValidationResult validateFight(JsonNode fight) {
        List<String> errors = new ArrayList<>();
        if (fight == null || !fight.isObject()) {
            errors.add("Fight data is required and must be an object");
            return ValidationResult.of(errors);
        }

        requireString(fight, "id", "Fight ID", errors);
        boolean hasFighter1 = requireString(fight, "fighter1Id", "Fighter1 ID", errors);
        boolean hasFighter2 = requireString(fight, "fighter2Id", "Fighter2 ID", errors);
        requireString(fight, "fighter1Name", "Fighter1 name", errors);
        requireString(fight, "fighter2Name", "Fighter2 name", errors);
        optionalString(fight, "eventId", "Event ID", errors);
        optionalString(fight, "weightClass", "Weight class", errors);
        optionalString(fight, "cardPosition", "Card position", errors);
        optionalPositive(fight, "scheduledRounds", "Scheduled rounds", errors);
        optionalPositive(fight, "fightNumber", "Fight number", errors);
        optionalBoolean(fight, "titleFight", "Title fight", errors);
        optionalBoolean(fight, "mainEvent", "Main event", errors);

        if (hasFighter1 && hasFighter2
                && fight.get("fighter1Id").asText().equals(fight.get("fighter2Id").asText())) {
            errors.add("fighter1Id and fighter2Id must be different");
        }

        return ValidationResult.of(errors);
    }

    private static boolean requireString(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            errors.add(label + " is required and must be a string");
            return false;
        }
        return true;
    }

    private static void optionalString(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.get(field);
        if (isPresent(value) && !value.isTextual()) {
            errors.add(label + " must be a string");
        }
    }

    private static void optionalBoolean(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.get(field);
        if (isPresent(value) && !value.isBoolean()) {
            errors.add(label + " must be a boolean");
        }
    }

    private static void optionalNonNegative(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.get(field);
        if (!isPresent(value)) {
            return;
        }
        if (!isFiniteNumber(value) || value.asDouble() < 0) {
            errors.add(label + " must be a non-negative number");
        } else if (value.asDouble() > Integer.MAX_VALUE) {
            errors.add(label + " must not exceed " + Integer.MAX_VALUE);
        }
    }

    private static void optionalPositive(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.get(field);
        if (!isPresent(value)) {
            return;
        }
        if (!isFiniteNumber(value) || value.asDouble() < 1) {
            errors.add(label + " must be a positive number");
        } else if (value.asDouble() > Integer.MAX_VALUE) {
            errors.add(label + " must not exceed " + Integer.MAX_VALUE);
        }
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    private static boolean isFiniteNumber(JsonNode value) {
        return value.isNumber() && Double.isFinite(value.asDouble());
    }
}
