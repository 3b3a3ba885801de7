package com.fightsync.application.usecase;

import com.fightsync.domain.matching.FightKeys;
import com.fightsync.domain.model.Fight;
import com.fightsync.domain.model.Fighter;
import com.fightsync.domain.model.ScrapedFight;

import java.util.Map;
import java.util.Objects;

/**
 * Builds catalog fights from scraped card entries.
 *
 * Only fields the scrape actually supplies are applied to an existing fight;
 * prediction fields are always carried over from the stored row.
 */
class FightAssembler {

    static final String DEFAULT_WEIGHT_CLASS = "unknown";
    static final String DEFAULT_CARD_POSITION = "preliminary";
    static final int DEFAULT_SCHEDULED_ROUNDS = 3;

    Fight newFight(String eventId, ScrapedFight scraped) {
        Fight fight = new Fight();
        fight.setId(scraped.getId());
        fight.setWeightClass(DEFAULT_WEIGHT_CLASS);
        fight.setCardPosition(DEFAULT_CARD_POSITION);
        fight.setScheduledRounds(DEFAULT_SCHEDULED_ROUNDS);
        applyScraped(fight, eventId, scraped);
        return fight;
    }

    /**
     * Returns a copy of {@code existing} with the scraped scheduling fields
     * applied. The stored id and prediction fields are kept.
     */
    Fight merge(Fight existing, ScrapedFight scraped) {
        Fight merged = copy(existing);
        applyScraped(merged, existing.getEventId(), scraped);
        return merged;
    }

    /**
     * True if any field the reconciler owns differs between the two fights.
     * Display names are excluded; they follow the fighter rows.
     */
    boolean schedulingChanged(Fight before, Fight after) {
        return !Objects.equals(before.getFighter1Id(), after.getFighter1Id())
            || !Objects.equals(before.getFighter2Id(), after.getFighter2Id())
            || !Objects.equals(before.getWeightClass(), after.getWeightClass())
            || before.isTitleFight() != after.isTitleFight()
            || before.isMainEvent() != after.isMainEvent()
            || !Objects.equals(before.getCardPosition(), after.getCardPosition())
            || before.getScheduledRounds() != after.getScheduledRounds()
            || !Objects.equals(before.getFightNumber(), after.getFightNumber());
    }

    /**
     * Resolves a fighter referenced by a fight, falling back to a minimal
     * record built from the card entry when the source sent no fighter row.
     */
    Fighter resolveFighter(String fighterId, String fighterName, String weightClass, Map<String, Fighter> fightersById) {
        Fighter known = fightersById.get(fighterId);
        if (known != null) {
            return known;
        }
        return new Fighter(fighterId, fighterName, weightClass != null ? weightClass : DEFAULT_WEIGHT_CLASS);
    }

    private static void applyScraped(Fight fight, String eventId, ScrapedFight scraped) {
        fight.setEventId(eventId);
        fight.setFighter1Id(scraped.getFighter1Id());
        fight.setFighter2Id(scraped.getFighter2Id());
        fight.setFighter1Name(scraped.getFighter1Name());
        fight.setFighter2Name(scraped.getFighter2Name());
        fight.setPairKey(FightKeys.of(scraped));

        if (scraped.getWeightClass() != null && !scraped.getWeightClass().isBlank()) {
            fight.setWeightClass(scraped.getWeightClass());
        }
        if (scraped.getTitleFight() != null) {
            fight.setTitleFight(scraped.getTitleFight());
        }
        if (scraped.getMainEvent() != null) {
            fight.setMainEvent(scraped.getMainEvent());
        }
        if (scraped.getCardPosition() != null && !scraped.getCardPosition().isBlank()) {
            fight.setCardPosition(scraped.getCardPosition());
        }
        if (scraped.getScheduledRounds() != null) {
            fight.setScheduledRounds(scraped.getScheduledRounds());
        }
        if (scraped.getFightNumber() != null) {
            fight.setFightNumber(scraped.getFightNumber());
        }
    }

    private static Fight copy(Fight source) {
        Fight fight = new Fight();
        fight.setId(source.getId());
        fight.setEventId(source.getEventId());
        fight.setFighter1Id(source.getFighter1Id());
        fight.setFighter2Id(source.getFighter2Id());
        fight.setFighter1Name(source.getFighter1Name());
        fight.setFighter2Name(source.getFighter2Name());
        fight.setPairKey(source.getPairKey());
        fight.setWeightClass(source.getWeightClass());
        fight.setTitleFight(source.isTitleFight());
        fight.setMainEvent(source.isMainEvent());
        fight.setCardPosition(source.getCardPosition());
        fight.setScheduledRounds(source.getScheduledRounds());
        fight.setFightNumber(source.getFightNumber());
        fight.setFunFactor(source.getFunFactor());
        fight.setFinishProbability(source.getFinishProbability());
        fight.setEntertainmentReason(source.getEntertainmentReason());
        fight.setAiDescription(source.getAiDescription());
        fight.setFightPrediction(source.getFightPrediction());
        fight.setRiskLevel(source.getRiskLevel());
        fight.setPredictedFunScore(source.getPredictedFunScore());
        return fight;
    }
}
