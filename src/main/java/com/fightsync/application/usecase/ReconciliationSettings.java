package com.fightsync.application.usecase;

import java.time.ZoneId;

/**
 * Tunables for one reconciliation run.
 *
 * @param eventCancelThreshold consecutive misses before a card is cancelled
 * @param fightCancelThreshold consecutive misses before a bout is removed
 * @param fetchLimit           maximum cards requested from each source
 * @param zone                 zone that defines "today" for the upcoming window
 */
public record ReconciliationSettings(int eventCancelThreshold, int fightCancelThreshold, int fetchLimit, ZoneId zone) {
}
