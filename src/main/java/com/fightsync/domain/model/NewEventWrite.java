package com.fightsync.domain.model;

import java.util.List;

/**
 * Everything needed to create a card atomically: the fighters it references,
 * the event row and its fights.
 */
public record NewEventWrite(Event event, List<Fighter> fighters, List<Fight> fights) {
}
