package com.fightsync.domain.model;

import java.time.Instant;

/**
 * A change applied to the catalog during a run.
 */
public record CatalogChange(ChangeType type, String eventId, String eventName, String detail, Instant timestamp) {
}
