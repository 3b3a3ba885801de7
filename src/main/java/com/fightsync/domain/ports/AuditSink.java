package com.fightsync.domain.ports;

import com.fightsync.domain.model.AuditLevel;

import java.util.Map;

/**
 * Port for operator-facing alerts. Implementations must be fire-and-forget:
 * the reconciler treats any failure here as non-fatal.
 */
public interface AuditSink {

    void record(AuditLevel level, String message, Map<String, Object> context);
}
