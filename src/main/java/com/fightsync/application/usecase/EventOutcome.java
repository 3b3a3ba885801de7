package com.fightsync.application.usecase;

/**
 * What happened to one card during a run. Failures are data here rather than
 * log lines so the summary and tests can see them.
 */
public record EventOutcome(Kind kind, String eventId, String eventName, String reason) {

    public enum Kind {
        OK,
        SKIPPED,
        FAILED
    }

    public static EventOutcome ok(String eventId, String eventName, String reason) {
        return new EventOutcome(Kind.OK, eventId, eventName, reason);
    }

    public static EventOutcome skipped(String eventId, String eventName, String reason) {
        return new EventOutcome(Kind.SKIPPED, eventId, eventName, reason);
    }

    public static EventOutcome failed(String eventId, String eventName, Throwable error) {
        return new EventOutcome(Kind.FAILED, eventId, eventName, error.getMessage());
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
