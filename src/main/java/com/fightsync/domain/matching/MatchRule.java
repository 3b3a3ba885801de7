package com.fightsync.domain.matching;

/**
 * Which step of the event matching algorithm produced a match.
 */
public enum MatchRule {
    /** Source reported the stored event's id; checked before any name rule and not date-gated. */
    SAME_ID,
    EXACT_NORMALIZED,
    NUMBERED_EVENT,
    CONTAINMENT,
    MAIN_EVENT_PAIR,
    SIMILARITY
}
