package com.fightsync.domain.matching;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Five-step event matcher. See {@link EventMatcher} for the contract.
 *
 * Matching is date-gated on purpose: two cards on different calendar dates
 * are never merged, however alike their names are.
 */
public class DefaultEventMatcher implements EventMatcher {

    static final int MIN_CONTAINMENT_LENGTH = 5;
    static final double PAIR_SIMILARITY_THRESHOLD = 0.8;
    static final double NAME_SIMILARITY_THRESHOLD = 0.9;

    private static final Pattern VERSUS = Pattern.compile("^(.+?)\\s+(?:vs\\.?|v\\.)\\s+(.+)$");
    private static final int MIN_SIDE_LENGTH = 2;

    private final List<String> promotionPrefixes;
    private final Pattern header;

    public DefaultEventMatcher(List<String> promotionPrefixes) {
        this.promotionPrefixes = promotionPrefixes.stream()
            .map(p -> p.trim().toLowerCase(Locale.ROOT))
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toList());

        // "<promo> 320:", "<promo> fight night:", "<promo> fight night 262 -"
        String prefixGroup = this.promotionPrefixes.isEmpty()
            ? ""
            : "(?:(?:" + this.promotionPrefixes.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")\\s+)*";
        this.header = Pattern.compile("^\\s*" + prefixGroup + "(?:fight\\s*night(?:\\s*\\d+)?|\\d+)\\s*(?:[:\\-–—]\\s*)?");
    }

    @Override
    public Optional<MatchRule> match(String nameA, LocalDate dateA, String nameB, LocalDate dateB) {
        if (nameA == null || nameB == null || dateA == null || !dateA.equals(dateB)) {
            return Optional.empty();
        }

        String normalizedA = normalize(nameA);
        String normalizedB = normalize(nameB);

        if (!normalizedA.isEmpty() && normalizedA.equals(normalizedB)) {
            return Optional.of(MatchRule.EXACT_NORMALIZED);
        }

        String numberA = NameNormalizer.leadingNumber(normalizedA);
        if (numberA != null && numberA.equals(NameNormalizer.leadingNumber(normalizedB))) {
            return Optional.of(MatchRule.NUMBERED_EVENT);
        }

        if (contains(normalizedA, normalizedB)) {
            return Optional.of(MatchRule.CONTAINMENT);
        }

        String pairA = mainEventPair(nameA);
        String pairB = mainEventPair(nameB);
        if (pairA != null && pairB != null) {
            if (pairA.equals(pairB)) {
                return Optional.of(MatchRule.MAIN_EVENT_PAIR);
            }
            boolean bothFightNights = NameNormalizer.isFightNightStyle(normalizedA)
                && NameNormalizer.isFightNightStyle(normalizedB);
            if (bothFightNights && StringSimilarity.similarity(pairA, pairB) >= PAIR_SIMILARITY_THRESHOLD) {
                return Optional.of(MatchRule.MAIN_EVENT_PAIR);
            }
        }

        if (StringSimilarity.similarity(normalizedA, normalizedB) >= NAME_SIMILARITY_THRESHOLD) {
            return Optional.of(MatchRule.SIMILARITY);
        }

        return Optional.empty();
    }

    public String normalize(String name) {
        return NameNormalizer.normalizeEventName(name, promotionPrefixes);
    }

    /**
     * Extracts the "Fighter A vs Fighter B" span from an event name as an
     * order-independent key, or null if the name has no usable pair.
     */
    public String mainEventPair(String eventName) {
        String folded = NameNormalizer.fold(eventName).trim();
        Matcher headerMatcher = header.matcher(folded);
        String body = headerMatcher.lookingAt() ? folded.substring(headerMatcher.end()) : folded;
        int colon = body.indexOf(':');
        if (colon >= 0) {
            body = body.substring(colon + 1);
        }

        Matcher versus = VERSUS.matcher(body.trim());
        if (!versus.matches()) {
            return null;
        }
        String sideA = NameNormalizer.normalizeNameSpan(versus.group(1));
        String sideB = NameNormalizer.normalizeNameSpan(versus.group(2));
        if (sideA.length() < MIN_SIDE_LENGTH || sideB.length() < MIN_SIDE_LENGTH) {
            return null;
        }
        return sideA.compareTo(sideB) <= 0 ? sideA + " | " + sideB : sideB + " | " + sideA;
    }

    private static boolean contains(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        return shorter.length() >= MIN_CONTAINMENT_LENGTH && longer.contains(shorter);
    }
}
