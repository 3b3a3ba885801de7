package com.fightsync.domain.matching;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalization shared by event and fight matching.
 */
public final class NameNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern FIGHT_NIGHT = Pattern.compile("fight\\s*night\\s*\\d*");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NON_ALPHANUMERIC_OR_SPACE = Pattern.compile("[^a-z0-9\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /** Canonical token every "fight night [###]" collapses to. */
    public static final String FIGHT_NIGHT_TOKEN = "fn";

    private NameNormalizer() {
    }

    /**
     * Removes accents and lowercases.
     *
     * Rules:
     * 1. Decompose and drop combining marks (Grêmio -> gremio)
     * 2. Lowercase using the root locale
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = DIACRITICS.matcher(normalized).replaceAll("");
        return normalized.toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes an event name for comparison.
     *
     * Rules:
     * 1. Fold accents and case
     * 2. "fight night" with an optional number becomes "fn"
     * 3. Apostrophes are dropped, other punctuation becomes a space
     * 4. Whitespace is collapsed
     * 5. Leading promotion tokens (e.g. "ufc") are stripped
     *
     * Example: "UFC Fight Night 262 - De Ridder vs. Allen" -> "fn de ridder vs allen"
     */
    public static String normalizeEventName(String name, List<String> promotionPrefixes) {
        String normalized = fold(name);
        normalized = FIGHT_NIGHT.matcher(normalized).replaceAll(" " + FIGHT_NIGHT_TOKEN + " ");
        normalized = APOSTROPHES.matcher(normalized).replaceAll("");
        normalized = NON_ALPHANUMERIC_OR_SPACE.matcher(normalized).replaceAll(" ");
        normalized = collapseWhitespace(normalized);

        List<String> tokens = Arrays.asList(normalized.split(" "));
        int start = 0;
        while (start < tokens.size() - 1 && promotionPrefixes.contains(tokens.get(start))) {
            start++;
        }
        return String.join(" ", tokens.subList(start, tokens.size()));
    }

    /**
     * Normalizes a person's name to bare lowercase alphanumerics
     * ("Jean-Silva" and "jean silva" both become "jeansilva").
     */
    public static String normalizeFighterName(String name) {
        String normalized = APOSTROPHES.matcher(fold(name)).replaceAll("");
        return NON_ALPHANUMERIC.matcher(normalized).replaceAll("");
    }

    /**
     * Normalizes one side of a "A vs B" span: punctuation to spaces, collapsed.
     */
    public static String normalizeNameSpan(String span) {
        String normalized = APOSTROPHES.matcher(fold(span)).replaceAll("");
        normalized = NON_ALPHANUMERIC_OR_SPACE.matcher(normalized).replaceAll(" ");
        return collapseWhitespace(normalized);
    }

    /**
     * Returns the leading integer token of a normalized name, or null if the
     * name does not start with one ("320 ankalaev vs pereira 2" -> "320").
     */
    public static String leadingNumber(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return null;
        }
        int space = normalizedName.indexOf(' ');
        String first = space < 0 ? normalizedName : normalizedName.substring(0, space);
        return DIGITS.matcher(first).matches() ? first : null;
    }

    public static boolean isFightNightStyle(String normalizedName) {
        return normalizedName.equals(FIGHT_NIGHT_TOKEN) || normalizedName.startsWith(FIGHT_NIGHT_TOKEN + " ");
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
