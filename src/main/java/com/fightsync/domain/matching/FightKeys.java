package com.fightsync.domain.matching;

import com.fightsync.domain.model.Fight;
import com.fightsync.domain.model.ScrapedFight;

/**
 * Fight identity within an event: the unordered pair of normalized fighter
 * names. No fuzzy matching happens at this level.
 */
public final class FightKeys {

    private FightKeys() {
    }

    public static String pairKey(String fighterA, String fighterB) {
        String a = NameNormalizer.normalizeFighterName(fighterA);
        String b = NameNormalizer.normalizeFighterName(fighterB);
        return a.compareTo(b) <= 0 ? a + "-" + b : b + "-" + a;
    }

    public static String of(Fight fight) {
        return pairKey(fight.getFighter1Name(), fight.getFighter2Name());
    }

    public static String of(ScrapedFight fight) {
        return pairKey(fight.getFighter1Name(), fight.getFighter2Name());
    }
}
