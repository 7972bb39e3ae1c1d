package com.handcoach.common.hand;

import com.handcoach.common.card.Card;

import java.util.List;

/**
 * Best-five-card evaluator for one to seven cards.
 *
 * <p>The score packs the {@link HandCategory} ordinal above five 4-bit tiebreak ranks, so a
 * higher score is always the stronger hand and equal scores split the pot. Fewer than five
 * cards are scored on the categories they can form (pairs, trips, quads, high cards).
 */
public final class HandRanker {

    private static final int CATEGORY_SHIFT = 20;

    private HandRanker() {}

    public static int evaluate(List<Card> cards) {
        return evaluate(cards.toArray(new Card[0]), cards.size());
    }

    public static int evaluate(Card[] cards, int length) {
        int[] rankCounts = new int[15];
        int[] suitCounts = new int[4];
        int[] suitMasks = new int[4];
        int rankMask = 0;
        for (int i = 0; i < length; i++) {
            Card c = cards[i];
            int r = c.rank().value();
            int s = c.suit().ordinal();
            rankCounts[r]++;
            suitCounts[s]++;
            suitMasks[s] |= 1 << r;
            rankMask |= 1 << r;
        }

        int flushSuit = -1;
        for (int s = 0; s < 4; s++) {
            if (suitCounts[s] >= 5) {
                int sf = highestStraight(suitMasks[s]);
                if (sf > 0) return encode(HandCategory.STRAIGHT_FLUSH, sf);
                flushSuit = s;
            }
        }

        int quad = 0;
        int trip1 = 0, trip2 = 0;
        int pair1 = 0, pair2 = 0, pair3 = 0;
        for (int r = 14; r >= 2; r--) {
            switch (rankCounts[r]) {
                case 4 -> quad = r;
                case 3 -> { if (trip1 == 0) trip1 = r; else if (trip2 == 0) trip2 = r; }
                case 2 -> { if (pair1 == 0) pair1 = r; else if (pair2 == 0) pair2 = r; else if (pair3 == 0) pair3 = r; }
                default -> { }
            }
        }

        if (quad > 0) {
            return encode(HandCategory.QUADS, quad, highestExcluding(rankMask, quad, 0));
        }
        if (trip1 > 0 && (trip2 > 0 || pair1 > 0)) {
            return encode(HandCategory.FULL_HOUSE, trip1, Math.max(trip2, pair1));
        }
        if (flushSuit >= 0) {
            return encode(HandCategory.FLUSH, topRanks(suitMasks[flushSuit], 5));
        }
        int straight = highestStraight(rankMask);
        if (straight > 0) {
            return encode(HandCategory.STRAIGHT, straight);
        }
        if (trip1 > 0) {
            int rest = rankMask & ~(1 << trip1);
            return encode(HandCategory.TRIPS, prepend(trip1, topRanks(rest, 2)));
        }
        if (pair2 > 0) {
            int kicker = highestExcluding(rankMask, pair1, pair2);
            return encode(HandCategory.TWO_PAIR, pair1, pair2, kicker);
        }
        if (pair1 > 0) {
            int rest = rankMask & ~(1 << pair1);
            return encode(HandCategory.PAIR, prepend(pair1, topRanks(rest, 3)));
        }
        return encode(HandCategory.HIGH_CARD, topRanks(rankMask, 5));
    }

    public static HandCategory category(int score) {
        return HandCategory.values()[score >>> CATEGORY_SHIFT];
    }

    /** Highest straight top-card in the rank mask, the wheel counting as 5; 0 when none. */
    static int highestStraight(int mask) {
        int m = mask;
        if ((m & (1 << 14)) != 0) m |= 1 << 1;
        for (int high = 14; high >= 5; high--) {
            int window = 0b11111 << (high - 4);
            if ((m & window) == window) return high;
        }
        return 0;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static int highestExcluding(int mask, int a, int b) {
        for (int r = 14; r >= 2; r--) {
            if (r != a && r != b && (mask & (1 << r)) != 0) return r;
        }
        return 0;
    }

    private static int[] topRanks(int mask, int n) {
        int[] out = new int[n];
        int k = 0;
        for (int r = 14; r >= 2 && k < n; r--) {
            if ((mask & (1 << r)) != 0) out[k++] = r;
        }
        return out;
    }

    private static int[] prepend(int first, int[] rest) {
        int[] out = new int[rest.length + 1];
        out[0] = first;
        System.arraycopy(rest, 0, out, 1, rest.length);
        return out;
    }

    private static int encode(HandCategory category, int... ranks) {
        int score = category.ordinal() << CATEGORY_SHIFT;
        for (int i = 0; i < ranks.length && i < 5; i++) {
            score |= ranks[i] << (16 - 4 * i);
        }
        return score;
    }
}
