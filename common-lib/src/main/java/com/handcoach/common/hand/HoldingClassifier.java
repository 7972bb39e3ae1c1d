package com.handcoach.common.hand;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Rank;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Names what a hole-card combo has made on a given board, and what it is drawing to.
 *
 * <p>A made hand only counts when the hole cards improve on the board itself: a straight or
 * flush that lies entirely on the board is not credited to the combo.
 *
 * <p>Kicker tiers for top pair:
 * <ul>
 *   <li>top kicker: an ace, or a king when the ace is the paired card</li>
 *   <li>good kicker: king or queen</li>
 *   <li>weak kicker: anything lower</li>
 * </ul>
 */
public final class HoldingClassifier {

    private HoldingClassifier() {}

    public static Holding classify(HandCombo combo, List<Card> board) {
        Objects.requireNonNull(combo, "combo");
        if (board == null || board.isEmpty()) {
            throw new IllegalArgumentException("Holding needs at least one board card");
        }

        List<Card> all = new ArrayList<>(board);
        all.addAll(combo.cards());
        int score = HandRanker.evaluate(all);
        int boardScore = HandRanker.evaluate(board);
        HandCategory category = HandRanker.category(score);

        if (category.ordinal() >= HandCategory.STRAIGHT.ordinal() && score > boardScore) {
            return Holding.STRAIGHT_OR_BETTER;
        }

        List<Integer> boardRanks = distinctRanksDescending(board);
        int top = boardRanks.get(0);
        int second = boardRanks.size() > 1 ? boardRanks.get(1) : -1;
        int highRank = combo.high().rank().value();
        int lowRank = combo.low().rank().value();

        if (combo.isPair()) {
            if (boardRanks.contains(highRank)) return Holding.SET;
            return highRank > top ? Holding.OVERPAIR : Holding.UNDERPAIR;
        }

        boolean highHits = boardRanks.contains(highRank);
        boolean lowHits = boardRanks.contains(lowRank);
        if (highHits && lowHits) {
            return (highRank == top && lowRank == second) ? Holding.TOP_TWO_PAIR : Holding.TWO_PAIR;
        }
        if (highHits || lowHits) {
            int paired = highHits ? highRank : lowRank;
            int kicker = highHits ? lowRank : highRank;
            if (countRank(board, paired) >= 2) return Holding.TRIPS;
            if (paired == top) return topPairByKicker(paired, kicker);
            if (paired == second) return Holding.SECOND_PAIR;
            return Holding.WEAK_PAIR;
        }
        return combo.hasRank(Rank.ACE) ? Holding.ACE_HIGH : Holding.HIGH_CARD;
    }

    public static DrawProfile draws(HandCombo combo, List<Card> board) {
        if (board == null || board.size() < 3 || board.size() >= 5) return DrawProfile.NONE;

        boolean flushDraw = false;
        for (Card hole : combo.cards()) {
            long boardSuited = board.stream().filter(c -> c.suit() == hole.suit()).count();
            long holeSuited = combo.cards().stream().filter(c -> c.suit() == hole.suit()).count();
            if (boardSuited + holeSuited == 4) {
                flushDraw = true;
                break;
            }
        }

        int boardMask = rankMask(board);
        int fullMask = boardMask | (1 << combo.high().rank().value()) | (1 << combo.low().rank().value());
        int fullOpen = countOpenEnders(fullMask);
        int fullGut = countGutshots(fullMask);
        boolean madeStraight = HandRanker.highestStraight(fullMask) > 0;
        boolean openEnded = !madeStraight && fullOpen > countOpenEnders(boardMask)
                            || !madeStraight && fullGut - countGutshots(boardMask) >= 2;
        boolean gutshot = !madeStraight && !openEnded && fullGut > countGutshots(boardMask);

        int topBoard = distinctRanksDescending(board).get(0);
        int overcards = 0;
        for (Card hole : combo.cards()) {
            if (hole.rank().value() > topBoard) overcards++;
        }
        if (combo.isPair()) overcards = 0;

        return new DrawProfile(flushDraw, openEnded, gutshot, overcards);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static Holding topPairByKicker(int paired, int kicker) {
        int topKicker = paired == Rank.ACE.value() ? Rank.KING.value() : Rank.ACE.value();
        if (kicker == topKicker) return Holding.TOP_PAIR_TOP_KICKER;
        if (kicker >= Rank.QUEEN.value()) return Holding.TOP_PAIR_GOOD_KICKER;
        return Holding.TOP_PAIR_WEAK_KICKER;
    }

    static List<Integer> distinctRanksDescending(List<Card> cards) {
        List<Integer> ranks = new ArrayList<>();
        for (int r = 14; r >= 2; r--) {
            for (Card c : cards) {
                if (c.rank().value() == r) {
                    ranks.add(r);
                    break;
                }
            }
        }
        return ranks;
    }

    private static int countRank(List<Card> cards, int rank) {
        int n = 0;
        for (Card c : cards) if (c.rank().value() == rank) n++;
        return n;
    }

    private static int rankMask(List<Card> cards) {
        int mask = 0;
        for (Card c : cards) mask |= 1 << c.rank().value();
        if ((mask & (1 << 14)) != 0) mask |= 1 << 1;
        return mask;
    }

    /** Four consecutive ranks that can be completed at either end. */
    private static int countOpenEnders(int mask) {
        int m = (mask & (1 << 14)) != 0 ? mask | 1 << 1 : mask;
        int count = 0;
        for (int low = 2; low <= 10; low++) {
            int run = 0b1111 << low;
            if ((m & run) == run && low - 1 >= 1 && low + 4 <= 14) {
                boolean belowOpen = (m & (1 << (low - 1))) == 0;
                boolean aboveOpen = (m & (1 << (low + 4))) == 0;
                if (belowOpen && aboveOpen) count++;
            }
        }
        return count;
    }

    /** Five-rank windows missing exactly one rank. */
    private static int countGutshots(int mask) {
        int m = (mask & (1 << 14)) != 0 ? mask | 1 << 1 : mask;
        int count = 0;
        for (int low = 1; low <= 10; low++) {
            int window = 0b11111 << low;
            if (Integer.bitCount(m & window) == 4) count++;
        }
        return count;
    }
}
