package com.handcoach.common.equity;

import com.handcoach.common.card.Card;
import com.handcoach.common.hand.HandCombo;

import java.util.List;

/**
 * Additive equity guess used when exact enumeration is unavailable.
 *
 * <p>The constants are empirically tuned placeholders rather than a derived model; only the
 * pot-odds comparison built on top of them is relied on for verdicts.
 */
public final class HeuristicEquity {

    static final double BASE = 0.40;
    static final double PAIR_BONUS = 0.15;
    static final double SUITED_BONUS = 0.03;
    static final double HIGH_CARDS_BONUS = 0.10;
    static final int HIGH_CARDS_RANK_SUM = 24;
    static final double BOARD_HIT_BONUS = 0.20;
    static final double MIN = 0.10;
    static final double MAX = 0.90;

    private HeuristicEquity() {}

    public static double estimate(HandCombo hero, List<Card> board) {
        double equity = BASE;
        if (hero.isPair()) equity += PAIR_BONUS;
        if (hero.isSuited()) equity += SUITED_BONUS;
        if (hero.rankSum() >= HIGH_CARDS_RANK_SUM) equity += HIGH_CARDS_BONUS;
        if (board != null && board.stream().anyMatch(c -> hero.hasRank(c.rank()))) equity += BOARD_HIT_BONUS;
        return Math.max(MIN, Math.min(MAX, equity));
    }
}
