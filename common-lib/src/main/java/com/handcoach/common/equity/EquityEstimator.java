package com.handcoach.common.equity;

import com.handcoach.common.card.Card;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.range.Range;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Equity with a guaranteed answer: the exact calculator when it supports the board, the
 * {@link HeuristicEquity} otherwise. A failing exact calculation falls back to the heuristic
 * and marks the result degraded instead of throwing.
 */
public final class EquityEstimator {

    private final EquityCalculator exact;

    public EquityEstimator(EquityCalculator exact) {
        this.exact = Objects.requireNonNull(exact, "exact");
    }

    public EquityResult estimate(HandCombo hero, Range villain, List<Card> board, double pot, double bet) {
        double equity;
        EquityMethod method = EquityMethod.HEURISTIC;
        boolean degraded = false;
        String reason = null;

        if (exact.supports(board)) {
            try {
                equity = exact.equity(hero, villain, board);
                method = EquityMethod.EXACT;
            } catch (RuntimeException e) {
                equity = HeuristicEquity.estimate(hero, board);
                degraded = true;
                reason = "Exact equity failed, heuristic used: " + e.getMessage();
            }
        } else {
            equity = HeuristicEquity.estimate(hero, board);
        }

        return result(equity, method, degraded, reason, pot, bet);
    }

    /** Heuristic-only result, for callers that could not run the estimator at all. */
    public static EquityResult heuristic(HandCombo hero, List<Card> board, double pot, double bet, String reason) {
        return result(HeuristicEquity.estimate(hero, board), EquityMethod.HEURISTIC, reason != null, reason, pot, bet);
    }

    /** Share of the final pot hero must win to break even on a call: bet / (pot + bet). */
    public static double potOdds(double pot, double bet) {
        if (bet <= 0) return 0.0;
        return bet / (pot + bet);
    }

    public static boolean isProfitable(double equity, double equityNeeded) {
        return equity > equityNeeded;
    }

    private static EquityResult result(double equity, EquityMethod method, boolean degraded, String reason,
                                       double pot, double bet) {
        double needed = potOdds(pot, bet);
        boolean profitable = isProfitable(equity, needed);
        String recommendation = bet <= 0
            ? "Nothing to call; equity %.0f%%".formatted(equity * 100)
            : profitable
                ? "Call is profitable: %.0f%% equity vs %.0f%% needed".formatted(equity * 100, needed * 100)
                : "Fold is correct: %.0f%% equity vs %.0f%% needed".formatted(equity * 100, needed * 100);

        return new EquityResult(round3(equity), method, degraded, reason, pot, bet, round3(needed),
                                oddsRatio(pot, bet), profitable, recommendation);
    }

    static String oddsRatio(double pot, double bet) {
        if (bet <= 0) return "n/a";
        return String.format(Locale.ROOT, "%.1f:1", pot / bet);
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
