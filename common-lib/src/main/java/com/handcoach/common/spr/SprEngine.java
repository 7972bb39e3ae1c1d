package com.handcoach.common.spr;

import com.handcoach.common.model.PotSizes;
import com.handcoach.common.model.Stacks;
import com.handcoach.common.model.Street;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack-to-pot ratio per street.
 *
 * <h3>Stack accounting</h3>
 * <ol>
 *   <li>Starting effective stack = min(hero, villain).</li>
 *   <li>Money each player put in between two reached streets = (pot[street] − pot[previous]) / 2,
 *       heads-up equal split, never negative.</li>
 *   <li>Remaining stack = previous remaining − invested, floored at zero.</li>
 *   <li>SPR = remaining / pot[street]; undefined on streets the hand never reached.</li>
 * </ol>
 *
 * No Spring dependencies. No I/O. Pure function.
 */
public final class SprEngine {

    private SprEngine() {}

    public static SprAnalysis computeSpr(PotSizes pots, Stacks stacks) {
        double effective = Math.max(0.0, stacks.effective());
        if (pots == null) return SprAnalysis.unavailable(effective);

        List<SprSnapshot> snapshots = new ArrayList<>();
        double remaining = effective;
        Double previousPot = null;
        SprSnapshot current = null;

        for (Street street : Street.values()) {
            if (!pots.isReached(street)) {
                snapshots.add(SprSnapshot.unreached(street, round2(remaining)));
                continue;
            }
            double pot = pots.get(street);
            if (previousPot != null) {
                double invested = Math.max(0.0, (pot - previousPot) / 2.0);
                remaining = Math.max(0.0, remaining - invested);
            }
            double spr = remaining / pot;
            current = new SprSnapshot(street, true, pot, round2(remaining), round2(spr),
                                      SprZone.of(spr), CommitmentThresholds.forSpr(spr));
            snapshots.add(current);
            previousPot = pot;
        }

        if (current == null) return new SprAnalysis(effective, snapshots, null, null, 0.0, "SPR unavailable");

        double committedPct = effective > 0 ? round2((effective - remaining) / effective * 100.0) : 0.0;
        return new SprAnalysis(effective, snapshots, current,
                               futureSpr(current.potSize(), remaining), committedPct,
                               sizingAdvice(current.zone()));
    }

    static FutureSpr futureSpr(double pot, double remaining) {
        return new FutureSpr(afterCalledBet(pot, remaining, pot * 0.5), afterCalledBet(pot, remaining, pot));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static double afterCalledBet(double pot, double remaining, double bet) {
        double size = Math.min(bet, remaining);
        double newPot = pot + 2 * size;
        return round2(Math.max(0.0, remaining - size) / newPot);
    }

    private static String sizingAdvice(SprZone zone) {
        return switch (zone) {
            case COMMITTED -> "Stacks are effectively committed: shove or check, any bet commits";
            case LOW -> "Bet 50-75% pot and plan to get stacks in with top pair or better";
            case MEDIUM -> "Bet 50-66% pot; two streets of value gets stacks in";
            case MEDIUM_HIGH -> "Bet 33-50% pot and keep one-pair hands in pot control";
            case HIGH -> "Small bets of 25-33% pot; implied odds favour speculative hands";
        };
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
