package com.handcoach.common.range;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Rank;
import com.handcoach.common.hand.DrawProfile;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.hand.Holding;
import com.handcoach.common.hand.HoldingClassifier;

import java.util.List;

/**
 * Assigns a single {@link Bucket} to a combo.
 *
 * <h3>Post-flop</h3>
 * <ol>
 *   <li>MONSTER: straight or better, sets, top two pair</li>
 *   <li>STRONG: other two pair, trips, overpairs, top pair top kicker</li>
 *   <li>DRAW_STRONG: flush draws and open-enders without one of the above</li>
 *   <li>MARGINAL: any other pair, ace high</li>
 *   <li>DRAW_WEAK: gutshots and two overcards</li>
 *   <li>AIR: everything else</li>
 * </ol>
 *
 * <h3>Preflop</h3>
 * Buckets by starting-hand class: QQ+ and AK are monsters, JJ–99 and strong broadways are strong,
 * small pairs and suited aces marginal, suited connectors strong draws, other suited hands and
 * offsuit connectors weak draws.
 */
public final class HandBucketer {

    private HandBucketer() {}

    public static Bucket bucket(HandCombo combo, List<Card> board) {
        if (board == null || board.isEmpty()) return preflop(combo);

        Holding holding = HoldingClassifier.classify(combo, board);
        Bucket made = switch (holding) {
            case STRAIGHT_OR_BETTER, SET, TOP_TWO_PAIR -> Bucket.MONSTER;
            case TWO_PAIR, TRIPS, OVERPAIR, TOP_PAIR_TOP_KICKER -> Bucket.STRONG;
            default -> null;
        };
        if (made != null) return made;

        DrawProfile draws = HoldingClassifier.draws(combo, board);
        if (draws.isStrongDraw()) return Bucket.DRAW_STRONG;
        if (holding != Holding.HIGH_CARD) return Bucket.MARGINAL;
        if (draws.isWeakDraw()) return Bucket.DRAW_WEAK;
        return Bucket.AIR;
    }

    static Bucket preflop(HandCombo combo) {
        int high = combo.high().rank().value();
        int low = combo.low().rank().value();
        if (combo.isPair()) {
            if (high >= Rank.QUEEN.value()) return Bucket.MONSTER;
            if (high >= Rank.NINE.value()) return Bucket.STRONG;
            return Bucket.MARGINAL;
        }
        if (high == Rank.ACE.value() && low == Rank.KING.value()) return Bucket.MONSTER;
        if (high == Rank.ACE.value() && low >= Rank.QUEEN.value()) return Bucket.STRONG;
        if (combo.isSuited() && high >= Rank.KING.value() && low >= Rank.JACK.value()) return Bucket.STRONG;
        if (combo.isSuited() && high == Rank.ACE.value()) return Bucket.MARGINAL;
        if (low >= Rank.TEN.value()) return Bucket.MARGINAL;
        if (combo.isSuited() && combo.gap() <= 2 && low >= Rank.FOUR.value()) return Bucket.DRAW_STRONG;
        if (combo.isSuited() || combo.gap() == 1) return Bucket.DRAW_WEAK;
        return Bucket.AIR;
    }
}
