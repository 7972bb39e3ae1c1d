package com.handcoach.common.equity;

import com.handcoach.common.card.Card;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.range.Range;

import java.util.List;

/**
 * Hero-hand-versus-range win probability.
 */
public interface EquityCalculator {

    /** Whether this calculator can price the given board at all. */
    boolean supports(List<Card> board);

    /**
     * @return hero's share of the pot in [0, 1], ties counted as half
     * @throws IllegalStateException when the villain range has nothing left to enumerate
     */
    double equity(HandCombo hero, Range villain, List<Card> board);
}
