package com.handcoach.common.equity;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.hand.HandRanker;
import com.handcoach.common.range.Range;
import com.handcoach.common.range.WeightedCombo;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact equity by enumerating every remaining runout against every live villain combo,
 * weighted by range weight. Post-flop only: at most two cards left to come.
 */
public class ExhaustiveEquityCalculator implements EquityCalculator {

    @Override
    public boolean supports(List<Card> board) {
        return board != null && board.size() >= 3 && board.size() <= 5;
    }

    @Override
    public double equity(HandCombo hero, Range villain, List<Card> board) {
        if (!supports(board)) {
            throw new IllegalArgumentException("Exhaustive enumeration needs a flop, turn or river board");
        }
        Set<Card> dead = new HashSet<>(board);
        dead.addAll(hero.cards());
        if (dead.size() != board.size() + 2) {
            throw new IllegalArgumentException("Hero cards collide with the board");
        }

        List<WeightedCombo> live = new ArrayList<>();
        for (WeightedCombo wc : villain.combos()) {
            if (!wc.combo().sharesCardWith(dead)) live.add(wc);
        }
        if (live.isEmpty()) throw new IllegalStateException("Villain range is empty after card removal");

        List<Card> deck = Cards.remaining(dead);
        int toCome = 5 - board.size();
        Card[] heroCards = new Card[7];
        Card[] villainCards = new Card[7];
        for (int i = 0; i < board.size(); i++) {
            heroCards[i] = board.get(i);
            villainCards[i] = board.get(i);
        }
        heroCards[5] = hero.high();
        heroCards[6] = hero.low();

        double weighted = 0.0;
        double totalWeight = 0.0;
        for (WeightedCombo wc : live) {
            villainCards[5] = wc.combo().high();
            villainCards[6] = wc.combo().low();
            double share = 0.0;
            int runouts = 0;

            if (toCome == 0) {
                share = showdown(heroCards, villainCards);
                runouts = 1;
            } else {
                for (int i = 0; i < deck.size(); i++) {
                    Card first = deck.get(i);
                    if (wc.combo().contains(first)) continue;
                    heroCards[board.size()] = first;
                    villainCards[board.size()] = first;
                    if (toCome == 1) {
                        share += showdown(heroCards, villainCards);
                        runouts++;
                        continue;
                    }
                    for (int j = i + 1; j < deck.size(); j++) {
                        Card second = deck.get(j);
                        if (wc.combo().contains(second)) continue;
                        heroCards[4] = second;
                        villainCards[4] = second;
                        share += showdown(heroCards, villainCards);
                        runouts++;
                    }
                }
            }
            weighted += wc.weight() * (share / runouts);
            totalWeight += wc.weight();
        }
        return weighted / totalWeight;
    }

    private static double showdown(Card[] hero, Card[] villain) {
        int h = HandRanker.evaluate(hero, 7);
        int v = HandRanker.evaluate(villain, 7);
        return h > v ? 1.0 : h == v ? 0.5 : 0.0;
    }
}
