package com.handcoach.common.equity;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.range.Range;
import com.handcoach.common.range.WeightedCombo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EquityEstimatorTest {

    private static final EquityEstimator ESTIMATOR = new EquityEstimator(new ExhaustiveEquityCalculator());

    private static Range only(String... combos) {
        return Range.of(Arrays.stream(combos)
            .map(c -> new WeightedCombo(HandCombo.parse(c), 1.0, null))
            .collect(Collectors.toList()));
    }

    @Nested
    @DisplayName("potOdds()")
    class PotOdds {

        @Test
        @DisplayName("pot-sized bet needs 50%")
        void potSized() {
            assertEquals(0.5, EquityEstimator.potOdds(10, 10));
            assertTrue(EquityEstimator.isProfitable(0.51, 0.5));
            assertFalse(EquityEstimator.isProfitable(0.5, 0.5));
        }

        @Test
        @DisplayName("nothing to call → 0")
        void noBet() {
            assertEquals(0.0, EquityEstimator.potOdds(10, 0));
        }
    }

    @Nested
    @DisplayName("estimate()")
    class Estimate {

        @Test
        @DisplayName("river: aces beat kings every time")
        void exactRiver() {
            EquityResult r = ESTIMATOR.estimate(HandCombo.parse("AhAs"), only("KhKs"),
                Cards.parseList("2c 7d 9h Jc Qd"), 100, 50);
            assertEquals(EquityMethod.EXACT, r.method());
            assertEquals(1.0, r.equity());
            assertFalse(r.degraded());
            assertTrue(r.profitable());
            assertEquals("2.0:1", r.oddsRatio());
        }

        @Test
        @DisplayName("turn: kings have two outs against aces")
        void exactTurn() {
            EquityResult r = ESTIMATOR.estimate(HandCombo.parse("AhAd"), only("KcKd"),
                Cards.parseList("2c 7d 9h Js"), 100, 0);
            assertEquals(0.955, r.equity(), 1e-9);
        }

        @Test
        @DisplayName("preflop uses the heuristic without flagging degradation")
        void preflopHeuristic() {
            EquityResult r = ESTIMATOR.estimate(HandCombo.parse("QhQs"), only("AhKd"), List.of(), 10, 5);
            assertEquals(EquityMethod.HEURISTIC, r.method());
            assertFalse(r.degraded());
            assertEquals(0.65, r.equity(), 1e-9);
        }

        @Test
        @DisplayName("calculator failure → heuristic, degraded, no exception")
        void calculatorFailure() {
            EquityResult r = ESTIMATOR.estimate(HandCombo.parse("AhKh"), Range.empty(),
                Cards.parseList("Ac 7d 2s"), 20, 10);
            assertEquals(EquityMethod.HEURISTIC, r.method());
            assertTrue(r.degraded());
            assertNotNull(r.degradationReason());
            assertEquals(0.73, r.equity(), 1e-9);
        }

        @Test
        @DisplayName("any calculator exception is absorbed")
        void brokenCalculator() {
            EquityCalculator broken = new EquityCalculator() {
                @Override
                public boolean supports(List<Card> board) {
                    return true;
                }

                @Override
                public double equity(HandCombo hero, Range villain, List<Card> board) {
                    throw new IllegalStateException("boom");
                }
            };
            EquityResult r = new EquityEstimator(broken).estimate(HandCombo.parse("7h2c"), Range.empty(),
                Cards.parseList("Ac Kd Qs"), 10, 10);
            assertTrue(r.degraded());
            assertEquals(0.40, r.equity(), 1e-9);
            assertFalse(r.profitable());
        }
    }

    @Test
    @DisplayName("heuristic is clamped to [0.10, 0.90]")
    void heuristicClamp() {
        double best = HeuristicEquity.estimate(HandCombo.parse("AhAs"), Cards.parseList("Ad 7c 2s"));
        assertEquals(0.85, best, 1e-9);
        assertTrue(best <= HeuristicEquity.MAX);
    }
}
