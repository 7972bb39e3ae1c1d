package com.handcoach.common.advantage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.card.Cards;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.hand.Holding;
import com.handcoach.common.model.Action;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Actor;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.PositionContext;
import com.handcoach.common.model.PotSizes;
import com.handcoach.common.model.Stacks;
import com.handcoach.common.model.Street;
import com.handcoach.common.model.TablePosition;
import com.handcoach.common.range.Bucket;
import com.handcoach.common.range.PreflopRangeTable;
import com.handcoach.common.range.RangeAnalysis;
import com.handcoach.common.range.RangeEngine;
import com.handcoach.common.range.RangeStats;
import com.handcoach.common.range.StreetRangeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdvantageEngineTest {

    private static RangeStats stats(double monster, double strong, double marginal) {
        Map<Bucket, Double> dist = new EnumMap<>(Bucket.class);
        dist.put(Bucket.MONSTER, monster);
        dist.put(Bucket.STRONG, strong);
        dist.put(Bucket.MARGINAL, marginal);
        dist.put(Bucket.DRAW_STRONG, 0.0);
        dist.put(Bucket.DRAW_WEAK, 0.0);
        dist.put(Bucket.AIR, 100.0 - monster - strong - marginal);
        return new RangeStats(100.0, dist, List.of(), 100);
    }

    // ── range and nut advantage ──────────────────────────────────────────────

    @Nested
    @DisplayName("rangeAdvantage() / nutAdvantage()")
    class Comparisons {

        @Test
        @DisplayName("swapping sides swaps the leader and keeps the margin")
        void symmetry() {
            RangeStats a = stats(12.0, 20.0, 25.0);
            RangeStats b = stats(3.0, 15.0, 20.0);

            RangeAdvantage ab = AdvantageEngine.rangeAdvantage(a, b);
            RangeAdvantage ba = AdvantageEngine.rangeAdvantage(b, a);
            assertEquals(Leader.HERO, ab.leader());
            assertEquals(ab.leader().swapped(), ba.leader());
            assertEquals(ab.margin(), ba.margin());
            assertEquals(ab.ratio(), ba.ratio());

            NutAdvantage nab = AdvantageEngine.nutAdvantage(a, b);
            NutAdvantage nba = AdvantageEngine.nutAdvantage(b, a);
            assertEquals(Leader.HERO, nab.leader());
            assertEquals(Leader.VILLAIN, nba.leader());
            assertEquals(nab.margin(), nba.margin());
        }

        @Test
        @DisplayName("gap under 5 points is even with no ratio")
        void evenRange() {
            RangeAdvantage r = AdvantageEngine.rangeAdvantage(stats(10, 20, 20), stats(10, 18, 19));
            assertEquals(Leader.EVEN, r.leader());
            assertNull(r.ratio());
        }

        @Test
        @DisplayName("side with no monsters is capped; trailer at 0 strength gives no ratio")
        void capped() {
            NutAdvantage n = AdvantageEngine.nutAdvantage(stats(8, 10, 10), stats(0, 0, 0));
            assertTrue(n.villainCapped());
            assertFalse(n.heroCapped());
            assertNull(AdvantageEngine.rangeAdvantage(stats(8, 10, 10), stats(0, 0, 0)).ratio());
        }
    }

    // ── blockers ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detectBlockers()")
    class Blockers {

        @Test
        @DisplayName("ace of a two-tone suit is a strong nut flush blocker")
        void nutFlushBlocker() {
            BlockerEffects b = AdvantageEngine.detectBlockers(HandCombo.parse("AhKh"), Cards.parseList("Qh 7h 2c"));
            assertTrue(b.flushBlocker());
            assertTrue(b.nutFlushBlocker());
            assertEquals(BlockerImpact.STRONG, b.impact());
        }

        @Test
        @DisplayName("king alone is a moderate rank blocker")
        void kingBlocker() {
            BlockerEffects b = AdvantageEngine.detectBlockers(HandCombo.parse("Kc9d"), Cards.parseList("Qh 7h 2s"));
            assertFalse(b.flushBlocker());
            assertEquals(BlockerImpact.MODERATE, b.impact());
        }

        @Test
        @DisplayName("no relevant cards → NONE")
        void none() {
            BlockerEffects b = AdvantageEngine.detectBlockers(HandCombo.parse("9c8c"), Cards.parseList("Kd 7s 2h"));
            assertEquals(BlockerImpact.NONE, b.impact());
            assertTrue(b.blockers().isEmpty());
        }
    }

    // ── hero spot ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("heroSpotAnalysis() flags a flip from ahead to behind")
    void heroSpotFlip() {
        HeroSpot flop = AdvantageEngine.heroSpotAnalysis(HandCombo.parse("AhAs"), stats(5, 10, 20),
            Cards.parseList("Kd 7s 2h"), null);
        assertEquals(Holding.OVERPAIR, flop.holding());
        assertTrue(flop.ahead());
        assertFalse(flop.flipped());

        HeroSpot turn = AdvantageEngine.heroSpotAnalysis(HandCombo.parse("AhAs"), stats(60, 10, 20),
            Cards.parseList("Kd 7s 2h Kc"), flop);
        assertFalse(turn.ahead());
        assertTrue(turn.flipped());
        assertNotNull(turn.flipNote());
    }

    // ── end to end through the range engine ──────────────────────────────────

    @Test
    @DisplayName("UTG opener vs BTN flat on A-K-Q: the preflop aggressor has the nut advantage")
    void aggressorOwnsNutsOnHighBoard() {
        RangeEngine engine = new RangeEngine(
            PreflopRangeTable.fromClasspath(new ObjectMapper(), PreflopRangeTable.DEFAULT_RESOURCE));
        ParsedHand hand = new ParsedHand("e2e-akq", HandCombo.parse("9s9h"), Cards.parseList("Ah Kd Qc"),
            PositionContext.of(TablePosition.UTG, TablePosition.BTN),
            List.of(Action.of(Street.PREFLOP, Actor.HERO, ActionType.RAISE, 2.5),
                    Action.of(Street.PREFLOP, Actor.VILLAIN, ActionType.CALL, 2.5)),
            new Stacks(100, 100), new PotSizes(6.5, 6.5, null, null), 1.0, 0.0);

        RangeAnalysis ranges = new StreetRangeBuilder(engine).build(hand);
        AdvantageAnalysis analysis = AdvantageEngine.analyze(hand, ranges);
        NutAdvantage nuts = analysis.on(Street.FLOP).orElseThrow().nutAdvantage();

        assertFalse(nuts.villainCapped());
        assertEquals(Leader.HERO, nuts.leader());
        assertNotNull(analysis.on(Street.FLOP).orElseThrow().heroSpot());
        assertNull(analysis.on(Street.PREFLOP).orElseThrow().heroSpot());
    }
}
