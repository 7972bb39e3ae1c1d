package com.handcoach.common.advantage;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Rank;
import com.handcoach.common.card.Suit;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.hand.Holding;
import com.handcoach.common.hand.HoldingClassifier;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Street;
import com.handcoach.common.range.RangeAnalysis;
import com.handcoach.common.range.RangeStats;
import com.handcoach.common.range.StreetRanges;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compares hero and villain range statistics and places hero's actual hand inside that picture.
 *
 * <h3>Range advantage</h3>
 * Sum of monster, strong and marginal percentages per side. A gap under
 * {@value #RANGE_EVEN_GAP} points is even; otherwise the larger side leads.
 *
 * <h3>Nut advantage</h3>
 * Monster percentages only, even under {@value #NUT_EVEN_GAP} points. A side with no monster
 * combos at all is capped.
 *
 * <h3>Hero spot</h3>
 * Share of the villain range hero beats, by holding:
 * <ul>
 *   <li>straight or better: everything but half the monsters</li>
 *   <li>set, top two, overpair: everything but the monsters</li>
 *   <li>two pair, trips: also loses to a quarter of the strong hands</li>
 *   <li>top pair: also loses to half the strong hands</li>
 *   <li>second pair: loses to all monster and strong hands</li>
 *   <li>weaker: loses to monster and strong hands plus another 20 points of the range</li>
 * </ul>
 *
 * Both comparisons are symmetric: swapping the arguments swaps the leader and keeps the margin.
 */
public final class AdvantageEngine {

    public static final double RANGE_EVEN_GAP = 5.0;
    public static final double NUT_EVEN_GAP = 2.0;

    private AdvantageEngine() {}

    public static RangeAdvantage rangeAdvantage(RangeStats hero, RangeStats villain) {
        double h = round1(hero.madeStrength());
        double v = round1(villain.madeStrength());
        double margin = round1(Math.abs(h - v));
        if (margin < RANGE_EVEN_GAP) {
            return new RangeAdvantage(Leader.EVEN, h, v, margin, null,
                "Ranges are close: %.1f%% vs %.1f%% made hands".formatted(h, v));
        }
        Leader leader = h > v ? Leader.HERO : Leader.VILLAIN;
        double lead = Math.max(h, v);
        double trail = Math.min(h, v);
        Double ratio = trail > 0 ? round2(lead / trail) : null;
        String summary = "%s has the range advantage: %.1f%% vs %.1f%% made hands".formatted(
            label(leader), lead, trail);
        return new RangeAdvantage(leader, h, v, margin, ratio, summary);
    }

    public static NutAdvantage nutAdvantage(RangeStats hero, RangeStats villain) {
        double h = round1(hero.monster());
        double v = round1(villain.monster());
        double margin = round1(Math.abs(h - v));
        boolean heroCapped = h <= 0.0;
        boolean villainCapped = v <= 0.0;

        Leader leader = margin < NUT_EVEN_GAP ? Leader.EVEN : h > v ? Leader.HERO : Leader.VILLAIN;
        StringBuilder summary = new StringBuilder(leader == Leader.EVEN
            ? "No clear nut advantage: %.1f%% vs %.1f%% monsters".formatted(h, v)
            : "%s has the nut advantage: %.1f%% vs %.1f%% monsters".formatted(
                  label(leader), Math.max(h, v), Math.min(h, v)));
        if (heroCapped) summary.append("; hero is capped (no monsters)");
        if (villainCapped) summary.append("; villain is capped (no monsters)");
        return new NutAdvantage(leader, h, v, margin, heroCapped, villainCapped, summary.toString());
    }

    /**
     * Card-removal effects of hero's hole cards: flush blockers for suits with two or more cards
     * on board, and rank blockers for aces and kings.
     */
    public static BlockerEffects detectBlockers(HandCombo hero, List<Card> board) {
        if (board == null || board.isEmpty()) return BlockerEffects.none();

        List<String> blockers = new ArrayList<>();
        boolean flushBlocker = false;
        boolean nutFlushBlocker = false;
        Set<Suit> seen = EnumSet.noneOf(Suit.class);
        for (Card card : hero.cards()) {
            long onBoard = board.stream().filter(c -> c.suit() == card.suit()).count();
            if (onBoard < 2) continue;
            flushBlocker = true;
            if (card.rank() == Rank.ACE) {
                nutFlushBlocker = true;
                blockers.add("Holds the %s: blocks the nut flush".formatted(card));
            } else if (seen.add(card.suit())) {
                blockers.add("Blocks %s flushes (%d on board)".formatted(
                    card.suit().name().toLowerCase(Locale.ROOT), onBoard));
            }
        }

        boolean holdsAce = hero.hasRank(Rank.ACE);
        if (holdsAce) blockers.add("Ace reduces villain's AA and Ax combos");
        if (hero.hasRank(Rank.KING)) blockers.add("King reduces villain's KK and AK combos");

        boolean boardAce = board.stream().anyMatch(c -> c.rank() == Rank.ACE);
        BlockerImpact impact = nutFlushBlocker || (holdsAce && boardAce) ? BlockerImpact.STRONG
                             : blockers.isEmpty() ? BlockerImpact.NONE : BlockerImpact.MODERATE;
        return new BlockerEffects(blockers, flushBlocker, nutFlushBlocker, impact);
    }

    /**
     * Places hero's holding against {@code villain}. {@code previous} is hero's spot on the prior
     * street, or {@code null}; it drives the ahead/behind flip flag.
     */
    public static HeroSpot heroSpotAnalysis(HandCombo hero, RangeStats villain, List<Card> board,
                                            HeroSpot previous) {
        Holding holding = HoldingClassifier.classify(hero, board);
        double m = villain.monster();
        double s = villain.strong();
        double beats = switch (holding) {
            case STRAIGHT_OR_BETTER -> 100 - m * 0.5;
            case SET, TOP_TWO_PAIR, OVERPAIR -> 100 - m;
            case TWO_PAIR, TRIPS -> 100 - m - s * 0.25;
            case TOP_PAIR_TOP_KICKER, TOP_PAIR_GOOD_KICKER, TOP_PAIR_WEAK_KICKER -> 100 - m - s * 0.5;
            case SECOND_PAIR -> 100 - m - s;
            default -> 100 - m - s - 20;
        };
        beats = round1(Math.max(0.0, Math.min(100.0, beats)));
        boolean ahead = beats >= 50.0;
        boolean flipped = previous != null && previous.ahead() != ahead;
        String flipNote = !flipped ? null
            : ahead ? "Now ahead of most of villain's range" : "Now behind most of villain's range";
        String description = "%s: ahead of about %.0f%% of villain's range".formatted(holding.label(), beats);
        return new HeroSpot(holding, description, beats, ahead, flipped, flipNote);
    }

    /** Per-street advantage for every street in {@code ranges}, with leader and flip shifts. */
    public static AdvantageAnalysis analyze(ParsedHand hand, RangeAnalysis ranges) {
        Map<Street, StreetAdvantage> streets = new EnumMap<>(Street.class);
        List<String> shifts = new ArrayList<>();
        StreetAdvantage previous = null;

        for (StreetRanges sr : ranges.streets().values()) {
            RangeAdvantage range = rangeAdvantage(sr.hero(), sr.villain());
            NutAdvantage nuts = nutAdvantage(sr.hero(), sr.villain());
            HeroSpot spot = null;
            if (sr.street() != Street.PREFLOP) {
                HeroSpot prevSpot = previous == null ? null : previous.heroSpot();
                spot = heroSpotAnalysis(hand.heroHand(), sr.villain(), hand.boardFor(sr.street()), prevSpot);
            }

            if (previous != null) {
                String street = sr.street().wireName();
                if (previous.rangeAdvantage().leader() != range.leader()) {
                    shifts.add("Range advantage moved from %s to %s on the %s".formatted(
                        previous.rangeAdvantage().leader().wireName(), range.leader().wireName(), street));
                }
                if (previous.nutAdvantage().leader() != nuts.leader()) {
                    shifts.add("Nut advantage moved from %s to %s on the %s".formatted(
                        previous.nutAdvantage().leader().wireName(), nuts.leader().wireName(), street));
                }
                if (spot != null && spot.flipped()) {
                    shifts.add("%s on the %s".formatted(spot.flipNote(), street));
                }
            }

            StreetAdvantage current = new StreetAdvantage(sr.street(), range, nuts, spot);
            streets.put(sr.street(), current);
            previous = current;
        }

        BlockerEffects blockers = detectBlockers(hand.heroHand(), hand.boardFor(hand.lastStreet()));
        return new AdvantageAnalysis(streets, blockers, shifts);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static String label(Leader leader) {
        return leader == Leader.HERO ? "Hero" : "Villain";
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
