package com.handcoach.common.range;

import com.handcoach.common.board.BoardTextureClassifier;
import com.handcoach.common.card.Card;
import com.handcoach.common.card.Rank;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.hand.HandRanker;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.TablePosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds, categorizes and narrows weighted ranges.
 *
 * <p>Every operation is a pure function from one {@link Range} to a new one; the input is
 * never modified. Filters that would leave nothing behind keep the top 1% of the input by
 * weight (at least one combo) so downstream ratios never divide by zero.
 *
 * <h3>Action filters</h3>
 * Each action multiplies the weight of every combo by a per-bucket factor. Wet and dry boards
 * use separate factor rows: on wet boards players continue wider with draws, on dry boards
 * bluffs are cheaper and calls are stickier with made hands. Combos falling below
 * {@link #MIN_WEIGHT} are dropped.
 */
public final class RangeEngine {

    public static final double SHORT_STACK_BB = 20.0;
    public static final double DEEP_STACK_BB = 150.0;
    public static final double MIN_WEIGHT = 0.01;
    static final double FLOOR_FRACTION = 0.01;
    static final double ACTIVE_WEIGHT = 0.05;
    static final int TOP_COMBOS = 10;

    //                                         MONSTER STRONG MARGINAL D_STRONG D_WEAK AIR
    private static final double[] RAISE_WET = {1.00,  0.85,  0.20,    0.70,    0.30,  0.15};
    private static final double[] RAISE_DRY = {1.00,  0.70,  0.10,    0.40,    0.15,  0.25};
    private static final double[] BET_WET   = {1.00,  0.90,  0.40,    0.85,    0.45,  0.30};
    private static final double[] BET_DRY   = {1.00,  0.85,  0.35,    0.60,    0.30,  0.45};
    private static final double[] CALL_WET  = {0.60,  1.00,  0.90,    1.00,    0.60,  0.10};
    private static final double[] CALL_DRY  = {0.50,  1.00,  0.85,    0.80,    0.40,  0.05};
    private static final double[] CHECK_WET = {0.30,  0.60,  1.00,    0.70,    0.90,  1.00};
    private static final double[] CHECK_DRY = {0.40,  0.70,  1.00,    0.60,    0.90,  1.00};
    private static final double[] FOLD      = {0.00,  0.00,  0.25,    0.10,    0.80,  1.00};

    /** Extra cut on value hands when the previous aggressor checks back. */
    private static final double AGGRESSOR_CHECK_VALUE_FACTOR = 0.7;

    private final PreflopRangeTable table;

    public RangeEngine(PreflopRangeTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /** Seeds a range from the preflop table for {@code position} and {@code role}. */
    public Range initialize(TablePosition position, RangeRole role) {
        Map<String, Double> freqs = table.frequencies(position, role);
        List<WeightedCombo> combos = new ArrayList<>();
        freqs.forEach((handClass, freq) -> {
            if (freq == null || freq <= 0) return;
            double weight = Math.min(1.0, freq);
            for (HandCombo combo : HandCombo.expand(handClass)) {
                combos.add(new WeightedCombo(combo, weight, null));
            }
        });
        return Range.of(combos);
    }

    /**
     * Short stacks collapse toward push/fold: pairs and big aces stay, speculative hands
     * are cut hard. Deep stacks give small pairs and suited connectors extra weight.
     */
    public Range applyStackFilter(Range range, double effectiveStackBb) {
        if (effectiveStackBb >= SHORT_STACK_BB && effectiveStackBb <= DEEP_STACK_BB) return range;
        boolean shortStack = effectiveStackBb < SHORT_STACK_BB;
        List<WeightedCombo> out = new ArrayList<>();
        for (WeightedCombo wc : range.combos()) {
            double factor = shortStack ? shortStackFactor(wc.combo()) : deepStackFactor(wc.combo());
            double weight = Math.min(1.0, wc.weight() * factor);
            if (weight >= MIN_WEIGHT) out.add(wc.withWeight(weight));
        }
        return withFloor(range, out);
    }

    /**
     * Labels every combo with exactly one bucket for {@code board}. Combos sharing a card
     * with the board are removed.
     */
    public Range categorize(Range range, List<Card> board) {
        List<Card> cards = board == null ? List.of() : board;
        Set<Card> boardSet = new HashSet<>(cards);
        List<WeightedCombo> out = new ArrayList<>();
        for (WeightedCombo wc : range.combos()) {
            if (wc.combo().sharesCardWith(boardSet)) continue;
            out.add(wc.withBucket(HandBucketer.bucket(wc.combo(), cards)));
        }
        return Range.of(out);
    }

    /** Down-weights combos inconsistent with {@code action}. Uncategorized combos count as air. */
    public Range applyActionFilter(Range range, ActionType action, boolean isAggressor, List<Card> board) {
        boolean wet = board != null && board.size() >= 3 && BoardTextureClassifier.isWet(board);
        double[] factors = factorsFor(action, isAggressor, wet);
        List<WeightedCombo> out = new ArrayList<>();
        for (WeightedCombo wc : range.combos()) {
            Bucket bucket = wc.bucket() == null ? Bucket.AIR : wc.bucket();
            double factor = factors[bucket.ordinal()];
            if (action == ActionType.CHECK && isAggressor && bucket.isValue()) {
                factor *= AGGRESSOR_CHECK_VALUE_FACTOR;
            }
            double weight = wc.weight() * factor;
            if (weight >= MIN_WEIGHT) out.add(wc.withWeight(weight));
        }
        return withFloor(range, out);
    }

    /** Card removal: drops every combo containing one of {@code deadCards}. */
    public Range removeCards(Range range, Collection<Card> deadCards) {
        Set<Card> dead = new HashSet<>(deadCards);
        List<WeightedCombo> out = range.combos().stream()
            .filter(wc -> !wc.combo().sharesCardWith(dead))
            .collect(Collectors.toList());
        return Range.of(out);
    }

    public RangeStats stats(Range range) {
        double total = range.totalWeight();
        if (total <= 0) return RangeStats.empty();

        Map<Bucket, Double> weights = new EnumMap<>(Bucket.class);
        for (WeightedCombo wc : range.combos()) {
            if (wc.bucket() != null) weights.merge(wc.bucket(), wc.weight(), Double::sum);
        }
        Map<Bucket, Double> distribution = new EnumMap<>(Bucket.class);
        double assigned = 0.0;
        for (Bucket b : Bucket.values()) {
            if (b == Bucket.AIR) continue;
            double pct = floor1(weights.getOrDefault(b, 0.0) / total * 100.0);
            distribution.put(b, pct);
            assigned += pct;
        }
        distribution.put(Bucket.AIR, round1(Math.max(0.0, 100.0 - assigned)));

        List<String> top = range.combos().stream()
            .sorted(STRONGEST_FIRST)
            .limit(TOP_COMBOS)
            .map(wc -> wc.combo().toString())
            .collect(Collectors.toList());
        int active = (int) range.combos().stream().filter(wc -> wc.weight() > ACTIVE_WEIGHT).count();

        return new RangeStats(round1(total), distribution, top, active);
    }

    /**
     * Percentage of {@code range}'s weight holding a strictly stronger hand than {@code combo} on
     * {@code board}; 0 for the best hand the range can hold. Combos are ordered by bucket, then by
     * made-hand score on a flop or later, then by starting-hand class.
     */
    public double shareAhead(Range range, HandCombo combo, List<Card> board) {
        double total = range.totalWeight();
        if (total <= 0) return 100.0;
        List<Card> cards = board == null ? List.of() : board;
        long target = strength(combo, HandBucketer.bucket(combo, cards), cards);
        double ahead = 0.0;
        for (WeightedCombo wc : range.combos()) {
            Bucket bucket = wc.bucket() == null ? HandBucketer.bucket(wc.combo(), cards) : wc.bucket();
            if (strength(wc.combo(), bucket, cards) > target) ahead += wc.weight();
        }
        return round1(ahead / total * 100.0);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static final Comparator<WeightedCombo> STRONGEST_FIRST = Comparator
        .comparingInt((WeightedCombo wc) -> wc.bucket() == null ? Bucket.values().length : wc.bucket().ordinal())
        .thenComparing(WeightedCombo::weight, Comparator.reverseOrder())
        .thenComparing(wc -> wc.combo().high(), Comparator.reverseOrder())
        .thenComparing(wc -> wc.combo().low(), Comparator.reverseOrder());

    private static long strength(HandCombo combo, Bucket bucket, List<Card> board) {
        long bucketScore = Bucket.values().length - bucket.ordinal();
        int handScore;
        if (board.size() >= 3) {
            List<Card> cards = new ArrayList<>(combo.cards());
            cards.addAll(board);
            handScore = HandRanker.evaluate(cards);
        } else {
            handScore = preflopScore(combo);
        }
        return (bucketScore << 32) | handScore;
    }

    /** Pairs above unpaired hands, then high card, kicker and suitedness. */
    static int preflopScore(HandCombo combo) {
        int high = combo.high().rank().value();
        int low = combo.low().rank().value();
        if (combo.isPair()) return 1000 + high;
        return high * 32 + low * 2 + (combo.isSuited() ? 1 : 0);
    }

    private static double[] factorsFor(ActionType action, boolean isAggressor, boolean wet) {
        return switch (action) {
            case RAISE -> wet ? RAISE_WET : RAISE_DRY;
            case BET -> isAggressor ? (wet ? BET_WET : BET_DRY) : (wet ? RAISE_WET : RAISE_DRY);
            case CALL -> wet ? CALL_WET : CALL_DRY;
            case CHECK -> wet ? CHECK_WET : CHECK_DRY;
            case FOLD -> FOLD;
        };
    }

    private static double shortStackFactor(HandCombo combo) {
        if (combo.isPair()) return combo.high().rank().value() >= Rank.SEVEN.value() ? 1.2 : 0.6;
        if (combo.high().rank() == Rank.ACE) return combo.low().rank().value() >= Rank.TEN.value() ? 1.2 : 0.7;
        if (combo.low().rank().value() >= Rank.TEN.value()) return 0.6;
        return combo.isSuited() ? 0.25 : 0.1;
    }

    private static double deepStackFactor(HandCombo combo) {
        if (combo.isPair() && combo.high().rank().value() <= Rank.EIGHT.value()) return 1.2;
        if (combo.isSuited() && combo.gap() <= 2) return 1.15;
        if (!combo.isSuited() && !combo.isPair() && combo.low().rank().value() < Rank.TEN.value()) return 0.85;
        return 1.0;
    }

    /** Keeps the filtered result, or the top 1% of {@code before} by weight if nothing survived. */
    private static Range withFloor(Range before, List<WeightedCombo> after) {
        if (!after.isEmpty() || before.isEmpty()) return Range.of(after);
        List<WeightedCombo> ranked = before.byWeightDescending();
        int keep = Math.max(1, (int) Math.ceil(ranked.size() * FLOOR_FRACTION));
        return Range.of(ranked.subList(0, keep));
    }

    private static double floor1(double v) {
        return Math.floor(v * 10.0) / 10.0;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
