package com.handcoach.common.classifier;

import com.handcoach.common.model.Action;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Street;
import com.handcoach.common.range.Bucket;
import com.handcoach.common.range.HandBucketer;
import com.handcoach.common.strategy.Branch;
import com.handcoach.common.strategy.GtoDecisionNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compares hero's actual actions with the recommended strategy tree.
 *
 * <h3>Decision points</h3>
 * Every street hero reached is scanned; a fold ends the scan. On each street the first two hero
 * actions are classified. The branch comes from the villain's action since hero last acted:
 * <ul>
 *   <li>none → INITIAL</li>
 *   <li>check or call → VS_CHECK</li>
 *   <li>bet → VS_BET</li>
 *   <li>raise → VS_RAISE</li>
 * </ul>
 * A missing villain action is inferred when it must have happened: hero acting last on the
 * street, or hero acting a second time.
 *
 * <h3>Verdict</h3>
 * Primary action → OPTIMAL; distinct alternative → ACCEPTABLE; anything else → MISTAKE with the
 * first matching {@link LeakCategory}:
 * <ol>
 *   <li>fold with street SPR in the shove zone</li>
 *   <li>fold when equity beat the price</li>
 *   <li>fold of a hand in the top tenth of hero's range</li>
 *   <li>post-flop check on the initial branch with a STRONG or MONSTER hand</li>
 *   <li>post-flop bet or raise with a DRAW_WEAK or AIR hand</li>
 *   <li>otherwise the street's own category</li>
 * </ol>
 */
public final class DecisionClassifier {

    static final double TOP_DECILE_PCT = 10.0;
    static final int MAX_ACTIONS_PER_STREET = 2;

    private DecisionClassifier() {}

    public static List<DecisionClassification> classify(ClassificationInput input) {
        ParsedHand hand = input.hand();
        List<DecisionClassification> out = new ArrayList<>();

        for (Street street : hand.streetsReached()) {
            Bucket heroBucket = HandBucketer.bucket(hand.heroHand(), hand.boardFor(street));
            ActionType previousHero = null;
            Action villainSinceHero = null;
            int heroActions = 0;
            boolean heroFolded = false;

            for (Action action : hand.actionsOn(street)) {
                if (!action.isHero()) {
                    villainSinceHero = action;
                    continue;
                }
                if (heroActions >= MAX_ACTIONS_PER_STREET) break;

                Branch branch = resolveBranch(villainSinceHero, previousHero, action.type(),
                                              hand.positions().heroActsLast(street));
                input.strategy().node(street, branch)
                    .map(node -> judge(street, branch, action.type(), node, heroBucket, input))
                    .ifPresent(out::add);

                heroActions++;
                previousHero = action.type();
                villainSinceHero = null;
                if (action.type() == ActionType.FOLD) {
                    heroFolded = true;
                    break;
                }
            }
            if (heroFolded) break;
        }
        return out;
    }

    /**
     * Branch for a hero action.
     *
     * @param villain      villain's last action since hero last acted, or {@code null}
     * @param previousHero hero's previous action on the street, or {@code null} for the first
     * @param heroAction   the action being classified
     * @param heroActsLast whether hero closes the action on this street
     */
    static Branch resolveBranch(Action villain, ActionType previousHero, ActionType heroAction,
                                boolean heroActsLast) {
        if (villain != null) {
            return switch (villain.type()) {
                case CHECK, CALL -> Branch.VS_CHECK;
                case BET -> Branch.VS_BET;
                case RAISE -> Branch.VS_RAISE;
                case FOLD -> Branch.INITIAL;
            };
        }
        if (previousHero != null) {
            return previousHero.isAggressive() ? Branch.VS_RAISE : Branch.VS_BET;
        }
        if (heroActsLast) {
            return heroAction == ActionType.CHECK || heroAction == ActionType.BET
                ? Branch.VS_CHECK : Branch.VS_BET;
        }
        return Branch.INITIAL;
    }

    static DecisionClassification judge(Street street, Branch branch, ActionType heroAction,
                                        GtoDecisionNode node, Bucket heroBucket,
                                        ClassificationInput input) {
        Verdict verdict;
        LeakCategory leak = null;
        if (heroAction == node.primary().action()) {
            verdict = Verdict.OPTIMAL;
        } else if (heroAction == node.distinctAlternative()) {
            verdict = Verdict.ACCEPTABLE;
        } else {
            verdict = Verdict.MISTAKE;
            leak = leakFor(street, branch, heroAction, heroBucket, input);
        }
        return new DecisionClassification(street, branch, heroAction, node.primary(),
                                          node.alternative(), verdict, leak);
    }

    static LeakCategory leakFor(Street street, Branch branch, ActionType heroAction,
                                Bucket heroBucket, ClassificationInput input) {
        if (heroAction == ActionType.FOLD) {
            if (input.spr() != null && input.spr().isShoveZone(street)) return LeakCategory.SPR_AWARENESS;
            if (input.equity() != null && input.equity().profitable()) return LeakCategory.EQUITY_MISCALCULATION;
            if (isTopDecile(street, input)) return LeakCategory.RANGE_AWARENESS;
        }
        if (street != Street.PREFLOP) {
            if (heroAction == ActionType.CHECK && branch == Branch.INITIAL && heroBucket.isValue()) {
                return LeakCategory.POSTFLOP_VALUE;
            }
            if (heroAction.isAggressive() && heroBucket.isWeak()) return LeakCategory.POSTFLOP_BLUFF;
        }
        return LeakCategory.forStreet(street);
    }

    private static boolean isTopDecile(Street street, ClassificationInput input) {
        return input.ranges().on(street)
            .filter(r -> r.hero().totalCombos() > 0)
            .map(r -> r.heroHandShareAhead() < TOP_DECILE_PCT)
            .orElse(false);
    }

    // ── aggregation ──────────────────────────────────────────────────────────

    public static ClassificationSummary summarize(List<DecisionClassification> decisions) {
        if (decisions == null || decisions.isEmpty()) return ClassificationSummary.empty();

        Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
        Map<LeakCategory, List<String>> examples = new EnumMap<>(LeakCategory.class);
        for (DecisionClassification d : decisions) {
            counts.merge(d.verdict(), 1, Integer::sum);
            if (d.isMistake() && d.leakCategory() != null) {
                examples.computeIfAbsent(d.leakCategory(), k -> new ArrayList<>()).add(d.example());
            }
        }

        List<LeakCount> leaks = new ArrayList<>();
        examples.forEach((category, list) ->
            leaks.add(new LeakCount(category, category.displayName(), list.size(), list)));
        // EnumMap iteration is priority order; a stable sort keeps it for equal counts
        leaks.sort(Comparator.comparingInt(LeakCount::count).reversed());

        String worst = leaks.isEmpty() ? null : worstLeakText(leaks.get(0));
        return new ClassificationSummary(
            decisions.size(),
            counts.getOrDefault(Verdict.OPTIMAL, 0),
            counts.getOrDefault(Verdict.ACCEPTABLE, 0),
            counts.getOrDefault(Verdict.MISTAKE, 0),
            leaks,
            worst);
    }

    private static String worstLeakText(LeakCount leak) {
        return leak.displayName() + " (" + leak.count() + " mistake" + (leak.count() > 1 ? "s" : "") + ")";
    }
}
