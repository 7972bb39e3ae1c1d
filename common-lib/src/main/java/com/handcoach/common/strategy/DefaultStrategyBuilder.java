package com.handcoach.common.strategy;

import com.handcoach.common.equity.EquityResult;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Street;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Strategy tree used when the narrative service cannot produce one.
 *
 * <p>Assumes neither player holds a range advantage, so betting lines are mixed evenly and
 * only facing-a-bet decisions lean on the pot-odds verdict from the equity stage. Every branch
 * of every requested street gets a node, so the classifier never lacks a lookup.
 */
public final class DefaultStrategyBuilder {

    private DefaultStrategyBuilder() {}

    public static GtoStrategyTree build(Collection<Street> streets, EquityResult equity) {
        boolean profitable = equity != null && equity.profitable();
        Map<Street, Map<Branch, GtoDecisionNode>> tree = new EnumMap<>(Street.class);
        for (Street street : streets) {
            tree.put(street, street == Street.PREFLOP ? preflop(profitable) : postflop(profitable));
        }
        return new GtoStrategyTree(tree, "Default strategy assuming even range advantage");
    }

    private static Map<Branch, GtoDecisionNode> preflop(boolean profitable) {
        Map<Branch, GtoDecisionNode> nodes = new EnumMap<>(Branch.class);
        nodes.put(Branch.INITIAL, GtoDecisionNode.of(
            GtoAction.of(ActionType.RAISE, 0.7, "2.5bb"), GtoAction.of(ActionType.FOLD, 0.3),
            "Open raise with a playable hand"));
        nodes.put(Branch.VS_CHECK, GtoDecisionNode.of(
            GtoAction.of(ActionType.CHECK, 0.6), GtoAction.of(ActionType.RAISE, 0.4, "3bb"),
            "Take the free flop, raise for value occasionally"));
        nodes.put(Branch.VS_BET, facingBet(profitable));
        nodes.put(Branch.VS_RAISE, profitable
            ? GtoDecisionNode.of(GtoAction.of(ActionType.CALL, 0.6), GtoAction.of(ActionType.RAISE, 0.4, "3x"),
                                 "Price is good enough to continue")
            : GtoDecisionNode.of(GtoAction.of(ActionType.FOLD, 0.7), GtoAction.of(ActionType.CALL, 0.3),
                                 "Price is too high to continue often"));
        return nodes;
    }

    private static Map<Branch, GtoDecisionNode> postflop(boolean profitable) {
        Map<Branch, GtoDecisionNode> nodes = new EnumMap<>(Branch.class);
        nodes.put(Branch.INITIAL, GtoDecisionNode.of(
            GtoAction.of(ActionType.CHECK, 0.6), GtoAction.of(ActionType.BET, 0.4, "33% pot"),
            "Even ranges: check most of the range, bet small with the rest"));
        nodes.put(Branch.VS_CHECK, GtoDecisionNode.of(
            GtoAction.of(ActionType.BET, 0.55, "50% pot"), GtoAction.of(ActionType.CHECK, 0.45),
            "Stab when checked to, check back showdown value"));
        nodes.put(Branch.VS_BET, facingBet(profitable));
        nodes.put(Branch.VS_RAISE, profitable
            ? GtoDecisionNode.of(GtoAction.of(ActionType.CALL, 0.6), GtoAction.of(ActionType.FOLD, 0.4),
                                 "Enough equity to call the raise")
            : GtoDecisionNode.of(GtoAction.of(ActionType.FOLD, 0.8), GtoAction.of(ActionType.CALL, 0.2),
                                 "Raises are weighted to value; fold without the price"));
        return nodes;
    }

    private static GtoDecisionNode facingBet(boolean profitable) {
        return profitable
            ? GtoDecisionNode.of(GtoAction.of(ActionType.CALL, 0.7), GtoAction.of(ActionType.RAISE, 0.3, "3x"),
                                 "Equity beats the price: continue")
            : GtoDecisionNode.of(GtoAction.of(ActionType.FOLD, 0.7), GtoAction.of(ActionType.CALL, 0.3),
                                 "Equity falls short of the price");
    }
}
