package com.handcoach.common.range;

import com.handcoach.common.card.Card;
import com.handcoach.common.model.Action;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Actor;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Street;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a hand through the {@link RangeEngine}, one street at a time.
 *
 * <ol>
 *   <li>Preflop roles: whoever raised first opens, the other player flats.</li>
 *   <li>Both ranges pass the stack filter; the villain's loses every combo holding a hero card.</li>
 *   <li>Each street re-categorizes both ranges against the visible board, then applies every
 *       action in order. The opening raise and the flat that answers it are already encoded in
 *       the preflop tables and are not filtered again.</li>
 * </ol>
 */
public final class StreetRangeBuilder {

    private final RangeEngine engine;

    public StreetRangeBuilder(RangeEngine engine) {
        this.engine = engine;
    }

    public RangeAnalysis build(ParsedHand hand) {
        List<Action> preflop = hand.actionsOn(Street.PREFLOP);
        Actor opener = preflop.stream()
            .filter(a -> a.type().isAggressive())
            .map(Action::actor)
            .findFirst()
            .orElse(null);

        RangeRole heroRole = opener == null || opener == Actor.HERO ? RangeRole.OPEN : RangeRole.CALL;
        RangeRole villainRole = opener == null || opener == Actor.VILLAIN ? RangeRole.OPEN : RangeRole.CALL;

        double stackBb = hand.effectiveStackBb();
        Range hero = engine.applyStackFilter(engine.initialize(hand.positions().hero(), heroRole), stackBb);
        Range villain = engine.applyStackFilter(engine.initialize(hand.positions().villain(), villainRole), stackBb);
        villain = engine.removeCards(villain, hand.heroHand().cards());

        Map<Street, StreetRanges> streets = new EnumMap<>(Street.class);
        Actor aggressor = opener;
        int preflopRaises = 0;

        for (Street street : hand.streetsReached()) {
            List<Card> board = hand.boardFor(street);
            hero = engine.categorize(hero, board);
            villain = engine.categorize(villain, board);
            RangeStats heroEntering = engine.stats(hero);
            RangeStats villainEntering = engine.stats(villain);
            double heroShareAhead = engine.shareAhead(hero, hand.heroHand(), board);

            for (Action action : hand.actionsOn(street)) {
                if (street == Street.PREFLOP) {
                    if (action.type().isAggressive()) preflopRaises++;
                    if (isEncodedInTables(action, preflopRaises)) continue;
                }
                boolean isAggressor = action.actor() == aggressor;
                if (action.isHero()) {
                    hero = engine.applyActionFilter(hero, action.type(), isAggressor, board);
                } else {
                    villain = engine.applyActionFilter(villain, action.type(), isAggressor, board);
                }
                if (action.type().isAggressive()) aggressor = action.actor();
            }

            streets.put(street, new StreetRanges(street, heroEntering, villainEntering,
                                                 engine.stats(hero), engine.stats(villain),
                                                 heroShareAhead));
        }
        return new RangeAnalysis(streets, hero, villain);
    }

    private static boolean isEncodedInTables(Action action, int raisesSoFar) {
        return switch (action.type()) {
            case RAISE, BET -> raisesSoFar == 1;
            case CALL, CHECK -> raisesSoFar <= 1;
            case FOLD -> false;
        };
    }
}
