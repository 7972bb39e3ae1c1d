package com.handcoach.common.model;

import com.handcoach.common.card.Card;
import com.handcoach.common.hand.HandCombo;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A validated hand: typed cards, seats, ordered actions and money. Everything downstream of
 * input parsing works from this value.
 */
public record ParsedHand(
    String handId,
    HandCombo heroHand,
    List<Card> board,
    PositionContext positions,
    List<Action> actions,
    Stacks stacks,
    PotSizes potSizes,
    double bigBlind,
    double lastBet
) {
    public ParsedHand {
        board = List.copyOf(board);
        actions = List.copyOf(actions);
    }

    /** Community cards visible on {@code street}, capped by what was dealt. */
    public List<Card> boardFor(Street street) {
        return board.subList(0, Math.min(street.boardSize(), board.size()));
    }

    public List<Action> actionsOn(Street street) {
        return actions.stream().filter(a -> a.street() == street).collect(Collectors.toList());
    }

    /**
     * Streets the hand actually played out, in order. Preflop always; a later street only when
     * nobody folded earlier and its board cards were dealt.
     */
    public List<Street> streetsReached() {
        List<Street> reached = new ArrayList<>();
        for (Street street : Street.values()) {
            if (street != Street.PREFLOP && board.size() < street.boardSize()) break;
            reached.add(street);
            boolean folded = actionsOn(street).stream().anyMatch(a -> a.type() == ActionType.FOLD);
            if (folded) break;
        }
        return reached;
    }

    public boolean heroSawFlop() {
        return streetsReached().contains(Street.FLOP);
    }

    public Street lastStreet() {
        List<Street> reached = streetsReached();
        return reached.get(reached.size() - 1);
    }

    public double effectiveStackBb() {
        return bigBlind > 0 ? stacks.effective() / bigBlind : stacks.effective();
    }
}
