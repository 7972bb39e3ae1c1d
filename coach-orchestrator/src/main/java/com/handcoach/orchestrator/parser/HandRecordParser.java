package com.handcoach.orchestrator.parser;

import com.handcoach.common.card.Card;
import com.handcoach.common.card.Cards;
import com.handcoach.common.exception.InvalidHandException;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.model.Action;
import com.handcoach.common.model.ActionType;
import com.handcoach.common.model.Actor;
import com.handcoach.common.model.HandRecord;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.PositionContext;
import com.handcoach.common.model.PotSizes;
import com.handcoach.common.model.Stacks;
import com.handcoach.common.model.Street;
import com.handcoach.common.model.TablePosition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw {@link HandRecord} into a {@link ParsedHand}, or rejects it.
 *
 * <p>Rejected with {@link InvalidHandException}:
 * <ul>
 *   <li>missing or unknown hero position, or hero and villain in the same seat</li>
 *   <li>hero cards that are not exactly two valid cards</li>
 *   <li>more than five board cards, or a card dealt twice</li>
 *   <li>no actions, an unknown street, actor or action type, a negative amount, or
 *       actions listed out of street order</li>
 *   <li>missing or non-positive stacks</li>
 * </ul>
 */
@Component
public class HandRecordParser {

    static final String ANONYMOUS_HAND = "anonymous";

    public ParsedHand parse(HandRecord record) {
        if (record == null) throw new InvalidHandException("Hand record is empty");

        PositionContext positions = positions(record.positions());
        HandCombo heroHand = heroHand(record.heroCards());
        List<Card> board = board(record.board());

        List<Card> dealt = new ArrayList<>(board);
        dealt.addAll(heroHand.cards());
        if (Cards.hasDuplicates(dealt)) {
            throw new InvalidHandException("Duplicate card between hero cards and board: " + Cards.format(dealt));
        }

        List<Action> actions = actions(record.actions());
        Stacks stacks = stacks(record.stacks());
        PotSizes pots = record.potSizes() == null ? new PotSizes(null, null, null, null) : record.potSizes();
        double bigBlind = record.bigBlind() == null || record.bigBlind() <= 0 ? 1.0 : record.bigBlind();
        double lastBet = record.lastBet() == null || record.lastBet() < 0 ? 0.0 : record.lastBet();
        String handId = record.handId() == null || record.handId().isBlank() ? ANONYMOUS_HAND : record.handId();

        return new ParsedHand(handId, heroHand, board, positions, actions, stacks, pots, bigBlind, lastBet);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static PositionContext positions(HandRecord.Seats seats) {
        if (seats == null) throw new InvalidHandException("Positions are missing");
        TablePosition hero = TablePosition.from(seats.hero());
        if (hero == null) throw new InvalidHandException("Hero position is missing or unknown: " + seats.hero());
        TablePosition villain = TablePosition.from(seats.villain());
        if (villain == null) throw new InvalidHandException("Villain position is missing or unknown: " + seats.villain());
        if (hero == villain) throw new InvalidHandException("Hero and villain cannot share seat " + hero);
        return PositionContext.of(hero, villain);
    }

    private static HandCombo heroHand(String text) {
        List<Card> cards = cards(text, "hero cards");
        if (cards.size() != 2) {
            throw new InvalidHandException("Hero must hold exactly two cards, got " + cards.size());
        }
        if (cards.get(0).equals(cards.get(1))) {
            throw new InvalidHandException("Hero cards are identical: " + cards.get(0));
        }
        return HandCombo.of(cards.get(0), cards.get(1));
    }

    private static List<Card> board(String text) {
        List<Card> board = cards(text, "board");
        if (board.size() > 5) throw new InvalidHandException("Board has " + board.size() + " cards, at most 5 allowed");
        return board;
    }

    private static List<Card> cards(String text, String field) {
        try {
            return Cards.parseList(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidHandException("Unreadable " + field + ": " + e.getMessage(), e);
        }
    }

    private static List<Action> actions(List<HandRecord.RawAction> raw) {
        if (raw == null || raw.isEmpty()) throw new InvalidHandException("Hand has no actions");
        List<Action> actions = new ArrayList<>(raw.size());
        Street previous = Street.PREFLOP;
        for (int i = 0; i < raw.size(); i++) {
            HandRecord.RawAction r = raw.get(i);
            if (r == null) throw new InvalidHandException("Action #" + i + " is empty");
            Street street = Street.from(r.street());
            if (street == null) throw new InvalidHandException("Action #" + i + " has unknown street: " + r.street());
            Actor actor = Actor.from(r.actor());
            if (actor == null) throw new InvalidHandException("Action #" + i + " has unknown actor: " + r.actor());
            ActionType type = ActionType.from(r.type());
            if (type == null) throw new InvalidHandException("Action #" + i + " has unknown type: " + r.type());
            if (r.amount() != null && r.amount() < 0) {
                throw new InvalidHandException("Action #" + i + " has a negative amount: " + r.amount());
            }
            if (street.ordinal() < previous.ordinal()) {
                throw new InvalidHandException("Action #" + i + " on " + street.wireName()
                    + " follows an action on " + previous.wireName());
            }
            previous = street;
            actions.add(new Action(street, actor, type, r.amount()));
        }
        return actions;
    }

    private static Stacks stacks(Stacks stacks) {
        if (stacks == null) throw new InvalidHandException("Stacks are missing");
        if (stacks.hero() <= 0 || stacks.villain() <= 0) {
            throw new InvalidHandException("Stacks must be positive: hero=" + stacks.hero() + " villain=" + stacks.villain());
        }
        return stacks;
    }
}
