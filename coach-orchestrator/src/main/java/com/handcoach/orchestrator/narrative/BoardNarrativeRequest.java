package com.handcoach.orchestrator.narrative;

import com.handcoach.common.card.Card;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.model.Street;

import java.util.List;

/** Board cards hero actually saw, with the streets they span. */
public record BoardNarrativeRequest(String handId, List<Card> board, List<Street> streets) {

    public BoardNarrativeRequest {
        board = List.copyOf(board);
        streets = List.copyOf(streets);
    }

    public static BoardNarrativeRequest from(ParsedHand hand) {
        List<Street> streets = hand.streetsReached();
        Street last = streets.get(streets.size() - 1);
        return new BoardNarrativeRequest(hand.handId(), hand.boardFor(last), streets);
    }
}
