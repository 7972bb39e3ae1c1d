package com.handcoach.orchestrator.narrative;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.board.BoardTextureClassifier;
import com.handcoach.common.equity.EquityEstimator;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.spr.SprEngine;
import com.handcoach.orchestrator.parser.HandRecordParser;
import com.handcoach.orchestrator.support.Hands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NarrativePromptsTest {

    private final ParsedHand hand = new HandRecordParser().parse(Hands.riverHand());

    @Test
    @DisplayName("board prompt lists each dealt street once")
    void boardPrompt() {
        String prompt = NarrativePrompts.boardPrompt(BoardNarrativeRequest.from(hand));

        assertTrue(prompt.contains("Flop: Ks 7d 2c"));
        assertTrue(prompt.contains("Turn: Qh"));
        assertTrue(prompt.contains("River: 3s"));
        assertFalse(prompt.contains("Preflop"));
    }

    @Test
    @DisplayName("strategy prompt carries seats, the hand log and the computed analysis")
    void strategyPrompt() throws Exception {
        StrategyRequest request = new StrategyRequest(hand,
            BoardTextureClassifier.classify(hand.board()),
            null,
            SprEngine.computeSpr(hand.potSizes(), hand.stacks()),
            EquityEstimator.heuristic(hand.heroHand(), hand.board(), 11.5, 8.0, null),
            null);

        String prompt = NarrativePrompts.strategyPrompt(request, new ObjectMapper());

        assertTrue(prompt.contains("Hero: BTN"));
        assertTrue(prompt.contains("Villain: BB"));
        assertTrue(prompt.contains("RIVER:"));
        assertTrue(prompt.contains("villain: bet 8.00"));
        assertTrue(prompt.contains("\"equity_needed\""));
        assertTrue(prompt.endsWith("preflop, flop, turn, river"));
    }
}
