package com.handcoach.orchestrator.narrative;

import com.handcoach.common.advantage.AdvantageAnalysis;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.equity.EquityResult;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.range.RangeAnalysis;
import com.handcoach.common.spr.SprAnalysis;

import java.util.Objects;

/** Everything the strategy generator is told about a hand: tiers one to three, plus the hand. */
public record StrategyRequest(
    ParsedHand hand,
    BoardTexture boardTexture,
    RangeAnalysis ranges,
    SprAnalysis spr,
    EquityResult equity,
    AdvantageAnalysis advantage
) {
    public StrategyRequest {
        Objects.requireNonNull(hand, "hand");
    }
}
