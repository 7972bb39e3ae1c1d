package com.handcoach.common.classifier;

import com.handcoach.common.equity.EquityResult;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.range.RangeAnalysis;
import com.handcoach.common.spr.SprAnalysis;
import com.handcoach.common.strategy.GtoStrategyTree;

import java.util.Objects;

/** Everything the classifier reads. Only the hand and the tree are mandatory. */
public record ClassificationInput(
    ParsedHand hand,
    GtoStrategyTree strategy,
    SprAnalysis spr,
    EquityResult equity,
    RangeAnalysis ranges
) {
    public ClassificationInput {
        Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(strategy, "strategy");
        if (ranges == null) ranges = RangeAnalysis.empty();
    }
}
