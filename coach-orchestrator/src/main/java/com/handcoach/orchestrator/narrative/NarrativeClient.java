package com.handcoach.orchestrator.narrative;

import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.strategy.GtoStrategyTree;
import reactor.core.publisher.Mono;

/**
 * Port to the external text-generation service behind the two narrative tiers.
 *
 * <p>Implementations signal failure through the returned {@code Mono} and never block.
 * Fallbacks are not their concern; the pipeline applies them.
 */
public interface NarrativeClient {

    Mono<BoardTexture> describeBoard(BoardNarrativeRequest request);

    Mono<GtoStrategyTree> generateStrategy(StrategyRequest request);
}
