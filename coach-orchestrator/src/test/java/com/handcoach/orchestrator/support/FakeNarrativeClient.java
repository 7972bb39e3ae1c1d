package com.handcoach.orchestrator.support;

import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.board.BoardTextureClassifier;
import com.handcoach.common.strategy.GtoStrategyTree;
import com.handcoach.orchestrator.narrative.BoardNarrativeRequest;
import com.handcoach.orchestrator.narrative.NarrativeClient;
import com.handcoach.orchestrator.narrative.StrategyRequest;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Deterministic {@link NarrativeClient}. By default it answers the board call with the template
 * classifier and the strategy call with the tree it was built with; either answer can be replaced.
 */
public class FakeNarrativeClient implements NarrativeClient {

    private Function<BoardNarrativeRequest, Mono<BoardTexture>> board =
        r -> Mono.just(BoardTextureClassifier.classify(r.board()));
    private Function<StrategyRequest, Mono<GtoStrategyTree>> strategy;

    private final AtomicInteger boardCalls = new AtomicInteger();
    private final AtomicInteger strategyCalls = new AtomicInteger();

    public FakeNarrativeClient(GtoStrategyTree tree) {
        this.strategy = r -> Mono.just(tree);
    }

    public FakeNarrativeClient onBoard(Function<BoardNarrativeRequest, Mono<BoardTexture>> answer) {
        this.board = answer;
        return this;
    }

    public FakeNarrativeClient onStrategy(Function<StrategyRequest, Mono<GtoStrategyTree>> answer) {
        this.strategy = answer;
        return this;
    }

    public int boardCalls() {
        return boardCalls.get();
    }

    public int strategyCalls() {
        return strategyCalls.get();
    }

    @Override
    public Mono<BoardTexture> describeBoard(BoardNarrativeRequest request) {
        boardCalls.incrementAndGet();
        return board.apply(request);
    }

    @Override
    public Mono<GtoStrategyTree> generateStrategy(StrategyRequest request) {
        strategyCalls.incrementAndGet();
        return strategy.apply(request);
    }
}
