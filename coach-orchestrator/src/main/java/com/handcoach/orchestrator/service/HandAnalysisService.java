package com.handcoach.orchestrator.service;

import com.handcoach.common.advantage.AdvantageAnalysis;
import com.handcoach.common.advantage.AdvantageEngine;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.board.BoardTextureClassifier;
import com.handcoach.common.card.Card;
import com.handcoach.common.classifier.ClassificationInput;
import com.handcoach.common.classifier.ClassificationSummary;
import com.handcoach.common.classifier.DecisionClassification;
import com.handcoach.common.classifier.DecisionClassifier;
import com.handcoach.common.equity.EquityEstimator;
import com.handcoach.common.equity.EquityResult;
import com.handcoach.common.exception.InvalidHandException;
import com.handcoach.common.model.Action;
import com.handcoach.common.model.HandRecord;
import com.handcoach.common.model.ParsedHand;
import com.handcoach.common.range.RangeAnalysis;
import com.handcoach.common.range.StreetRangeBuilder;
import com.handcoach.common.spr.SprAnalysis;
import com.handcoach.common.spr.SprEngine;
import com.handcoach.common.strategy.DefaultStrategyBuilder;
import com.handcoach.common.strategy.GtoStrategyTree;
import com.handcoach.common.trace.TraceContextUtil;
import com.handcoach.orchestrator.logger.PipelineFlowLogger;
import com.handcoach.orchestrator.narrative.BoardNarrativeRequest;
import com.handcoach.orchestrator.narrative.NarrativeClient;
import com.handcoach.orchestrator.narrative.StrategyRequest;
import com.handcoach.orchestrator.parser.HandRecordParser;
import com.handcoach.orchestrator.pipeline.ComputationGuard;
import com.handcoach.orchestrator.pipeline.Degradation;
import com.handcoach.orchestrator.pipeline.ExternalCallGuard;
import com.handcoach.orchestrator.pipeline.PipelineStep;
import com.handcoach.orchestrator.pipeline.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Five-tier hand analysis pipeline.
 *
 * <ol>
 *   <li>Board narrative (external, template fallback). Skipped when the hand ended preflop.</li>
 *   <li>Ranges and SPR, concurrently.</li>
 *   <li>Equity and advantage, concurrently; both read the tier-2 ranges.</li>
 *   <li>Strategy tree (external, fallback assumes even advantage).</li>
 *   <li>Decision classification and leak summary.</li>
 * </ol>
 *
 * <p>Only {@link InvalidHandException} reaches the caller. Every later failure is replaced by a
 * stage default and recorded as a {@link Degradation} on the report.
 */
@Service
public class HandAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(HandAnalysisService.class);

    static final String BOARD_STAGE = "BoardNarrative";
    static final String RANGE_STAGE = "RangeEngine";
    static final String SPR_STAGE = "SprEngine";
    static final String EQUITY_STAGE = "EquityEstimator";
    static final String ADVANTAGE_STAGE = "AdvantageEngine";
    static final String STRATEGY_STAGE = "StrategyNarrative";
    static final String CLASSIFIER_STAGE = "DecisionClassifier";

    private final HandRecordParser handRecordParser;
    private final NarrativeClient narrativeClient;
    private final StreetRangeBuilder streetRangeBuilder;
    private final EquityEstimator equityEstimator;
    private final ExternalCallGuard externalCallGuard;
    private final ComputationGuard computationGuard;
    private final PipelineFlowLogger pipelineFlowLogger;

    public HandAnalysisService(HandRecordParser handRecordParser,
                               NarrativeClient narrativeClient,
                               StreetRangeBuilder streetRangeBuilder,
                               EquityEstimator equityEstimator,
                               ExternalCallGuard externalCallGuard,
                               ComputationGuard computationGuard,
                               PipelineFlowLogger pipelineFlowLogger) {
        this.handRecordParser = handRecordParser;
        this.narrativeClient = narrativeClient;
        this.streetRangeBuilder = streetRangeBuilder;
        this.equityEstimator = equityEstimator;
        this.externalCallGuard = externalCallGuard;
        this.computationGuard = computationGuard;
        this.pipelineFlowLogger = pipelineFlowLogger;
    }

    public Mono<AnalysisReport> analyze(HandRecord record) {
        String traceId = TraceContextUtil.newTraceId();
        long startNanos = System.nanoTime();

        Mono<AnalysisReport> pipeline = Mono.fromCallable(() -> handRecordParser.parse(record))
            .doOnError(InvalidHandException.class, e -> TraceContextUtil.withMdc(traceId, () ->
                log.warn("[HandAnalysis] Rejected hand. reason={} traceId={}", e.getMessage(), traceId)))
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.HAND_PARSED))
            .map(PipelineState::start)
            .flatMap(this::boardTier)
            .flatMap(this::rangeAndSprTier)
            .flatMap(this::equityAndAdvantageTier)
            .flatMap(this::strategyTier)
            .flatMap(this::classificationTier)
            .map(state -> assemble(state, traceId, startNanos))
            .doOnNext(pipelineFlowLogger::logReport);

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    // ── tiers ────────────────────────────────────────────────────────────────

    private Mono<PipelineState> boardTier(PipelineState state) {
        ParsedHand hand = state.hand();
        if (!hand.heroSawFlop()) {
            return Mono.just(state.withBoard(BoardTexture.notReached())
                .log(PipelineStep.skipped(1, BOARD_STAGE, "hand ended preflop")));
        }
        BoardNarrativeRequest request = BoardNarrativeRequest.from(hand);
        return externalCallGuard.call(BOARD_STAGE,
                () -> narrativeClient.describeBoard(request),
                () -> BoardTextureClassifier.classify(request.board()))
            .map(outcome -> state.withBoard(outcome.value())
                .record(1, BOARD_STAGE, outcome, Degradation.Kind.EXTERNAL_SERVICE))
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.BOARD_NARRATED));
    }

    private Mono<PipelineState> rangeAndSprTier(PipelineState state) {
        ParsedHand hand = state.hand();
        return Mono.zip(
                computationGuard.run(RANGE_STAGE,
                    () -> streetRangeBuilder.build(hand),
                    RangeAnalysis::empty),
                computationGuard.run(SPR_STAGE,
                    () -> SprEngine.computeSpr(hand.potSizes(), hand.stacks()),
                    () -> SprAnalysis.unavailable(hand.stacks().effective())))
            .map(t -> state.withRangesAndSpr(t.getT1().value(), t.getT2().value())
                .record(2, RANGE_STAGE, t.getT1(), Degradation.Kind.COMPUTATION)
                .record(2, SPR_STAGE, t.getT2(), Degradation.Kind.COMPUTATION))
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.RANGES_AND_SPR_COMPUTED));
    }

    private Mono<PipelineState> equityAndAdvantageTier(PipelineState state) {
        ParsedHand hand = state.hand();
        List<Card> board = hand.boardFor(hand.lastStreet());
        double pot = hand.potSizes().latest();
        double bet = betToCall(hand);

        return Mono.zip(
                computationGuard.run(EQUITY_STAGE,
                    () -> equityEstimator.estimate(hand.heroHand(), state.ranges().finalVillainRange(), board, pot, bet),
                    () -> EquityEstimator.heuristic(hand.heroHand(), board, pot, bet, "equity estimator failed")),
                computationGuard.run(ADVANTAGE_STAGE,
                    () -> AdvantageEngine.analyze(hand, state.ranges()),
                    AdvantageAnalysis::even))
            .map(t -> {
                StageOutcome<EquityResult> equity = t.getT1();
                if (!equity.fallbackUsed() && equity.value().degraded()) {
                    equity = StageOutcome.fallback(equity.value(), equity.value().degradationReason());
                }
                return state.withEquityAndAdvantage(equity.value(), t.getT2().value())
                    .record(3, EQUITY_STAGE, equity, Degradation.Kind.COMPUTATION)
                    .record(3, ADVANTAGE_STAGE, t.getT2(), Degradation.Kind.COMPUTATION);
            })
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.EQUITY_AND_ADVANTAGE_COMPUTED));
    }

    private Mono<PipelineState> strategyTier(PipelineState state) {
        ParsedHand hand = state.hand();
        StrategyRequest request = new StrategyRequest(hand, state.boardTexture(), state.ranges(),
                                                      state.spr(), state.equity(), state.advantage());
        return externalCallGuard.call(STRATEGY_STAGE,
                () -> narrativeClient.generateStrategy(request),
                () -> DefaultStrategyBuilder.build(hand.streetsReached(), state.equity()))
            .map(outcome -> state.withStrategy(outcome.value())
                .record(4, STRATEGY_STAGE, outcome, Degradation.Kind.EXTERNAL_SERVICE))
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.STRATEGY_GENERATED));
    }

    private Mono<PipelineState> classificationTier(PipelineState state) {
        ClassificationInput input = new ClassificationInput(state.hand(), state.strategy(), state.spr(),
                                                            state.equity(), state.ranges());
        return computationGuard.run(CLASSIFIER_STAGE,
                () -> {
                    List<DecisionClassification> decisions = DecisionClassifier.classify(input);
                    return new Classification(decisions, DecisionClassifier.summarize(decisions));
                },
                () -> new Classification(List.of(), ClassificationSummary.empty()))
            .map(outcome -> state.withClassification(outcome.value())
                .record(5, CLASSIFIER_STAGE, outcome, Degradation.Kind.COMPUTATION))
            .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.DECISIONS_CLASSIFIED));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    /** Amount hero faces on the last street: the recorded last bet, else villain's last wager there. */
    static double betToCall(ParsedHand hand) {
        if (hand.lastBet() > 0) return hand.lastBet();
        List<Action> actions = hand.actionsOn(hand.lastStreet());
        for (int i = actions.size() - 1; i >= 0; i--) {
            Action a = actions.get(i);
            if (!a.isHero() && a.type().isAggressive()) return a.amountOrZero();
        }
        return 0.0;
    }

    private static AnalysisReport assemble(PipelineState state, String traceId, long startNanos) {
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new AnalysisReport(
            state.hand().handId(),
            traceId,
            Instant.now(),
            latencyMs,
            state.boardTexture(),
            state.ranges().streets(),
            state.equity(),
            state.advantage(),
            state.spr(),
            state.strategy(),
            state.classification().decisions(),
            state.classification().summary(),
            state.degradations(),
            state.steps(),
            !state.degradations().isEmpty());
    }

    private record Classification(List<DecisionClassification> decisions, ClassificationSummary summary) {}

    /** Read-only snapshot handed from tier to tier; each tier returns a new one. */
    private record PipelineState(
        ParsedHand hand,
        BoardTexture boardTexture,
        RangeAnalysis ranges,
        SprAnalysis spr,
        EquityResult equity,
        AdvantageAnalysis advantage,
        GtoStrategyTree strategy,
        Classification classification,
        List<Degradation> degradations,
        List<PipelineStep> steps
    ) {
        static PipelineState start(ParsedHand hand) {
            return new PipelineState(hand, null, null, null, null, null, null, null, List.of(), List.of());
        }

        PipelineState withBoard(BoardTexture board) {
            return new PipelineState(hand, board, ranges, spr, equity, advantage, strategy, classification,
                                     degradations, steps);
        }

        PipelineState withRangesAndSpr(RangeAnalysis r, SprAnalysis s) {
            return new PipelineState(hand, boardTexture, r, s, equity, advantage, strategy, classification,
                                     degradations, steps);
        }

        PipelineState withEquityAndAdvantage(EquityResult e, AdvantageAnalysis a) {
            return new PipelineState(hand, boardTexture, ranges, spr, e, a, strategy, classification,
                                     degradations, steps);
        }

        PipelineState withStrategy(GtoStrategyTree tree) {
            return new PipelineState(hand, boardTexture, ranges, spr, equity, advantage, tree, classification,
                                     degradations, steps);
        }

        PipelineState withClassification(Classification c) {
            return new PipelineState(hand, boardTexture, ranges, spr, equity, advantage, strategy, c,
                                     degradations, steps);
        }

        PipelineState log(PipelineStep step) {
            List<PipelineStep> s = new ArrayList<>(steps);
            s.add(step);
            return new PipelineState(hand, boardTexture, ranges, spr, equity, advantage, strategy, classification,
                                     degradations, List.copyOf(s));
        }

        PipelineState record(int tier, String stage, StageOutcome<?> outcome, Degradation.Kind kind) {
            PipelineState next = log(PipelineStep.of(tier, stage, outcome));
            if (!outcome.fallbackUsed()) return next;
            List<Degradation> d = new ArrayList<>(degradations);
            d.add(new Degradation(stage, kind, outcome.reason()));
            return new PipelineState(hand, boardTexture, ranges, spr, equity, advantage, strategy, classification,
                                     List.copyOf(d), next.steps());
        }
    }
}
