package com.handcoach.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.advantage.AdvantageAnalysis;
import com.handcoach.common.board.BoardTexture;
import com.handcoach.common.classifier.ClassificationSummary;
import com.handcoach.common.classifier.DecisionClassification;
import com.handcoach.common.equity.EquityResult;
import com.handcoach.common.model.Street;
import com.handcoach.common.range.StreetRanges;
import com.handcoach.common.spr.SprAnalysis;
import com.handcoach.common.strategy.GtoStrategyTree;
import com.handcoach.orchestrator.pipeline.Degradation;
import com.handcoach.orchestrator.pipeline.PipelineStep;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the pipeline learned about one hand. {@code degraded} is true when any stage
 * reported a {@link Degradation}.
 */
public record AnalysisReport(
    @JsonProperty("hand_id") String handId,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("analyzed_at") Instant analyzedAt,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("board_summary") BoardTexture boardSummary,
    @JsonProperty("ranges_per_street") Map<Street, StreetRanges> rangesPerStreet,
    @JsonProperty("equity_analysis") EquityResult equityAnalysis,
    @JsonProperty("advantage_analysis") AdvantageAnalysis advantageAnalysis,
    @JsonProperty("spr_analysis") SprAnalysis sprAnalysis,
    @JsonProperty("gto_strategy_tree") GtoStrategyTree gtoStrategyTree,
    @JsonProperty("decision_classifications") List<DecisionClassification> decisionClassifications,
    @JsonProperty("leak_summary") ClassificationSummary leakSummary,
    @JsonProperty("degradations") List<Degradation> degradations,
    @JsonProperty("pipeline_log") List<PipelineStep> pipelineLog,
    @JsonProperty("degraded") boolean degraded
) {}
