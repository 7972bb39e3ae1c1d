package com.handcoach.orchestrator.logger;

import com.handcoach.common.trace.TraceContextUtil;
import com.handcoach.orchestrator.service.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for one hand's trip through the analysis pipeline. Pure side effects; nothing
 * here changes what the pipeline computes.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #HAND_PARSED}                  : raw record validated</li>
 *   <li>{@link #BOARD_NARRATED}               : tier 1 produced a board texture</li>
 *   <li>{@link #RANGES_AND_SPR_COMPUTED}      : tier 2 joined</li>
 *   <li>{@link #EQUITY_AND_ADVANTAGE_COMPUTED}: tier 3 joined</li>
 *   <li>{@link #STRATEGY_GENERATED}           : tier 4 produced a strategy tree</li>
 *   <li>{@link #DECISIONS_CLASSIFIED}         : tier 5 judged hero's actions</li>
 *   <li>{@link #REPORT_ASSEMBLED}             : report handed back to the caller</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (traceId read from the Reactor Context):
 * <pre>
 *     .doOnEach(pipelineFlowLogger.stage(PipelineFlowLogger.HAND_PARSED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String HAND_PARSED                   = "HAND_PARSED";
    public static final String BOARD_NARRATED                = "BOARD_NARRATED";
    public static final String RANGES_AND_SPR_COMPUTED       = "RANGES_AND_SPR_COMPUTED";
    public static final String EQUITY_AND_ADVANTAGE_COMPUTED = "EQUITY_AND_ADVANTAGE_COMPUTED";
    public static final String STRATEGY_GENERATED            = "STRATEGY_GENERATED";
    public static final String DECISIONS_CLASSIFIED          = "DECISIONS_CLASSIFIED";
    public static final String REPORT_ASSEMBLED              = "REPORT_ASSEMBLED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on the next signal.
     * Errors and completion are ignored; the traceId is bridged into MDC only for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            logWithTraceId(stageName, traceId);
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** Logs a stage that gave up on its primary path and used its fallback value. */
    public void fallback(String stageName, String reason, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[PipelineFlow] stage={} fallback=true reason={} traceId={}", stageName, reason, traceId)
        );
    }

    public void logReport(AnalysisReport report) {
        TraceContextUtil.withMdc(report.traceId(), () ->
            log.info("[PipelineFlow] stage={} handId={} decisions={} mistakes={} degraded={} latencyMs={} traceId={}",
                     REPORT_ASSEMBLED,
                     report.handId(),
                     report.decisionClassifications().size(),
                     report.leakSummary().mistakes(),
                     report.degraded(),
                     report.latencyMs(),
                     report.traceId())
        );
    }
}
