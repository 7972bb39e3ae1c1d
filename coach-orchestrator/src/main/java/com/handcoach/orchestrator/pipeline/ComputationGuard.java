package com.handcoach.orchestrator.pipeline;

import com.handcoach.common.trace.TraceContextUtil;
import com.handcoach.orchestrator.logger.PipelineFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs a deterministic engine off the request thread. An unexpected runtime failure is logged
 * and replaced by the stage's safe default so the remaining tiers still run.
 */
@Component
public class ComputationGuard {

    private static final Logger log = LoggerFactory.getLogger(ComputationGuard.class);

    private final PipelineFlowLogger pipelineFlowLogger;

    public ComputationGuard(PipelineFlowLogger pipelineFlowLogger) {
        this.pipelineFlowLogger = pipelineFlowLogger;
    }

    public <T> Mono<StageOutcome<T>> run(String stage, Callable<T> computation, Supplier<T> fallback) {
        return Mono.fromCallable(computation)
            .subscribeOn(Schedulers.boundedElastic())
            .map(StageOutcome::success)
            .onErrorResume(RuntimeException.class, e -> Mono.deferContextual(ctx -> {
                String traceId = TraceContextUtil.getTraceId(ctx);
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("[ComputationGuard] Stage failed, using default. stage={} traceId={}", stage, traceId, e));
                String reason = ExternalCallGuard.describe(e);
                pipelineFlowLogger.fallback(stage, reason, traceId);
                return Mono.fromSupplier(() -> StageOutcome.fallback(fallback.get(), reason));
            }));
    }
}
