package com.handcoach.orchestrator.pipeline;

import com.handcoach.common.exception.NarrativeServiceException;
import com.handcoach.common.trace.TraceContextUtil;
import com.handcoach.orchestrator.logger.PipelineFlowLogger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single wrapper around every call to the narrative service.
 *
 * <p>Applies a bounded timeout and turns any failure into the stage's fallback value: an error
 * signal, a timeout, an empty result, or an exception thrown while building the call. The
 * returned {@code Mono} therefore always emits exactly one {@link StageOutcome} and never errors.
 * No retries.
 */
@Component
public class ExternalCallGuard {

    private final PipelineFlowLogger pipelineFlowLogger;

    static final long DEFAULT_TIMEOUT_MS = 8000L;

    @Value("${coach.narrative.timeout-ms:" + DEFAULT_TIMEOUT_MS + "}")
    private long timeoutMs = DEFAULT_TIMEOUT_MS;

    public ExternalCallGuard(PipelineFlowLogger pipelineFlowLogger) {
        this.pipelineFlowLogger = pipelineFlowLogger;
    }

    public <T> Mono<StageOutcome<T>> call(String stage, Supplier<Mono<T>> call, Supplier<T> fallback) {
        return Mono.defer(call)
            .timeout(Duration.ofMillis(timeoutMs))
            .map(StageOutcome::success)
            .switchIfEmpty(Mono.error(() -> new NarrativeServiceException(stage, "No result")))
            .onErrorResume(e -> Mono.deferContextual(ctx -> {
                String reason = describe(e);
                pipelineFlowLogger.fallback(stage, reason, TraceContextUtil.getTraceId(ctx));
                return Mono.fromSupplier(() -> StageOutcome.fallback(fallback.get(), reason));
            }));
    }

    static String describe(Throwable e) {
        if (e instanceof TimeoutException) return "timeout";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
