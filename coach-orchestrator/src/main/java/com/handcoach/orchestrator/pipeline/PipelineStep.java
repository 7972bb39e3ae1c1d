package com.handcoach.orchestrator.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** One line of the report's pipeline log. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineStep(
    @JsonProperty("tier") int tier,
    @JsonProperty("stage") String stage,
    @JsonProperty("status") Status status,
    @JsonProperty("detail") String detail
) {
    public enum Status {
        OK, FALLBACK, SKIPPED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static PipelineStep of(int tier, String stage, StageOutcome<?> outcome) {
        return outcome.fallbackUsed()
            ? new PipelineStep(tier, stage, Status.FALLBACK, outcome.reason())
            : new PipelineStep(tier, stage, Status.OK, null);
    }

    public static PipelineStep skipped(int tier, String stage, String detail) {
        return new PipelineStep(tier, stage, Status.SKIPPED, detail);
    }
}
