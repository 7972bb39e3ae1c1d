package com.handcoach.orchestrator.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** A stage that delivered a substitute result instead of its real one. */
public record Degradation(
    @JsonProperty("stage") String stage,
    @JsonProperty("kind") Kind kind,
    @JsonProperty("reason") String reason
) {
    public enum Kind {
        EXTERNAL_SERVICE, COMPUTATION;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
