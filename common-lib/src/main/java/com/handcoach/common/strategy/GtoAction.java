package com.handcoach.common.strategy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.ActionType;

import java.util.Objects;

/** One action of a mixed strategy with its frequency in [0, 1]. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GtoAction(
    @JsonProperty("action") ActionType action,
    @JsonProperty("frequency") double frequency,
    @JsonProperty("sizing") String sizing
) {
    public GtoAction {
        Objects.requireNonNull(action, "action");
        frequency = Double.isNaN(frequency) ? 0.0 : Math.max(0.0, Math.min(1.0, frequency));
    }

    public static GtoAction of(ActionType action, double frequency) {
        return new GtoAction(action, frequency, null);
    }

    public static GtoAction of(ActionType action, double frequency, String sizing) {
        return new GtoAction(action, frequency, sizing);
    }
}
