package com.handcoach.common.strategy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.ActionType;

import java.util.Objects;

/**
 * Recommended play at one decision point. The primary action is always at least as frequent
 * as the alternative; a node built the other way round is swapped on construction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GtoDecisionNode(
    @JsonProperty("primary") GtoAction primary,
    @JsonProperty("alternative") GtoAction alternative,
    @JsonProperty("reasoning") String reasoning
) {
    public GtoDecisionNode {
        Objects.requireNonNull(primary, "primary");
        if (alternative != null && alternative.frequency() > primary.frequency()) {
            GtoAction swap = primary;
            primary = alternative;
            alternative = swap;
        }
    }

    public static GtoDecisionNode of(GtoAction primary, GtoAction alternative, String reasoning) {
        return new GtoDecisionNode(primary, alternative, reasoning);
    }

    /** Alternative action when present and different from the primary. */
    public ActionType distinctAlternative() {
        if (alternative == null || alternative.action() == primary.action()) return null;
        return alternative.action();
    }
}
