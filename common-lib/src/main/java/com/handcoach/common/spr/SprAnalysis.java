package com.handcoach.common.spr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SprAnalysis(
    @JsonProperty("effective_stack") double effectiveStack,
    @JsonProperty("snapshots") List<SprSnapshot> snapshots,
    @JsonProperty("current") SprSnapshot current,
    @JsonProperty("future_spr") FutureSpr futureSpr,
    @JsonProperty("stack_committed_pct") double stackCommittedPct,
    @JsonProperty("sizing_advice") String sizingAdvice
) {
    public SprAnalysis {
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
    }

    public static SprAnalysis unavailable(double effectiveStack) {
        return new SprAnalysis(effectiveStack, List.of(), null, null, 0.0, "SPR unavailable");
    }

    public Optional<SprSnapshot> snapshot(Street street) {
        return snapshots.stream().filter(s -> s.street() == street).findFirst();
    }

    public boolean isShoveZone(Street street) {
        return snapshot(street).map(SprSnapshot::isShoveZone).orElse(false);
    }
}
