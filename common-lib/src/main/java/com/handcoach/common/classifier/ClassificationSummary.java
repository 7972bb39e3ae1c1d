package com.handcoach.common.classifier;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Aggregate of a hand's classifications: verdict counts and leaks, most frequent first. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationSummary(
    @JsonProperty("total_decisions") int totalDecisions,
    @JsonProperty("optimal") int optimal,
    @JsonProperty("acceptable") int acceptable,
    @JsonProperty("mistakes") int mistakes,
    @JsonProperty("leaks") List<LeakCount> leaks,
    @JsonProperty("worst_leak") String worstLeak
) {
    public ClassificationSummary {
        leaks = List.copyOf(leaks);
    }

    public static ClassificationSummary empty() {
        return new ClassificationSummary(0, 0, 0, 0, List.of(), null);
    }
}
