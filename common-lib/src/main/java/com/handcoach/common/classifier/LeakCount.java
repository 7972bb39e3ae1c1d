package com.handcoach.common.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LeakCount(
    @JsonProperty("category") LeakCategory category,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("count") int count,
    @JsonProperty("examples") List<String> examples
) {
    public LeakCount {
        examples = List.copyOf(examples);
    }
}
