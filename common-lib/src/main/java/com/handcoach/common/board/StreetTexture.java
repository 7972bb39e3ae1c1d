package com.handcoach.common.board;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StreetTexture(
    @JsonProperty("tags") List<String> tags,
    @JsonProperty("description") String description
) {
    public StreetTexture {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
