package com.handcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Starting stacks of both players, in chips or big blinds. */
public record Stacks(
    @JsonProperty("hero") double hero,
    @JsonProperty("villain") double villain
) {
    public double effective() {
        return Math.min(hero, villain);
    }
}
