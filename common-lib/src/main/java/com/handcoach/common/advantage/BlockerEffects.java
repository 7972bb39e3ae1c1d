package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BlockerEffects(
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("flush_blocker") boolean flushBlocker,
    @JsonProperty("nut_flush_blocker") boolean nutFlushBlocker,
    @JsonProperty("impact") BlockerImpact impact
) {
    public BlockerEffects {
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }

    public static BlockerEffects none() {
        return new BlockerEffects(List.of(), false, false, BlockerImpact.NONE);
    }
}
