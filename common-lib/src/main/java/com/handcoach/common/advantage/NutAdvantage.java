package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Which range holds more monster-bucket combos; a side with none is capped. */
public record NutAdvantage(
    @JsonProperty("leader") Leader leader,
    @JsonProperty("hero_monster_pct") double heroMonsterPct,
    @JsonProperty("villain_monster_pct") double villainMonsterPct,
    @JsonProperty("margin") double margin,
    @JsonProperty("hero_capped") boolean heroCapped,
    @JsonProperty("villain_capped") boolean villainCapped,
    @JsonProperty("summary") String summary
) {}
