package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which range holds more showdown value (monster + strong + marginal).
 *
 * @param margin absolute gap in percentage points
 * @param ratio  leader strength over trailer strength; {@code null} when even or the trailer has none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangeAdvantage(
    @JsonProperty("leader") Leader leader,
    @JsonProperty("hero_strength") double heroStrength,
    @JsonProperty("villain_strength") double villainStrength,
    @JsonProperty("margin") double margin,
    @JsonProperty("ratio") Double ratio,
    @JsonProperty("summary") String summary
) {}
