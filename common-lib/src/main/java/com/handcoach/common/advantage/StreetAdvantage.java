package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreetAdvantage(
    @JsonProperty("street") Street street,
    @JsonProperty("range_advantage") RangeAdvantage rangeAdvantage,
    @JsonProperty("nut_advantage") NutAdvantage nutAdvantage,
    @JsonProperty("hero_spot") HeroSpot heroSpot
) {}
