package com.handcoach.common.equity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquityResult(
    @JsonProperty("equity") double equity,
    @JsonProperty("method") EquityMethod method,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("degradation_reason") String degradationReason,
    @JsonProperty("pot_size") double potSize,
    @JsonProperty("bet_to_call") double betToCall,
    @JsonProperty("equity_needed") double equityNeeded,
    @JsonProperty("odds_ratio") String oddsRatio,
    @JsonProperty("profitable") boolean profitable,
    @JsonProperty("recommendation") String recommendation
) {}
