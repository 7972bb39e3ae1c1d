package com.handcoach.common.advantage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdvantageAnalysis(
    @JsonProperty("streets") Map<Street, StreetAdvantage> streets,
    @JsonProperty("blockers") BlockerEffects blockers,
    @JsonProperty("shifts") List<String> shifts
) {
    public AdvantageAnalysis {
        Map<Street, StreetAdvantage> copy = new EnumMap<>(Street.class);
        if (streets != null) copy.putAll(streets);
        streets = Collections.unmodifiableMap(copy);
        shifts = shifts == null ? List.of() : List.copyOf(shifts);
    }

    public static AdvantageAnalysis even() {
        return new AdvantageAnalysis(Map.of(), BlockerEffects.none(), List.of());
    }

    public Optional<StreetAdvantage> on(Street street) {
        return Optional.ofNullable(streets.get(street));
    }
}
