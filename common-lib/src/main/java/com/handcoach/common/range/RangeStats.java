package com.handcoach.common.range;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only summary of a {@link Range}: weighted combo count, percentage per bucket and the
 * strongest combos. Air absorbs whatever the other buckets leave, so a non-empty range sums to 100.
 */
public record RangeStats(
    @JsonProperty("total_combos") double totalCombos,
    @JsonProperty("distribution") Map<Bucket, Double> distribution,
    @JsonProperty("top_combos") List<String> topCombos,
    @JsonProperty("active_combos") int activeCombos
) {
    public static RangeStats empty() {
        Map<Bucket, Double> zero = new EnumMap<>(Bucket.class);
        for (Bucket b : Bucket.values()) zero.put(b, 0.0);
        return new RangeStats(0.0, zero, List.of(), 0);
    }

    public double pct(Bucket bucket) {
        return distribution.getOrDefault(bucket, 0.0);
    }

    public double monster() { return pct(Bucket.MONSTER); }

    public double strong() { return pct(Bucket.STRONG); }

    public double marginal() { return pct(Bucket.MARGINAL); }

    /** Monster + strong + marginal: the share of the range with showdown value. */
    public double madeStrength() {
        return monster() + strong() + marginal();
    }
}
