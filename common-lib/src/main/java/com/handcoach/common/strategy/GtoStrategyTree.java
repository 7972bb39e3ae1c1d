package com.handcoach.common.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recommended strategy for a hand: one {@link GtoDecisionNode} per street and branch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GtoStrategyTree(
    @JsonProperty("streets") Map<Street, Map<Branch, GtoDecisionNode>> streets,
    @JsonProperty("summary") String summary
) {
    public GtoStrategyTree {
        Map<Street, Map<Branch, GtoDecisionNode>> copy = new EnumMap<>(Street.class);
        if (streets != null) {
            streets.forEach((street, nodes) -> {
                if (street == null || nodes == null) return;
                Map<Branch, GtoDecisionNode> inner = new EnumMap<>(Branch.class);
                nodes.forEach((branch, node) -> {
                    if (branch != null && node != null) inner.put(branch, node);
                });
                copy.put(street, Collections.unmodifiableMap(inner));
            });
        }
        streets = Collections.unmodifiableMap(copy);
    }

    public Optional<GtoDecisionNode> node(Street street, Branch branch) {
        Map<Branch, GtoDecisionNode> nodes = streets.get(street);
        return nodes == null ? Optional.empty() : Optional.ofNullable(nodes.get(branch));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return streets.values().stream().allMatch(Map::isEmpty);
    }
}
