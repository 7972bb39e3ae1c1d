package com.handcoach.common.range;

import com.handcoach.common.hand.HandCombo;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable weighted set of starting hands. Every {@link RangeEngine} operation returns a new
 * instance; combos with zero weight are never stored.
 */
public final class Range {

    private static final Range EMPTY = new Range(Map.of());

    private final Map<HandCombo, WeightedCombo> entries;

    private Range(Map<HandCombo, WeightedCombo> entries) {
        this.entries = entries;
    }

    public static Range empty() {
        return EMPTY;
    }

    public static Range of(Collection<WeightedCombo> combos) {
        Map<HandCombo, WeightedCombo> map = new LinkedHashMap<>();
        for (WeightedCombo wc : combos) {
            if (wc.weight() > 0) map.put(wc.combo(), wc);
        }
        return new Range(Collections.unmodifiableMap(map));
    }

    public static Range ofWeights(Map<HandCombo, Double> weights) {
        return of(weights.entrySet().stream()
            .map(e -> new WeightedCombo(e.getKey(), e.getValue(), null))
            .collect(Collectors.toList()));
    }

    public double weight(HandCombo combo) {
        WeightedCombo wc = entries.get(combo);
        return wc == null ? 0.0 : wc.weight();
    }

    public Optional<Bucket> bucket(HandCombo combo) {
        WeightedCombo wc = entries.get(combo);
        return wc == null ? Optional.empty() : Optional.ofNullable(wc.bucket());
    }

    public boolean contains(HandCombo combo) {
        return entries.containsKey(combo);
    }

    public Collection<WeightedCombo> combos() {
        return entries.values();
    }

    public List<WeightedCombo> byWeightDescending() {
        return entries.values().stream()
            .sorted((a, b) -> Double.compare(b.weight(), a.weight()))
            .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public double totalWeight() {
        return entries.values().stream().mapToDouble(WeightedCombo::weight).sum();
    }

    @Override
    public String toString() {
        return "Range{combos=" + entries.size() + ", weight=" + String.format("%.2f", totalWeight()) + "}";
    }
}
