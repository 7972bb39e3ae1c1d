package com.handcoach.common.range;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handcoach.common.hand.HandCombo;
import com.handcoach.common.model.TablePosition;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-position preflop frequencies, keyed by hand class ({@code "AKs"} → 1.0).
 *
 * <p>Loaded once from JSON at startup and never mutated afterwards. The file carries an
 * {@code open} table (raise first in), a {@code call} table (flat an open), seat aliases
 * for seats that share a table, and a default seat per table for seats it does not list.
 */
public final class PreflopRangeTable {

    public static final String DEFAULT_RESOURCE = "preflop-ranges.json";

    private final Map<String, String> aliases;
    private final Map<RangeRole, String> defaults;
    private final Map<RangeRole, Map<String, Map<String, Double>>> tables;

    private PreflopRangeTable(Map<String, String> aliases,
                              Map<RangeRole, String> defaults,
                              Map<RangeRole, Map<String, Map<String, Double>>> tables) {
        this.aliases = aliases;
        this.defaults = defaults;
        this.tables = tables;
    }

    public static PreflopRangeTable load(ObjectMapper mapper, InputStream in) throws IOException {
        TableFile file = mapper.readValue(in, TableFile.class);
        if (file.open() == null || file.open().isEmpty() || file.call() == null || file.call().isEmpty()) {
            throw new IOException("Range table must define non-empty 'open' and 'call' sections");
        }
        Map<RangeRole, Map<String, Map<String, Double>>> tables = new EnumMap<>(RangeRole.class);
        tables.put(RangeRole.OPEN, freeze(file.open()));
        tables.put(RangeRole.CALL, freeze(file.call()));
        for (Map<String, Map<String, Double>> byPosition : tables.values()) {
            byPosition.values().forEach(freqs -> freqs.keySet().forEach(HandCombo::expand));
        }

        Map<RangeRole, String> defaults = new EnumMap<>(RangeRole.class);
        Map<String, String> rawDefaults = file.defaults() == null ? Map.of() : file.defaults();
        defaults.put(RangeRole.OPEN, rawDefaults.getOrDefault("open", "BTN"));
        defaults.put(RangeRole.CALL, rawDefaults.getOrDefault("call", "BB"));

        Map<String, String> aliases = file.aliases() == null ? Map.of() : Map.copyOf(file.aliases());
        return new PreflopRangeTable(aliases, Collections.unmodifiableMap(defaults),
                                     Collections.unmodifiableMap(tables));
    }

    /** Loads {@value #DEFAULT_RESOURCE} (or another classpath resource). */
    public static PreflopRangeTable fromClasspath(ObjectMapper mapper, String resource) {
        String path = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream in = PreflopRangeTable.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Range table resource not found: " + path);
            return load(mapper, in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load preflop range table " + path, e);
        }
    }

    /**
     * Frequencies for a seat and role. Unknown or unlisted seats resolve to the role's default seat.
     */
    public Map<String, Double> frequencies(TablePosition position, RangeRole role) {
        Map<String, Map<String, Double>> table = tables.get(role);
        String key = position == null ? defaults.get(role) : position.name();
        key = aliases.getOrDefault(key, key);
        Map<String, Double> freqs = table.get(key);
        return freqs != null ? freqs : table.get(defaults.get(role));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static Map<String, Map<String, Double>> freeze(Map<String, Map<String, Double>> raw) {
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        raw.forEach((position, freqs) ->
            out.put(position.toUpperCase(Locale.ROOT), Collections.unmodifiableMap(new LinkedHashMap<>(freqs))));
        return Collections.unmodifiableMap(out);
    }

    record TableFile(
        @JsonProperty("aliases") Map<String, String> aliases,
        @JsonProperty("defaults") Map<String, String> defaults,
        @JsonProperty("open") Map<String, Map<String, Double>> open,
        @JsonProperty("call") Map<String, Map<String, Double>> call
    ) {}
}
