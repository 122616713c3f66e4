package com.baton.core.marker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One parsed structured block: a type plus ordered fields.
 * <p>
 * A field keeps its raw entries: the inline value after {@code key:} and each
 * following {@code - item} line. Field keys are normalised to lower-case with
 * hyphens ("Next action" becomes {@code next-action}).
 */
public record MarkerBlock(MarkerType type, Map<String, List<String>> fields) {

    private static final List<String> EMPTY_VALUES = List.of("none", "-", "n/a");

    public MarkerBlock {
        var copy = new LinkedHashMap<String, List<String>>();
        fields.forEach((k, v) -> copy.put(normalizeKey(k), List.copyOf(v)));
        fields = java.util.Collections.unmodifiableMap(copy);
    }

    /** Field key is present, whatever its value. */
    public boolean has(String key) {
        return fields.containsKey(normalizeKey(key));
    }

    /** Field joined into a single trimmed string; empty when absent. */
    public String text(String key) {
        List<String> raw = fields.get(normalizeKey(key));
        if (raw == null) return "";
        return String.join("\n", raw.stream().map(String::trim).filter(s -> !s.isEmpty()).toList()).trim();
    }

    /**
     * Field as a list: each raw entry is split on commas, trimmed, and
     * placeholder values such as "none" are dropped.
     */
    public List<String> list(String key) {
        List<String> raw = fields.get(normalizeKey(key));
        if (raw == null) return List.of();
        var items = new ArrayList<String>();
        for (String entry : raw) {
            for (String part : entry.split(",")) {
                String item = part.trim();
                if (!item.isEmpty() && !EMPTY_VALUES.contains(item.toLowerCase(Locale.ROOT))) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    public static Builder builder(MarkerType type) {
        return new Builder(type);
    }

    static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
    }

    public static final class Builder {
        private final MarkerType type;
        private final Map<String, List<String>> fields = new LinkedHashMap<>();

        private Builder(MarkerType type) {
            this.type = type;
        }

        public Builder field(String key, String value) {
            fields.put(key, value == null ? List.of() : List.of(value));
            return this;
        }

        public Builder field(String key, Object value) {
            return field(key, value == null ? null : String.valueOf(value));
        }

        public Builder items(String key, Collection<String> values) {
            fields.put(key, values == null || values.isEmpty() ? List.of("none") : new ArrayList<>(values));
            return this;
        }

        public Builder items(String key, String... values) {
            return items(key, Arrays.asList(values));
        }

        public MarkerBlock build() {
            return new MarkerBlock(type, fields);
        }
    }
}
