package com.example.presence.tracker.alias;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable raw id to canonical id table. Unmapped ids are their own canonical id.
 */
public final class AliasMapping {

    private static final AliasMapping EMPTY = new AliasMapping(Map.of(), Map.of());

    private final Map<String, String> canonicalByRawId;
    private final Map<String, String> labelByCanonicalId;

    AliasMapping(Map<String, String> canonicalByRawId, Map<String, String> labelByCanonicalId) {
        this.canonicalByRawId = Map.copyOf(canonicalByRawId);
        this.labelByCanonicalId = Map.copyOf(labelByCanonicalId);
    }

    public static AliasMapping empty() {
        return EMPTY;
    }

    public String canonicalOf(String rawId) {
        return canonicalByRawId.getOrDefault(rawId, rawId);
    }

    public Optional<String> labelOf(String canonicalId) {
        return Optional.ofNullable(labelByCanonicalId.get(canonicalId));
    }

    public int size() {
        return canonicalByRawId.size();
    }

    @Override
    public String toString() {
        return "AliasMapping" + canonicalByRawId;
    }
}
