package com.assetsync.domain.model;

import com.assetsync.domain.enums.FieldType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Remote field changes staged for one asset, sent in a single update call.
 * Values are already rendered in the remote representation.
 */
public class UpdateBatch {

    private final Map<String, StagedUpdate> updates = new LinkedHashMap<>();

    public void stage(String remoteName, FieldType type, String remoteValue) {
        updates.put(remoteName, new StagedUpdate(type, remoteValue));
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    public int size() {
        return updates.size();
    }

    public Map<String, StagedUpdate> getUpdates() {
        return Collections.unmodifiableMap(updates);
    }

    /** Remote field name to rendered value, in staging order. */
    public Map<String, String> toValueMap() {
        return updates.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey, e -> e.getValue().value(), (a, b) -> b, LinkedHashMap::new));
    }

    @Override
    public String toString() {
        return toValueMap().toString();
    }

    public record StagedUpdate(FieldType type, String value) {}
}
