package com.netcracker.core.tagsync.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-type plan computed by the diff engine.
 */
public record WorkspaceDiff(Map<EntityType, EntityDiff> byType) {

    public WorkspaceDiff {
        EnumMap<EntityType, EntityDiff> copy = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            copy.put(type, byType == null ? EntityDiff.EMPTY : byType.getOrDefault(type, EntityDiff.EMPTY));
        }
        byType = Collections.unmodifiableMap(copy);
    }

    public EntityDiff of(EntityType type) {
        return byType.get(type);
    }

    public boolean isEmpty() {
        return byType.values().stream().allMatch(EntityDiff::isEmpty);
    }
}
