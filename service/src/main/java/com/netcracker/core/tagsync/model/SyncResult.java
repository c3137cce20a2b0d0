package com.netcracker.core.tagsync.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of a sync run: a summary for every entity type plus sorted non-fatal warnings.
 */
public record SyncResult(String workspacePath, Map<EntityType, EntitySyncSummary> summaries, List<String> warnings) {

    public SyncResult {
        EnumMap<EntityType, EntitySyncSummary> copy = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            copy.put(type, summaries == null ? EntitySyncSummary.EMPTY
                    : summaries.getOrDefault(type, EntitySyncSummary.EMPTY));
        }
        summaries = Collections.unmodifiableMap(copy);
        warnings = warnings == null ? List.of() : warnings.stream().sorted().toList();
    }

    public EntitySyncSummary of(EntityType type) {
        return summaries.get(type);
    }

    public boolean hasChanges() {
        return summaries.values().stream().anyMatch(EntitySyncSummary::hasChanges);
    }
}
