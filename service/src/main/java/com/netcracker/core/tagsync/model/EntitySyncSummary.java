package com.netcracker.core.tagsync.model;

import java.util.List;

/**
 * Outcome of a sync run for one entity type. Every list is sorted for stable, diffable output.
 */
public record EntitySyncSummary(List<String> created, List<String> updated, List<String> deleted,
                                List<String> skipped) {
    public static final EntitySyncSummary EMPTY = new EntitySyncSummary(List.of(), List.of(), List.of(), List.of());

    public EntitySyncSummary {
        created = sorted(created);
        updated = sorted(updated);
        deleted = sorted(deleted);
        skipped = sorted(skipped);
    }

    public boolean hasChanges() {
        return !created.isEmpty() || !updated.isEmpty() || !deleted.isEmpty();
    }

    private static List<String> sorted(List<String> names) {
        return names == null ? List.of() : names.stream().sorted().toList();
    }
}
