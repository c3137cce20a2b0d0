package com.netcracker.core.tagsync.model;

import java.util.List;

/**
 * Planned changes of one entity type. Every list is sorted.
 */
public record EntityDiff(List<String> create, List<String> update, List<String> delete) {
    public static final EntityDiff EMPTY = new EntityDiff(List.of(), List.of(), List.of());

    public EntityDiff {
        create = sorted(create);
        update = sorted(update);
        delete = sorted(delete);
    }

    public boolean isEmpty() {
        return create.isEmpty() && update.isEmpty() && delete.isEmpty();
    }

    private static List<String> sorted(List<String> names) {
        return names == null ? List.of() : names.stream().sorted().toList();
    }
}
