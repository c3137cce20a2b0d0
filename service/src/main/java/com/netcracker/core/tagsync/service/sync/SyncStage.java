package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.model.EntityType;

import java.util.EnumSet;
import java.util.Set;

/**
 * One step of a sync run: applies a single entity type, recording the ids of that type and reading only
 * the id maps of the types listed in {@code resolvesFrom}.
 */
public record SyncStage(EntityType type, Set<EntityType> resolvesFrom) {

    public SyncStage {
        resolvesFrom = resolvesFrom.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(resolvesFrom));
    }

    public static SyncStage of(EntityType type, EntityType... resolvesFrom) {
        return new SyncStage(type, Set.of(resolvesFrom));
    }
}
