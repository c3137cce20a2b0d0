package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.model.DesiredState;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntitySyncSummary;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;
import com.netcracker.core.tagsync.model.SyncOptions;
import com.netcracker.core.tagsync.model.SyncResult;
import com.netcracker.core.tagsync.model.WorkspaceSnapshot;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one sync run: name to id maps per entity type, the outcome per type and the
 * warnings collected so far. Created per run and discarded with it.
 */
@Getter
final class SyncRunContext {
    private static final String PLANNED_ID_PREFIX = "planned:";

    private final String workspacePath;
    private final DesiredState desired;
    private final WorkspaceSnapshot snapshot;
    private final SyncOptions options;

    @Getter(AccessLevel.NONE)
    private final Map<EntityType, Map<String, String>> ids = new EnumMap<>(EntityType.class);
    @Getter(AccessLevel.NONE)
    private final Map<EntityType, Outcome> outcomes = new EnumMap<>(EntityType.class);
    @Getter(AccessLevel.NONE)
    private final List<String> warnings = new ArrayList<>();

    SyncRunContext(String workspacePath, DesiredState desired, WorkspaceSnapshot snapshot, SyncOptions options) {
        this.workspacePath = workspacePath;
        this.desired = desired;
        this.snapshot = snapshot;
        this.options = options;
        for (EntityType type : EntityType.values()) {
            for (Entity entity : snapshot.entities(type)) {
                if (!Names.isBlank(entity.getName()) && !Names.isBlank(entity.getId())) {
                    recordId(type, entity.getName(), entity.getId());
                }
            }
        }
    }

    String idOf(EntityType type, String name) {
        return ids.getOrDefault(type, Map.of()).get(Names.key(name));
    }

    void recordId(EntityType type, String name, String id) {
        ids.computeIfAbsent(type, t -> new HashMap<>()).put(Names.key(name), id);
    }

    /**
     * Records a stand-in id for an entity that a dry run would have created, so that later stages can
     * still resolve references to it.
     */
    void recordPlannedId(EntityType type, String name) {
        recordId(type, name, PLANNED_ID_PREFIX + type.getKey() + "/" + Names.key(name));
    }

    void created(EntityType type, String name) {
        outcome(type).created.add(name);
    }

    void updated(EntityType type, String name) {
        outcome(type).updated.add(name);
    }

    void deleted(EntityType type, String name) {
        outcome(type).deleted.add(name);
    }

    void skipped(EntityType type, String name) {
        outcome(type).skipped.add(name);
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    EntitySyncSummary summary(EntityType type) {
        Outcome outcome = outcome(type);
        return new EntitySyncSummary(outcome.created, outcome.updated, outcome.deleted, outcome.skipped);
    }

    SyncResult toResult() {
        Map<EntityType, EntitySyncSummary> summaries = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            summaries.put(type, summary(type));
        }
        return new SyncResult(workspacePath, summaries, warnings);
    }

    private Outcome outcome(EntityType type) {
        return outcomes.computeIfAbsent(type, t -> new Outcome());
    }

    private static final class Outcome {
        private final List<String> created = new ArrayList<>();
        private final List<String> updated = new ArrayList<>();
        private final List<String> deleted = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
    }
}
