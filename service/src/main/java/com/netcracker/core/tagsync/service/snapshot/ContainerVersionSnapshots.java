package com.netcracker.core.tagsync.service.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.WorkspaceSnapshot;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a published container version into a {@link WorkspaceSnapshot}, so a desired state can be
 * diffed against a version instead of a live workspace.
 */
public final class ContainerVersionSnapshots {
    private static final Map<EntityType, String> VERSION_KEYS = Map.of(
            EntityType.TAG, "tag",
            EntityType.TRIGGER, "trigger",
            EntityType.VARIABLE, "variable",
            EntityType.TEMPLATE, "customTemplate",
            EntityType.ZONE, "zone",
            EntityType.FOLDER, "folder",
            EntityType.CLIENT, "client",
            EntityType.TRANSFORMATION, "transformation",
            EntityType.BUILT_IN_VARIABLE, "builtInVariable"
    );

    private ContainerVersionSnapshots() {
    }

    public static WorkspaceSnapshot fromContainerVersion(JsonNode version) {
        if (version == null || !version.isObject()) {
            throw new IllegalArgumentException("Container version must be a JSON object");
        }
        Map<EntityType, List<Entity>> entities = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            // environments belong to the container, a version does not embed them
            String key = VERSION_KEYS.get(type);
            entities.put(type, key == null ? List.of() : WorkspaceSnapshot.parseList(type, version.get(key)));
        }
        return WorkspaceSnapshot.builder().entities(entities).build();
    }
}
