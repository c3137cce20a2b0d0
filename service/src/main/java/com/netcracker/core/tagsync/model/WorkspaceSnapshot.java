package com.netcracker.core.tagsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live state of a workspace, read at the start of a sync run and never persisted.
 * Built-in variables are kept as entities carrying their {@code type} field.
 */
@Value
@Builder
public class WorkspaceSnapshot {
    public static final WorkspaceSnapshot EMPTY = WorkspaceSnapshot.builder().build();

    @Builder.Default
    Map<EntityType, List<Entity>> entities = Map.of();

    public List<Entity> entities(EntityType type) {
        return entities.getOrDefault(type, List.of());
    }

    /**
     * Types of the enabled built-in variables, in snapshot order.
     */
    public Set<String> builtInVariableTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (Entity builtIn : entities(EntityType.BUILT_IN_VARIABLE)) {
            JsonNode type = builtIn.field("type");
            if (type != null && type.isTextual() && !type.asText().isBlank()) {
                types.add(type.asText());
            }
        }
        return types;
    }

    /**
     * Maps a snapshot document keyed by {@link EntityType#getKey()}. Built-in variables may be
     * given either as objects with a {@code type} field or as plain type strings.
     */
    public static WorkspaceSnapshot fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Snapshot must be a JSON object");
        }
        Map<EntityType, List<Entity>> entities = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            entities.put(type, parseList(type, root.get(type.getKey())));
        }
        return WorkspaceSnapshot.builder().entities(entities).build();
    }

    /**
     * Parses one entity list; non-object items are ignored except type strings of built-in variables.
     */
    public static List<Entity> parseList(EntityType type, JsonNode list) {
        if (list == null || !list.isArray()) {
            return List.of();
        }
        List<Entity> parsed = new ArrayList<>();
        for (JsonNode item : list) {
            if (item.isTextual() && type == EntityType.BUILT_IN_VARIABLE) {
                parsed.add(Entity.fromJson(type, builtInOfType(item)));
            } else if (item.isObject()) {
                parsed.add(Entity.fromJson(type, item));
            }
        }
        return List.copyOf(parsed);
    }

    private static JsonNode builtInOfType(JsonNode typeNode) {
        return JsonNodeFactory.instance.objectNode()
                .put("type", typeNode.asText());
    }
}
