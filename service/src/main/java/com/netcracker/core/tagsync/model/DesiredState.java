package com.netcracker.core.tagsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared target configuration of one workspace, as supplied by the config source.
 */
@Value
@Builder
public class DesiredState {
    String workspaceName;

    @Builder.Default
    Policy policy = Policy.EMPTY;

    @Builder.Default
    Map<EntityType, List<Entity>> entities = Map.of();

    /**
     * Built-in variable types to keep enabled. Plain identifiers, not entities.
     */
    @Singular
    Set<String> builtInVariableTypes;

    public List<Entity> entities(EntityType type) {
        return entities.getOrDefault(type, List.of());
    }

    /**
     * Maps an already merged and validated desired-state document. Entity lists are keyed by
     * {@link EntityType#getKey()}; built-in variables are given as {@code builtInVariableTypes}.
     */
    public static DesiredState fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Desired state must be a JSON object");
        }
        Map<EntityType, List<Entity>> entities = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            if (type == EntityType.BUILT_IN_VARIABLE) {
                continue;
            }
            JsonNode list = root.get(type.getKey());
            if (list != null && list.isArray()) {
                List<Entity> parsed = new ArrayList<>();
                list.forEach(item -> parsed.add(Entity.fromJson(type, item)));
                entities.put(type, List.copyOf(parsed));
            }
        }
        Set<String> builtIns = new LinkedHashSet<>();
        JsonNode builtInNode = root.get("builtInVariableTypes");
        if (builtInNode != null && builtInNode.isArray()) {
            builtInNode.forEach(item -> builtIns.add(item.asText()));
        }
        JsonNode workspaceName = root.get("workspaceName");
        return DesiredState.builder()
                .workspaceName(workspaceName == null ? null : workspaceName.asText())
                .policy(Policy.fromJson(root.get("policy")))
                .entities(entities)
                .builtInVariableTypes(builtIns)
                .build();
    }
}
