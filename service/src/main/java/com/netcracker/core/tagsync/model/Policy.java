package com.netcracker.core.tagsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deletion policy of a desired state. Immutable for the duration of a sync run.
 */
@Value
@Builder
public class Policy {
    public static final Policy EMPTY = Policy.builder().build();

    /**
     * Per type, names that are never deleted even when absent from the desired state.
     */
    @Singular("protectedName")
    Map<EntityType, Set<String>> protectedNames;

    /**
     * When non-empty, only these types may ever be deleted.
     */
    @Singular
    Set<EntityType> deleteAllowTypes;

    /**
     * Types that are never deleted. Wins over {@link #deleteAllowTypes}.
     */
    @Singular
    Set<EntityType> deleteDenyTypes;

    public boolean isProtected(EntityType type, String name) {
        Set<String> names = protectedNames.get(type);
        if (names == null || names.isEmpty()) {
            return false;
        }
        String key = Names.key(name);
        return names.stream().anyMatch(protectedName -> Names.key(protectedName).equals(key));
    }

    static Policy fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return EMPTY;
        }
        Map<EntityType, Set<String>> protectedNames = new EnumMap<>(EntityType.class);
        JsonNode protectedNode = node.get("protectedNames");
        if (protectedNode != null && protectedNode.isObject()) {
            protectedNode.fields().forEachRemaining(entry -> {
                Set<String> names = new LinkedHashSet<>();
                entry.getValue().forEach(item -> names.add(item.asText()));
                protectedNames.put(EntityType.requireKey(entry.getKey()), names);
            });
        }
        return Policy.builder()
                .protectedNames(protectedNames)
                .deleteAllowTypes(types(node.get("deleteAllowTypes")))
                .deleteDenyTypes(types(node.get("deleteDenyTypes")))
                .build();
    }

    private static Set<EntityType> types(JsonNode node) {
        if (node == null || !node.isArray()) {
            return EnumSet.noneOf(EntityType.class);
        }
        Set<String> keys = new LinkedHashSet<>();
        node.forEach(item -> keys.add(item.asText()));
        return keys.stream()
                .map(EntityType::requireKey)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(EntityType.class)));
    }
}
