package com.netcracker.core.tagsync.service.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.tagsync.model.DesiredState;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityDiff;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;
import com.netcracker.core.tagsync.model.WorkspaceDiff;
import com.netcracker.core.tagsync.model.WorkspaceSnapshot;
import com.netcracker.core.tagsync.service.normalize.EntityNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the create/update/delete plan between a desired state and a snapshot. Performs no I/O.
 * <p>
 * Entities are matched by case-insensitive name. A matched pair is an update when the normalized
 * current entity does not {@link SubsetMatcher#matches subset-match} the normalized desired one.
 * Name-based references cannot be resolved without ids and are left out of the comparison.
 * Delete names are reported in their normalized (lower-case) form.
 */
@ApplicationScoped
@Slf4j
public class WorkspaceDiffEngine {

    public WorkspaceDiff diff(DesiredState desired, WorkspaceSnapshot current) {
        Map<EntityType, EntityDiff> byType = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            EntityDiff diff = type == EntityType.BUILT_IN_VARIABLE
                    ? diffStringSet(desired.getBuiltInVariableTypes(), current.builtInVariableTypes())
                    : diffByName(type, desired.entities(type), current.entities(type));
            byType.put(type, diff);
            if (!diff.isEmpty()) {
                log.debug("Diff for {}: create={}, update={}, delete={}",
                        type.getKey(), diff.create(), diff.update(), diff.delete());
            }
        }
        return new WorkspaceDiff(byType);
    }

    public EntityDiff diffByName(EntityType type, List<Entity> desired, List<Entity> current) {
        Map<String, JsonNode> currentByName = new LinkedHashMap<>();
        for (Entity entity : current) {
            if (Names.isBlank(entity.getName())) {
                continue;
            }
            currentByName.put(entity.nameKey(), EntityNormalizer.normalize(entity.toJson(type)));
        }

        Set<String> desiredNames = new HashSet<>();
        List<String> create = new ArrayList<>();
        List<String> update = new ArrayList<>();
        for (Entity entity : desired) {
            desiredNames.add(entity.nameKey());
            JsonNode existing = currentByName.get(entity.nameKey());
            if (existing == null) {
                create.add(entity.getName());
            } else if (!SubsetMatcher.matches(existing, EntityNormalizer.normalize(entity.toApiJson(type)))) {
                update.add(entity.getName());
            }
        }

        List<String> delete = currentByName.keySet().stream()
                .filter(name -> !desiredNames.contains(name))
                .toList();
        return new EntityDiff(create, update, delete);
    }

    public EntityDiff diffStringSet(Collection<String> desired, Collection<String> current) {
        Map<String, String> desiredByKey = byKey(desired);
        Map<String, String> currentByKey = byKey(current);

        List<String> create = desiredByKey.entrySet().stream()
                .filter(entry -> !currentByKey.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
        List<String> delete = currentByKey.entrySet().stream()
                .filter(entry -> !desiredByKey.containsKey(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
        return new EntityDiff(create, List.of(), delete);
    }

    private static Map<String, String> byKey(Collection<String> values) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String value : values) {
            if (!Names.isBlank(value)) {
                out.put(Names.key(value), value.trim());
            }
        }
        return out;
    }
}
