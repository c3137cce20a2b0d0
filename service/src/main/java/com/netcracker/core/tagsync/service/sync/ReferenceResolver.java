package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.error.ConflictingReferenceException;
import com.netcracker.core.tagsync.error.UnresolvedReferenceException;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;
import com.netcracker.core.tagsync.model.ReferenceField;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces name-based references of a desired entity with the ids known to the current run.
 */
final class ReferenceResolver {

    /**
     * Returns the entity record with every declared name reference turned into its id field.
     *
     * @throws ConflictingReferenceException if both forms of one reference are present
     * @throws UnresolvedReferenceException  if a referenced name has no id in this run
     */
    ObjectNode resolve(SyncStage stage, Entity desired, SyncRunContext context) {
        EntityType type = stage.type();
        ObjectNode out = desired.toJson(type);
        for (ReferenceField reference : type.references()) {
            JsonNode holderNode = reference.container() == null ? out : out.get(reference.container());
            if (!(holderNode instanceof ObjectNode holder)) {
                continue;
            }
            JsonNode names = holder.get(reference.nameField());
            if (names == null) {
                continue;
            }
            if (holder.has(reference.idField())) {
                throw new ConflictingReferenceException(type, desired.getName(),
                        reference.qualifiedIdField(), reference.qualifiedNameField());
            }
            holder.remove(reference.nameField());
            if (!names.isArray()) {
                continue;
            }
            ArrayNode ids = holder.putArray(reference.idField());
            for (JsonNode name : names) {
                if (name.isTextual() && !name.asText().isBlank()) {
                    ids.add(requireId(stage, context, reference.target(), desired.getName(),
                            reference.description(), name.asText()));
                }
            }
        }
        return out;
    }

    /**
     * Resolves names of entities an owner of the stage's type refers to, e.g. the members of a folder.
     */
    List<String> resolveNames(SyncStage stage, SyncRunContext context, EntityType target, String ownerName,
                              String referenceKind, List<String> names) {
        List<String> ids = new ArrayList<>(names.size());
        for (String name : names) {
            if (!Names.isBlank(name)) {
                ids.add(requireId(stage, context, target, ownerName, referenceKind, name));
            }
        }
        return ids;
    }

    private static String requireId(SyncStage stage, SyncRunContext context, EntityType target, String ownerName,
                                    String referenceKind, String name) {
        if (!stage.resolvesFrom().contains(target)) {
            throw new IllegalStateException("Stage " + stage.type().getKey() + " may not resolve ids of "
                    + target.getKey());
        }
        String id = context.idOf(target, name);
        if (id == null) {
            throw new UnresolvedReferenceException(stage.type(), ownerName, referenceKind, name);
        }
        return id;
    }
}
