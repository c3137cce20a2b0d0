package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;

/**
 * A mutation was requested for an entity that lacks the path or id the operation needs.
 */
public class MissingEntityIdentifierException extends TagSyncException {

    public MissingEntityIdentifierException(EntityType entityType, String entityName, String operation) {
        super(entityType, entityName, String.format("Cannot %s %s \"%s\" (missing path/%s).",
                operation, entityType.getDisplayName(), entityName,
                entityType.getIdField() == null ? "id" : entityType.getIdField()));
    }
}
