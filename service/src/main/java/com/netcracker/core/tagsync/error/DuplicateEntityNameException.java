package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;

public class DuplicateEntityNameException extends TagSyncException {

    public DuplicateEntityNameException(EntityType entityType, String entityName) {
        super(entityType, entityName,
                String.format("Duplicate %s name in desired config: \"%s\"", entityType.getDisplayName(), entityName));
    }
}
