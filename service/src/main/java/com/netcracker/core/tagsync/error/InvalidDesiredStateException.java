package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;

public class InvalidDesiredStateException extends TagSyncException {

    public InvalidDesiredStateException(EntityType entityType, String entityName, String message) {
        super(entityType, entityName, message);
    }
}
