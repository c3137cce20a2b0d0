package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;
import lombok.Getter;

/**
 * Fatal error of a sync run. Carries the entity type and name involved, where known.
 */
@Getter
public class TagSyncException extends RuntimeException {
    private final EntityType entityType;
    private final String entityName;

    public TagSyncException(EntityType entityType, String entityName, String message) {
        super(message);
        this.entityType = entityType;
        this.entityName = entityName;
    }

    public TagSyncException(EntityType entityType, String entityName, String message, Throwable cause) {
        super(message, cause);
        this.entityType = entityType;
        this.entityName = entityName;
    }
}
