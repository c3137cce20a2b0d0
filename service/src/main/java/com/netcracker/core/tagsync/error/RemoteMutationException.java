package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;
import lombok.Getter;

/**
 * A remote call that changes one entity, or a batch of built-in variables, failed after its retries.
 * The original remote failure is the cause.
 */
@Getter
public class RemoteMutationException extends TagSyncException {
    private final String action;

    public RemoteMutationException(EntityType entityType, String entityName, String action, Throwable cause) {
        super(entityType, entityName, String.format("Failed to %s %s \"%s\": %s",
                action, entityType.getDisplayName(), entityName, cause.getMessage()), cause);
        this.action = action;
    }
}
