package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;

/**
 * An entity declares both the id form and the name form of the same reference.
 */
public class ConflictingReferenceException extends TagSyncException {

    public ConflictingReferenceException(EntityType entityType, String entityName, String idField, String nameField) {
        super(entityType, entityName, String.format("%s \"%s\" cannot specify both %s and %s.",
                entityType.getTitle(), entityName, idField, nameField));
    }
}
