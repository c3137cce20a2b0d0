package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;
import lombok.Getter;

@Getter
public class UnresolvedReferenceException extends TagSyncException {
    private final String referencedName;

    public UnresolvedReferenceException(EntityType entityType, String entityName, String referenceKind,
                                        String referencedName) {
        super(entityType, entityName, String.format("%s \"%s\" references missing %s by name: \"%s\"",
                entityType.getTitle(), entityName,
                referenceKind, referencedName));
        this.referencedName = referencedName;
    }
}
