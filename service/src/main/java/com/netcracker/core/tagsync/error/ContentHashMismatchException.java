package com.netcracker.core.tagsync.error;

import com.netcracker.core.tagsync.model.EntityType;
import lombok.Getter;

@Getter
public class ContentHashMismatchException extends TagSyncException {
    private final String expected;
    private final String actual;

    public ContentHashMismatchException(EntityType entityType, String entityName, String expected, String actual) {
        super(entityType, entityName, String.format("%s \"%s\" content hash mismatch (expected=%s, actual=%s).",
                entityType.getTitle(), entityName, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
