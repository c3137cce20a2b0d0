package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.error.DuplicateEntityNameException;
import com.netcracker.core.tagsync.error.InvalidDesiredStateException;
import com.netcracker.core.tagsync.model.DesiredState;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks a desired state before any remote call: every entity has a name and names are unique per type
 * under case-insensitive, trimmed comparison.
 */
final class DesiredStateValidator {

    private DesiredStateValidator() {
    }

    static void validate(DesiredState desired) {
        for (EntityType type : EntityType.values()) {
            Set<String> seen = new HashSet<>();
            for (Entity entity : desired.entities(type)) {
                if (Names.isBlank(entity.getName())) {
                    throw new InvalidDesiredStateException(type, entity.getName(),
                            "Desired " + type.getDisplayName() + " missing a valid name.");
                }
                if (!seen.add(entity.nameKey())) {
                    throw new DuplicateEntityNameException(type, entity.getName());
                }
            }
        }
    }
}
