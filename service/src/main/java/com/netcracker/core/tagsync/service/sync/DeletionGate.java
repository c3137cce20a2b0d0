package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Policy;

/**
 * Decides whether a current entity that is absent from the desired state may be deleted.
 * <p>
 * Checks run in a fixed order: the deny list, then the allow list (only when non-empty), then the
 * protected names of the type.
 */
public final class DeletionGate {

    public enum Decision {
        ALLOWED,
        TYPE_DENIED,
        TYPE_NOT_ALLOWED,
        PROTECTED_NAME
    }

    private DeletionGate() {
    }

    public static Decision evaluate(Policy policy, EntityType type, String name) {
        if (policy.getDeleteDenyTypes().contains(type)) {
            return Decision.TYPE_DENIED;
        }
        if (!policy.getDeleteAllowTypes().isEmpty() && !policy.getDeleteAllowTypes().contains(type)) {
            return Decision.TYPE_NOT_ALLOWED;
        }
        if (policy.isProtected(type, name)) {
            return Decision.PROTECTED_NAME;
        }
        return Decision.ALLOWED;
    }

    /**
     * Warning reported for an entity kept by the given decision.
     */
    public static String warning(Decision decision, EntityType type, String name) {
        return switch (decision) {
            case TYPE_DENIED -> String.format("Deletion of %s is denied by policy; %s \"%s\" not deleted.",
                    type.getKey(), type.getDisplayName(), name);
            case TYPE_NOT_ALLOWED -> String.format("Deletion of %s is not allowed by policy; %s \"%s\" not deleted.",
                    type.getKey(), type.getDisplayName(), name);
            case PROTECTED_NAME -> String.format("Protected %s not deleted: \"%s\"", type.getDisplayName(), name);
            case ALLOWED -> throw new IllegalArgumentException("Deletion of \"" + name + "\" is allowed");
        };
    }
}
