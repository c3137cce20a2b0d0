package com.netcracker.core.tagsync.model;

/**
 * Describes a reference from one entity to entities of another type that a desired state may
 * declare by name instead of by server-assigned id.
 *
 * @param container   name of the nested object holding both fields, or {@code null} for top level
 * @param nameField   IaC-only field with referenced names, never sent to the remote API
 * @param idField     API field with referenced ids
 * @param target      type of the referenced entities
 * @param description human readable reference kind used in error messages
 */
public record ReferenceField(String container, String nameField, String idField, EntityType target,
                             String description) {

    public static ReferenceField topLevel(String nameField, String idField, EntityType target, String description) {
        return new ReferenceField(null, nameField, idField, target, description);
    }

    public static ReferenceField nested(String container, String nameField, String idField, EntityType target,
                                        String description) {
        return new ReferenceField(container, nameField, idField, target, description);
    }

    public String qualifiedNameField() {
        return container == null ? nameField : container + "." + nameField;
    }

    public String qualifiedIdField() {
        return container == null ? idField : container + "." + idField;
    }
}
