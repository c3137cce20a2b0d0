package com.netcracker.core.tagsync.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entity types of a tag-management workspace.
 * <p>
 * The {@link #getKey() key} is the plural name used by desired-state documents, policies and
 * sync results; the {@link #getPathSegment() path segment} is the collection name in remote paths.
 */
@Getter
public enum EntityType {
    ENVIRONMENT("environments", "environment", "environmentId", "environments", true, false, null),
    TEMPLATE("templates", "template", "templateId", "templates", false, false, "templateData"),
    VARIABLE("variables", "variable", "variableId", "variables", false, false, null),
    BUILT_IN_VARIABLE("builtInVariables", "built-in variable", null, "built_in_variables", false, false, null),
    CLIENT("clients", "client", "clientId", "clients", false, true, null),
    TRANSFORMATION("transformations", "transformation", "transformationId", "transformations", false, true, null),
    TRIGGER("triggers", "trigger", "triggerId", "triggers", false, false, null),
    ZONE("zones", "zone", "zoneId", "zones", false, true, null),
    TAG("tags", "tag", "tagId", "tags", false, false, null),
    FOLDER("folders", "folder", "folderId", "folders", false, false, null);

    private final String key;
    private final String displayName;
    private final String idField;
    private final String pathSegment;
    private final boolean containerScoped;
    private final boolean optional;
    private final String pinnedField;

    EntityType(String key, String displayName, String idField, String pathSegment,
               boolean containerScoped, boolean optional, String pinnedField) {
        this.key = key;
        this.displayName = displayName;
        this.idField = idField;
        this.pathSegment = pathSegment;
        this.containerScoped = containerScoped;
        this.optional = optional;
        this.pinnedField = pinnedField;
    }

    /**
     * Display name starting with a capital letter, for the start of a message.
     */
    public String getTitle() {
        return Character.toUpperCase(displayName.charAt(0)) + displayName.substring(1);
    }

    /**
     * Name-based references this type may declare in a desired state.
     */
    public List<ReferenceField> references() {
        return switch (this) {
            case TAG -> List.of(
                    ReferenceField.topLevel("firingTriggerNames", "firingTriggerId", TRIGGER, "trigger"),
                    ReferenceField.topLevel("blockingTriggerNames", "blockingTriggerId", TRIGGER, "blocking trigger"));
            case ZONE -> List.of(
                    ReferenceField.nested("boundary", "customEvaluationTriggerNames", "customEvaluationTriggerId",
                            TRIGGER, "custom evaluation trigger"));
            default -> List.of();
        };
    }

    public static Optional<EntityType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.key.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    public static EntityType requireKey(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + key));
    }
}
