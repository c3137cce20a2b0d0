package com.netcracker.core.tagsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Set;

/**
 * A workspace entity: a typed core ({@code name}, server-assigned id, fingerprint, path) plus the open set
 * of type-specific fields, which are passed through untouched.
 * <p>
 * Desired-state entities may additionally carry IaC-only data: a content hash pin ({@code __sha256}),
 * folder members ({@code __members}) and name-based references (see {@link EntityType#references()}).
 * None of them is ever part of {@link #toApiJson(EntityType)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Entity {
    public static final String NAME = "name";
    public static final String FINGERPRINT = "fingerprint";
    public static final String PATH = "path";
    public static final String CONTENT_SHA256 = "__sha256";
    public static final String MEMBERS = "__members";

    private static final Set<String> CORE_FIELDS = Set.of(NAME, FINGERPRINT, PATH, CONTENT_SHA256, MEMBERS);

    private final String name;
    private final String id;
    private final String fingerprint;
    private final String path;
    private final String contentSha256;
    private final FolderMembers members;
    private final ObjectNode fields;

    private Entity(String name, String id, String fingerprint, String path, String contentSha256,
                   FolderMembers members, ObjectNode fields) {
        this.name = name;
        this.id = id;
        this.fingerprint = fingerprint;
        this.path = path;
        this.contentSha256 = contentSha256;
        this.members = members == null ? FolderMembers.NONE : members;
        this.fields = fields == null ? JsonNodeFactory.instance.objectNode() : fields;
    }

    public static Entity fromJson(EntityType type, JsonNode node) {
        Objects.requireNonNull(type, "type");
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object for " + type.getDisplayName() + ": " + node);
        }
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        node.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            if (!CORE_FIELDS.contains(key) && !key.equals(type.getIdField())) {
                fields.set(key, entry.getValue().deepCopy());
            }
        });
        return new Entity(
                text(node, NAME),
                type.getIdField() == null ? null : text(node, type.getIdField()),
                text(node, FINGERPRINT),
                text(node, PATH),
                text(node, CONTENT_SHA256),
                FolderMembers.fromJson(node.get(MEMBERS)),
                fields);
    }

    /**
     * Full record as observed or declared, without IaC-only pin and member data.
     */
    public ObjectNode toJson(EntityType type) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        if (name != null) {
            out.put(NAME, name);
        }
        if (id != null && type.getIdField() != null) {
            out.put(type.getIdField(), id);
        }
        if (fingerprint != null) {
            out.put(FINGERPRINT, fingerprint);
        }
        if (path != null) {
            out.put(PATH, path);
        }
        out.setAll(fields.deepCopy());
        return out;
    }

    /**
     * The record as the remote API accepts it: name-based reference fields are removed.
     */
    public ObjectNode toApiJson(EntityType type) {
        ObjectNode out = toJson(type);
        for (ReferenceField reference : type.references()) {
            ObjectNode holder = reference.container() == null ? out : asObject(out.get(reference.container()));
            if (holder != null) {
                holder.remove(reference.nameField());
            }
        }
        return out;
    }

    public ObjectNode getFields() {
        return fields.deepCopy();
    }

    public JsonNode field(String fieldName) {
        JsonNode value = fields.get(fieldName);
        return value == null ? null : value.deepCopy();
    }

    public String nameKey() {
        return Names.key(name);
    }

    public boolean hasIdentifier() {
        return !Names.isBlank(path) || !Names.isBlank(id);
    }

    private static ObjectNode asObject(JsonNode node) {
        return node instanceof ObjectNode objectNode ? objectNode : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
