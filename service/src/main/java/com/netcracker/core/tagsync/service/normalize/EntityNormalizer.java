package com.netcracker.core.tagsync.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Produces comparison-ready values by removing server-managed keys at every depth: resource ids of
 * the account, container, workspace and each entity type, the fingerprint, the hierarchical path and
 * the environment-specific UI URL. Everything else, array order included, is kept as is.
 */
public final class EntityNormalizer {
    public static final Set<String> DYNAMIC_KEYS = Set.of(
            "accountId",
            "containerId",
            "workspaceId",
            "path",
            "tagManagerUrl",
            "fingerprint",
            "environmentId",
            "templateId",
            "variableId",
            "clientId",
            "transformationId",
            "triggerId",
            "zoneId",
            "tagId",
            "folderId"
    );

    private EntityNormalizer() {
    }

    /**
     * Returns a normalized deep copy; the argument is not modified.
     */
    public static JsonNode normalize(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
            value.forEach(item -> out.add(normalize(item)));
            return out;
        }
        if (value.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!DYNAMIC_KEYS.contains(field.getKey())) {
                    out.set(field.getKey(), normalize(field.getValue()));
                }
            }
            return out;
        }
        return value.deepCopy();
    }

    public static ObjectNode normalizeObject(ObjectNode value) {
        return (ObjectNode) normalize(value);
    }
}
