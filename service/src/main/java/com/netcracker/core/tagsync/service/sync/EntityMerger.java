package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Overlays desired fields onto a copy of the current record: objects merge recursively, arrays and
 * scalars replace. Fields only present in the current record are kept.
 */
final class EntityMerger {

    private EntityMerger() {
    }

    static ObjectNode merge(ObjectNode current, ObjectNode desired) {
        ObjectNode out = current.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode desiredValue = field.getValue();
            JsonNode currentValue = out.get(field.getKey());
            if (desiredValue instanceof ObjectNode desiredObject && currentValue instanceof ObjectNode currentObject) {
                out.set(field.getKey(), merge(currentObject, desiredObject));
            } else {
                out.set(field.getKey(), desiredValue.deepCopy());
            }
        }
        return out;
    }
}
