package com.netcracker.core.tagsync.service.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.tagsync.model.Names;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * One-directional subset test: {@code current} matches when it agrees with every field {@code desired}
 * specifies. Extra fields of {@code current} are ignored.
 * <p>
 * Arrays are compared by the shape of the desired elements:
 * <ul>
 *     <li>all primitives: every desired element must occur somewhere in current;</li>
 *     <li>all objects keyed by {@code name} (case-insensitive) or all by {@code key}: each desired element
 *     must subset-match the current element with the same identity, in any order;</li>
 *     <li>otherwise: same length, position by position.</li>
 * </ul>
 */
public final class SubsetMatcher {
    static final String NAME = "name";
    static final String KEY = "key";

    private SubsetMatcher() {
    }

    public static boolean matches(JsonNode current, JsonNode desired) {
        if (desired == null || desired.isMissingNode()) {
            return true;
        }
        if (desired.isArray()) {
            return current != null && current.isArray() && matchesArray(current, desired);
        }
        if (desired.isObject()) {
            if (!hasDefinedField(desired)) {
                return true;
            }
            return current != null && current.isObject() && matchesObject(current, desired);
        }
        return primitiveEquals(current, desired);
    }

    private static boolean matchesObject(JsonNode current, JsonNode desired) {
        Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isMissingNode()) {
                continue;
            }
            if (!current.has(field.getKey())) {
                return false;
            }
            if (!matches(current.get(field.getKey()), field.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasDefinedField(JsonNode object) {
        for (JsonNode value : object) {
            if (!value.isMissingNode()) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesArray(JsonNode current, JsonNode desired) {
        if (desired.isEmpty()) {
            return true;
        }
        if (allPrimitive(desired)) {
            for (JsonNode desiredItem : desired) {
                if (!containsPrimitive(current, desiredItem)) {
                    return false;
                }
            }
            return true;
        }

        String identityField = allKeyedBy(desired, NAME) ? NAME : allKeyedBy(desired, KEY) ? KEY : null;
        if (identityField != null) {
            return matchesByIdentity(current, desired, identityField);
        }

        if (current.size() != desired.size()) {
            return false;
        }
        for (int i = 0; i < desired.size(); i++) {
            if (!matches(current.get(i), desired.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesByIdentity(JsonNode current, JsonNode desired, String identityField) {
        Map<String, JsonNode> currentIndex = new HashMap<>();
        for (JsonNode currentItem : current) {
            JsonNode id = currentItem.isObject() ? currentItem.get(identityField) : null;
            if (id != null && id.isTextual() && !id.asText().isBlank()) {
                currentIndex.put(identity(id.asText(), identityField), currentItem);
            }
        }
        for (JsonNode desiredItem : desired) {
            JsonNode match = currentIndex.get(identity(desiredItem.get(identityField).asText(), identityField));
            if (match == null || !matches(match, desiredItem)) {
                return false;
            }
        }
        return true;
    }

    private static String identity(String value, String identityField) {
        return NAME.equals(identityField) ? Names.key(value) : value;
    }

    private static boolean allPrimitive(JsonNode array) {
        for (JsonNode item : array) {
            if (item.isContainerNode()) {
                return false;
            }
        }
        return true;
    }

    private static boolean allKeyedBy(JsonNode array, String identityField) {
        for (JsonNode item : array) {
            if (!item.isObject() || item.get(identityField) == null || !item.get(identityField).isTextual()) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsPrimitive(JsonNode array, JsonNode value) {
        for (JsonNode item : array) {
            if (primitiveEquals(item, value)) {
                return true;
            }
        }
        return false;
    }

    static boolean primitiveEquals(JsonNode current, JsonNode desired) {
        if (current == null || current.isMissingNode()) {
            return false;
        }
        if (desired.isNull() || current.isNull()) {
            return desired.isNull() && current.isNull();
        }
        if (desired.isNumber() && current.isNumber()) {
            if (desired.isFloatingPointNumber() && Double.isNaN(desired.doubleValue())) {
                return current.isFloatingPointNumber() && Double.isNaN(current.doubleValue());
            }
            return desired.decimalValue().compareTo(current.decimalValue()) == 0;
        }
        if (desired.isTextual() && current.isTextual()) {
            return desired.textValue().equals(current.textValue());
        }
        if (desired.isBoolean() && current.isBoolean()) {
            return desired.booleanValue() == current.booleanValue();
        }
        return false;
    }
}
