package com.netcracker.core.tagsync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Entities a desired folder declares as its members, by name.
 */
public record FolderMembers(List<String> tagNames, List<String> triggerNames, List<String> variableNames) {
    public static final FolderMembers NONE = new FolderMembers(List.of(), List.of(), List.of());

    public FolderMembers {
        tagNames = tagNames == null ? List.of() : List.copyOf(tagNames);
        triggerNames = triggerNames == null ? List.of() : List.copyOf(triggerNames);
        variableNames = variableNames == null ? List.of() : List.copyOf(variableNames);
    }

    public boolean isEmpty() {
        return tagNames.isEmpty() && triggerNames.isEmpty() && variableNames.isEmpty();
    }

    static FolderMembers fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return NONE;
        }
        return new FolderMembers(
                textList(node.get("tagNames")),
                textList(node.get("triggerNames")),
                textList(node.get("variableNames")));
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    out.add(item.asText());
                }
            });
        }
        return out;
    }
}
