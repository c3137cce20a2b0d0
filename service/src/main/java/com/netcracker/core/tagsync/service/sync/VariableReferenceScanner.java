package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort check of {@code {{ name }}} variable references in string values.
 */
final class VariableReferenceScanner {
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*\\}\\}");

    private VariableReferenceScanner() {
    }

    /**
     * Referenced names found at any depth, sorted.
     */
    static Set<String> collect(Collection<? extends JsonNode> values) {
        Set<String> names = new TreeSet<>();
        values.forEach(value -> collect(value, names));
        return names;
    }

    /**
     * One warning per name referenced by the given entity whose normalized form is not among
     * {@code availableKeys}.
     */
    static List<String> scan(EntityType type, String entityName, JsonNode value, Set<String> availableKeys) {
        List<String> warnings = new ArrayList<>();
        for (String name : collect(List.of(value))) {
            if (!availableKeys.contains(Names.key(name))) {
                warnings.add(String.format(
                        "%s \"%s\" references variable \"{{%s}}\" not found in workspace variables or enabled built-in variables.",
                        type.getTitle(), entityName, name));
            }
        }
        return warnings;
    }

    private static void collect(JsonNode value, Set<String> names) {
        if (value == null) {
            return;
        }
        if (value.isTextual()) {
            Matcher matcher = REFERENCE.matcher(value.asText());
            while (matcher.find()) {
                String name = matcher.group(1).trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        } else if (value.isContainerNode()) {
            value.forEach(child -> collect(child, names));
        }
    }
}
