package com.netcracker.core.tagsync.model;

import java.util.Locale;

/**
 * Entity names are identities compared case-insensitively after trimming.
 */
public final class Names {

    private Names() {
    }

    public static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String name) {
        return name == null || name.isBlank();
    }
}
