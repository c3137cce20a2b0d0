package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.netcracker.core.tagsync.error.ContentHashMismatchException;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;
import com.netcracker.core.tagsync.service.normalize.ContentHasher;

import java.util.Locale;

/**
 * Verifies the {@code __sha256} pin of a desired entity against the content about to be applied.
 * <p>
 * For types with a {@link EntityType#getPinnedField() pinned field} the pin is the SHA-256 of that
 * field's text; otherwise it is the {@link ContentHasher#hash content hash} of the API record.
 */
final class ContentPins {

    private ContentPins() {
    }

    static void verify(EntityType type, Entity desired) {
        String expected = desired.getContentSha256();
        if (Names.isBlank(expected)) {
            return;
        }
        String actual = actualHash(type, desired);
        if (!actual.equals(expected.trim().toLowerCase(Locale.ROOT))) {
            throw new ContentHashMismatchException(type, desired.getName(), expected, actual);
        }
    }

    static String actualHash(EntityType type, Entity desired) {
        if (type.getPinnedField() == null) {
            return ContentHasher.hash(desired.toApiJson(type));
        }
        JsonNode content = desired.field(type.getPinnedField());
        String text;
        if (content == null || content.isNull()) {
            text = "";
        } else if (content.isValueNode()) {
            text = content.asText();
        } else {
            text = content.toString();
        }
        return ContentHasher.sha256Hex(text);
    }
}
