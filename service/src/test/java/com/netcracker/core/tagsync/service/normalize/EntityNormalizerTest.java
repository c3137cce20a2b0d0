package com.netcracker.core.tagsync.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static com.netcracker.core.tagsync.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class EntityNormalizerTest {

    @Test
    void removesServerManagedKeysAtEveryDepth() {
        JsonNode value = json("""
                {name: 'Tag A', tagId: '1', fingerprint: 'x', path: 'accounts/1/containers/2/workspaces/3/tags/1',
                 accountId: '1', containerId: '2', workspaceId: '3', tagManagerUrl: 'https://example',
                 parameter: [{key: 'a', variableId: '9', list: [{triggerId: '4', value: 'v'}]}]}
                """);

        assertThat(EntityNormalizer.normalize(value)).isEqualTo(json("""
                {name: 'Tag A', parameter: [{key: 'a', list: [{value: 'v'}]}]}
                """));
    }

    @Test
    void keepsReferenceIdListsAndOrder() {
        JsonNode value = json("{firingTriggerId: ['2', '1'], blockingTriggerId: []}");

        assertThat(EntityNormalizer.normalize(value)).isEqualTo(value);
    }

    @Test
    void doesNotModifyArgument() {
        JsonNode value = json("{name: 'v', variableId: '5'}");

        EntityNormalizer.normalize(value);

        assertThat(value.has("variableId")).isTrue();
    }

    @Test
    void identifiersDoNotAffectNormalizedValue() {
        JsonNode withIds = json("{name: 'T', type: 'html', tagId: '123', fingerprint: 'xyz'}");
        JsonNode withoutIds = json("{name: 'T', type: 'html'}");

        assertThat(EntityNormalizer.normalize(withIds)).isEqualTo(EntityNormalizer.normalize(withoutIds));
    }

    @Test
    void nullStaysNull() {
        assertThat(EntityNormalizer.normalize(null)).isNull();
    }
}
