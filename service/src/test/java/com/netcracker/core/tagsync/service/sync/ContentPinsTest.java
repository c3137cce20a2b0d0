package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.error.ContentHashMismatchException;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.service.normalize.ContentHasher;
import org.junit.jupiter.api.Test;

import static com.netcracker.core.tagsync.TestJson.object;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentPinsTest {

    @Test
    void templatePinCoversTemplateDataOnly() {
        ObjectNode template = object("{name: 'Tpl', templateData: '___INFO___', notes: 'ignored'}");
        template.put("__sha256", ContentHasher.sha256Hex("___INFO___").toUpperCase());

        assertThatCode(() -> ContentPins.verify(EntityType.TEMPLATE, Entity.fromJson(EntityType.TEMPLATE, template)))
                .doesNotThrowAnyException();
    }

    @Test
    void otherTypesPinTheApiRecord() {
        ObjectNode variable = object("{name: 'v', type: 'c', parameter: [{type: 'template', key: 'value', value: '1'}]}");
        String pin = ContentPins.actualHash(EntityType.VARIABLE, Entity.fromJson(EntityType.VARIABLE, variable));
        variable.put("__sha256", " " + pin + " ");
        variable.put("type", "jsm");

        assertThatThrownBy(() -> ContentPins.verify(EntityType.VARIABLE, Entity.fromJson(EntityType.VARIABLE, variable)))
                .isInstanceOf(ContentHashMismatchException.class);
    }

    @Test
    void entitiesWithoutPinAreNotChecked() {
        assertThatCode(() -> ContentPins.verify(EntityType.TAG, Entity.fromJson(EntityType.TAG, object("{name: 't'}"))))
                .doesNotThrowAnyException();
    }
}
