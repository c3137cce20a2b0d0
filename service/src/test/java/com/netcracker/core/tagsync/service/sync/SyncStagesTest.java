package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.model.EntityType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncStagesTest {

    @Test
    void applyOrderIsFixed() {
        assertThat(SyncStages.ORDER).extracting(SyncStage::type).containsExactly(
                EntityType.ENVIRONMENT,
                EntityType.TEMPLATE,
                EntityType.VARIABLE,
                EntityType.BUILT_IN_VARIABLE,
                EntityType.CLIENT,
                EntityType.TRANSFORMATION,
                EntityType.TRIGGER,
                EntityType.ZONE,
                EntityType.TAG,
                EntityType.FOLDER);
    }

    @Test
    void stageMayNotResolveIdsOfLaterStage() {
        List<SyncStage> stages = new ArrayList<>(SyncStages.ORDER);
        stages.remove(SyncStage.of(EntityType.TRIGGER));
        stages.add(SyncStage.of(EntityType.TRIGGER));

        assertThatThrownBy(() -> SyncStages.validate(stages))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("zones resolves ids of triggers");
    }

    @Test
    void stageMustResolveEveryDeclaredReference() {
        List<SyncStage> stages = new ArrayList<>(SyncStages.ORDER);
        stages.set(stages.indexOf(SyncStage.of(EntityType.TAG, EntityType.TRIGGER)), SyncStage.of(EntityType.TAG));

        assertThatThrownBy(() -> SyncStages.validate(stages))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("firingTriggerNames");
    }

    @Test
    void everyTypeNeedsExactlyOneStage() {
        List<SyncStage> missing = new ArrayList<>(SyncStages.ORDER.subList(0, 9));
        List<SyncStage> twice = new ArrayList<>(SyncStages.ORDER);
        twice.add(SyncStage.of(EntityType.TAG, EntityType.TRIGGER));

        assertThatThrownBy(() -> SyncStages.validate(missing)).hasMessageContaining("FOLDER");
        assertThatThrownBy(() -> SyncStages.validate(twice)).hasMessageContaining("applied twice");
    }
}
