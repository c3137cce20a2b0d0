package com.netcracker.core.tagsync.service.sync;

import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.ReferenceField;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed apply order of a sync run. Every stage comes after each stage it resolves ids from; folders are
 * last because membership moves need the ids of tags, triggers and variables created in the same run.
 */
public final class SyncStages {
    public static final List<SyncStage> ORDER = validate(List.of(
            SyncStage.of(EntityType.ENVIRONMENT),
            SyncStage.of(EntityType.TEMPLATE),
            SyncStage.of(EntityType.VARIABLE),
            SyncStage.of(EntityType.BUILT_IN_VARIABLE),
            SyncStage.of(EntityType.CLIENT),
            SyncStage.of(EntityType.TRANSFORMATION),
            SyncStage.of(EntityType.TRIGGER),
            SyncStage.of(EntityType.ZONE, EntityType.TRIGGER),
            SyncStage.of(EntityType.TAG, EntityType.TRIGGER),
            SyncStage.of(EntityType.FOLDER, EntityType.TAG, EntityType.TRIGGER, EntityType.VARIABLE)
    ));

    private SyncStages() {
    }

    /**
     * Checks that the stages cover every entity type exactly once, that each stage only resolves ids of
     * types applied before it, and that each stage may resolve every reference its type declares.
     *
     * @return the argument
     * @throws IllegalStateException if the order violates one of these rules
     */
    static List<SyncStage> validate(List<SyncStage> stages) {
        Set<EntityType> applied = EnumSet.noneOf(EntityType.class);
        for (SyncStage stage : stages) {
            EntityType type = stage.type();
            if (applied.contains(type)) {
                throw new IllegalStateException("Entity type " + type.getKey() + " is applied twice");
            }
            for (EntityType source : stage.resolvesFrom()) {
                if (!applied.contains(source)) {
                    throw new IllegalStateException("Stage " + type.getKey() + " resolves ids of "
                            + source.getKey() + " before they are applied");
                }
            }
            for (ReferenceField reference : type.references()) {
                if (!stage.resolvesFrom().contains(reference.target())) {
                    throw new IllegalStateException("Stage " + type.getKey() + " cannot resolve "
                            + reference.qualifiedNameField());
                }
            }
            applied.add(type);
        }
        if (applied.size() != EntityType.values().length) {
            Set<EntityType> missing = EnumSet.allOf(EntityType.class);
            missing.removeAll(applied);
            throw new IllegalStateException("No stage for entity types " + missing);
        }
        return List.copyOf(stages);
    }
}
