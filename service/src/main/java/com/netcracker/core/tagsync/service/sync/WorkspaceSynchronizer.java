package com.netcracker.core.tagsync.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.client.RemoteDirectoryService;
import com.netcracker.core.tagsync.client.RetryingRemoteDirectoryService;
import com.netcracker.core.tagsync.client.WorkspacePaths;
import com.netcracker.core.tagsync.error.InvalidDesiredStateException;
import com.netcracker.core.tagsync.error.MissingEntityIdentifierException;
import com.netcracker.core.tagsync.error.RemoteMutationException;
import com.netcracker.core.tagsync.model.DesiredState;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityDiff;
import com.netcracker.core.tagsync.model.EntitySyncSummary;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.FolderMembers;
import com.netcracker.core.tagsync.model.Names;
import com.netcracker.core.tagsync.model.SyncOptions;
import com.netcracker.core.tagsync.model.SyncResult;
import com.netcracker.core.tagsync.model.WorkspaceDiff;
import com.netcracker.core.tagsync.model.WorkspaceSnapshot;
import com.netcracker.core.tagsync.service.diff.SubsetMatcher;
import com.netcracker.core.tagsync.service.diff.WorkspaceDiffEngine;
import com.netcracker.core.tagsync.service.normalize.EntityNormalizer;
import com.netcracker.core.tagsync.service.retry.RemoteCallPolicies;
import com.netcracker.core.tagsync.service.retry.RetryConfig;
import com.netcracker.core.tagsync.service.retry.RetryDriver;
import com.netcracker.core.tagsync.service.retry.RetryableErrors;
import com.netcracker.core.tagsync.service.snapshot.WorkspaceSnapshotReader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Converges a remote workspace towards a desired state.
 * <p>
 * A run validates the desired state, reads a snapshot of the workspace with concurrent listings and then
 * applies the entity types one after another in {@link SyncStages#ORDER}. All mutations of a run are
 * issued sequentially. The first fatal error completes the returned future exceptionally; changes
 * applied before it stay applied.
 */
@ApplicationScoped
@Slf4j
public class WorkspaceSynchronizer {
    private static final String PARENT_FOLDER_ID = "parentFolderId";

    private final RemoteDirectoryService directory;
    private final WorkspaceSnapshotReader snapshotReader;
    private final WorkspaceDiffEngine diffEngine;
    private final ReferenceResolver referenceResolver = new ReferenceResolver();

    @Inject
    @SuppressWarnings("unused")
    public WorkspaceSynchronizer(RemoteDirectoryService directory,
                                 RetryDriver retryDriver,
                                 RetryConfig retryConfig,
                                 WorkspaceDiffEngine diffEngine) {
        this(new RetryingRemoteDirectoryService(directory, retryDriver, RemoteCallPolicies.from(retryConfig)),
                diffEngine);
    }

    WorkspaceSynchronizer(RemoteDirectoryService directory, WorkspaceDiffEngine diffEngine) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        this.snapshotReader = new WorkspaceSnapshotReader(directory);
    }

    /**
     * Computes what a sync run would change without issuing any mutation.
     */
    public CompletableFuture<WorkspaceDiff> plan(String workspacePath, DesiredState desired) {
        Objects.requireNonNull(workspacePath, "workspacePath");
        Objects.requireNonNull(desired, "desired");
        try {
            DesiredStateValidator.validate(desired);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return snapshotReader.read(workspacePath)
                .thenApply(snapshot -> diffEngine.diff(desired, snapshot));
    }

    public CompletableFuture<SyncResult> sync(String workspacePath, DesiredState desired, SyncOptions options) {
        Objects.requireNonNull(workspacePath, "workspacePath");
        Objects.requireNonNull(desired, "desired");
        Objects.requireNonNull(options, "options");
        try {
            DesiredStateValidator.validate(desired);
        } catch (RuntimeException e) {
            log.error("Desired state for '{}' rejected: {}", workspacePath, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        log.info("Starting sync of '{}' (dryRun={}, deleteMissing={}, updateExisting={})",
                workspacePath, options.isDryRun(), options.isDeleteMissing(), options.isUpdateExisting());
        return snapshotReader.read(workspacePath)
                .thenCompose(snapshot -> apply(new SyncRunContext(workspacePath, desired, snapshot, options)))
                .exceptionallyCompose(error -> {
                    Throwable cause = RetryableErrors.unwrap(error);
                    log.error("Sync of '{}' aborted: {}", workspacePath, cause.getMessage());
                    return CompletableFuture.failedFuture(cause);
                })
                .thenApply(result -> {
                    log.info("Finished sync of '{}' (changes={}, warnings={})",
                            workspacePath, result.hasChanges(), result.warnings().size());
                    return result;
                });
    }

    private CompletableFuture<SyncResult> apply(SyncRunContext context) {
        if (context.getOptions().isValidateVariableRefs()) {
            checkVariableReferences(context);
        }
        CompletableFuture<Void> run = CompletableFuture.completedFuture(null);
        for (SyncStage stage : SyncStages.ORDER) {
            run = run.thenCompose(ignored -> applyStage(stage, context))
                    .thenRun(() -> logOutcome(stage.type(), context));
        }
        return run.thenApply(ignored -> context.toResult());
    }

    private CompletableFuture<Void> applyStage(SyncStage stage, SyncRunContext context) {
        return stage.type() == EntityType.BUILT_IN_VARIABLE
                ? applyBuiltInVariables(context)
                : applyEntities(stage, context);
    }

    private CompletableFuture<Void> applyEntities(SyncStage stage, SyncRunContext context) {
        EntityType type = stage.type();
        Map<String, Entity> currentByName = new LinkedHashMap<>();
        for (Entity entity : context.getSnapshot().entities(type)) {
            if (!Names.isBlank(entity.getName())) {
                currentByName.put(entity.nameKey(), entity);
            }
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        Set<String> desiredNames = new HashSet<>();
        for (Entity desired : context.getDesired().entities(type)) {
            desiredNames.add(desired.nameKey());
            Entity existing = currentByName.get(desired.nameKey());
            chain = chain.thenCompose(ignored -> upsert(stage, desired, existing, context));
            if (type == EntityType.FOLDER) {
                chain = chain.thenCompose(ignored -> moveFolderMembers(stage, desired, context));
            }
        }

        if (context.getOptions().isDeleteMissing()) {
            for (Map.Entry<String, Entity> entry : currentByName.entrySet()) {
                if (!desiredNames.contains(entry.getKey())) {
                    chain = chain.thenCompose(ignored -> delete(type, entry.getValue(), context));
                }
            }
        }
        return chain;
    }

    private CompletableFuture<Void> upsert(SyncStage stage, Entity desired, Entity existing, SyncRunContext context) {
        EntityType type = stage.type();
        String name = desired.getName();
        ContentPins.verify(type, desired);
        ObjectNode body = referenceResolver.resolve(stage, desired, context);

        if (existing == null) {
            return create(type, name, body, context);
        }
        if (!context.getOptions().isUpdateExisting()) {
            log.debug("Skipping {} '{}': updates disabled", type.getDisplayName(), name);
            context.skipped(type, name);
            return CompletableFuture.completedFuture(null);
        }

        ObjectNode current = existing.toJson(type);
        if (SubsetMatcher.matches(EntityNormalizer.normalize(current), EntityNormalizer.normalize(body))) {
            log.debug("Skipping {} '{}': up to date", type.getDisplayName(), name);
            context.skipped(type, name);
            return CompletableFuture.completedFuture(null);
        }

        context.updated(type, name);
        if (context.getOptions().isDryRun()) {
            return CompletableFuture.completedFuture(null);
        }
        String path = WorkspacePaths.pathOf(context.getWorkspacePath(), type, existing);
        if (path == null) {
            throw new MissingEntityIdentifierException(type, name, "update");
        }
        ObjectNode merged = EntityNormalizer.normalizeObject(EntityMerger.merge(current, body));
        log.debug("Updating {} '{}' at '{}'", type.getDisplayName(), name, path);
        return failingWith(directory.update(type, path, merged, existing.getFingerprint()), type, name, "update")
                .thenAccept(updated -> recordAssignedId(type, name, updated, context));
    }

    private CompletableFuture<Void> create(EntityType type, String name, ObjectNode body, SyncRunContext context) {
        if (type == EntityType.TAG && !body.path("firingTriggerId").isArray()) {
            throw new InvalidDesiredStateException(type, name, String.format(
                    "Cannot create tag \"%s\": missing firingTriggerId (or firingTriggerNames).", name));
        }

        context.created(type, name);
        if (context.getOptions().isDryRun()) {
            context.recordPlannedId(type, name);
            return CompletableFuture.completedFuture(null);
        }
        String parentPath = WorkspacePaths.parentPath(context.getWorkspacePath(), type);
        log.debug("Creating {} '{}' under '{}'", type.getDisplayName(), name, parentPath);
        return failingWith(directory.create(type, parentPath, EntityNormalizer.normalizeObject(body)), type, name, "create")
                .thenAccept(created -> recordAssignedId(type, name, created, context));
    }

    private CompletableFuture<Void> delete(EntityType type, Entity existing, SyncRunContext context) {
        String name = existing.getName();
        DeletionGate.Decision decision = DeletionGate.evaluate(context.getDesired().getPolicy(), type, name);
        if (decision != DeletionGate.Decision.ALLOWED) {
            String warning = DeletionGate.warning(decision, type, name);
            log.warn("{}", warning);
            context.skipped(type, name);
            context.warn(warning);
            return CompletableFuture.completedFuture(null);
        }

        context.deleted(type, name);
        if (context.getOptions().isDryRun()) {
            return CompletableFuture.completedFuture(null);
        }
        String path = WorkspacePaths.pathOf(context.getWorkspacePath(), type, existing);
        if (path == null) {
            throw new MissingEntityIdentifierException(type, name, "delete");
        }
        log.debug("Deleting {} '{}' at '{}'", type.getDisplayName(), name, path);
        return failingWith(directory.delete(type, path), type, name, "delete");
    }

    private CompletableFuture<Void> applyBuiltInVariables(SyncRunContext context) {
        EntityType type = EntityType.BUILT_IN_VARIABLE;
        EntityDiff diff = diffEngine.diffStringSet(
                context.getDesired().getBuiltInVariableTypes(), context.getSnapshot().builtInVariableTypes());

        List<String> toEnable = diff.create();
        List<String> toDisable = new ArrayList<>();
        if (context.getOptions().isDeleteMissing()) {
            for (String builtIn : diff.delete()) {
                DeletionGate.Decision decision = DeletionGate.evaluate(context.getDesired().getPolicy(), type, builtIn);
                if (decision == DeletionGate.Decision.ALLOWED) {
                    toDisable.add(builtIn);
                } else {
                    String warning = DeletionGate.warning(decision, type, builtIn);
                    log.warn("{}", warning);
                    context.skipped(type, builtIn);
                    context.warn(warning);
                }
            }
        }
        toEnable.forEach(builtIn -> context.created(type, builtIn));
        toDisable.forEach(builtIn -> context.deleted(type, builtIn));
        if (context.getOptions().isDryRun()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        if (!toEnable.isEmpty()) {
            chain = chain.thenCompose(ignored -> failingWith(
                    directory.enableBuiltInVariables(context.getWorkspacePath(), toEnable),
                    type, String.join(", ", toEnable), "enable"));
        }
        if (!toDisable.isEmpty()) {
            chain = chain.thenCompose(ignored -> failingWith(
                    directory.disableBuiltInVariables(context.getWorkspacePath(), List.copyOf(toDisable)),
                    type, String.join(", ", toDisable), "disable"));
        }
        return chain;
    }

    private CompletableFuture<Void> moveFolderMembers(SyncStage stage, Entity folder, SyncRunContext context) {
        FolderMembers members = folder.getMembers();
        if (members.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        String name = folder.getName();
        if (context.getOptions().isDryRun()) {
            context.warn(String.format("dry-run: would move entities into folder \"%s\"", name));
            return CompletableFuture.completedFuture(null);
        }

        String folderId = context.idOf(EntityType.FOLDER, name);
        if (Names.isBlank(folderId)) {
            throw new MissingEntityIdentifierException(EntityType.FOLDER, name, "move entities into");
        }
        List<String> tagIds = referenceResolver.resolveNames(stage, context, EntityType.TAG, name,
                EntityType.TAG.getDisplayName(), outsideFolder(context, EntityType.TAG, members.tagNames(), folderId));
        List<String> triggerIds = referenceResolver.resolveNames(stage, context, EntityType.TRIGGER, name,
                EntityType.TRIGGER.getDisplayName(),
                outsideFolder(context, EntityType.TRIGGER, members.triggerNames(), folderId));
        List<String> variableIds = referenceResolver.resolveNames(stage, context, EntityType.VARIABLE, name,
                EntityType.VARIABLE.getDisplayName(),
                outsideFolder(context, EntityType.VARIABLE, members.variableNames(), folderId));
        if (tagIds.isEmpty() && triggerIds.isEmpty() && variableIds.isEmpty()) {
            log.debug("Members of folder '{}' already in place", name);
            return CompletableFuture.completedFuture(null);
        }

        String folderPath = WorkspacePaths.entityPath(context.getWorkspacePath(), EntityType.FOLDER, folderId);
        log.debug("Moving {} tags, {} triggers and {} variables into folder '{}'",
                tagIds.size(), triggerIds.size(), variableIds.size(), name);
        return failingWith(directory.moveEntitiesToFolder(folderPath, tagIds, triggerIds, variableIds),
                EntityType.FOLDER, name, "move entities into");
    }

    /**
     * Member names whose current entity is not already placed in the folder. Names unknown to the
     * snapshot are kept, so they are still resolved.
     */
    private static List<String> outsideFolder(SyncRunContext context, EntityType type, List<String> names,
                                              String folderId) {
        Map<String, String> parentByName = new HashMap<>();
        for (Entity current : context.getSnapshot().entities(type)) {
            JsonNode parent = current.field(PARENT_FOLDER_ID);
            if (parent != null && parent.isValueNode()) {
                parentByName.put(current.nameKey(), parent.asText());
            }
        }
        List<String> outside = new ArrayList<>();
        for (String memberName : names) {
            if (!folderId.equals(parentByName.get(Names.key(memberName)))) {
                outside.add(memberName);
            }
        }
        return outside;
    }

    private void checkVariableReferences(SyncRunContext context) {
        DesiredState desired = context.getDesired();
        WorkspaceSnapshot snapshot = context.getSnapshot();
        Set<String> available = new HashSet<>();
        desired.entities(EntityType.VARIABLE).forEach(variable -> available.add(variable.nameKey()));
        snapshot.entities(EntityType.VARIABLE).forEach(variable -> available.add(variable.nameKey()));
        snapshot.entities(EntityType.BUILT_IN_VARIABLE).forEach(builtIn -> available.add(builtIn.nameKey()));

        for (EntityType type : EntityType.values()) {
            for (Entity entity : desired.entities(type)) {
                for (String warning : VariableReferenceScanner.scan(type, entity.getName(), entity.toJson(type), available)) {
                    log.warn("{}", warning);
                    context.warn(warning);
                }
            }
        }
    }

    private static <T> CompletableFuture<T> failingWith(CompletableFuture<T> call, EntityType type, String name,
                                                        String action) {
        return call.exceptionallyCompose(error -> CompletableFuture.failedFuture(
                new RemoteMutationException(type, name, action, RetryableErrors.unwrap(error))));
    }

    private static void recordAssignedId(EntityType type, String name, Entity stored, SyncRunContext context) {
        if (stored != null && !Names.isBlank(stored.getId())) {
            context.recordId(type, name, stored.getId());
        }
    }

    private static void logOutcome(EntityType type, SyncRunContext context) {
        EntitySyncSummary summary = context.summary(type);
        if (summary.hasChanges() || !summary.skipped().isEmpty()) {
            log.info("{}: created={}, updated={}, deleted={}, skipped={}", type.getKey(),
                    summary.created().size(), summary.updated().size(),
                    summary.deleted().size(), summary.skipped().size());
        }
    }
}
