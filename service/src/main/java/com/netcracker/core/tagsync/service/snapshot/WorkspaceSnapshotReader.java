package com.netcracker.core.tagsync.service.snapshot;

import com.netcracker.core.tagsync.client.RemoteApiException;
import com.netcracker.core.tagsync.client.RemoteDirectoryService;
import com.netcracker.core.tagsync.client.WorkspacePaths;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.WorkspaceSnapshot;
import com.netcracker.core.tagsync.service.retry.RetryableErrors;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the current state of a workspace, issuing one listing per entity type concurrently.
 * <p>
 * Optional categories (see {@link EntityType#isOptional()}) that the remote side rejects with one of
 * {@link #NOT_AVAILABLE_STATUSES} are read as empty. Any other failure fails the whole snapshot.
 */
@Slf4j
public class WorkspaceSnapshotReader {
    static final Set<Integer> NOT_AVAILABLE_STATUSES = Set.of(400, 404);

    private final RemoteDirectoryService directory;

    public WorkspaceSnapshotReader(RemoteDirectoryService directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public CompletableFuture<WorkspaceSnapshot> read(String workspacePath) {
        Objects.requireNonNull(workspacePath, "workspacePath");
        Map<EntityType, CompletableFuture<List<Entity>>> reads = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            reads.put(type, list(workspacePath, type));
        }

        return CompletableFuture.allOf(reads.values().toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    Map<EntityType, List<Entity>> entities = new EnumMap<>(EntityType.class);
                    reads.forEach((type, future) -> entities.put(type, List.copyOf(future.join())));
                    log.debug("Read snapshot of '{}': {}", workspacePath, counts(entities));
                    return WorkspaceSnapshot.builder().entities(entities).build();
                });
    }

    private CompletableFuture<List<Entity>> list(String workspacePath, EntityType type) {
        CompletableFuture<List<Entity>> listing = directory.list(type, WorkspacePaths.parentPath(workspacePath, type));
        if (!type.isOptional()) {
            return listing;
        }
        return listing.exceptionallyCompose(error -> {
            Throwable cause = RetryableErrors.unwrap(error);
            if (isNotAvailable(cause)) {
                log.info("Skipping {} for '{}': not available for this target ({})",
                        type.getKey(), workspacePath, cause.getMessage());
                return CompletableFuture.completedFuture(List.of());
            }
            return CompletableFuture.failedFuture(cause);
        });
    }

    static boolean isNotAvailable(Throwable error) {
        return error instanceof RemoteApiException remote && NOT_AVAILABLE_STATUSES.contains(remote.getStatus());
    }

    private static Map<String, Integer> counts(Map<EntityType, List<Entity>> entities) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        entities.forEach((type, list) -> counts.put(type.getKey(), list.size()));
        return counts;
    }
}
