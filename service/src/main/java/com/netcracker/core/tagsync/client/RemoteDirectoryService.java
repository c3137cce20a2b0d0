package com.netcracker.core.tagsync.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the entities of a remote tag-management workspace.
 * <p>
 * Implementations own the transport: pagination, marshaling and authentication. Failures are
 * reported by completing the future with a {@link RemoteApiException}.
 */
public interface RemoteDirectoryService {

    /**
     * Lists every entity of the type under the parent path, following all pages.
     */
    CompletableFuture<List<Entity>> list(EntityType type, String parentPath);

    /**
     * Creates an entity and returns it as stored, including its assigned id.
     */
    CompletableFuture<Entity> create(EntityType type, String parentPath, ObjectNode body);

    /**
     * Updates an entity. When {@code fingerprint} is not {@code null} the remote side rejects the write
     * if the entity changed since that fingerprint was observed.
     */
    CompletableFuture<Entity> update(EntityType type, String path, ObjectNode body, String fingerprint);

    CompletableFuture<Void> delete(EntityType type, String path);

    CompletableFuture<Void> enableBuiltInVariables(String workspacePath, List<String> types);

    CompletableFuture<Void> disableBuiltInVariables(String workspacePath, List<String> types);

    CompletableFuture<Void> moveEntitiesToFolder(String folderPath, List<String> tagIds, List<String> triggerIds,
                                                 List<String> variableIds);
}
