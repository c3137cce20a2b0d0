package com.netcracker.core.tagsync.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.service.retry.RemoteCallPolicies;
import com.netcracker.core.tagsync.service.retry.RetryDriver;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Decorates a {@link RemoteDirectoryService} so that listings use the read retry budget and every
 * mutation uses the write budget.
 */
public final class RetryingRemoteDirectoryService implements RemoteDirectoryService {
    private final RemoteDirectoryService delegate;
    private final RetryDriver retryDriver;
    private final RemoteCallPolicies policies;

    public RetryingRemoteDirectoryService(RemoteDirectoryService delegate,
                                          RetryDriver retryDriver,
                                          RemoteCallPolicies policies) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.retryDriver = Objects.requireNonNull(retryDriver, "retryDriver");
        this.policies = Objects.requireNonNull(policies, "policies");
    }

    @Override
    public CompletableFuture<List<Entity>> list(EntityType type, String parentPath) {
        return retryDriver.execute(type.getPathSegment() + ".list",
                () -> delegate.list(type, parentPath), policies.getReads());
    }

    @Override
    public CompletableFuture<Entity> create(EntityType type, String parentPath, ObjectNode body) {
        return retryDriver.execute(type.getPathSegment() + ".create",
                () -> delegate.create(type, parentPath, body), policies.getWrites());
    }

    @Override
    public CompletableFuture<Entity> update(EntityType type, String path, ObjectNode body, String fingerprint) {
        return retryDriver.execute(type.getPathSegment() + ".update",
                () -> delegate.update(type, path, body, fingerprint), policies.getWrites());
    }

    @Override
    public CompletableFuture<Void> delete(EntityType type, String path) {
        return retryDriver.execute(type.getPathSegment() + ".delete",
                () -> delegate.delete(type, path), policies.getWrites());
    }

    @Override
    public CompletableFuture<Void> enableBuiltInVariables(String workspacePath, List<String> types) {
        return retryDriver.execute("built_in_variables.create",
                () -> delegate.enableBuiltInVariables(workspacePath, types), policies.getWrites());
    }

    @Override
    public CompletableFuture<Void> disableBuiltInVariables(String workspacePath, List<String> types) {
        return retryDriver.execute("built_in_variables.delete",
                () -> delegate.disableBuiltInVariables(workspacePath, types), policies.getWrites());
    }

    @Override
    public CompletableFuture<Void> moveEntitiesToFolder(String folderPath, List<String> tagIds,
                                                        List<String> triggerIds, List<String> variableIds) {
        return retryDriver.execute("folders.move_entities_to_folder",
                () -> delegate.moveEntitiesToFolder(folderPath, tagIds, triggerIds, variableIds),
                policies.getWrites());
    }
}
