package com.netcracker.core.tagsync.client;

import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.model.Names;

import java.util.Objects;

/**
 * Resource paths of the remote directory: {@code accounts/{a}/containers/{c}/workspaces/{w}}.
 */
public final class WorkspacePaths {
    private static final String WORKSPACES_SEGMENT = "/workspaces/";

    private WorkspacePaths() {
    }

    public static String accountPath(String accountId) {
        return "accounts/" + Objects.requireNonNull(accountId, "accountId");
    }

    public static String containerPath(String accountId, String containerId) {
        return accountPath(accountId) + "/containers/" + Objects.requireNonNull(containerId, "containerId");
    }

    public static String workspacePath(String accountId, String containerId, String workspaceId) {
        return containerPath(accountId, containerId) + WORKSPACES_SEGMENT
                + Objects.requireNonNull(workspaceId, "workspaceId");
    }

    /**
     * Container a workspace path belongs to.
     */
    public static String containerOf(String workspacePath) {
        int idx = workspacePath.indexOf(WORKSPACES_SEGMENT);
        return idx < 0 ? workspacePath : workspacePath.substring(0, idx);
    }

    /**
     * Path under which entities of the type are listed and created.
     */
    public static String parentPath(String workspacePath, EntityType type) {
        return type.isContainerScoped() ? containerOf(workspacePath) : workspacePath;
    }

    public static String entityPath(String workspacePath, EntityType type, String id) {
        return parentPath(workspacePath, type) + "/" + type.getPathSegment() + "/" + id;
    }

    /**
     * Path of an observed entity: its own {@code path} when the snapshot carries one, otherwise the path
     * derived from its id; {@code null} when neither is known.
     */
    public static String pathOf(String workspacePath, EntityType type, Entity entity) {
        if (!entity.hasIdentifier()) {
            return null;
        }
        return Names.isBlank(entity.getPath()) ? entityPath(workspacePath, type, entity.getId()) : entity.getPath();
    }
}
