package com.netcracker.core.tagsync.client;

import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import org.junit.jupiter.api.Test;

import static com.netcracker.core.tagsync.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class WorkspacePathsTest {
    private static final String WORKSPACE = "accounts/1/containers/2/workspaces/3";

    @Test
    void buildsHierarchicalPaths() {
        assertThat(WorkspacePaths.workspacePath("1", "2", "3")).isEqualTo(WORKSPACE);
        assertThat(WorkspacePaths.containerOf(WORKSPACE)).isEqualTo("accounts/1/containers/2");
    }

    @Test
    void environmentsLiveInContainer() {
        assertThat(WorkspacePaths.parentPath(WORKSPACE, EntityType.ENVIRONMENT)).isEqualTo("accounts/1/containers/2");
        assertThat(WorkspacePaths.parentPath(WORKSPACE, EntityType.TAG)).isEqualTo(WORKSPACE);
        assertThat(WorkspacePaths.entityPath(WORKSPACE, EntityType.BUILT_IN_VARIABLE, "x"))
                .isEqualTo(WORKSPACE + "/built_in_variables/x");
    }

    @Test
    void observedPathWinsOverIdPath() {
        Entity withPath = Entity.fromJson(EntityType.TAG, json("{name: 'T', tagId: '1', path: 'custom/path'}"));
        Entity withId = Entity.fromJson(EntityType.TAG, json("{name: 'T', tagId: '1'}"));
        Entity without = Entity.fromJson(EntityType.TAG, json("{name: 'T'}"));

        assertThat(WorkspacePaths.pathOf(WORKSPACE, EntityType.TAG, withPath)).isEqualTo("custom/path");
        assertThat(WorkspacePaths.pathOf(WORKSPACE, EntityType.TAG, withId)).isEqualTo(WORKSPACE + "/tags/1");
        assertThat(WorkspacePaths.pathOf(WORKSPACE, EntityType.TAG, without)).isNull();
    }
}
