package com.netcracker.core.tagsync.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netcracker.core.tagsync.model.Entity;
import com.netcracker.core.tagsync.model.EntityType;
import com.netcracker.core.tagsync.service.retry.RemoteCallPolicies;
import com.netcracker.core.tagsync.service.retry.RetryDriver;
import com.netcracker.core.tagsync.service.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static com.netcracker.core.tagsync.TestJson.object;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetryingRemoteDirectoryServiceTest {
    private static final String WORKSPACE = "accounts/1/containers/2/workspaces/3";

    private RemoteDirectoryService delegate;
    private RetryDriver retryDriver;
    private RemoteCallPolicies policies;
    private RetryingRemoteDirectoryService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        delegate = mock(RemoteDirectoryService.class);
        retryDriver = mock(RetryDriver.class);
        policies = new RemoteCallPolicies(
                RetryPolicy.builder().maxRetries(5).build(), RetryPolicy.builder().maxRetries(2).build());
        service = new RetryingRemoteDirectoryService(delegate, retryDriver, policies);
        when(retryDriver.execute(anyString(), any(Supplier.class), any(RetryPolicy.class)))
                .thenAnswer(invocation -> ((Supplier<CompletableFuture<?>>) invocation.getArgument(1)).get());
    }

    @Test
    void listingUsesReadBudget() {
        List<Entity> tags = List.of(Entity.fromJson(EntityType.TAG, object("{name: 'T', tagId: '1'}")));
        when(delegate.list(EntityType.TAG, WORKSPACE)).thenReturn(CompletableFuture.completedFuture(tags));

        assertThat(service.list(EntityType.TAG, WORKSPACE).join()).isEqualTo(tags);

        verify(retryDriver).execute(eq("tags.list"), any(), same(policies.getReads()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void mutationsUseWriteBudget() {
        ObjectNode body = object("{name: 'All Pages', type: 'pageview'}");
        Entity created = Entity.fromJson(EntityType.TRIGGER, object("{name: 'All Pages', triggerId: '5'}"));
        when(delegate.create(EntityType.TRIGGER, WORKSPACE, body)).thenReturn(CompletableFuture.completedFuture(created));
        when(delegate.delete(EntityType.TRIGGER, WORKSPACE + "/triggers/5"))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(delegate.enableBuiltInVariables(WORKSPACE, List.of("pageUrl")))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertThat(service.create(EntityType.TRIGGER, WORKSPACE, body).join()).isEqualTo(created);
        service.delete(EntityType.TRIGGER, WORKSPACE + "/triggers/5").join();
        service.enableBuiltInVariables(WORKSPACE, List.of("pageUrl")).join();

        ArgumentCaptor<String> operations = ArgumentCaptor.forClass(String.class);
        verify(retryDriver, times(3))
                .execute(operations.capture(), any(Supplier.class), same(policies.getWrites()));
        assertThat(operations.getAllValues())
                .containsExactly("triggers.create", "triggers.delete", "built_in_variables.create");
    }

    @Test
    void updatePassesFingerprintThrough() {
        ObjectNode body = object("{name: 'v', type: 'c'}");
        String path = WORKSPACE + "/variables/11";
        when(delegate.update(EntityType.VARIABLE, path, body, "fp-1"))
                .thenReturn(CompletableFuture.completedFuture(Entity.fromJson(EntityType.VARIABLE, body)));

        service.update(EntityType.VARIABLE, path, body, "fp-1").join();

        verify(delegate).update(EntityType.VARIABLE, path, body, "fp-1");
        verify(retryDriver).execute(eq("variables.update"), any(), same(policies.getWrites()));
    }
}
