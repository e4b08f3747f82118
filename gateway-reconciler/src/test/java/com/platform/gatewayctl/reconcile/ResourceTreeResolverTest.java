package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.client.memory.InMemoryControlPlane;
import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.PathTemplate;
import com.platform.gatewayctl.model.RestApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceTreeResolverTest {

    private static final PathTemplate PROXY = PathTemplate.parse("/api/{proxy+}");

    private InMemoryControlPlane controlPlane;
    private RestApi api;
    private ResourceTreeResolver resolver;

    @BeforeEach
    void setUp() {
        controlPlane = new InMemoryControlPlane();
        api = controlPlane.createApi("finance-api");
        resolver = new ResourceTreeResolver(controlPlane);
    }

    @Test
    @DisplayName("Missing segments are created root first")
    void createsMissingSegments() {
        ResourceTreeResolver.ResolvedPath resolved = resolver.resolve(api.id(), PROXY);

        assertThat(resolved.created()).extracting(GatewayResource::path).containsExactly("/api", "/api/{proxy+}");
        assertThat(resolved.leafId()).isEqualTo(resolved.created().get(1).id());
    }

    @Test
    @DisplayName("Resolving twice creates nothing the second time and yields the same leaf")
    void idempotent() {
        String first = resolver.resolve(api.id(), PROXY).leafId();
        controlPlane.clearCallLog();

        ResourceTreeResolver.ResolvedPath second = resolver.resolve(api.id(), PROXY);

        assertThat(second.leafId()).isEqualTo(first);
        assertThat(second.createdAny()).isFalse();
        assertThat(controlPlane.getCallLog()).noneMatch(call -> call.startsWith("createResource"));
    }

    @Test
    @DisplayName("Existing siblings are reused and kinds are never confused")
    void reusesSharedPrefixes() {
        String proxyLeaf = resolver.resolve(api.id(), PROXY).leafId();
        ResourceTreeResolver.ResolvedPath single = resolver.resolve(api.id(), PathTemplate.parse("/api/{proxy}"));
        ResourceTreeResolver.ResolvedPath literal = resolver.resolve(api.id(), PathTemplate.parse("/api/proxy"));

        assertThat(single.created()).extracting(GatewayResource::path).containsExactly("/api/{proxy}");
        assertThat(literal.created()).extracting(GatewayResource::path).containsExactly("/api/proxy");
        assertThat(single.leafId()).isNotEqualTo(proxyLeaf);
        assertThat(literal.leafId()).isNotEqualTo(proxyLeaf).isNotEqualTo(single.leafId());
    }

    @Test
    @DisplayName("findExisting creates nothing")
    void findExisting() {
        assertThat(resolver.findExisting(api.id(), PROXY)).isEmpty();

        String leaf = resolver.resolve(api.id(), PROXY).leafId();

        assertThat(resolver.findExisting(api.id(), PROXY)).contains(leaf);
        assertThat(resolver.findExisting(api.id(), PathTemplate.parse("/api"))).isPresent();
        assertThat(resolver.findExisting(api.id(), PathTemplate.parse("/"))).isPresent();
    }

    @Test
    @DisplayName("Two children matching one segment are reported as ambiguous")
    void ambiguousChildren() {
        ControlPlaneClient client = mock(ControlPlaneClient.class);
        when(client.getResources("api-1")).thenReturn(List.of(
            new GatewayResource("r", null, null, "/"),
            new GatewayResource("a1", "r", "api", "/api"),
            new GatewayResource("a2", "r", "api", "/api")));

        assertThatThrownBy(() -> new ResourceTreeResolver(client).resolve("api-1", PROXY))
            .isInstanceOf(ResourceConflictException.class)
            .extracting(e -> ((ResourceConflictException) e).getErrorCode())
            .isEqualTo(ErrorCode.AMBIGUOUS_MATCH);
        verify(client, never()).createResource(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("A tree without a root is reported as not found")
    void missingRoot() {
        ControlPlaneClient client = mock(ControlPlaneClient.class);
        when(client.getResources("api-1")).thenReturn(List.of());

        assertThatThrownBy(() -> new ResourceTreeResolver(client).resolve("api-1", PROXY))
            .isInstanceOf(ResourceNotFoundException.class)
            .extracting(e -> ((ResourceNotFoundException) e).getErrorCode())
            .isEqualTo(ErrorCode.ROOT_RESOURCE_NOT_FOUND);
    }

    @Test
    @DisplayName("A segment created concurrently is picked up after re-reading the tree")
    void concurrentCreate() {
        ControlPlaneClient client = mock(ControlPlaneClient.class);
        GatewayResource root = new GatewayResource("r", null, null, "/");
        GatewayResource apiResource = new GatewayResource("a", "r", "api", "/api");
        when(client.getResources("api-1")).thenReturn(List.of(root), List.of(root, apiResource));
        when(client.createResource("api-1", "r", "api"))
            .thenThrow(new ResourceAlreadyExistsException("Resource", "/api"));

        ResourceTreeResolver.ResolvedPath resolved = new ResourceTreeResolver(client)
            .resolve("api-1", PathTemplate.parse("/api"));

        assertThat(resolved.leafId()).isEqualTo("a");
        assertThat(resolved.createdAny()).isFalse();
    }
}
