package com.platform.gatewayctl.client.memory;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.model.RestApi;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strongly consistent in-memory control plane.
 * <p>
 * Honours the same contract as the remote one: duplicate creates report
 * {@link ResourceAlreadyExistsException}, putting an integration before its method or an
 * integration response before its method response reports a
 * {@link ResourceConflictException}, deletes cascade, and a deployment freezes the
 * current tree into a snapshot that its stage serves until the next deployment.
 * Every call is appended to a call log so that tests can assert on ordering.
 */
@Slf4j
public class InMemoryControlPlane implements ControlPlaneClient {

    private final Map<String, ApiState> apis = new LinkedHashMap<>();
    private final List<String> callLog = new ArrayList<>();
    private final Map<String, Deque<RuntimeException>> injectedFailures = new HashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryControlPlane() {
        this(Clock.systemUTC());
    }

    public InMemoryControlPlane(Clock clock) {
        this.clock = clock;
    }

    // ==================== Setup and inspection ====================

    /**
     * Create an API with an empty root resource.
     */
    public synchronized RestApi createApi(String name) {
        String apiId = nextId("api");
        ApiState api = new ApiState(apiId, name);
        String rootId = nextId("res");
        api.resources.put(rootId, new ResourceNode(new GatewayResource(rootId, null, null, "/")));
        apis.put(apiId, api);
        log.debug("Created API {} ({}) with root {}", name, apiId, rootId);
        return new RestApi(apiId, name);
    }

    /**
     * Make the next call of the named operation fail with the given exception.
     * Failures queue up, so several may be injected for the same operation.
     */
    public synchronized void failNext(String operation, RuntimeException failure) {
        injectedFailures.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(failure);
    }

    /**
     * Calls received so far, e.g. {@code putIntegrationResponse res-3 ANY 200}.
     */
    public synchronized List<String> getCallLog() {
        return List.copyOf(callLog);
    }

    public synchronized void clearCallLog() {
        callLog.clear();
    }

    /**
     * Current, not yet deployed, configuration of an API.
     */
    public synchronized ApiSnapshot currentConfiguration(String apiId) {
        return api(apiId).snapshot();
    }

    /**
     * Configuration the stage serves, empty until a first deployment.
     */
    public synchronized Optional<ApiSnapshot> stageConfiguration(String apiId, String stageName) {
        ApiState api = api(apiId);
        String deploymentId = api.stages.get(stageName);
        return deploymentId == null ? Optional.empty() : Optional.of(api.snapshots.get(deploymentId));
    }

    public synchronized List<Deployment> getDeployments(String apiId) {
        return List.copyOf(api(apiId).deployments);
    }

    // ==================== ControlPlaneClient ====================

    @Override
    public synchronized List<RestApi> findApisByName(String name) {
        logCall("findApisByName " + name);
        return apis.values().stream()
            .filter(a -> a.name.equals(name))
            .map(a -> new RestApi(a.id, a.name))
            .toList();
    }

    @Override
    public synchronized List<GatewayResource> getResources(String apiId) {
        logCall("getResources " + apiId);
        return api(apiId).resources.values().stream()
            .map(ResourceNode::resource)
            .toList();
    }

    @Override
    public synchronized GatewayResource createResource(String apiId, String parentId, String pathPart) {
        logCall("createResource " + parentId + " " + pathPart);
        ApiState api = api(apiId);
        ResourceNode parent = resource(api, parentId);
        boolean duplicate = api.resources.values().stream()
            .map(ResourceNode::resource)
            .anyMatch(r -> r.isChildOf(parentId) && pathPart.equals(r.pathPart()));
        if (duplicate) {
            throw new ResourceAlreadyExistsException("Resource", childPath(parent.resource, pathPart));
        }
        String id = nextId("res");
        GatewayResource created = new GatewayResource(id, parentId, pathPart, childPath(parent.resource, pathPart));
        api.resources.put(id, new ResourceNode(created));
        return created;
    }

    @Override
    public synchronized void deleteResource(String apiId, String resourceId) {
        logCall("deleteResource " + resourceId);
        ApiState api = api(apiId);
        ResourceNode node = resource(api, resourceId);
        if (node.resource.isRoot()) {
            throw new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, "Resource", resourceId,
                "The root resource cannot be deleted");
        }
        deleteRecursively(api, resourceId);
    }

    private void deleteRecursively(ApiState api, String resourceId) {
        List<String> children = api.resources.values().stream()
            .map(ResourceNode::resource)
            .filter(r -> r.isChildOf(resourceId))
            .map(GatewayResource::id)
            .toList();
        children.forEach(child -> deleteRecursively(api, child));
        api.resources.remove(resourceId);
    }

    @Override
    public synchronized void putMethod(String apiId, String resourceId, MethodSpec method) {
        logCall("putMethod " + resourceId + " " + method.verb());
        ResourceNode node = resource(api(apiId), resourceId);
        if (node.methods.containsKey(method.verb())) {
            throw new ResourceAlreadyExistsException("Method", resourceId + " " + method.verb());
        }
        node.methods.put(method.verb(), new MethodNode(method));
    }

    @Override
    public synchronized Optional<MethodSpec> getMethod(String apiId, String resourceId, HttpVerb verb) {
        logCall("getMethod " + resourceId + " " + verb);
        return Optional.ofNullable(resource(api(apiId), resourceId).methods.get(verb))
            .map(m -> m.method);
    }

    @Override
    public synchronized void updateMethod(String apiId, String resourceId, HttpVerb verb,
                                          List<PatchOperation> operations) {
        logCall("updateMethod " + resourceId + " " + verb);
        MethodNode method = method(apiId, resourceId, verb);
        method.method = PatchApplier.apply(method.method, operations);
    }

    @Override
    public synchronized void putIntegration(String apiId, String resourceId, HttpVerb verb,
                                            IntegrationSpec integration, boolean overwrite) {
        logCall("putIntegration " + resourceId + " " + verb);
        MethodNode method = requireDependency(apiId, resourceId, verb, "Integration");
        if (method.integration != null && !overwrite) {
            throw new ResourceAlreadyExistsException("Integration", resourceId + " " + verb);
        }
        method.integration = integration;
    }

    @Override
    public synchronized Optional<IntegrationSpec> getIntegration(String apiId, String resourceId, HttpVerb verb) {
        logCall("getIntegration " + resourceId + " " + verb);
        return Optional.ofNullable(resource(api(apiId), resourceId).methods.get(verb))
            .map(m -> m.integration);
    }

    @Override
    public synchronized void updateIntegration(String apiId, String resourceId, HttpVerb verb,
                                               List<PatchOperation> operations) {
        logCall("updateIntegration " + resourceId + " " + verb);
        MethodNode method = method(apiId, resourceId, verb);
        if (method.integration == null) {
            throw new ResourceNotFoundException("Integration", resourceId + " " + verb);
        }
        method.integration = PatchApplier.apply(method.integration, operations);
    }

    @Override
    public synchronized void putMethodResponse(String apiId, String resourceId, HttpVerb verb,
                                               MethodResponseSpec response) {
        logCall("putMethodResponse " + resourceId + " " + verb + " " + response.statusCode());
        MethodNode method = requireDependency(apiId, resourceId, verb, "MethodResponse");
        if (method.methodResponses.containsKey(response.statusCode())) {
            throw new ResourceAlreadyExistsException("MethodResponse",
                resourceId + " " + verb + " " + response.statusCode());
        }
        method.methodResponses.put(response.statusCode(), response);
    }

    @Override
    public synchronized Optional<MethodResponseSpec> getMethodResponse(String apiId, String resourceId,
                                                                       HttpVerb verb, String statusCode) {
        logCall("getMethodResponse " + resourceId + " " + verb + " " + statusCode);
        return Optional.ofNullable(resource(api(apiId), resourceId).methods.get(verb))
            .map(m -> m.methodResponses.get(statusCode));
    }

    @Override
    public synchronized void updateMethodResponse(String apiId, String resourceId, HttpVerb verb,
                                                  String statusCode, List<PatchOperation> operations) {
        logCall("updateMethodResponse " + resourceId + " " + verb + " " + statusCode);
        MethodNode method = method(apiId, resourceId, verb);
        MethodResponseSpec current = method.methodResponses.get(statusCode);
        if (current == null) {
            throw new ResourceNotFoundException("MethodResponse", resourceId + " " + verb + " " + statusCode);
        }
        method.methodResponses.put(statusCode, PatchApplier.apply(current, operations));
    }

    @Override
    public synchronized void putIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                                    IntegrationResponseSpec response) {
        logCall("putIntegrationResponse " + resourceId + " " + verb + " " + response.statusCode());
        MethodNode method = requireDependency(apiId, resourceId, verb, "IntegrationResponse");
        if (method.integration == null) {
            throw ResourceConflictException.missingDependency("IntegrationResponse", resourceId,
                "integration of " + verb);
        }
        if (!method.methodResponses.containsKey(response.statusCode())) {
            throw ResourceConflictException.missingDependency("IntegrationResponse", resourceId,
                "method response " + response.statusCode());
        }
        if (method.integrationResponses.containsKey(response.statusCode())) {
            throw new ResourceAlreadyExistsException("IntegrationResponse",
                resourceId + " " + verb + " " + response.statusCode());
        }
        method.integrationResponses.put(response.statusCode(), response);
    }

    @Override
    public synchronized Optional<IntegrationResponseSpec> getIntegrationResponse(String apiId, String resourceId,
                                                                                 HttpVerb verb, String statusCode) {
        logCall("getIntegrationResponse " + resourceId + " " + verb + " " + statusCode);
        return Optional.ofNullable(resource(api(apiId), resourceId).methods.get(verb))
            .map(m -> m.integrationResponses.get(statusCode));
    }

    @Override
    public synchronized void updateIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                                       String statusCode, List<PatchOperation> operations) {
        logCall("updateIntegrationResponse " + resourceId + " " + verb + " " + statusCode);
        MethodNode method = method(apiId, resourceId, verb);
        IntegrationResponseSpec current = method.integrationResponses.get(statusCode);
        if (current == null) {
            throw new ResourceNotFoundException("IntegrationResponse", resourceId + " " + verb + " " + statusCode);
        }
        method.integrationResponses.put(statusCode, PatchApplier.apply(current, operations));
    }

    @Override
    public synchronized Deployment createDeployment(String apiId, String stageName, String description) {
        logCall("createDeployment " + apiId + " " + stageName);
        ApiState api = api(apiId);
        boolean servesTraffic = api.resources.values().stream()
            .flatMap(r -> r.methods.values().stream())
            .anyMatch(m -> m.integration != null);
        if (!servesTraffic) {
            throw new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, "Deployment", apiId,
                "The REST API doesn't contain any methods with an integration");
        }
        Deployment deployment = new Deployment(nextId("dep"), stageName, description, Instant.now(clock));
        api.deployments.add(deployment);
        api.snapshots.put(deployment.id(), api.snapshot());
        api.stages.put(stageName, deployment.id());
        log.debug("Deployment {} now serves stage {} of {}", deployment.id(), stageName, apiId);
        return deployment;
    }

    // ==================== Internals ====================

    private void logCall(String call) {
        callLog.add(call);
        String operation = call.substring(0, call.indexOf(' ') < 0 ? call.length() : call.indexOf(' '));
        Deque<RuntimeException> failures = injectedFailures.get(operation);
        if (failures != null && !failures.isEmpty()) {
            throw failures.poll();
        }
    }

    private String nextId(String prefix) {
        return prefix + "-" + idSequence.incrementAndGet();
    }

    private ApiState api(String apiId) {
        ApiState api = apis.get(apiId);
        if (api == null) {
            throw new ResourceNotFoundException("REST API", apiId);
        }
        return api;
    }

    private static ResourceNode resource(ApiState api, String resourceId) {
        ResourceNode node = api.resources.get(resourceId);
        if (node == null) {
            throw new ResourceNotFoundException("Resource", resourceId);
        }
        return node;
    }

    private MethodNode method(String apiId, String resourceId, HttpVerb verb) {
        MethodNode method = resource(api(apiId), resourceId).methods.get(verb);
        if (method == null) {
            throw new ResourceNotFoundException("Method", resourceId + " " + verb);
        }
        return method;
    }

    private MethodNode requireDependency(String apiId, String resourceId, HttpVerb verb, String dependent) {
        MethodNode method = resource(api(apiId), resourceId).methods.get(verb);
        if (method == null) {
            throw ResourceConflictException.missingDependency(dependent, resourceId, "method " + verb);
        }
        return method;
    }

    private static String childPath(GatewayResource parent, String pathPart) {
        return parent.isRoot() ? "/" + pathPart : parent.path() + "/" + pathPart;
    }

    private static final class ApiState {
        private final String id;
        private final String name;
        private final Map<String, ResourceNode> resources = new LinkedHashMap<>();
        private final List<Deployment> deployments = new ArrayList<>();
        private final Map<String, ApiSnapshot> snapshots = new HashMap<>();
        private final Map<String, String> stages = new HashMap<>();

        private ApiState(String id, String name) {
            this.id = id;
            this.name = name;
        }

        private ApiSnapshot snapshot() {
            List<ApiSnapshot.ResourceSnapshot> frozen = new ArrayList<>();
            for (ResourceNode node : resources.values()) {
                Map<HttpVerb, ApiSnapshot.MethodSnapshot> methods = new EnumMap<>(HttpVerb.class);
                node.methods.forEach((verb, m) -> methods.put(verb, new ApiSnapshot.MethodSnapshot(
                    m.method, m.integration, m.methodResponses, m.integrationResponses)));
                frozen.add(new ApiSnapshot.ResourceSnapshot(node.resource, methods));
            }
            return new ApiSnapshot(frozen);
        }
    }

    private record ResourceNode(GatewayResource resource, Map<HttpVerb, MethodNode> methods) {
        private ResourceNode(GatewayResource resource) {
            this(resource, new EnumMap<>(HttpVerb.class));
        }
    }

    private static final class MethodNode {
        private MethodSpec method;
        private IntegrationSpec integration;
        private final Map<String, MethodResponseSpec> methodResponses = new TreeMap<>();
        private final Map<String, IntegrationResponseSpec> integrationResponses = new TreeMap<>();

        private MethodNode(MethodSpec method) {
            this.method = method;
        }
    }
}
