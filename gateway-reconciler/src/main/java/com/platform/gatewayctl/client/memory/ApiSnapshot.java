package com.platform.gatewayctl.client.memory;

import com.platform.gatewayctl.model.DeployedRoute;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PathTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen copy of an API's resource tree, as captured by a deployment.
 */
public record ApiSnapshot(List<ResourceSnapshot> resources) {
    
    public ApiSnapshot {
        resources = List.copyOf(resources);
    }
    
    public record ResourceSnapshot(
        GatewayResource resource,
        Map<HttpVerb, MethodSnapshot> methods
    ) {
        public ResourceSnapshot {
            methods = Map.copyOf(methods);
        }
    }
    
    public record MethodSnapshot(
        MethodSpec method,
        IntegrationSpec integration,
        Map<String, MethodResponseSpec> methodResponses,
        Map<String, IntegrationResponseSpec> integrationResponses
    ) {
        public MethodSnapshot {
            methodResponses = Map.copyOf(methodResponses);
            integrationResponses = Map.copyOf(integrationResponses);
        }
    }
    
    public Optional<ResourceSnapshot> findByPath(String path) {
        return resources.stream()
            .filter(r -> r.resource().path().equals(path))
            .findFirst();
    }
    
    /**
     * Methods that have an integration, i.e. that actually serve traffic.
     */
    public List<DeployedRoute> routes() {
        List<DeployedRoute> routes = new ArrayList<>();
        for (ResourceSnapshot snapshot : resources) {
            snapshot.methods().forEach((verb, method) -> {
                if (method.integration() != null) {
                    routes.add(new DeployedRoute(
                        PathTemplate.parse(snapshot.resource().path()),
                        verb,
                        method.integration()));
                }
            });
        }
        return routes;
    }
}
