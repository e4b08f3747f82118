package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.RebuildPolicy;
import com.platform.gatewayctl.model.RouteDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Deletes a route's existing leaf resource when its rebuild policy asks for it.
 * Deletion cascades to the leaf's methods, integrations, responses and descendants.
 */
@Slf4j
public class ResourcePruner {

    private final ControlPlaneClient client;
    private final ResourceTreeResolver resolver;

    public ResourcePruner(ControlPlaneClient client, ResourceTreeResolver resolver) {
        this.client = client;
        this.resolver = resolver;
    }

    /**
     * @return {@link StepOutcome#DELETED} if the leaf was removed, {@link StepOutcome#SKIPPED} otherwise
     */
    public StepOutcome prune(String apiId, RouteDefinition route) {
        if (route.rebuildPolicy() == RebuildPolicy.NEVER) {
            return StepOutcome.SKIPPED;
        }
        Optional<String> leaf = resolver.findExisting(apiId, route.path());
        if (leaf.isEmpty()) {
            return StepOutcome.SKIPPED;
        }
        String leafId = leaf.get();

        if (route.rebuildPolicy() == RebuildPolicy.ON_INTEGRATION_TYPE_CHANGE) {
            Optional<IntegrationSpec> current = client.getMethod(apiId, leafId, route.verb()).isPresent()
                ? client.getIntegration(apiId, leafId, route.verb())
                : Optional.empty();
            if (current.isEmpty() || current.get().type() == route.integrationType()) {
                return StepOutcome.SKIPPED;
            }
            log.info("Integration type of {} changes from {} to {}, rebuilding the resource",
                route.path(), current.get().type(), route.integrationType());
        }

        client.deleteResource(apiId, leafId);
        log.info("Deleted resource {} ({})", route.path(), leafId);
        return StepOutcome.DELETED;
    }
}
