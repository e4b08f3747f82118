package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.model.RouteDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Converges the method stack of one leaf resource: method, integration, then for every
 * status code in ascending order the method response followed by the integration response.
 * <p>
 * Every step first tries to create. When the object already exists it is read back, diffed
 * and patched with only the differing fields; an integration whose type or verb changed is
 * re-put in overwrite mode instead.
 */
@Slf4j
public class MethodConfigurator {

    private final ControlPlaneClient client;

    public MethodConfigurator(ControlPlaneClient client) {
        this.client = client;
    }

    public void configure(ReconciliationContext context, String apiId, String resourceId, RouteDefinition route) {
        MethodStack stack = MethodStack.of(route);
        HttpVerb verb = route.verb();
        String target = route.path() + " " + verb;

        context.step(StepKind.METHOD, target,
            () -> ensureMethod(apiId, resourceId, stack.method()));
        context.step(StepKind.INTEGRATION, target,
            () -> ensureIntegration(apiId, resourceId, verb, stack.integration()));

        for (MethodStack.Response response : stack.responses()) {
            String statusTarget = target + " " + response.statusCode();
            context.step(StepKind.METHOD_RESPONSE, statusTarget,
                () -> ensureMethodResponse(apiId, resourceId, verb, response.methodResponse()));
            context.step(StepKind.INTEGRATION_RESPONSE, statusTarget,
                () -> ensureIntegrationResponse(apiId, resourceId, verb, response.integrationResponse()));
        }
    }

    StepOutcome ensureMethod(String apiId, String resourceId, MethodSpec desired) {
        try {
            client.putMethod(apiId, resourceId, desired);
            return StepOutcome.CREATED;
        } catch (ResourceAlreadyExistsException e) {
            MethodSpec current = client.getMethod(apiId, resourceId, desired.verb())
                .orElseThrow(() -> new ResourceNotFoundException("Method", resourceId + " " + desired.verb()));
            List<PatchOperation> operations = PatchPlanner.plan(current, desired);
            if (operations.isEmpty()) {
                return StepOutcome.UNCHANGED;
            }
            log.debug("Patching method {} {}: {}", resourceId, desired.verb(), operations);
            client.updateMethod(apiId, resourceId, desired.verb(), operations);
            return StepOutcome.UPDATED;
        }
    }

    StepOutcome ensureIntegration(String apiId, String resourceId, HttpVerb verb, IntegrationSpec desired) {
        try {
            client.putIntegration(apiId, resourceId, verb, desired, false);
            return StepOutcome.CREATED;
        } catch (ResourceAlreadyExistsException e) {
            IntegrationSpec current = client.getIntegration(apiId, resourceId, verb)
                .orElseThrow(() -> new ResourceNotFoundException("Integration", resourceId + " " + verb));
            if (PatchPlanner.requiresOverwrite(current, desired)) {
                log.info("Integration of {} {} changes from {} {} to {} {}, replacing it",
                    resourceId, verb, current.type(), current.integrationVerb(),
                    desired.type(), desired.integrationVerb());
                client.putIntegration(apiId, resourceId, verb, desired, true);
                return StepOutcome.UPDATED;
            }
            List<PatchOperation> operations = PatchPlanner.plan(current, desired);
            if (operations.isEmpty()) {
                return StepOutcome.UNCHANGED;
            }
            log.debug("Patching integration {} {}: {}", resourceId, verb, operations);
            client.updateIntegration(apiId, resourceId, verb, operations);
            return StepOutcome.UPDATED;
        }
    }

    StepOutcome ensureMethodResponse(String apiId, String resourceId, HttpVerb verb, MethodResponseSpec desired) {
        try {
            client.putMethodResponse(apiId, resourceId, verb, desired);
            return StepOutcome.CREATED;
        } catch (ResourceAlreadyExistsException e) {
            MethodResponseSpec current = client.getMethodResponse(apiId, resourceId, verb, desired.statusCode())
                .orElseThrow(() -> new ResourceNotFoundException("MethodResponse",
                    resourceId + " " + verb + " " + desired.statusCode()));
            List<PatchOperation> operations = PatchPlanner.plan(current, desired);
            if (operations.isEmpty()) {
                return StepOutcome.UNCHANGED;
            }
            client.updateMethodResponse(apiId, resourceId, verb, desired.statusCode(), operations);
            return StepOutcome.UPDATED;
        }
    }

    StepOutcome ensureIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                          IntegrationResponseSpec desired) {
        try {
            client.putIntegrationResponse(apiId, resourceId, verb, desired);
            return StepOutcome.CREATED;
        } catch (ResourceAlreadyExistsException e) {
            IntegrationResponseSpec current = client
                .getIntegrationResponse(apiId, resourceId, verb, desired.statusCode())
                .orElseThrow(() -> new ResourceNotFoundException("IntegrationResponse",
                    resourceId + " " + verb + " " + desired.statusCode()));
            List<PatchOperation> operations = PatchPlanner.plan(current, desired);
            if (operations.isEmpty()) {
                return StepOutcome.UNCHANGED;
            }
            client.updateIntegrationResponse(apiId, resourceId, verb, desired.statusCode(), operations);
            return StepOutcome.UPDATED;
        }
    }
}
