package com.platform.gatewayctl.client;

import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.model.RestApi;
import com.platform.gatewayctl.observability.MetricsRegistry;
import com.platform.gatewayctl.retry.RetryEngine;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decorates a control-plane client with bounded retries of transient failures and call metrics.
 */
public class RetryingControlPlaneClient implements ControlPlaneClient {

    private final ControlPlaneClient delegate;
    private final RetryEngine retryEngine;
    private final MetricsRegistry metricsRegistry;

    public RetryingControlPlaneClient(ControlPlaneClient delegate, RetryEngine retryEngine,
                                      MetricsRegistry metricsRegistry) {
        this.delegate = delegate;
        this.retryEngine = retryEngine;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public List<RestApi> findApisByName(String name) {
        return call("findApisByName", () -> delegate.findApisByName(name));
    }

    @Override
    public List<GatewayResource> getResources(String apiId) {
        return call("getResources", () -> delegate.getResources(apiId));
    }

    @Override
    public GatewayResource createResource(String apiId, String parentId, String pathPart) {
        return call("createResource", () -> delegate.createResource(apiId, parentId, pathPart));
    }

    @Override
    public void deleteResource(String apiId, String resourceId) {
        run("deleteResource", () -> delegate.deleteResource(apiId, resourceId));
    }

    @Override
    public void putMethod(String apiId, String resourceId, MethodSpec method) {
        run("putMethod", () -> delegate.putMethod(apiId, resourceId, method));
    }

    @Override
    public Optional<MethodSpec> getMethod(String apiId, String resourceId, HttpVerb verb) {
        return call("getMethod", () -> delegate.getMethod(apiId, resourceId, verb));
    }

    @Override
    public void updateMethod(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations) {
        run("updateMethod", () -> delegate.updateMethod(apiId, resourceId, verb, operations));
    }

    @Override
    public void putIntegration(String apiId, String resourceId, HttpVerb verb, IntegrationSpec integration,
                               boolean overwrite) {
        run("putIntegration", () -> delegate.putIntegration(apiId, resourceId, verb, integration, overwrite));
    }

    @Override
    public Optional<IntegrationSpec> getIntegration(String apiId, String resourceId, HttpVerb verb) {
        return call("getIntegration", () -> delegate.getIntegration(apiId, resourceId, verb));
    }

    @Override
    public void updateIntegration(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations) {
        run("updateIntegration", () -> delegate.updateIntegration(apiId, resourceId, verb, operations));
    }

    @Override
    public void putMethodResponse(String apiId, String resourceId, HttpVerb verb, MethodResponseSpec response) {
        run("putMethodResponse", () -> delegate.putMethodResponse(apiId, resourceId, verb, response));
    }

    @Override
    public Optional<MethodResponseSpec> getMethodResponse(String apiId, String resourceId, HttpVerb verb,
                                                          String statusCode) {
        return call("getMethodResponse", () -> delegate.getMethodResponse(apiId, resourceId, verb, statusCode));
    }

    @Override
    public void updateMethodResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                                     List<PatchOperation> operations) {
        run("updateMethodResponse",
            () -> delegate.updateMethodResponse(apiId, resourceId, verb, statusCode, operations));
    }

    @Override
    public void putIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                       IntegrationResponseSpec response) {
        run("putIntegrationResponse", () -> delegate.putIntegrationResponse(apiId, resourceId, verb, response));
    }

    @Override
    public Optional<IntegrationResponseSpec> getIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                                                    String statusCode) {
        return call("getIntegrationResponse",
            () -> delegate.getIntegrationResponse(apiId, resourceId, verb, statusCode));
    }

    @Override
    public void updateIntegrationResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                                          List<PatchOperation> operations) {
        run("updateIntegrationResponse",
            () -> delegate.updateIntegrationResponse(apiId, resourceId, verb, statusCode, operations));
    }

    @Override
    public Deployment createDeployment(String apiId, String stageName, String description) {
        return call("createDeployment", () -> delegate.createDeployment(apiId, stageName, description));
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> action) {
        return retryEngine.executeWithRetry(operation, () -> timed(operation, action));
    }

    private <T> T timed(String operation, Supplier<T> action) {
        long start = System.currentTimeMillis();
        String outcome = "success";
        try {
            return action.get();
        } catch (GatewayControlException e) {
            outcome = e.getErrorCode().getCode();
            throw e;
        } finally {
            metricsRegistry.recordCall(operation, outcome, System.currentTimeMillis() - start);
        }
    }
}
