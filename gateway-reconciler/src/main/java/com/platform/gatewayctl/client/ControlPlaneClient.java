package com.platform.gatewayctl.client;

import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.model.RestApi;

import java.util.List;
import java.util.Optional;

/**
 * Narrow view of a gateway control plane.
 * <p>
 * Implementations translate remote failures into the reconciler's exception hierarchy:
 * {@code ResourceNotFoundException}, {@code ResourceAlreadyExistsException},
 * {@code ResourceConflictException}, {@code PermissionDeniedException} and
 * {@code TransientControlPlaneException}. Reads after writes within one run are
 * assumed to be consistent.
 */
public interface ControlPlaneClient {

    /**
     * All REST APIs whose name equals {@code name}. The control plane does not enforce unique names.
     */
    List<RestApi> findApisByName(String name);

    /**
     * Every resource of the API, root included.
     */
    List<GatewayResource> getResources(String apiId);

    GatewayResource createResource(String apiId, String parentId, String pathPart);

    /**
     * Deletes the resource and cascades to its descendants, methods, integrations and responses.
     */
    void deleteResource(String apiId, String resourceId);

    // ==================== Method ====================

    /**
     * @throws com.platform.gatewayctl.error.ResourceAlreadyExistsException if the method exists
     */
    void putMethod(String apiId, String resourceId, MethodSpec method);

    Optional<MethodSpec> getMethod(String apiId, String resourceId, HttpVerb verb);

    void updateMethod(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations);

    // ==================== Integration ====================

    /**
     * Creates the integration. With {@code overwrite} set an existing integration is replaced
     * instead of reported as already existing.
     *
     * @throws com.platform.gatewayctl.error.ResourceConflictException if the method does not exist
     */
    void putIntegration(String apiId, String resourceId, HttpVerb verb, IntegrationSpec integration, boolean overwrite);

    Optional<IntegrationSpec> getIntegration(String apiId, String resourceId, HttpVerb verb);

    void updateIntegration(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations);

    // ==================== Method response ====================

    void putMethodResponse(String apiId, String resourceId, HttpVerb verb, MethodResponseSpec response);

    Optional<MethodResponseSpec> getMethodResponse(String apiId, String resourceId, HttpVerb verb, String statusCode);

    void updateMethodResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                              List<PatchOperation> operations);

    // ==================== Integration response ====================

    /**
     * @throws com.platform.gatewayctl.error.ResourceConflictException if the method response
     *         for the same status code does not exist
     */
    void putIntegrationResponse(String apiId, String resourceId, HttpVerb verb, IntegrationResponseSpec response);

    Optional<IntegrationResponseSpec> getIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                                             String statusCode);

    void updateIntegrationResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                                   List<PatchOperation> operations);

    // ==================== Deployment ====================

    /**
     * Snapshots the API's current configuration and points the stage at it.
     */
    Deployment createDeployment(String apiId, String stageName, String description);
}
