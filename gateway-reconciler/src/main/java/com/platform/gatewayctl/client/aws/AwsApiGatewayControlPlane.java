package com.platform.gatewayctl.client.aws;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.model.AuthorizationType;
import com.platform.gatewayctl.model.ContentHandling;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.IntegrationType;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PassthroughBehavior;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.model.RestApi;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.ContentHandlingStrategy;
import software.amazon.awssdk.services.apigateway.model.CreateDeploymentResponse;
import software.amazon.awssdk.services.apigateway.model.CreateResourceResponse;
import software.amazon.awssdk.services.apigateway.model.GetIntegrationResponse;
import software.amazon.awssdk.services.apigateway.model.GetIntegrationResponseResponse;
import software.amazon.awssdk.services.apigateway.model.GetMethodResponse;
import software.amazon.awssdk.services.apigateway.model.GetMethodResponseResponse;
import software.amazon.awssdk.services.apigateway.model.NotFoundException;
import software.amazon.awssdk.services.apigateway.model.Op;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Control plane backed by the AWS API Gateway REST API through the AWS SDK v2.
 * <p>
 * SDK retries are disabled on the injected client; transient failures surface as
 * {@code TransientControlPlaneException} and are retried by the caller.
 */
@Slf4j
public class AwsApiGatewayControlPlane implements ControlPlaneClient {

    private static final int PAGE_SIZE = 500;

    private final ApiGatewayClient apiGateway;

    public AwsApiGatewayControlPlane(ApiGatewayClient apiGateway) {
        this.apiGateway = apiGateway;
    }

    @Override
    public List<RestApi> findApisByName(String name) {
        return call("getRestApis", "REST API", name, () ->
            apiGateway.getRestApisPaginator(r -> r.limit(PAGE_SIZE)).items().stream()
                .filter(api -> name.equals(api.name()))
                .map(api -> new RestApi(api.id(), api.name()))
                .toList());
    }

    @Override
    public List<GatewayResource> getResources(String apiId) {
        return call("getResources", "REST API", apiId, () ->
            apiGateway.getResourcesPaginator(r -> r.restApiId(apiId).limit(PAGE_SIZE)).items().stream()
                .map(r -> new GatewayResource(r.id(), r.parentId(), r.pathPart(), r.path()))
                .toList());
    }

    @Override
    public GatewayResource createResource(String apiId, String parentId, String pathPart) {
        CreateResourceResponse created = call("createResource", "Resource", parentId + "/" + pathPart, () ->
            apiGateway.createResource(r -> r.restApiId(apiId).parentId(parentId).pathPart(pathPart)));
        log.debug("Created resource {} ({})", created.path(), created.id());
        return new GatewayResource(created.id(), created.parentId(), created.pathPart(), created.path());
    }

    @Override
    public void deleteResource(String apiId, String resourceId) {
        call("deleteResource", "Resource", resourceId, () ->
            apiGateway.deleteResource(r -> r.restApiId(apiId).resourceId(resourceId)));
    }

    // ==================== Method ====================

    @Override
    public void putMethod(String apiId, String resourceId, MethodSpec method) {
        call("putMethod", "Method", resourceId + " " + method.verb(), () ->
            apiGateway.putMethod(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(method.verb().name())
                .authorizationType(method.authorizationType().name())
                .requestParameters(method.requestParameters())));
    }

    @Override
    public Optional<MethodSpec> getMethod(String apiId, String resourceId, HttpVerb verb) {
        return find("getMethod", "Method", resourceId + " " + verb, () -> {
            GetMethodResponse method = apiGateway.getMethod(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name()));
            return new MethodSpec(verb,
                remoteEnum(AuthorizationType.class, method.authorizationType()),
                method.requestParameters());
        });
    }

    @Override
    public void updateMethod(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations) {
        call("updateMethod", "Method", resourceId + " " + verb, () ->
            apiGateway.updateMethod(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .patchOperations(toSdk(operations))));
    }

    // ==================== Integration ====================

    @Override
    public void putIntegration(String apiId, String resourceId, HttpVerb verb, IntegrationSpec integration,
                               boolean overwrite) {
        // put-integration always replaces remotely; honour create semantics explicitly
        if (!overwrite && getIntegration(apiId, resourceId, verb).isPresent()) {
            throw new ResourceAlreadyExistsException("Integration", resourceId + " " + verb);
        }
        call("putIntegration", "Integration", resourceId + " " + verb, () ->
            apiGateway.putIntegration(r -> {
                r.restApiId(apiId)
                    .resourceId(resourceId)
                    .httpMethod(verb.name())
                    .type(integration.type().name())
                    .integrationHttpMethod(integration.integrationVerb().name())
                    .uri(integration.uri())
                    .requestParameters(integration.requestParameters())
                    .requestTemplates(integration.requestTemplates());
                if (integration.passthroughBehavior() != null) {
                    r.passthroughBehavior(integration.passthroughBehavior().name());
                }
                if (integration.contentHandling() != null) {
                    r.contentHandling(integration.contentHandling().name());
                }
            }));
    }

    @Override
    public Optional<IntegrationSpec> getIntegration(String apiId, String resourceId, HttpVerb verb) {
        return find("getIntegration", "Integration", resourceId + " " + verb, () -> {
            GetIntegrationResponse integration = apiGateway.getIntegration(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name()));
            return new IntegrationSpec(
                IntegrationType.fromRemote(integration.typeAsString()),
                integration.httpMethod() == null ? null : remoteEnum(HttpVerb.class, integration.httpMethod()),
                integration.uri(),
                integration.requestParameters(),
                integration.requestTemplates(),
                remoteEnum(PassthroughBehavior.class, integration.passthroughBehavior()),
                toContentHandling(integration.contentHandling()));
        });
    }

    @Override
    public void updateIntegration(String apiId, String resourceId, HttpVerb verb, List<PatchOperation> operations) {
        call("updateIntegration", "Integration", resourceId + " " + verb, () ->
            apiGateway.updateIntegration(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .patchOperations(toSdk(operations))));
    }

    // ==================== Method response ====================

    @Override
    public void putMethodResponse(String apiId, String resourceId, HttpVerb verb, MethodResponseSpec response) {
        call("putMethodResponse", "MethodResponse", resourceId + " " + verb + " " + response.statusCode(), () ->
            apiGateway.putMethodResponse(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .statusCode(response.statusCode())
                .responseParameters(response.responseParameters())));
    }

    @Override
    public Optional<MethodResponseSpec> getMethodResponse(String apiId, String resourceId, HttpVerb verb,
                                                          String statusCode) {
        return find("getMethodResponse", "MethodResponse", resourceId + " " + verb + " " + statusCode, () -> {
            GetMethodResponseResponse response = apiGateway.getMethodResponse(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .statusCode(statusCode));
            return new MethodResponseSpec(response.statusCode(), response.responseParameters());
        });
    }

    @Override
    public void updateMethodResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                                     List<PatchOperation> operations) {
        call("updateMethodResponse", "MethodResponse", resourceId + " " + verb + " " + statusCode, () ->
            apiGateway.updateMethodResponse(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .statusCode(statusCode)
                .patchOperations(toSdk(operations))));
    }

    // ==================== Integration response ====================

    @Override
    public void putIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                       IntegrationResponseSpec response) {
        // also replaced silently by the remote
        if (getIntegrationResponse(apiId, resourceId, verb, response.statusCode()).isPresent()) {
            throw new ResourceAlreadyExistsException("IntegrationResponse",
                resourceId + " " + verb + " " + response.statusCode());
        }
        call("putIntegrationResponse", "IntegrationResponse",
            resourceId + " " + verb + " " + response.statusCode(), () ->
                apiGateway.putIntegrationResponse(r -> r.restApiId(apiId)
                    .resourceId(resourceId)
                    .httpMethod(verb.name())
                    .statusCode(response.statusCode())
                    .responseParameters(response.responseParameters())
                    .responseTemplates(response.responseTemplates())));
    }

    @Override
    public Optional<IntegrationResponseSpec> getIntegrationResponse(String apiId, String resourceId, HttpVerb verb,
                                                                    String statusCode) {
        return find("getIntegrationResponse", "IntegrationResponse", resourceId + " " + verb + " " + statusCode,
            () -> {
                GetIntegrationResponseResponse response = apiGateway.getIntegrationResponse(r -> r.restApiId(apiId)
                    .resourceId(resourceId)
                    .httpMethod(verb.name())
                    .statusCode(statusCode));
                return new IntegrationResponseSpec(response.statusCode(), response.responseParameters(),
                    response.responseTemplates());
            });
    }

    @Override
    public void updateIntegrationResponse(String apiId, String resourceId, HttpVerb verb, String statusCode,
                                          List<PatchOperation> operations) {
        call("updateIntegrationResponse", "IntegrationResponse", resourceId + " " + verb + " " + statusCode, () ->
            apiGateway.updateIntegrationResponse(r -> r.restApiId(apiId)
                .resourceId(resourceId)
                .httpMethod(verb.name())
                .statusCode(statusCode)
                .patchOperations(toSdk(operations))));
    }

    // ==================== Deployment ====================

    @Override
    public Deployment createDeployment(String apiId, String stageName, String description) {
        CreateDeploymentResponse deployment = call("createDeployment", "Deployment", apiId + "/" + stageName, () ->
            apiGateway.createDeployment(r -> r.restApiId(apiId).stageName(stageName).description(description)));
        return new Deployment(deployment.id(), stageName, deployment.description(), deployment.createdDate());
    }

    // ==================== Internals ====================

    private static List<software.amazon.awssdk.services.apigateway.model.PatchOperation> toSdk(
            List<PatchOperation> operations) {
        return operations.stream()
            .map(op -> software.amazon.awssdk.services.apigateway.model.PatchOperation.builder()
                .op(switch (op.op()) {
                    case ADD -> Op.ADD;
                    case REPLACE -> Op.REPLACE;
                    case REMOVE -> Op.REMOVE;
                })
                .path(op.path())
                .value(op.value())
                .build())
            .toList();
    }

    /**
     * Values this tool does not model map to null, which never equals a desired value and so
     * leads to a patch or an overwrite.
     */
    private static <E extends Enum<E>> E remoteEnum(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            log.debug("Gateway reports {} {} which is not managed here", type.getSimpleName(), value);
            return null;
        }
    }

    private static ContentHandling toContentHandling(ContentHandlingStrategy strategy) {
        if (strategy == null || strategy == ContentHandlingStrategy.UNKNOWN_TO_SDK_VERSION) {
            return null;
        }
        return ContentHandling.valueOf(strategy.name());
    }

    private <T> T call(String operation, String resourceType, String target, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw AwsErrorTranslator.translate(operation, resourceType, target, e);
        }
    }

    private <T> Optional<T> find(String operation, String resourceType, String target, Supplier<T> action) {
        try {
            return Optional.of(action.get());
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw AwsErrorTranslator.translate(operation, resourceType, target, e);
        }
    }
}
