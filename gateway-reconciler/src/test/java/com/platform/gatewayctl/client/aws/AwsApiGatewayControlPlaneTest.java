package com.platform.gatewayctl.client.aws;

import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.TransientControlPlaneException;
import com.platform.gatewayctl.model.AuthorizationType;
import com.platform.gatewayctl.model.ContentHandling;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.IntegrationType;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PassthroughBehavior;
import com.platform.gatewayctl.model.PatchOperation;
import com.platform.gatewayctl.reconcile.PatchPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Answers;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.ContentHandlingStrategy;
import software.amazon.awssdk.services.apigateway.model.CreateDeploymentRequest;
import software.amazon.awssdk.services.apigateway.model.CreateDeploymentResponse;
import software.amazon.awssdk.services.apigateway.model.GetIntegrationRequest;
import software.amazon.awssdk.services.apigateway.model.GetIntegrationResponse;
import software.amazon.awssdk.services.apigateway.model.GetMethodRequest;
import software.amazon.awssdk.services.apigateway.model.GetMethodResponse;
import software.amazon.awssdk.services.apigateway.model.NotFoundException;
import software.amazon.awssdk.services.apigateway.model.Op;
import software.amazon.awssdk.services.apigateway.model.PutIntegrationRequest;
import software.amazon.awssdk.services.apigateway.model.PutIntegrationResponse;
import software.amazon.awssdk.services.apigateway.model.PutMethodRequest;
import software.amazon.awssdk.services.apigateway.model.PutMethodResponse;
import software.amazon.awssdk.services.apigateway.model.TooManyRequestsException;
import software.amazon.awssdk.services.apigateway.model.UpdateIntegrationRequest;
import software.amazon.awssdk.services.apigateway.model.UpdateIntegrationResponse;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.withSettings;

class AwsApiGatewayControlPlaneTest {

    private ApiGatewayClient apiGateway;
    private AwsApiGatewayControlPlane controlPlane;

    @BeforeEach
    void setUp() {
        // consumer-builder overloads are default methods delegating to the request overloads stubbed below
        apiGateway = mock(ApiGatewayClient.class, withSettings().defaultAnswer(Answers.CALLS_REAL_METHODS));
        controlPlane = new AwsApiGatewayControlPlane(apiGateway);
    }

    private static IntegrationSpec transformedIntegration() {
        return new IntegrationSpec(IntegrationType.HTTP, HttpVerb.ANY, "http://10.0.0.5:8000/api/{proxy}",
            Map.of("integration.request.path.proxy", "method.request.path.proxy"),
            Map.of("application/json", "$input.json('$')"),
            PassthroughBehavior.WHEN_NO_MATCH, ContentHandling.CONVERT_TO_TEXT);
    }

    @Test
    @DisplayName("putMethod sends verb, authorization and required path parameters")
    void putMethod() {
        doReturn(PutMethodResponse.builder().build()).when(apiGateway).putMethod(any(PutMethodRequest.class));

        controlPlane.putMethod("api-1", "res-3",
            new MethodSpec(HttpVerb.ANY, AuthorizationType.NONE, Map.of("method.request.path.proxy", true)));

        ArgumentCaptor<PutMethodRequest> request = ArgumentCaptor.forClass(PutMethodRequest.class);
        verify(apiGateway).putMethod(request.capture());
        assertThat(request.getValue().restApiId()).isEqualTo("api-1");
        assertThat(request.getValue().resourceId()).isEqualTo("res-3");
        assertThat(request.getValue().httpMethod()).isEqualTo("ANY");
        assertThat(request.getValue().authorizationType()).isEqualTo("NONE");
        assertThat(request.getValue().requestParameters()).containsEntry("method.request.path.proxy", true);
    }

    @Test
    @DisplayName("A missing integration reads as empty")
    void missingIntegrationIsEmpty() {
        doThrow(NotFoundException.builder().message("Invalid Integration identifier specified").build())
            .when(apiGateway).getIntegration(any(GetIntegrationRequest.class));

        assertThat(controlPlane.getIntegration("api-1", "res-3", HttpVerb.ANY)).isEmpty();
    }

    @Test
    @DisplayName("getIntegration maps type, verb, passthrough and content handling")
    void readsIntegration() {
        doReturn(GetIntegrationResponse.builder()
                .type("HTTP")
                .httpMethod("ANY")
                .uri("http://10.0.0.5:8000/api/{proxy}")
                .passthroughBehavior("WHEN_NO_MATCH")
                .contentHandling(ContentHandlingStrategy.CONVERT_TO_TEXT)
                .requestParameters(Map.of("integration.request.path.proxy", "method.request.path.proxy"))
                .build())
            .when(apiGateway).getIntegration(any(GetIntegrationRequest.class));

        assertThat(controlPlane.getIntegration("api-1", "res-3", HttpVerb.ANY)).hasValueSatisfying(i -> {
            assertThat(i.type()).isEqualTo(IntegrationType.HTTP);
            assertThat(i.integrationVerb()).isEqualTo(HttpVerb.ANY);
            assertThat(i.passthroughBehavior()).isEqualTo(PassthroughBehavior.WHEN_NO_MATCH);
            assertThat(i.contentHandling()).isEqualTo(ContentHandling.CONVERT_TO_TEXT);
            assertThat(i.requestTemplates()).isEmpty();
        });
    }

    @Test
    @DisplayName("An integration kind this tool does not manage reads as OTHER and needs an overwrite")
    void readsForeignIntegration() {
        doReturn(GetIntegrationResponse.builder()
                .type("MOCK")
                .passthroughBehavior("WHEN_NO_MATCH")
                .requestTemplates(Map.of("application/json", "{\"statusCode\": 200}"))
                .build())
            .when(apiGateway).getIntegration(any(GetIntegrationRequest.class));

        IntegrationSpec current = controlPlane.getIntegration("api-1", "res-3", HttpVerb.ANY).orElseThrow();

        assertThat(current.type()).isEqualTo(IntegrationType.OTHER);
        assertThat(current.integrationVerb()).isNull();
        assertThat(PatchPlanner.requiresOverwrite(current, transformedIntegration())).isTrue();
    }

    @Test
    @DisplayName("An unknown authorization type reads as null so that it gets replaced")
    void readsUnknownAuthorization() {
        doReturn(GetMethodResponse.builder()
                .httpMethod("ANY")
                .authorizationType("SOME_FUTURE_AUTHORIZER")
                .build())
            .when(apiGateway).getMethod(any(GetMethodRequest.class));

        MethodSpec current = controlPlane.getMethod("api-1", "res-3", HttpVerb.ANY).orElseThrow();

        assertThat(current.authorizationType()).isNull();
        assertThat(PatchPlanner.plan(current, new MethodSpec(HttpVerb.ANY, AuthorizationType.NONE, Map.of())))
            .containsExactly(PatchOperation.replace("/authorizationType", "NONE"));
    }

    @Test
    @DisplayName("putIntegration without overwrite refuses to replace an existing integration")
    void putIntegrationHonoursCreateSemantics() {
        doReturn(GetIntegrationResponse.builder().type("HTTP_PROXY").httpMethod("ANY").uri("http://old").build())
            .when(apiGateway).getIntegration(any(GetIntegrationRequest.class));

        assertThatThrownBy(() -> controlPlane.putIntegration("api-1", "res-3", HttpVerb.ANY,
                transformedIntegration(), false))
            .isInstanceOf(ResourceAlreadyExistsException.class);
        verify(apiGateway, never()).putIntegration(any(PutIntegrationRequest.class));
    }

    @Test
    @DisplayName("putIntegration with overwrite sends the full binding")
    void putIntegrationOverwrite() {
        doReturn(PutIntegrationResponse.builder().build()).when(apiGateway).putIntegration(any(PutIntegrationRequest.class));

        controlPlane.putIntegration("api-1", "res-3", HttpVerb.ANY, transformedIntegration(), true);

        ArgumentCaptor<PutIntegrationRequest> request = ArgumentCaptor.forClass(PutIntegrationRequest.class);
        verify(apiGateway).putIntegration(request.capture());
        verify(apiGateway, never()).getIntegration(any(GetIntegrationRequest.class));
        assertThat(request.getValue().typeAsString()).isEqualTo("HTTP");
        assertThat(request.getValue().integrationHttpMethod()).isEqualTo("ANY");
        assertThat(request.getValue().uri()).isEqualTo("http://10.0.0.5:8000/api/{proxy}");
        assertThat(request.getValue().requestParameters())
            .containsEntry("integration.request.path.proxy", "method.request.path.proxy");
        assertThat(request.getValue().passthroughBehavior()).isEqualTo("WHEN_NO_MATCH");
        assertThat(request.getValue().contentHandling()).isEqualTo(ContentHandlingStrategy.CONVERT_TO_TEXT);
    }

    @Test
    @DisplayName("Patch operations are sent with escaped map keys")
    void updateIntegration() {
        doReturn(UpdateIntegrationResponse.builder().build())
            .when(apiGateway).updateIntegration(any(UpdateIntegrationRequest.class));

        controlPlane.updateIntegration("api-1", "res-3", HttpVerb.ANY, List.of(
            PatchOperation.replace("/uri", "http://10.0.0.6:8000/api/{proxy}"),
            PatchOperation.remove(PatchOperation.mapEntryPath("requestTemplates", "application/json"))));

        ArgumentCaptor<UpdateIntegrationRequest> request = ArgumentCaptor.forClass(UpdateIntegrationRequest.class);
        verify(apiGateway).updateIntegration(request.capture());
        assertThat(request.getValue().patchOperations()).satisfiesExactly(
            op -> {
                assertThat(op.op()).isEqualTo(Op.REPLACE);
                assertThat(op.path()).isEqualTo("/uri");
            },
            op -> {
                assertThat(op.op()).isEqualTo(Op.REMOVE);
                assertThat(op.path()).isEqualTo("/requestTemplates/application~1json");
            });
    }

    @Test
    @DisplayName("Throttling is translated to a transient failure")
    void throttling() {
        doThrow(TooManyRequestsException.builder().message("Too Many Requests").statusCode(429).build())
            .when(apiGateway).createDeployment(any(CreateDeploymentRequest.class));

        assertThatThrownBy(() -> controlPlane.createDeployment("api-1", "prod", "release"))
            .isInstanceOf(TransientControlPlaneException.class);
    }

    @Test
    @DisplayName("createDeployment returns the new deployment for the stage")
    void createDeployment() {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        doReturn(CreateDeploymentResponse.builder().id("dep-9").description("release").createdDate(created).build())
            .when(apiGateway).createDeployment(any(CreateDeploymentRequest.class));

        Deployment deployment = controlPlane.createDeployment("api-1", "prod", "release");

        assertThat(deployment).isEqualTo(new Deployment("dep-9", "prod", "release", created));
    }
}
