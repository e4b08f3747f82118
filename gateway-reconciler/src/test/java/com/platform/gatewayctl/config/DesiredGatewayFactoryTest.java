package com.platform.gatewayctl.config;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;
import com.platform.gatewayctl.model.BodyContentType;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationType;
import com.platform.gatewayctl.model.PassthroughBehavior;
import com.platform.gatewayctl.model.RebuildPolicy;
import com.platform.gatewayctl.model.ResponseHeader;
import com.platform.gatewayctl.model.RouteDefinition;
import com.platform.gatewayctl.reconcile.DesiredGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesiredGatewayFactoryTest {

    private GatewayProperties properties;
    private DesiredGatewayFactory factory;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.setApiName("finance-api");
        properties.getUpstream().setHost("10.0.0.5");
        factory = new DesiredGatewayFactory(properties);
    }

    private static GatewayProperties.Route route(String path, String upstreamPath) {
        GatewayProperties.Route route = new GatewayProperties.Route();
        route.setPath(path);
        route.setUpstreamPath(upstreamPath);
        return route;
    }

    @Test
    @DisplayName("Without configured routes the whole /api subtree is proxied with transformed forwarding")
    void defaultRoute() {
        DesiredGateway desired = factory.create();

        assertThat(desired.routes()).singleElement().satisfies(route -> {
            assertThat(route.name()).isEqualTo("proxy");
            assertThat(route.path().path()).isEqualTo("/api/{proxy+}");
            assertThat(route.verb()).isEqualTo(HttpVerb.ANY);
            assertThat(route.integrationType()).isEqualTo(IntegrationType.HTTP);
            assertThat(route.upstreamUri()).isEqualTo("http://10.0.0.5:8000/api/{proxy}");
        });
        assertThat(desired.deploymentDescription()).isEqualTo("/api/{proxy+} -> 10.0.0.5:8000");
        assertThat(desired.publishWhenUnchanged()).isTrue();
        assertThat(desired.publicUrl("abc123")).isEqualTo("https://abc123.execute-api.eu-west-1.amazonaws.com/prod/api");
    }

    @Test
    @DisplayName("Configured routes are mapped with lenient enum spelling")
    void configuredRoute() {
        GatewayProperties.Route configured = route("/v1/{proxy+}", "v1/{proxy}");
        configured.setName("v1");
        configured.setIntegrationType("http-proxy");
        configured.setRebuildPolicy("on-integration-type-change");
        GatewayProperties.Response ok = new GatewayProperties.Response();
        ok.setHeaders(Map.of("Access-Control-Allow-Origin", "'*'"));
        configured.setResponses(List.of(ok));
        properties.setRoutes(List.of(configured));
        properties.getDeployment().setDescription("release 42");

        DesiredGateway desired = factory.create();

        RouteDefinition route = desired.routes().get(0);
        assertThat(route.integrationType()).isEqualTo(IntegrationType.HTTP_PROXY);
        assertThat(route.rebuildPolicy()).isEqualTo(RebuildPolicy.ON_INTEGRATION_TYPE_CHANGE);
        assertThat(route.upstreamUri()).isEqualTo("http://10.0.0.5:8000/v1/{proxy}");
        assertThat(route.requestTemplates()).isEmpty();
        assertThat(route.responses().get(0).headers())
            .containsExactly(ResponseHeader.literal("Access-Control-Allow-Origin", "*"));
        assertThat(desired.deploymentDescription()).isEqualTo("release 42");
    }

    @Test
    @DisplayName("Request templates are keyed by known content types only")
    void templates() {
        GatewayProperties.Route configured = route("/api/{proxy+}", "/api/{proxy}");
        configured.setRequestTemplates(Map.of("application/json", "$input.body"));
        configured.setPassthroughBehavior("never");

        RouteDefinition route = factory.toRoute(configured);

        assertThat(route.requestTemplates()).containsExactly(Map.entry(BodyContentType.APPLICATION_JSON, "$input.body"));
        assertThat(route.passthroughBehavior()).isEqualTo(PassthroughBehavior.NEVER);

        configured.setRequestTemplates(Map.of("text/xml", "<a/>"));
        assertThatThrownBy(() -> factory.toRoute(configured))
            .isInstanceOf(ValidationException.class)
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.UNSUPPORTED_CONTENT_TYPE);
    }

    @Test
    @DisplayName("Unknown enum values and header sources are rejected")
    void rejectsUnknownValues() {
        GatewayProperties.Route badType = route("/api/{proxy+}", "/api/{proxy}");
        badType.setIntegrationType("lambda");
        assertThatThrownBy(() -> factory.toRoute(badType)).isInstanceOf(ValidationException.class)
            .hasMessageContaining("IntegrationType");

        GatewayProperties.Route badHeader = route("/api/{proxy+}", "/api/{proxy}");
        GatewayProperties.Response response = new GatewayProperties.Response();
        response.setHeaders(Map.of("X-Origin", "*"));
        badHeader.setResponses(List.of(response));
        assertThatThrownBy(() -> factory.toRoute(badHeader)).isInstanceOf(ValidationException.class);

        GatewayProperties.Route badVerb = route("/api/{proxy+}", "/api/{proxy}");
        badVerb.setVerb("FETCH");
        assertThatThrownBy(() -> factory.toRoute(badVerb)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Blank enum values fall back to defaults")
    void blankMeansDefault() {
        assertThat(DesiredGatewayFactory.parseEnum(RebuildPolicy.class, "rebuildPolicy", " ")).isNull();
        assertThat(DesiredGatewayFactory.parseEnum(RebuildPolicy.class, "rebuildPolicy", "always"))
            .isEqualTo(RebuildPolicy.ALWAYS);
    }
}
