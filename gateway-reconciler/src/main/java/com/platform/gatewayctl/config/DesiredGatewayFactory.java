package com.platform.gatewayctl.config;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;
import com.platform.gatewayctl.model.AuthorizationType;
import com.platform.gatewayctl.model.BodyContentType;
import com.platform.gatewayctl.model.ContentHandling;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationType;
import com.platform.gatewayctl.model.PassthroughBehavior;
import com.platform.gatewayctl.model.PathTemplate;
import com.platform.gatewayctl.model.RebuildPolicy;
import com.platform.gatewayctl.model.ResponseHeader;
import com.platform.gatewayctl.model.ResponseRule;
import com.platform.gatewayctl.model.RouteDefinition;
import com.platform.gatewayctl.reconcile.DesiredGateway;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the desired gateway from {@link GatewayProperties}, rejecting unknown content types,
 * header sources, verbs and enum values.
 */
@Component
public class DesiredGatewayFactory {

    static final String DEFAULT_ROUTE_NAME = "proxy";
    static final String DEFAULT_ROUTE_PATH = "/api/{proxy+}";
    static final String DEFAULT_UPSTREAM_PATH = "/api/{proxy}";

    private final GatewayProperties properties;

    public DesiredGatewayFactory(GatewayProperties properties) {
        this.properties = properties;
    }

    public DesiredGateway create() {
        List<RouteDefinition> routes = properties.getRoutes().isEmpty()
            ? List.of(defaultRoute())
            : properties.getRoutes().stream().map(this::toRoute).toList();

        return new DesiredGateway(
            properties.getApiName(),
            properties.getRegion(),
            properties.getStage(),
            routes,
            describe(routes),
            properties.getDeployment().isPublishWhenUnchanged());
    }

    /**
     * Every verb under {@code /api} forwarded to the same path on the upstream.
     */
    RouteDefinition defaultRoute() {
        return RouteDefinition.builder()
            .name(DEFAULT_ROUTE_NAME)
            .path(PathTemplate.parse(DEFAULT_ROUTE_PATH))
            .verb(HttpVerb.ANY)
            .integrationType(IntegrationType.HTTP)
            .upstreamUri(upstreamUri(DEFAULT_UPSTREAM_PATH))
            .build();
    }

    RouteDefinition toRoute(GatewayProperties.Route route) {
        return RouteDefinition.builder()
            .name(route.getName())
            .path(PathTemplate.parse(route.getPath()))
            .verb(HttpVerb.parse(route.getVerb()))
            .authorizationType(parseEnum(AuthorizationType.class, "authorization", route.getAuthorization()))
            .integrationType(parseEnum(IntegrationType.class, "integrationType", route.getIntegrationType()))
            .integrationVerb(isBlank(route.getIntegrationVerb()) ? null : HttpVerb.parse(route.getIntegrationVerb()))
            .upstreamUri(upstreamUri(route.getUpstreamPath()))
            .requestTemplates(templates(route.getRequestTemplates()))
            .passthroughBehavior(parseEnum(PassthroughBehavior.class, "passthroughBehavior",
                route.getPassthroughBehavior()))
            .contentHandling(parseEnum(ContentHandling.class, "contentHandling", route.getContentHandling()))
            .responses(route.getResponses().stream().map(this::toResponseRule).toList())
            .rebuildPolicy(parseEnum(RebuildPolicy.class, "rebuildPolicy", route.getRebuildPolicy()))
            .build();
    }

    private ResponseRule toResponseRule(GatewayProperties.Response response) {
        List<ResponseHeader> headers = response.getHeaders().entrySet().stream()
            .map(e -> ResponseHeader.parse(e.getKey(), e.getValue()))
            .toList();
        return new ResponseRule(response.getStatus(), headers, templates(response.getTemplates()));
    }

    private static Map<BodyContentType, String> templates(Map<String, String> configured) {
        Map<BodyContentType, String> templates = new EnumMap<>(BodyContentType.class);
        configured.forEach((mimeType, template) -> templates.put(BodyContentType.fromMimeType(mimeType), template));
        return templates;
    }

    private String upstreamUri(String upstreamPath) {
        if (isBlank(upstreamPath)) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "upstreamPath", upstreamPath,
                "upstream path is required");
        }
        String path = upstreamPath.startsWith("/") ? upstreamPath : "/" + upstreamPath;
        return properties.getUpstream().baseUrl() + path;
    }

    private String describe(List<RouteDefinition> routes) {
        String configured = properties.getDeployment().getDescription();
        if (!isBlank(configured)) {
            return configured;
        }
        GatewayProperties.Upstream upstream = properties.getUpstream();
        return routes.stream().map(r -> r.path().path()).collect(Collectors.joining(", "))
            + " -> " + upstream.getHost() + ":" + upstream.getPort();
    }

    /**
     * Blank means "use the default"; anything else must name a constant.
     */
    static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String value) {
        if (isBlank(value)) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, field, value,
                "unknown " + type.getSimpleName());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
