package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;
import com.platform.gatewayctl.model.RouteDefinition;

import java.util.List;

/**
 * Desired state of one REST API: the routes it serves and where they are published.
 */
public record DesiredGateway(
    String apiName,
    String region,
    String stage,
    List<RouteDefinition> routes,
    String deploymentDescription,
    boolean publishWhenUnchanged
) {
    
    public DesiredGateway {
        if (apiName == null || apiName.isBlank()) {
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, "apiName", apiName, "API name is required");
        }
        if (routes == null || routes.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "routes", routes, "at least one route is required");
        }
        routes = List.copyOf(routes);
        long distinct = routes.stream().map(r -> r.path().path() + " " + r.verb()).distinct().count();
        if (distinct != routes.size()) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "routes", routes.size(),
                "two routes declare the same path and verb");
        }
    }
    
    /**
     * Public invoke URL of the stage, pointing at the first literal segment of the first route.
     */
    public String publicUrl(String apiId) {
        String base = String.format("https://%s.execute-api.%s.amazonaws.com/%s", apiId, region, stage);
        String firstLiteral = routes.get(0).path().firstLiteral();
        return firstLiteral.isEmpty() ? base : base + "/" + firstLiteral;
    }
}
