package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.model.BodyContentType;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.ResponseHeader;
import com.platform.gatewayctl.model.ResponseRule;
import com.platform.gatewayctl.model.RouteDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control-plane objects a route needs on its leaf resource.
 * Every captured path variable is declared on the method and bound on the integration.
 */
public record MethodStack(
    MethodSpec method,
    IntegrationSpec integration,
    List<Response> responses
) {

    public record Response(MethodResponseSpec methodResponse, IntegrationResponseSpec integrationResponse) {

        public String statusCode() {
            return methodResponse.statusCode();
        }
    }

    public static MethodStack of(RouteDefinition route) {
        Map<String, Boolean> methodParameters = new LinkedHashMap<>();
        Map<String, String> integrationParameters = new LinkedHashMap<>();
        for (String variable : route.path().captureVariables()) {
            methodParameters.put(methodPathParameter(variable), true);
            integrationParameters.put(integrationPathParameter(variable), methodPathParameter(variable));
        }

        MethodSpec method = new MethodSpec(route.verb(), route.authorizationType(), methodParameters);
        IntegrationSpec integration = new IntegrationSpec(
            route.integrationType(),
            route.integrationVerb(),
            route.upstreamUri(),
            integrationParameters,
            byMimeType(route.requestTemplates()),
            route.passthroughBehavior(),
            route.contentHandling());

        List<Response> responses = route.responses().stream()
            .map(MethodStack::response)
            .toList();
        return new MethodStack(method, integration, responses);
    }

    private static Response response(ResponseRule rule) {
        Map<String, Boolean> declared = new LinkedHashMap<>();
        Map<String, String> mapped = new LinkedHashMap<>();
        for (ResponseHeader header : rule.headers()) {
            declared.put(header.methodResponseKey(), true);
            mapped.put(header.methodResponseKey(), header.integrationExpression());
        }
        return new Response(
            new MethodResponseSpec(rule.status(), declared),
            new IntegrationResponseSpec(rule.status(), mapped, byMimeType(rule.templates())));
    }

    public static String methodPathParameter(String variable) {
        return "method.request.path." + variable;
    }

    public static String integrationPathParameter(String variable) {
        return "integration.request.path." + variable;
    }

    private static Map<String, String> byMimeType(Map<BodyContentType, String> templates) {
        Map<String, String> result = new LinkedHashMap<>();
        templates.forEach((type, template) -> result.put(type.getMimeType(), template));
        return result;
    }
}
