package com.platform.gatewayctl.model;

import java.util.Map;

/**
 * Declares which headers a method response may carry for one status code.
 *
 * @param responseParameters e.g. {@code method.response.header.Access-Control-Allow-Origin -> true}
 */
public record MethodResponseSpec(
    String statusCode,
    Map<String, Boolean> responseParameters
) {
    
    public MethodResponseSpec {
        responseParameters = responseParameters == null ? Map.of() : Map.copyOf(responseParameters);
    }
}
