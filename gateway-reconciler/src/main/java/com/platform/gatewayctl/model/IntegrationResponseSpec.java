package com.platform.gatewayctl.model;

import java.util.Map;

/**
 * Maps an upstream response onto a method response for one status code.
 *
 * @param responseParameters header target to source, e.g.
 *                           {@code method.response.header.Access-Control-Allow-Origin -> '*'}
 * @param responseTemplates  MIME type to mapping template
 */
public record IntegrationResponseSpec(
    String statusCode,
    Map<String, String> responseParameters,
    Map<String, String> responseTemplates
) {
    
    public IntegrationResponseSpec {
        responseParameters = responseParameters == null ? Map.of() : Map.copyOf(responseParameters);
        responseTemplates = responseTemplates == null ? Map.of() : Map.copyOf(responseTemplates);
    }
}
