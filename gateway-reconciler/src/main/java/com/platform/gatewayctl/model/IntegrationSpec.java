package com.platform.gatewayctl.model;

import java.util.Map;

/**
 * The upstream binding of a method.
 *
 * @param requestParameters  e.g. {@code integration.request.path.proxy -> method.request.path.proxy}
 * @param requestTemplates   MIME type to mapping template
 * @param passthroughBehavior nullable for opaque passthrough forwarding
 * @param contentHandling    nullable, meaning no conversion
 */
public record IntegrationSpec(
    IntegrationType type,
    HttpVerb integrationVerb,
    String uri,
    Map<String, String> requestParameters,
    Map<String, String> requestTemplates,
    PassthroughBehavior passthroughBehavior,
    ContentHandling contentHandling
) {
    
    public IntegrationSpec {
        requestParameters = requestParameters == null ? Map.of() : Map.copyOf(requestParameters);
        requestTemplates = requestTemplates == null ? Map.of() : Map.copyOf(requestTemplates);
    }
}
