package com.platform.gatewayctl.model;

import java.util.Map;

/**
 * A method attached to one resource and one verb.
 *
 * @param requestParameters e.g. {@code method.request.path.proxy -> true} (required)
 */
public record MethodSpec(
    HttpVerb verb,
    AuthorizationType authorizationType,
    Map<String, Boolean> requestParameters
) {
    
    public MethodSpec {
        requestParameters = requestParameters == null ? Map.of() : Map.copyOf(requestParameters);
    }
}
