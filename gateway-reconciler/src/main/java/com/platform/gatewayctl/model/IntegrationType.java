package com.platform.gatewayctl.model;

/**
 * How the gateway forwards a request to the upstream.
 */
public enum IntegrationType {
    
    /**
     * Opaque passthrough forwarding. Request and response are relayed untouched,
     * upstream redirects included, so the client re-issues redirected requests
     * itself and loses its Authorization header on the second hop.
     */
    HTTP_PROXY,
    
    /**
     * Transformed forwarding. The gateway terminates the client request, applies
     * the request templates and issues a fresh request upstream carrying the client
     * headers on the first hop.
     */
    HTTP,
    
    /**
     * An integration kind this tool does not manage ({@code AWS}, {@code AWS_PROXY}, {@code MOCK}).
     * Only ever observed on the gateway, never desired; it is replaced in overwrite mode.
     */
    OTHER;
    
    public boolean isTransformed() {
        return this == HTTP;
    }
    
    /**
     * Maps the type string the gateway reports, falling back to {@link #OTHER}.
     */
    public static IntegrationType fromRemote(String value) {
        if (value == null) {
            return OTHER;
        }
        return switch (value) {
            case "HTTP" -> HTTP;
            case "HTTP_PROXY" -> HTTP_PROXY;
            default -> OTHER;
        };
    }
}
