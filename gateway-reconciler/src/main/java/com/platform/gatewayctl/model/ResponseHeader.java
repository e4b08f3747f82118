package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

/**
 * A response header exposed by a method response.
 * The value either passes through an upstream header or is a fixed literal such as the CORS wildcard.
 */
public record ResponseHeader(String name, Source source, String value) {
    
    private static final String INTEGRATION_HEADER_PREFIX = "integration.response.header.";
    
    public enum Source {
        PASSTHROUGH,
        LITERAL
    }
    
    public ResponseHeader {
        if (name == null || name.isBlank() || name.contains(" ")) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "responses.headers", name, "invalid header name");
        }
    }
    
    public static ResponseHeader literal(String name, String value) {
        return new ResponseHeader(name, Source.LITERAL, value);
    }
    
    public static ResponseHeader passthrough(String name, String upstreamHeader) {
        return new ResponseHeader(name, Source.PASSTHROUGH, upstreamHeader);
    }
    
    /**
     * Parse a configured header source.
     * Accepts {@code 'value'} for a literal and {@code integration.response.header.Name}
     * for a passthrough; anything else is rejected.
     */
    public static ResponseHeader parse(String name, String expression) {
        if (expression == null) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "responses.headers." + name, null,
                "header source is required");
        }
        String trimmed = expression.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return literal(name, trimmed.substring(1, trimmed.length() - 1));
        }
        if (trimmed.startsWith(INTEGRATION_HEADER_PREFIX) && trimmed.length() > INTEGRATION_HEADER_PREFIX.length()) {
            return passthrough(name, trimmed.substring(INTEGRATION_HEADER_PREFIX.length()));
        }
        throw new ValidationException(ErrorCode.INVALID_ROUTE, "responses.headers." + name, expression,
            "expected a quoted literal or integration.response.header.<Name>");
    }
    
    /**
     * Key on the method response side, e.g. {@code method.response.header.Access-Control-Allow-Origin}.
     */
    public String methodResponseKey() {
        return "method.response.header." + name;
    }
    
    /**
     * Mapping expression on the integration response side.
     */
    public String integrationExpression() {
        return source == Source.LITERAL
            ? "'" + value + "'"
            : INTEGRATION_HEADER_PREFIX + value;
    }
}
