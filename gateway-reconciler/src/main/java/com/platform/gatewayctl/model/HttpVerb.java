package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

import java.util.Locale;

/**
 * HTTP verbs a method can be attached to. {@link #ANY} matches every verb.
 */
public enum HttpVerb {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    ANY;
    
    public static HttpVerb parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "verb", value, "HTTP verb is required");
        }
        try {
            return HttpVerb.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "verb", value, "unknown HTTP verb");
        }
    }
    
    public boolean accepts(String requestVerb) {
        return this == ANY || name().equalsIgnoreCase(requestVerb);
    }
}
