package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Header and body pass-through rules for one status code.
 */
public record ResponseRule(
    int statusCode,
    List<ResponseHeader> headers,
    Map<BodyContentType, String> templates
) {
    
    public ResponseRule {
        if (statusCode < 100 || statusCode > 599) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "responses.status", statusCode,
                "status code must be between 100 and 599");
        }
        headers = headers == null ? List.of() : List.copyOf(headers);
        templates = templates == null || templates.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(templates));
    }
    
    public static ResponseRule ok() {
        return new ResponseRule(200, List.of(), Map.of());
    }
    
    public String status() {
        return String.valueOf(statusCode);
    }
}
