package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Content types for which request and response templates may be declared.
 */
public enum BodyContentType {
    
    APPLICATION_JSON("application/json", "$input.json('$')"),
    
    /**
     * Form bodies are forwarded as raw text; there is no structured mapping for them.
     */
    FORM_URLENCODED("application/x-www-form-urlencoded", "$input.body");
    
    private final String mimeType;
    private final String defaultTemplate;
    
    BodyContentType(String mimeType, String defaultTemplate) {
        this.mimeType = mimeType;
        this.defaultTemplate = defaultTemplate;
    }
    
    public String getMimeType() {
        return mimeType;
    }
    
    public String getDefaultTemplate() {
        return defaultTemplate;
    }
    
    /**
     * Look up a content type by MIME type, rejecting anything not enumerated here.
     */
    public static BodyContentType fromMimeType(String mimeType) {
        String normalized = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(t -> t.mimeType.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new ValidationException(
                ErrorCode.UNSUPPORTED_CONTENT_TYPE,
                "templates",
                mimeType,
                "supported content types are application/json and application/x-www-form-urlencoded"));
    }
}
