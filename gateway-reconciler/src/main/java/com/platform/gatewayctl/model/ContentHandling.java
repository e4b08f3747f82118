package com.platform.gatewayctl.model;

/**
 * Payload conversion applied by the gateway.
 */
public enum ContentHandling {
    CONVERT_TO_TEXT,
    CONVERT_TO_BINARY
}
