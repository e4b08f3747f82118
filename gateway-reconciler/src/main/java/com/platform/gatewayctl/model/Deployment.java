package com.platform.gatewayctl.model;

import java.time.Instant;

/**
 * Immutable configuration snapshot bound to a stage.
 */
public record Deployment(
    String id,
    String stageName,
    String description,
    Instant createdDate
) {}
