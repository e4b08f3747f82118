package com.platform.gatewayctl.model;

/**
 * A REST API on the gateway: the root of one resource tree.
 */
public record RestApi(
    String id,
    String name
) {}
