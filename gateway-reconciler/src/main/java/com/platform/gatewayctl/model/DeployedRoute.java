package com.platform.gatewayctl.model;

/**
 * A method with its integration as a stage serves it.
 */
public record DeployedRoute(
    PathTemplate path,
    HttpVerb verb,
    IntegrationSpec integration
) {}
