package com.platform.gatewayctl.model;

/**
 * Whether an existing route leaf is deleted before it is resolved again.
 */
public enum RebuildPolicy {
    /** Never delete; converge in place. */
    NEVER,
    /** Delete the leaf when its current integration type differs from the desired one. */
    ON_INTEGRATION_TYPE_CHANGE,
    /** Delete and rebuild the leaf on every run. */
    ALWAYS
}
