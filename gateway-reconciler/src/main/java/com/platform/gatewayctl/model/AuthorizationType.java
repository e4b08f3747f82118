package com.platform.gatewayctl.model;

/**
 * Authorization mode of a method.
 */
public enum AuthorizationType {
    NONE,
    AWS_IAM,
    CUSTOM,
    COGNITO_USER_POOLS
}
