package com.platform.gatewayctl.model;

/**
 * What the gateway does with a request body whose content type has no template.
 */
public enum PassthroughBehavior {
    /** Forward verbatim when no template matches the content type. */
    WHEN_NO_MATCH,
    /** Forward verbatim only when no templates are defined at all. */
    WHEN_NO_TEMPLATES,
    /** Reject untemplated content types with 415. */
    NEVER
}
