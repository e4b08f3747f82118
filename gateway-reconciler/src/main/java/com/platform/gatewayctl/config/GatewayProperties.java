package com.platform.gatewayctl.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties describing the desired gateway topology and how to reach the control plane.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Which control plane to reconcile against.
     */
    @NotNull
    private ControlPlaneMode controlPlane = ControlPlaneMode.AWS;

    /**
     * Name of the REST API to reconcile. Looked up at run time.
     */
    @NotBlank
    private String apiName;

    /**
     * Region of the REST API, also used to build the public invoke URL.
     */
    @NotBlank
    private String region = "eu-west-1";

    /**
     * Stage the deployment is published to.
     */
    @NotBlank
    private String stage = "prod";

    @Valid
    private Upstream upstream = new Upstream();

    /**
     * Routes to reconcile, in order. Empty means the single default {@code /api/{proxy+}} route.
     */
    @Valid
    private List<Route> routes = new ArrayList<>();

    @Valid
    private DeploymentSettings deployment = new DeploymentSettings();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Aws aws = new Aws();

    /**
     * Request paths whose upstream resolution is printed after a successful run.
     */
    private List<String> previewPaths = new ArrayList<>();

    public enum ControlPlaneMode {
        AWS,
        IN_MEMORY
    }

    /**
     * Backend every route forwards to.
     */
    @Data
    public static class Upstream {

        @NotBlank
        private String scheme = "http";

        @NotBlank
        private String host;

        @Min(1)
        @Max(65535)
        private int port = 8000;

        public String baseUrl() {
            return String.format("%s://%s:%d", scheme, host, port);
        }
    }

    /**
     * One desired proxy subtree.
     */
    @Data
    public static class Route {

        private String name;

        /**
         * Path template, e.g. {@code /api/{proxy+}}.
         */
        @NotBlank
        private String path;

        private String verb = "ANY";

        private String authorization = "NONE";

        /**
         * {@code HTTP} (transformed forwarding) or {@code HTTP_PROXY} (opaque passthrough).
         */
        private String integrationType = "HTTP";

        /**
         * Verb used towards the upstream, defaults to the route verb.
         */
        private String integrationVerb;

        /**
         * Path appended to the upstream base URL, e.g. {@code /api/{proxy}}.
         */
        @NotBlank
        private String upstreamPath;

        /**
         * MIME type to request template. Use bracket keys in YAML: {@code "[application/json]"}.
         */
        private Map<String, String> requestTemplates = new LinkedHashMap<>();

        private String passthroughBehavior;

        private String contentHandling;

        @Valid
        private List<Response> responses = new ArrayList<>();

        private String rebuildPolicy = "NEVER";
    }

    /**
     * Response rule for one status code.
     */
    @Data
    public static class Response {

        @Min(100)
        @Max(599)
        private int status = 200;

        /**
         * Header name to source: {@code "'*'"} for a literal or
         * {@code integration.response.header.Name} for a passthrough.
         */
        private Map<String, String> headers = new LinkedHashMap<>();

        /**
         * MIME type to response template.
         */
        private Map<String, String> templates = new LinkedHashMap<>();
    }

    @Data
    public static class DeploymentSettings {

        /**
         * Free-text deployment description. Derived from routes and upstream when blank.
         */
        private String description;

        /**
         * Publish even when no step changed anything. Duplicate deployments are harmless.
         */
        private boolean publishWhenUnchanged = true;
    }

    /**
     * Bounded retry of transient control-plane failures.
     */
    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 4;

        @Min(0)
        private long initialDelayMs = 500;

        @Min(0)
        private long maxDelayMs = 8000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.1;
    }

    /**
     * AWS SDK client settings. Credentials come from the default provider chain.
     */
    @Data
    public static class Aws {

        @NotNull
        private Duration apiCallTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration apiCallAttemptTimeout = Duration.ofSeconds(10);

        /**
         * Optional endpoint override, e.g. a local emulator.
         */
        private String endpointOverride;
    }
}
