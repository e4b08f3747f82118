package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;
import lombok.Builder;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Desired configuration of one proxy subtree: a path template, the method on its leaf,
 * the upstream integration and the response rules.
 * <p>
 * Construction validates that every captured path variable is bound to a placeholder
 * of the upstream URI and vice versa.
 */
@Builder(toBuilder = true)
public record RouteDefinition(
    String name,
    PathTemplate path,
    HttpVerb verb,
    AuthorizationType authorizationType,
    IntegrationType integrationType,
    HttpVerb integrationVerb,
    String upstreamUri,
    Map<BodyContentType, String> requestTemplates,
    PassthroughBehavior passthroughBehavior,
    ContentHandling contentHandling,
    List<ResponseRule> responses,
    RebuildPolicy rebuildPolicy
) {
    
    private static final Pattern URI_PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");
    
    public RouteDefinition {
        if (path == null) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "path", null, "path template is required");
        }
        if (path.isRoot()) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "path", "/", "the root resource cannot be a route");
        }
        if (upstreamUri == null || !(upstreamUri.startsWith("http://") || upstreamUri.startsWith("https://"))) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "upstreamUri", upstreamUri,
                "must be an absolute http(s) URI");
        }
        name = name == null || name.isBlank() ? path.path() : name;
        verb = verb == null ? HttpVerb.ANY : verb;
        authorizationType = authorizationType == null ? AuthorizationType.NONE : authorizationType;
        integrationType = integrationType == null ? IntegrationType.HTTP : integrationType;
        integrationVerb = integrationVerb == null ? verb : integrationVerb;
        rebuildPolicy = rebuildPolicy == null ? RebuildPolicy.NEVER : rebuildPolicy;
        if (integrationType == IntegrationType.OTHER) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "integrationType", integrationType,
                "only HTTP and HTTP_PROXY integrations can be declared");
        }
        
        if (integrationType.isTransformed()) {
            Map<BodyContentType, String> templates = new EnumMap<>(BodyContentType.class);
            if (requestTemplates == null || requestTemplates.isEmpty()) {
                for (BodyContentType type : BodyContentType.values()) {
                    templates.put(type, type.getDefaultTemplate());
                }
            } else {
                templates.putAll(requestTemplates);
            }
            requestTemplates = Map.copyOf(templates);
            passthroughBehavior = passthroughBehavior == null ? PassthroughBehavior.WHEN_NO_MATCH : passthroughBehavior;
            contentHandling = contentHandling == null ? ContentHandling.CONVERT_TO_TEXT : contentHandling;
        } else {
            if (requestTemplates != null && !requestTemplates.isEmpty()) {
                throw new ValidationException(ErrorCode.INVALID_ROUTE, "requestTemplates", requestTemplates.keySet(),
                    "request templates apply only to transformed (HTTP) forwarding");
            }
            requestTemplates = Map.of();
        }
        
        responses = responses == null || responses.isEmpty()
            ? List.of(ResponseRule.ok())
            : responses.stream().sorted(Comparator.comparingInt(ResponseRule::statusCode)).toList();
        if (responses.stream().map(ResponseRule::statusCode).distinct().count() != responses.size()) {
            throw new ValidationException(ErrorCode.INVALID_ROUTE, "responses", responses.size(),
                "status codes must be unique");
        }
        
        validateCaptureBindings(path, upstreamUri);
    }
    
    private static void validateCaptureBindings(PathTemplate path, String upstreamUri) {
        Set<String> placeholders = uriPlaceholders(upstreamUri);
        for (String variable : path.captureVariables()) {
            if (!placeholders.contains(variable)) {
                throw new ValidationException(ErrorCode.CAPTURE_BINDING_MISSING, "upstreamUri", upstreamUri,
                    "captured path variable '" + variable + "' of " + path + " has no {" + variable + "} placeholder");
            }
        }
        for (String placeholder : placeholders) {
            if (!path.captureVariables().contains(placeholder)) {
                throw new ValidationException(ErrorCode.CAPTURE_BINDING_MISSING, "upstreamUri", upstreamUri,
                    "placeholder {" + placeholder + "} is not captured by " + path);
            }
        }
    }
    
    /**
     * Placeholder names of an upstream URI template, in order of appearance.
     */
    public static Set<String> uriPlaceholders(String uri) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = URI_PLACEHOLDER.matcher(uri);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
