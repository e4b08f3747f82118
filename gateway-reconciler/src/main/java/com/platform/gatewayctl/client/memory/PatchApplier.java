package com.platform.gatewayctl.client.memory;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.model.AuthorizationType;
import com.platform.gatewayctl.model.ContentHandling;
import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PassthroughBehavior;
import com.platform.gatewayctl.model.PatchOperation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Applies patch operations to stored specs the way the remote control plane does.
 * Unsupported paths are rejected with a conflict, as the remote rejects them with a bad request.
 */
final class PatchApplier {

    private PatchApplier() {
    }

    static MethodSpec apply(MethodSpec current, List<PatchOperation> operations) {
        AuthorizationType authorization = current.authorizationType();
        Map<String, Boolean> parameters = new HashMap<>(current.requestParameters());

        for (PatchOperation op : operations) {
            if (op.path().equals("/authorizationType")) {
                authorization = AuthorizationType.valueOf(op.value());
            } else if (op.path().startsWith("/requestParameters/")) {
                applyToMap(parameters, "/requestParameters/", op, Boolean::parseBoolean);
            } else {
                throw unsupported("Method", op);
            }
        }
        return new MethodSpec(current.verb(), authorization, parameters);
    }

    static IntegrationSpec apply(IntegrationSpec current, List<PatchOperation> operations) {
        String uri = current.uri();
        PassthroughBehavior passthrough = current.passthroughBehavior();
        ContentHandling contentHandling = current.contentHandling();
        Map<String, String> parameters = new HashMap<>(current.requestParameters());
        Map<String, String> templates = new HashMap<>(current.requestTemplates());

        for (PatchOperation op : operations) {
            String path = op.path();
            if (path.equals("/uri")) {
                uri = op.value();
            } else if (path.equals("/passthroughBehavior")) {
                passthrough = op.op() == PatchOperation.Op.REMOVE ? null : PassthroughBehavior.valueOf(op.value());
            } else if (path.equals("/contentHandling")) {
                contentHandling = op.op() == PatchOperation.Op.REMOVE ? null : ContentHandling.valueOf(op.value());
            } else if (path.startsWith("/requestParameters/")) {
                applyToMap(parameters, "/requestParameters/", op, Function.identity());
            } else if (path.startsWith("/requestTemplates/")) {
                applyToMap(templates, "/requestTemplates/", op, Function.identity());
            } else {
                throw unsupported("Integration", op);
            }
        }
        return new IntegrationSpec(current.type(), current.integrationVerb(), uri, parameters, templates,
            passthrough, contentHandling);
    }

    static MethodResponseSpec apply(MethodResponseSpec current, List<PatchOperation> operations) {
        Map<String, Boolean> parameters = new HashMap<>(current.responseParameters());
        for (PatchOperation op : operations) {
            if (!op.path().startsWith("/responseParameters/")) {
                throw unsupported("MethodResponse", op);
            }
            applyToMap(parameters, "/responseParameters/", op, Boolean::parseBoolean);
        }
        return new MethodResponseSpec(current.statusCode(), parameters);
    }

    static IntegrationResponseSpec apply(IntegrationResponseSpec current, List<PatchOperation> operations) {
        Map<String, String> parameters = new HashMap<>(current.responseParameters());
        Map<String, String> templates = new HashMap<>(current.responseTemplates());
        for (PatchOperation op : operations) {
            if (op.path().startsWith("/responseParameters/")) {
                applyToMap(parameters, "/responseParameters/", op, Function.identity());
            } else if (op.path().startsWith("/responseTemplates/")) {
                applyToMap(templates, "/responseTemplates/", op, Function.identity());
            } else {
                throw unsupported("IntegrationResponse", op);
            }
        }
        return new IntegrationResponseSpec(current.statusCode(), parameters, templates);
    }

    private static <V> void applyToMap(Map<String, V> target, String prefix, PatchOperation op,
                                       Function<String, V> parser) {
        String key = PatchOperation.unescape(op.path().substring(prefix.length()));
        switch (op.op()) {
            case ADD, REPLACE -> target.put(key, parser.apply(op.value()));
            case REMOVE -> target.remove(key);
        }
    }

    private static ResourceConflictException unsupported(String resourceType, PatchOperation op) {
        return new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, resourceType, op.path(),
            "Unsupported patch path for " + resourceType + ": " + op);
    }
}
