package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.model.IntegrationResponseSpec;
import com.platform.gatewayctl.model.IntegrationSpec;
import com.platform.gatewayctl.model.MethodResponseSpec;
import com.platform.gatewayctl.model.MethodSpec;
import com.platform.gatewayctl.model.PatchOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Computes the patch operations that turn a current control-plane object into the desired one.
 * An empty plan means the object has converged.
 */
public final class PatchPlanner {

    private PatchPlanner() {
    }

    public static List<PatchOperation> plan(MethodSpec current, MethodSpec desired) {
        List<PatchOperation> operations = new ArrayList<>();
        if (current.authorizationType() != desired.authorizationType()) {
            operations.add(PatchOperation.replace("/authorizationType", desired.authorizationType().name()));
        }
        diffMap("requestParameters", current.requestParameters(), desired.requestParameters(), operations);
        return operations;
    }

    /**
     * Integration type and verb are not patchable; callers compare them separately
     * via {@link #requiresOverwrite(IntegrationSpec, IntegrationSpec)}.
     */
    public static List<PatchOperation> plan(IntegrationSpec current, IntegrationSpec desired) {
        List<PatchOperation> operations = new ArrayList<>();
        if (!Objects.equals(current.uri(), desired.uri())) {
            operations.add(PatchOperation.replace("/uri", desired.uri()));
        }
        diffScalar("/passthroughBehavior", current.passthroughBehavior(), desired.passthroughBehavior(), operations);
        diffScalar("/contentHandling", current.contentHandling(), desired.contentHandling(), operations);
        diffMap("requestParameters", current.requestParameters(), desired.requestParameters(), operations);
        diffMap("requestTemplates", current.requestTemplates(), desired.requestTemplates(), operations);
        return operations;
    }

    public static boolean requiresOverwrite(IntegrationSpec current, IntegrationSpec desired) {
        return current.type() != desired.type() || current.integrationVerb() != desired.integrationVerb();
    }

    public static List<PatchOperation> plan(MethodResponseSpec current, MethodResponseSpec desired) {
        List<PatchOperation> operations = new ArrayList<>();
        diffMap("responseParameters", current.responseParameters(), desired.responseParameters(), operations);
        return operations;
    }

    public static List<PatchOperation> plan(IntegrationResponseSpec current, IntegrationResponseSpec desired) {
        List<PatchOperation> operations = new ArrayList<>();
        diffMap("responseParameters", current.responseParameters(), desired.responseParameters(), operations);
        diffMap("responseTemplates", current.responseTemplates(), desired.responseTemplates(), operations);
        return operations;
    }

    /**
     * A null desired value leaves the field unmanaged: the gateway fills in its own default
     * (e.g. {@code WHEN_NO_MATCH}) and these fields only accept {@code replace}.
     */
    private static void diffScalar(String path, Enum<?> current, Enum<?> desired, List<PatchOperation> operations) {
        if (desired == null || current == desired) {
            return;
        }
        operations.add(PatchOperation.replace(path, desired.name()));
    }

    private static void diffMap(String field, Map<String, ?> current, Map<String, ?> desired,
                                List<PatchOperation> operations) {
        // sorted so that plans are deterministic
        TreeSet<String> keys = new TreeSet<>(current.keySet());
        keys.addAll(desired.keySet());
        for (String key : keys) {
            Object have = current.get(key);
            Object want = desired.get(key);
            String path = PatchOperation.mapEntryPath(field, key);
            if (want == null) {
                operations.add(PatchOperation.remove(path));
            } else if (have == null) {
                operations.add(PatchOperation.add(path, String.valueOf(want)));
            } else if (!have.equals(want)) {
                operations.add(PatchOperation.replace(path, String.valueOf(want)));
            }
        }
    }
}
