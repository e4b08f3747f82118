package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.RestApi;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a successful reconciliation run.
 *
 * @param leafResourceIds route name to the id of its leaf resource
 * @param deployment      {@code null} when publishing was skipped
 */
public record ReconciliationReport(
    RestApi api,
    Map<String, String> leafResourceIds,
    List<StepRecord> steps,
    boolean changed,
    Deployment deployment,
    String publicUrl,
    Duration duration
) {
    
    public ReconciliationReport {
        leafResourceIds = Map.copyOf(leafResourceIds);
        steps = List.copyOf(steps);
    }
    
    public Optional<Deployment> getDeployment() {
        return Optional.ofNullable(deployment);
    }
    
    public boolean isPublished() {
        return deployment != null;
    }
    
    public long count(StepOutcome outcome) {
        return steps.stream().filter(s -> s.outcome() == outcome).count();
    }
}
