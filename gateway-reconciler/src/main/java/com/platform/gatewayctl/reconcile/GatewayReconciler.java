package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.error.ReconciliationFailedException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.model.RebuildPolicy;
import com.platform.gatewayctl.model.RestApi;
import com.platform.gatewayctl.model.RouteDefinition;
import com.platform.gatewayctl.observability.MetricsRegistry;
import com.platform.gatewayctl.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciliation engine that converges a REST API towards its desired routes and publishes the result.
 * <p>
 * One run looks up the API, applies every route's rebuild policy, then for every route resolves the
 * path and configures the method stack, and finally publishes one deployment. All prunes run before
 * the first resolve because routes may share a leaf and deleting it removes every verb under it. The run halts at the first
 * unrecovered failure, which is rethrown as a {@link ReconciliationFailedException}.
 */
@Slf4j
@Component
public class GatewayReconciler {

    private static final String MDC_API_NAME = "apiName";
    private static final String MDC_ROUTE = "route";

    private final ControlPlaneClient client;
    private final ResourceTreeResolver resolver;
    private final ResourcePruner pruner;
    private final MethodConfigurator configurator;
    private final DeploymentPublisher publisher;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;

    public GatewayReconciler(
            ControlPlaneClient client,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.client = client;
        this.resolver = new ResourceTreeResolver(client);
        this.pruner = new ResourcePruner(client, resolver);
        this.configurator = new MethodConfigurator(client);
        this.publisher = new DeploymentPublisher(client);
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }

    public ReconciliationReport reconcile(DesiredGateway desired) {
        long start = System.currentTimeMillis();
        ReconciliationContext context = new ReconciliationContext(this::onStepCompleted);
        MDC.put(MDC_API_NAME, desired.apiName());
        structuredLogger.reconcile().runStarted(desired.apiName(), desired.routes().size());

        try {
            RestApi api = context.step(StepKind.LOOKUP_API, desired.apiName(),
                () -> lookupApi(desired.apiName()), found -> StepOutcome.UNCHANGED);

            for (RouteDefinition route : desired.routes()) {
                if (route.rebuildPolicy() != RebuildPolicy.NEVER) {
                    MDC.put(MDC_ROUTE, route.name());
                    context.step(StepKind.PRUNE, route.path().path(), () -> pruner.prune(api.id(), route));
                }
            }

            Map<String, String> leafResourceIds = new LinkedHashMap<>();
            for (RouteDefinition route : desired.routes()) {
                MDC.put(MDC_ROUTE, route.name());
                leafResourceIds.put(route.name(), reconcileRoute(context, api, route));
            }
            MDC.remove(MDC_ROUTE);

            Deployment deployment = publishIfNeeded(context, api, desired);

            ReconciliationReport report = new ReconciliationReport(
                api,
                leafResourceIds,
                context.getRecords(),
                context.hasChanges(),
                deployment,
                desired.publicUrl(api.id()),
                Duration.ofMillis(System.currentTimeMillis() - start));

            metricsRegistry.recordRun(desired.apiName(), true, report.duration().toMillis());
            structuredLogger.reconcile().runCompleted(report);
            log.info("Reconciled {} ({}) in {}ms: {} step(s), changed={}",
                api.name(), api.id(), report.duration().toMillis(), report.steps().size(), report.changed());
            return report;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - start;
            String failedStep = context.describeCurrentStep();
            boolean deploymentReached = context.getCurrentStep() == StepKind.DEPLOYMENT;

            metricsRegistry.recordRun(desired.apiName(), false, duration);
            structuredLogger.reconcile().runFailed(failedStep, e, duration);
            log.error("Reconciliation of {} failed at {}", desired.apiName(), failedStep, e);
            throw new ReconciliationFailedException(failedStep, deploymentReached, e);
        } finally {
            MDC.remove(MDC_API_NAME);
            MDC.remove(MDC_ROUTE);
            MDC.remove(ReconciliationContext.MDC_STEP);
        }
    }

    private RestApi lookupApi(String apiName) {
        List<RestApi> matches = client.findApisByName(apiName);
        if (matches.isEmpty()) {
            throw ResourceNotFoundException.api(apiName);
        }
        if (matches.size() > 1) {
            throw ResourceConflictException.ambiguous("REST API", apiName, matches.size());
        }
        return matches.get(0);
    }

    private String reconcileRoute(ReconciliationContext context, RestApi api, RouteDefinition route) {
        ResourceTreeResolver.ResolvedPath resolved = context.step(StepKind.RESOLVE_RESOURCE, route.path().path(),
            () -> resolver.resolve(api.id(), route.path()),
            r -> r.createdAny() ? StepOutcome.CREATED : StepOutcome.UNCHANGED);

        configurator.configure(context, api.id(), resolved.leafId(), route);
        return resolved.leafId();
    }

    private Deployment publishIfNeeded(ReconciliationContext context, RestApi api, DesiredGateway desired) {
        if (!desired.publishWhenUnchanged() && !context.hasChanges()) {
            context.step(StepKind.DEPLOYMENT, desired.stage(), () -> StepOutcome.SKIPPED);
            structuredLogger.deployment().skipped(desired.stage());
            return null;
        }
        Deployment deployment = context.step(StepKind.DEPLOYMENT, desired.stage(),
            () -> publisher.publish(api.id(), desired.stage(), desired.deploymentDescription()),
            d -> StepOutcome.PUBLISHED);
        structuredLogger.deployment().published(deployment.id(), desired.stage(), desired.deploymentDescription());
        return deployment;
    }

    private void onStepCompleted(StepRecord record) {
        metricsRegistry.recordStepOutcome(record.step().getStepName(), record.outcome().name());
        structuredLogger.reconcile().stepCompleted(record);
    }
}
