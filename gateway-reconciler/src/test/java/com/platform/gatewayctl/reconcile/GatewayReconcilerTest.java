package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.cli.ExitCodes;
import com.platform.gatewayctl.client.RetryingControlPlaneClient;
import com.platform.gatewayctl.client.memory.InMemoryControlPlane;
import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ReconciliationFailedException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.TransientControlPlaneException;
import com.platform.gatewayctl.model.DeployedRoute;
import com.platform.gatewayctl.model.HttpVerb;
import com.platform.gatewayctl.model.IntegrationType;
import com.platform.gatewayctl.model.RebuildPolicy;
import com.platform.gatewayctl.model.RestApi;
import com.platform.gatewayctl.model.RouteDefinition;
import com.platform.gatewayctl.observability.MetricsRegistry;
import com.platform.gatewayctl.retry.RetryEngine;
import com.platform.gatewayctl.support.TestRoutes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;

import static com.platform.gatewayctl.support.TestRoutes.STAGE;
import static com.platform.gatewayctl.support.TestRoutes.gateway;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GatewayReconcilerTest {

    private InMemoryControlPlane controlPlane;
    private MetricsRegistry metrics;
    private GatewayReconciler reconciler;
    private RestApi api;

    @BeforeEach
    void setUp() {
        controlPlane = new InMemoryControlPlane();
        api = controlPlane.createApi(TestRoutes.API_NAME);
        metrics = TestRoutes.metrics();
        RetryEngine retryEngine = new RetryEngine(metrics, TestRoutes.fastRetry(3), millis -> { });
        reconciler = new GatewayReconciler(
            new RetryingControlPlaneClient(controlPlane, retryEngine, metrics),
            metrics,
            TestRoutes.structuredLogger());
    }

    private String stageUpstream() {
        return controlPlane.stageConfiguration(api.id(), STAGE).orElseThrow().routes().stream()
            .map(DeployedRoute::integration)
            .map(i -> i.uri())
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("An empty API converges and is published")
    void convergesEmptyApi() {
        ReconciliationReport report = reconciler.reconcile(gateway(TestRoutes.proxy()));

        assertThat(report.api()).isEqualTo(api);
        assertThat(report.changed()).isTrue();
        assertThat(report.isPublished()).isTrue();
        assertThat(report.leafResourceIds()).containsOnlyKeys("proxy");
        assertThat(report.steps()).extracting(StepRecord::step).containsExactly(
            StepKind.LOOKUP_API, StepKind.RESOLVE_RESOURCE, StepKind.METHOD, StepKind.INTEGRATION,
            StepKind.METHOD_RESPONSE, StepKind.INTEGRATION_RESPONSE, StepKind.DEPLOYMENT);
        assertThat(report.publicUrl())
            .isEqualTo("https://" + api.id() + ".execute-api.eu-west-1.amazonaws.com/prod/api");
        assertThat(stageUpstream()).isEqualTo(TestRoutes.UPSTREAM + "/api/{proxy}");
        assertThat(MDC.get("apiName")).isNull();
    }

    @Test
    @DisplayName("A second run changes nothing but still publishes by default")
    void idempotentRerun() {
        reconciler.reconcile(gateway(TestRoutes.proxy(), TestRoutes.health(TestRoutes.UPSTREAM)));

        ReconciliationReport second = reconciler.reconcile(
            gateway(TestRoutes.proxy(), TestRoutes.health(TestRoutes.UPSTREAM)));

        assertThat(second.changed()).isFalse();
        assertThat(second.count(StepOutcome.CREATED)).isZero();
        assertThat(second.count(StepOutcome.UPDATED)).isZero();
        assertThat(second.count(StepOutcome.PUBLISHED)).isEqualTo(1);
        assertThat(controlPlane.getDeployments(api.id())).hasSize(2);
        assertThat(controlPlane.getResources(api.id())).hasSize(4);
    }

    @Test
    @DisplayName("Publishing is skipped on an unchanged run when configured so")
    void skipsUnchangedDeployment() {
        reconciler.reconcile(gateway(TestRoutes.proxy()));
        DesiredGateway quiet = new DesiredGateway(TestRoutes.API_NAME, "eu-west-1", STAGE,
            List.of(TestRoutes.proxy()), "test deployment", false);

        ReconciliationReport report = reconciler.reconcile(quiet);

        assertThat(report.isPublished()).isFalse();
        assertThat(report.steps()).last().extracting(StepRecord::outcome).isEqualTo(StepOutcome.SKIPPED);
        assertThat(controlPlane.getDeployments(api.id())).hasSize(1);
    }

    @Test
    @DisplayName("Changes are invisible on the stage until a deployment succeeds")
    void failedDeploymentLeavesStageUntouched() {
        reconciler.reconcile(gateway(TestRoutes.proxy()));
        controlPlane.failNext("createDeployment", new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT,
            "Deployment", api.id(), "Stage is being updated"));

        ReconciliationFailedException failure = catchThrowableOfType(
            () -> reconciler.reconcile(gateway(TestRoutes.proxy("http://10.0.0.6:8000"))),
            ReconciliationFailedException.class);

        assertThat(failure.isDeploymentReached()).isTrue();
        assertThat(failure.getFailedStep()).isEqualTo("deployment prod");
        assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.DEPLOYMENT_FAILED);
        assertThat(stageUpstream()).isEqualTo(TestRoutes.UPSTREAM + "/api/{proxy}");
        assertThat(controlPlane.currentConfiguration(api.id()).routes())
            .extracting(r -> r.integration().uri())
            .containsExactly("http://10.0.0.6:8000/api/{proxy}");
    }

    @Test
    @DisplayName("Transient failures are retried transparently")
    void retriesTransientFailures() {
        controlPlane.failNext("putIntegration",
            TransientControlPlaneException.throttled("putIntegration", "Too Many Requests", null));

        ReconciliationReport report = reconciler.reconcile(gateway(TestRoutes.proxy()));

        assertThat(report.isPublished()).isTrue();
        assertThat(controlPlane.getCallLog()).filteredOn(call -> call.startsWith("putIntegration ")).hasSize(2);
    }

    @Test
    @DisplayName("Exhausted retries halt the run before deployment")
    void exhaustedRetries() {
        for (int i = 0; i < 3; i++) {
            controlPlane.failNext("createResource",
                TransientControlPlaneException.unavailable("createResource", "Service Unavailable", null));
        }

        ReconciliationFailedException failure = catchThrowableOfType(
            () -> reconciler.reconcile(gateway(TestRoutes.proxy())), ReconciliationFailedException.class);

        assertThat(failure.isDeploymentReached()).isFalse();
        assertThat(failure.getFailedStep()).isEqualTo("resolveResource /api/{proxy+}");
        assertThat(failure.getCauseCode()).isEqualTo(ErrorCode.RETRIES_EXHAUSTED);
        assertThat(ExitCodes.forFailure(failure)).isEqualTo(ExitCodes.RETRIES_EXHAUSTED);
        assertThat(controlPlane.getDeployments(api.id())).isEmpty();
    }

    @Nested
    class ApiLookup {

        @Test
        @DisplayName("An unknown API name fails without touching anything")
        void unknownApi() {
            DesiredGateway other = new DesiredGateway("payments-api", "eu-west-1", STAGE,
                List.of(TestRoutes.proxy()), "test deployment", true);

            ReconciliationFailedException failure = catchThrowableOfType(
                () -> reconciler.reconcile(other), ReconciliationFailedException.class);

            assertThat(failure.getCauseCode()).isEqualTo(ErrorCode.API_NOT_FOUND);
            assertThat(failure.getFailedStep()).isEqualTo("lookupApi payments-api");
            assertThat(ExitCodes.forFailure(failure)).isEqualTo(ExitCodes.NOT_FOUND);
            assertThat(controlPlane.getCallLog()).containsExactly("findApisByName payments-api");
        }

        @Test
        @DisplayName("Two APIs with the same name are ambiguous")
        void ambiguousApi() {
            controlPlane.createApi(TestRoutes.API_NAME);

            assertThatThrownBy(() -> reconciler.reconcile(gateway(TestRoutes.proxy())))
                .isInstanceOf(ReconciliationFailedException.class)
                .extracting(e -> ((ReconciliationFailedException) e).getCauseCode())
                .isEqualTo(ErrorCode.AMBIGUOUS_MATCH);
        }
    }

    @Nested
    class RebuildPolicies {

        private String firstLeaf;

        @BeforeEach
        void deployProxy() {
            firstLeaf = reconciler.reconcile(gateway(TestRoutes.proxy())).leafResourceIds().get("proxy");
        }

        private RouteDefinition withPolicy(RouteDefinition route, RebuildPolicy policy) {
            return route.toBuilder().rebuildPolicy(policy).build();
        }

        @Test
        @DisplayName("ALWAYS deletes and recreates the leaf")
        void always() {
            ReconciliationReport report = reconciler.reconcile(
                gateway(withPolicy(TestRoutes.proxy(), RebuildPolicy.ALWAYS)));

            assertThat(report.steps()).filteredOn(r -> r.step() == StepKind.PRUNE)
                .singleElement().extracting(StepRecord::outcome).isEqualTo(StepOutcome.DELETED);
            assertThat(report.leafResourceIds().get("proxy")).isNotEqualTo(firstLeaf);
            assertThat(report.changed()).isTrue();
        }

        @Test
        @DisplayName("ALWAYS on two verbs of one path keeps both method stacks")
        void alwaysOnSharedLeaf() {
            RouteDefinition get = withPolicy(TestRoutes.proxy(), RebuildPolicy.ALWAYS).toBuilder()
                .name("proxy-get").verb(HttpVerb.GET).build();
            RouteDefinition post = get.toBuilder().name("proxy-post").verb(HttpVerb.POST).build();

            ReconciliationReport report = reconciler.reconcile(gateway(get, post));

            assertThat(report.steps()).extracting(StepRecord::step).startsWith(
                StepKind.LOOKUP_API, StepKind.PRUNE, StepKind.PRUNE, StepKind.RESOLVE_RESOURCE);
            assertThat(report.count(StepOutcome.DELETED)).isEqualTo(1);
            assertThat(report.leafResourceIds().get("proxy-get"))
                .isEqualTo(report.leafResourceIds().get("proxy-post"))
                .isNotEqualTo(firstLeaf);
            assertThat(controlPlane.stageConfiguration(api.id(), STAGE).orElseThrow().routes())
                .extracting(DeployedRoute::verb)
                .containsExactlyInAnyOrder(HttpVerb.GET, HttpVerb.POST);
        }

        @Test
        @DisplayName("ON_INTEGRATION_TYPE_CHANGE keeps the leaf while the type is unchanged")
        void sameTypeKeepsLeaf() {
            ReconciliationReport report = reconciler.reconcile(
                gateway(withPolicy(TestRoutes.proxy(), RebuildPolicy.ON_INTEGRATION_TYPE_CHANGE)));

            assertThat(report.steps()).filteredOn(r -> r.step() == StepKind.PRUNE)
                .singleElement().extracting(StepRecord::outcome).isEqualTo(StepOutcome.SKIPPED);
            assertThat(report.leafResourceIds().get("proxy")).isEqualTo(firstLeaf);
            assertThat(report.changed()).isFalse();
        }

        @Test
        @DisplayName("ON_INTEGRATION_TYPE_CHANGE rebuilds the leaf when the type changes")
        void typeChangeRebuilds() {
            ReconciliationReport report = reconciler.reconcile(gateway(
                withPolicy(TestRoutes.passthroughProxy(TestRoutes.UPSTREAM), RebuildPolicy.ON_INTEGRATION_TYPE_CHANGE)));

            assertThat(report.leafResourceIds().get("proxy")).isNotEqualTo(firstLeaf);
            assertThat(report.count(StepOutcome.DELETED)).isEqualTo(1);
            assertThat(controlPlane.stageConfiguration(api.id(), STAGE).orElseThrow().routes())
                .singleElement()
                .satisfies(r -> assertThat(r.integration().type())
                    .isEqualTo(IntegrationType.HTTP_PROXY));
        }
    }
}
