package com.platform.gatewayctl.cli;

import com.platform.gatewayctl.client.memory.ApiSnapshot;
import com.platform.gatewayctl.client.memory.InMemoryControlPlane;
import com.platform.gatewayctl.config.DesiredGatewayFactory;
import com.platform.gatewayctl.config.GatewayProperties;
import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.error.ReconciliationFailedException;
import com.platform.gatewayctl.error.ValidationException;
import com.platform.gatewayctl.preview.UpstreamRoutePreview;
import com.platform.gatewayctl.reconcile.DesiredGateway;
import com.platform.gatewayctl.reconcile.GatewayReconciler;
import com.platform.gatewayctl.reconcile.ReconciliationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Runs one reconciliation at startup, prints the public URL and route previews, and exposes
 * the process exit code.
 */
@Slf4j
@Component
public class ReconcileRunner implements ApplicationRunner, ExitCodeGenerator {

    private final DesiredGatewayFactory desiredGatewayFactory;
    private final GatewayReconciler reconciler;
    private final GatewayProperties properties;
    private final ObjectProvider<InMemoryControlPlane> inMemoryControlPlane;
    private final PrintStream out;

    private int exitCode = ExitCodes.OK;

    @Autowired
    public ReconcileRunner(DesiredGatewayFactory desiredGatewayFactory, GatewayReconciler reconciler,
                           GatewayProperties properties, ObjectProvider<InMemoryControlPlane> inMemoryControlPlane) {
        this(desiredGatewayFactory, reconciler, properties, inMemoryControlPlane, System.out);
    }

    ReconcileRunner(DesiredGatewayFactory desiredGatewayFactory, GatewayReconciler reconciler,
                    GatewayProperties properties, ObjectProvider<InMemoryControlPlane> inMemoryControlPlane,
                    PrintStream out) {
        this.desiredGatewayFactory = desiredGatewayFactory;
        this.reconciler = reconciler;
        this.properties = properties;
        this.inMemoryControlPlane = inMemoryControlPlane;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            DesiredGateway desired = desiredGatewayFactory.create();
            ReconciliationReport report = reconciler.reconcile(desired);
            printReport(report);
            printPreviews(desired, report);
            exitCode = ExitCodes.OK;
        } catch (GatewayControlException e) {
            exitCode = ExitCodes.forFailure(e);
            out.println("Reconciliation failed [" + e.getErrorCode().getCode() + "]: " + e.getMessage());
            printRejectedField(e);
            log.error("Exiting with code {}", exitCode);
        }
    }

    private void printRejectedField(GatewayControlException e) {
        Throwable cause = e instanceof ReconciliationFailedException ? e.getCause() : e;
        if (cause instanceof ValidationException validation && validation.getField() != null) {
            out.println("  Rejected " + validation.getField() + ": " + validation.getRejectedValue());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printReport(ReconciliationReport report) {
        out.println("API " + report.api().name() + " (" + report.api().id() + ")");
        report.steps().forEach(step -> out.println("  " + step));
        report.getDeployment().ifPresentOrElse(
            d -> out.println("Deployment " + d.id() + " published to stage " + d.stageName()),
            () -> out.println("Nothing changed, deployment skipped"));
        out.println("Public URL: " + report.publicUrl());
    }

    private void printPreviews(DesiredGateway desired, ReconciliationReport report) {
        if (properties.getPreviewPaths().isEmpty()) {
            return;
        }
        UpstreamRoutePreview preview = inMemoryControlPlane.stream()
            .findFirst()
            .flatMap(cp -> cp.stageConfiguration(report.api().id(), desired.stage()))
            .map(ApiSnapshot::routes)
            .map(UpstreamRoutePreview::new)
            .orElseGet(() -> UpstreamRoutePreview.ofDesired(desired.routes()));

        for (String path : properties.getPreviewPaths()) {
            String target = preview.resolve(path)
                .map(UpstreamRoutePreview.Resolution::upstreamUri)
                .orElse("(no matching route)");
            out.println("  " + path + " -> " + target);
        }
    }
}
