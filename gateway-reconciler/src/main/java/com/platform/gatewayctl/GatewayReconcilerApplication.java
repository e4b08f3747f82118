package com.platform.gatewayctl;

import com.platform.gatewayctl.cli.ExitCodes;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gateway Reconciler
 * 
 * Converges the resource tree of a REST API gateway towards the configured routes:
 * - Path resolution with literal, single and greedy captures
 * - Create-or-update of methods, integrations and responses
 * - Deployment snapshots published to a stage
 * 
 * Runs once and exits with a code describing the outcome.
 */
@SpringBootApplication
public class GatewayReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(GatewayReconcilerApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        int exitCode;
        try {
            exitCode = SpringApplication.exit(application.run(args));
        } catch (RuntimeException e) {
            // startup failures, e.g. invalid gateway.* properties
            exitCode = ExitCodes.forFailure(e);
        }
        System.exit(exitCode);
    }
}
