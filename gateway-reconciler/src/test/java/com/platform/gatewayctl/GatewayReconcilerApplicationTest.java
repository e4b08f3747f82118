package com.platform.gatewayctl;

import com.platform.gatewayctl.cli.ExitCodes;
import com.platform.gatewayctl.cli.ReconcileRunner;
import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.client.RetryingControlPlaneClient;
import com.platform.gatewayctl.client.memory.InMemoryControlPlane;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "gateway.control-plane=in-memory",
    "gateway.api-name=finance-api",
    "gateway.upstream.host=10.0.0.5",
    "gateway.preview-paths=/api/health"
})
class GatewayReconcilerApplicationTest {

    @Autowired
    private ReconcileRunner runner;

    @Autowired
    private ControlPlaneClient controlPlaneClient;

    @Autowired
    private InMemoryControlPlane inMemoryControlPlane;

    @Test
    @DisplayName("The dry run reconciles and publishes against the in-memory control plane at startup")
    void dryRunAtStartup() {
        assertThat(runner.getExitCode()).isEqualTo(ExitCodes.OK);
        assertThat(controlPlaneClient).isInstanceOf(RetryingControlPlaneClient.class);
        String apiId = inMemoryControlPlane.findApisByName("finance-api").get(0).id();
        assertThat(inMemoryControlPlane.getDeployments(apiId)).hasSize(1);
        assertThat(inMemoryControlPlane.stageConfiguration(apiId, "prod")).isPresent();
    }
}
