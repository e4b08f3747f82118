package com.platform.gatewayctl.observability;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.model.Deployment;
import com.platform.gatewayctl.reconcile.ReconciliationReport;
import com.platform.gatewayctl.reconcile.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Machine-parsable JSON events for reconciliation runs, written to the {@code structured.*} loggers.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    
    public StructuredLogger(@Value("${spring.application.name:gateway-reconciler}") String serviceName) {
        this.serviceName = serviceName;
    }
    
    public ReconcileLogger reconcile() {
        return new ReconcileLogger(serviceName);
    }
    
    public DeploymentLogger deployment() {
        return new DeploymentLogger(serviceName);
    }
    
    // ==================== RECONCILE LOGGER ====================
    
    public static class ReconcileLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.reconcile");
        private final String service;
        
        ReconcileLogger(String service) {
            this.service = service;
        }
        
        public void runStarted(String apiName, int routes) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.RECONCILE_RUN_STARTED, "INFO")
                .apiName(apiName)
                .context(Map.of("routes", routes))
                .build();
            log.info(event.toJson());
        }
        
        public void stepCompleted(StepRecord record) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.RECONCILE_STEP_COMPLETED, "INFO")
                .step(record.step().getStepName())
                .target(record.target())
                .outcome(record.outcome().name())
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void runCompleted(ReconciliationReport report) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.RECONCILE_RUN_COMPLETED, "INFO")
                .apiName(report.api().name())
                .success(true)
                .durationMs(report.duration().toMillis())
                .deploymentId(report.getDeployment().map(Deployment::id).orElse(null))
                .context(Map.of(
                    "steps", report.steps().size(),
                    "changed", report.changed()
                ))
                .build();
            log.info(event.toJson());
        }
        
        public void runFailed(String failedStep, Throwable failure, long durationMs) {
            String errorCode = failure instanceof GatewayControlException gce
                ? gce.getErrorCode().getCode()
                : ErrorCode.INTERNAL_ERROR.getCode();
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.RECONCILE_RUN_FAILED, "ERROR")
                .target(failedStep)
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .errorMessage(failure.getMessage())
                .build();
            log.error(event.toJson());
        }
    }
    
    // ==================== DEPLOYMENT LOGGER ====================
    
    public static class DeploymentLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.deployment");
        private final String service;
        
        DeploymentLogger(String service) {
            this.service = service;
        }
        
        public void published(String deploymentId, String stage, String description) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.DEPLOYMENT_PUBLISHED, "INFO")
                .deploymentId(deploymentId)
                .target(stage)
                .message(description)
                .success(true)
                .build();
            log.info(event.toJson());
        }
        
        public void skipped(String stage) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service,
                    LogEventType.DEPLOYMENT_SKIPPED, "INFO")
                .target(stage)
                .message("No step changed the configuration; stage left as is")
                .build();
            log.info(event.toJson());
        }
    }
}
