package com.platform.gatewayctl.cli;

import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.error.PermissionDeniedException;
import com.platform.gatewayctl.error.ReconciliationFailedException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.error.TransientControlPlaneException;
import com.platform.gatewayctl.error.ValidationException;
import org.springframework.boot.context.properties.bind.BindException;

/**
 * Process exit codes of the reconciler.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int VALIDATION = 2;
    public static final int NOT_FOUND = 3;
    public static final int CONFLICT = 4;
    public static final int PERMISSION_DENIED = 5;
    public static final int RETRIES_EXHAUSTED = 6;

    private ExitCodes() {
    }

    /**
     * Exit code for a failure, looking through the wrapper of a failed run and through
     * startup exceptions to the first cause we know.
     */
    public static int forFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof BindException || t instanceof ValidationException) {
                return VALIDATION;
            }
            if (t instanceof ResourceNotFoundException) {
                return NOT_FOUND;
            }
            if (t instanceof ResourceConflictException) {
                return CONFLICT;
            }
            if (t instanceof PermissionDeniedException) {
                return PERMISSION_DENIED;
            }
            if (t instanceof TransientControlPlaneException) {
                return RETRIES_EXHAUSTED;
            }
            if (t instanceof GatewayControlException && !(t instanceof ReconciliationFailedException)) {
                return FAILURE;
            }
        }
        return FAILURE;
    }
}
