package com.platform.gatewayctl.client.aws;

import com.platform.gatewayctl.error.ControlPlaneCallException;
import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.error.PermissionDeniedException;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.error.TransientControlPlaneException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.apigateway.model.BadRequestException;
import software.amazon.awssdk.services.apigateway.model.ConflictException;
import software.amazon.awssdk.services.apigateway.model.LimitExceededException;
import software.amazon.awssdk.services.apigateway.model.NotFoundException;
import software.amazon.awssdk.services.apigateway.model.ServiceUnavailableException;
import software.amazon.awssdk.services.apigateway.model.TooManyRequestsException;
import software.amazon.awssdk.services.apigateway.model.UnauthorizedException;

import java.util.Locale;

/**
 * Maps AWS SDK exceptions onto the reconciler's error taxonomy.
 */
final class AwsErrorTranslator {

    private AwsErrorTranslator() {
    }

    /**
     * @param operation control-plane operation, e.g. {@code putMethod}
     * @param resourceType kind of object the call targeted
     * @param target identifier of the object the call targeted, used in messages
     */
    static GatewayControlException translate(String operation, String resourceType, String target, SdkException e) {
        String message = remoteMessage(e);

        if (e instanceof NotFoundException) {
            return new ResourceNotFoundException(resourceType, target,
                String.format("%s not found: %s (%s)", resourceType, target, message), e);
        }
        if (e instanceof ConflictException) {
            String lower = message.toLowerCase(Locale.ROOT);
            // "Method already exists ...", "Another resource with the same parent already has this name"
            if (lower.contains("already exist") || lower.contains("already has this name")) {
                return new ResourceAlreadyExistsException(resourceType, target, message, e);
            }
            return new ResourceConflictException(resourceType, target, message, e);
        }
        if (e instanceof BadRequestException) {
            return new ResourceConflictException(resourceType, target,
                String.format("%s rejected for %s: %s", operation, target, message), e);
        }
        if (e instanceof UnauthorizedException) {
            return new PermissionDeniedException(operation, message, e);
        }
        if (e instanceof TooManyRequestsException || e instanceof LimitExceededException) {
            return TransientControlPlaneException.throttled(operation, message, e);
        }
        if (e instanceof ServiceUnavailableException) {
            return TransientControlPlaneException.unavailable(operation, message, e);
        }
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return TransientControlPlaneException.timeout(operation, message, e);
        }
        if (e instanceof AwsServiceException service) {
            int status = service.statusCode();
            if (status == 403) {
                return new PermissionDeniedException(operation, message, e);
            }
            if (status == 429) {
                return TransientControlPlaneException.throttled(operation, message, e);
            }
            if (status >= 500) {
                return TransientControlPlaneException.unavailable(operation, message, e);
            }
        }
        if (e instanceof SdkClientException) {
            // connection refused, DNS, socket resets
            return TransientControlPlaneException.unavailable(operation, message, e);
        }
        return new ControlPlaneCallException(operation, message, e);
    }

    private static String remoteMessage(SdkException e) {
        if (e instanceof AwsServiceException service
                && service.awsErrorDetails() != null
                && service.awsErrorDetails().errorMessage() != null) {
            return service.awsErrorDetails().errorMessage();
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
