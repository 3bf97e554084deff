package com.xammer.guardrail.service;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Set;

/**
 * Decides which AWS failures are worth retrying: throttling, server-side
 * errors, client/network faults and the error codes IAM and S3 return while a
 * change is still propagating.
 */
public final class TransientErrors {

    private static final Set<String> TRANSIENT_ERROR_CODES = Set.of(
            "ConcurrentModification",
            "ConcurrentModificationException",
            "OperationAborted",
            "ServiceUnavailable",
            "SlowDown",
            "RequestTimeout",
            "InternalError",
            "NoSuchEntity");

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        if (error instanceof SdkClientException) {
            return true;
        }
        if (error instanceof AwsServiceException) {
            AwsServiceException serviceException = (AwsServiceException) error;
            if (serviceException.isThrottlingException() || serviceException.statusCode() >= 500) {
                return true;
            }
            String code = serviceException.awsErrorDetails() == null
                    ? null : serviceException.awsErrorDetails().errorCode();
            return code != null && TRANSIENT_ERROR_CODES.contains(code);
        }
        return false;
    }
}
