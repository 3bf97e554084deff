package com.xammer.guardrail.exception;

/**
 * Rate limiting or eventual-consistency lag on the remediation target.
 * Retried with backoff by the guarded mutation path.
 */
public class TransientTargetException extends RuntimeException {

    public TransientTargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
