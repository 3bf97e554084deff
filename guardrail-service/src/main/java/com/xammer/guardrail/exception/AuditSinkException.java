package com.xammer.guardrail.exception;

/**
 * The audit trail could not be written. This is the only failure that is
 * allowed to abort an invocation.
 */
public class AuditSinkException extends RuntimeException {

    public AuditSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
