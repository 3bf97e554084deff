package com.xammer.guardrail.exception;

/**
 * The inbound payload cannot be turned into a finding. Not retried by the
 * service; redelivery is up to the delivery platform.
 */
public class MalformedFindingException extends RuntimeException {

    private final String findingId;

    public MalformedFindingException(String message) {
        this(message, null, null);
    }

    public MalformedFindingException(String message, String findingId, Throwable cause) {
        super(message, cause);
        this.findingId = findingId;
    }

    /** Identifier recovered from the payload, if any. */
    public String getFindingId() {
        return findingId;
    }
}
