package com.xammer.guardrail.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class MutationResult {

    public enum Status {
        APPLIED,
        ALREADY_SATISFIED,
        FAILED
    }

    private final Status status;
    private final int attempts;
    private final String error;

    static MutationResult applied(int attempts) {
        return new MutationResult(Status.APPLIED, attempts, null);
    }

    static MutationResult alreadySatisfied(int attempts) {
        return new MutationResult(Status.ALREADY_SATISFIED, attempts, null);
    }

    static MutationResult failed(int attempts, String error) {
        return new MutationResult(Status.FAILED, attempts, error);
    }
}
