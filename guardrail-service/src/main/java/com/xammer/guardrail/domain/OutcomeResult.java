package com.xammer.guardrail.domain;

public enum OutcomeResult {
    APPLIED,
    SKIPPED,
    FAILED
}
