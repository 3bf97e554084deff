package com.xammer.guardrail.domain;

public enum OutcomeSource {
    FINDING_PIPELINE,
    CREDENTIAL_HYGIENE
}
