package com.xammer.guardrail.domain;

public enum CredentialStatus {
    ACTIVE,
    DEACTIVATED
}
