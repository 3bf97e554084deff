package com.xammer.guardrail.domain;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
