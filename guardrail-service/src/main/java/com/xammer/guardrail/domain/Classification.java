package com.xammer.guardrail.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class Classification {

    public static final String UNCLASSIFIED_TYPE = "unclassified-type";

    private final Finding finding;
    private final Exposure exposure;
    private final Severity severity;
    private final String reason;
}
