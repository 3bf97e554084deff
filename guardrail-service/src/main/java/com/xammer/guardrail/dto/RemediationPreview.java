package com.xammer.guardrail.dto;

import com.xammer.guardrail.domain.Exposure;
import com.xammer.guardrail.domain.Finding;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.domain.Severity;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RemediationPreview {

    private Finding finding;
    private Severity severity;
    private Exposure exposure;
    private String classificationReason;
    private RemediationPlan plan;
}
