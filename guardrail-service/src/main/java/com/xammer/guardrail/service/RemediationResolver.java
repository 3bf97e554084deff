package com.xammer.guardrail.service;

import com.xammer.guardrail.config.GuardrailProperties;
import com.xammer.guardrail.domain.Finding;
import com.xammer.guardrail.domain.FindingType;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Maps (finding type, severity) to exactly one plan using the configured
 * policy table. Automatic actions are only chosen at the severities their
 * action policy lists; every other combination falls back to manual review.
 */
@Service
public class RemediationResolver {

    private static final Logger logger = LoggerFactory.getLogger(RemediationResolver.class);

    private final GuardrailProperties.Remediation policy;
    private final RemediationGuidance guidance;

    public RemediationResolver(GuardrailProperties properties, RemediationGuidance guidance) {
        this.policy = properties.getRemediation();
        this.guidance = guidance;
    }

    @PostConstruct
    public void validatePolicy() {
        GuardrailProperties.ActionPolicy manual = policy.getActions().get(RemediationAction.MANUAL_REVIEW);
        if (manual != null && !manual.getAutomaticSeverities().isEmpty()) {
            throw new IllegalStateException("MANUAL_REVIEW cannot declare automatic severities: "
                    + manual.getAutomaticSeverities());
        }
        List<String> gaps = policyGaps();
        if (!gaps.isEmpty()) {
            logger.error("Remediation policy has gaps, these findings will fall back to manual review: {}", gaps);
        } else {
            logger.info("Remediation policy covers all {} finding types", FindingType.values().length);
        }
    }

    public RemediationPlan resolve(Finding finding, Severity severity) {
        RemediationAction configured = policy.getFindingTypes().get(finding.getType());
        if (configured == null) {
            logger.error("Policy gap: no remediation action configured for {}/{} (finding {}), using manual review",
                    finding.getType(), severity, finding.getId());
            return plan(finding, severity, RemediationAction.MANUAL_REVIEW, RemediationAction.MANUAL_REVIEW);
        }
        RemediationAction action = isAutomatic(configured, severity) ? configured : RemediationAction.MANUAL_REVIEW;
        logger.info("Finding {} ({}/{}) resolved to {}{}", finding.getId(), finding.getType(), severity,
                action.getLabel(), action == configured ? "" : " (recommended: " + configured.getLabel() + ")");
        return plan(finding, severity, action, configured);
    }

    /** Every (type, severity) pair the table cannot resolve to a configured action. */
    public List<String> policyGaps() {
        List<String> gaps = new ArrayList<>();
        for (FindingType type : FindingType.values()) {
            if (!policy.getFindingTypes().containsKey(type)) {
                for (Severity severity : Severity.values()) {
                    gaps.add(type + "/" + severity);
                }
            }
        }
        return Collections.unmodifiableList(gaps);
    }

    private boolean isAutomatic(RemediationAction action, Severity severity) {
        if (!action.isMutating()) {
            return false;
        }
        GuardrailProperties.ActionPolicy actionPolicy = policy.getActions().get(action);
        Set<Severity> automatic = actionPolicy == null ? Set.of() : actionPolicy.getAutomaticSeverities();
        return automatic.contains(severity);
    }

    private RemediationPlan plan(Finding finding, Severity severity, RemediationAction action,
                                 RemediationAction recommended) {
        return RemediationPlan.builder()
                .findingId(finding.getId())
                .action(action)
                .recommendedAction(recommended)
                .severity(severity)
                .targetRef(finding.getResourceRef())
                .guidance(guidance.forFinding(finding.getType(), finding.getResourceRef()))
                .attributes(finding.getRawAttributes())
                .build();
    }
}
