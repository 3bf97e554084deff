package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.Classification;
import com.xammer.guardrail.domain.Finding;
import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.OutcomeSource;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.dto.RemediationPreview;
import com.xammer.guardrail.exception.MalformedFindingException;
import com.xammer.guardrail.service.audit.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Normalizer → classifier → resolver → executor for a single inbound event.
 * Holds no state between calls.
 */
@Service
public class RemediationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RemediationPipeline.class);

    static final String UNIDENTIFIED = "unidentified";

    private final FindingNormalizer normalizer;
    private final RiskClassifier classifier;
    private final RemediationResolver resolver;
    private final RemediationExecutor executor;
    private final AuditSink auditSink;
    private final Clock clock;

    public RemediationPipeline(FindingNormalizer normalizer, RiskClassifier classifier, RemediationResolver resolver,
                               RemediationExecutor executor, AuditSink auditSink, Clock clock) {
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.resolver = resolver;
        this.executor = executor;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    /**
     * Processes one finding event end to end.
     *
     * @throws MalformedFindingException after the rejection has been recorded
     */
    public RemediationOutcome process(String payload) {
        Finding finding = normalizeOrReject(payload);
        Classification classification = classifier.classify(finding);
        RemediationPlan plan = resolver.resolve(finding, classification.getSeverity());
        return executor.execute(plan);
    }

    /** Same as {@link #process} up to the plan, without executing or recording anything. */
    public RemediationPreview preview(String payload) {
        Finding finding = normalizer.normalize(payload);
        Classification classification = classifier.classify(finding);
        RemediationPlan plan = resolver.resolve(finding, classification.getSeverity());
        return RemediationPreview.builder()
                .finding(finding)
                .severity(classification.getSeverity())
                .exposure(classification.getExposure())
                .classificationReason(classification.getReason())
                .plan(plan)
                .build();
    }

    private Finding normalizeOrReject(String payload) {
        try {
            return normalizer.normalize(payload);
        } catch (MalformedFindingException e) {
            logger.warn("Rejecting malformed finding event: {}", e.getMessage());
            auditSink.record(RemediationOutcome.builder()
                    .findingId(e.getFindingId() == null ? UNIDENTIFIED : e.getFindingId())
                    .source(OutcomeSource.FINDING_PIPELINE)
                    .result(OutcomeResult.FAILED)
                    .reason("malformed-input: " + e.getMessage())
                    .timestamp(clock.instant())
                    .build());
            throw e;
        }
    }
}
