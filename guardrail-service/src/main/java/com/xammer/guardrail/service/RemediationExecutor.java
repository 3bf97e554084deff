package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.OutcomeSource;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.service.audit.AuditSink;
import com.xammer.guardrail.service.handler.RemediationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a plan and writes exactly one outcome per call. Remediation
 * failures end up in the outcome; only an audit sink failure escapes.
 */
@Service
public class RemediationExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RemediationExecutor.class);

    private final Map<RemediationAction, RemediationHandler> handlers = new EnumMap<>(RemediationAction.class);
    private final GuardedMutationService guardedMutationService;
    private final AuditSink auditSink;
    private final Clock clock;

    public RemediationExecutor(List<RemediationHandler> handlers, GuardedMutationService guardedMutationService,
                               AuditSink auditSink, Clock clock) {
        for (RemediationHandler handler : handlers) {
            RemediationHandler previous = this.handlers.put(handler.action(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.action());
            }
        }
        this.guardedMutationService = guardedMutationService;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public RemediationOutcome execute(RemediationPlan plan) {
        RemediationOutcome outcome = attempt(plan);
        auditSink.record(outcome);
        logger.info("Finding {}: {} {} on {} ({})", plan.getFindingId(), outcome.getAction().getLabel(),
                outcome.getResult(), plan.getTargetRef(), outcome.getReason());
        return outcome;
    }

    private RemediationOutcome attempt(RemediationPlan plan) {
        if (!plan.isAutomatic()) {
            return outcome(plan, OutcomeResult.SKIPPED, RemediationOutcome.MANUAL_REVIEW, 0);
        }
        RemediationHandler handler = handlers.get(plan.getAction());
        if (handler == null) {
            logger.error("No handler registered for {}", plan.getAction());
            return outcome(plan, OutcomeResult.FAILED, "no-handler: " + plan.getAction().getLabel(), 0);
        }
        if (!handler.supports(plan)) {
            String target = plan.getTargetRef().getService() + "/" + plan.getTargetRef().getResourceType();
            return outcome(plan, OutcomeResult.FAILED, RemediationOutcome.UNSUPPORTED_TARGET + ": " + target, 0);
        }

        String targetKey = plan.getAction().name() + ":" + plan.getTargetRef();
        MutationResult result = guardedMutationService.apply(targetKey,
                () -> handler.isSatisfied(plan),
                () -> handler.apply(plan));
        switch (result.getStatus()) {
            case APPLIED:
                return outcome(plan, OutcomeResult.APPLIED, "applied", result.getAttempts());
            case ALREADY_SATISFIED:
                return outcome(plan, OutcomeResult.SKIPPED, RemediationOutcome.ALREADY_SATISFIED, result.getAttempts());
            default:
                return outcome(plan, OutcomeResult.FAILED, result.getError(), result.getAttempts());
        }
    }

    private RemediationOutcome outcome(RemediationPlan plan, OutcomeResult result, String reason, int attempts) {
        return RemediationOutcome.builder()
                .findingId(plan.getFindingId())
                .source(OutcomeSource.FINDING_PIPELINE)
                .action(plan.getAction())
                .targetRef(plan.getTargetRef().toString())
                .result(result)
                .reason(reason)
                .attempts(attempts)
                .timestamp(clock.instant())
                .build();
    }
}
