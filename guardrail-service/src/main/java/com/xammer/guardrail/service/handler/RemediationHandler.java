package com.xammer.guardrail.service.handler;

import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationPlan;

/**
 * Performs one remediation action against live AWS state. Implementations
 * must make {@link #apply} establish exactly the post-condition that
 * {@link #isSatisfied} checks for.
 */
public interface RemediationHandler {

    RemediationAction action();

    /** Whether this handler knows how to act on the plan's target resource. */
    boolean supports(RemediationPlan plan);

    /** Reads current target state; true when the action's post-condition already holds. */
    boolean isSatisfied(RemediationPlan plan);

    void apply(RemediationPlan plan);
}
