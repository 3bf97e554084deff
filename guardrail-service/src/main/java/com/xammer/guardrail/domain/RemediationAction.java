package com.xammer.guardrail.domain;

/**
 * Closed set of corrective operations. MANUAL_REVIEW is the explicit no-op
 * that never reaches a mutation path.
 */
public enum RemediationAction {
    BLOCK_PUBLIC_ACCESS("block-public-access"),
    REVOKE_OVERPERMISSIVE_STATEMENT("revoke-overpermissive-statement"),
    DISABLE_UNUSED_CREDENTIAL("disable-unused-credential"),
    DEACTIVATE_STALE_CREDENTIAL("deactivate-stale-credential"),
    MANUAL_REVIEW("no-action-required-manual-review");

    private final String label;

    RemediationAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMutating() {
        return this != MANUAL_REVIEW;
    }
}
