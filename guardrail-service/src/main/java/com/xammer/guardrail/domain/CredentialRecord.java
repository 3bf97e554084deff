package com.xammer.guardrail.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * A long-lived credential (IAM access key) as seen by the hygiene scan.
 */
@Getter
@Builder
@ToString
public class CredentialRecord {

    private final String accountId;
    private final String ownerId;
    private final String credentialId;
    private final Instant createdAt;
    private final Instant lastUsedAt;
    private final CredentialStatus status;

    /** Age from creation; last use is not considered. */
    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    public String qualifiedId() {
        return accountId + "/" + ownerId + "/" + credentialId;
    }
}
