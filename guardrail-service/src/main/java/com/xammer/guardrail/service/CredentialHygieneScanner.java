package com.xammer.guardrail.service;

import com.xammer.guardrail.config.GuardrailProperties;
import com.xammer.guardrail.domain.CredentialRecord;
import com.xammer.guardrail.domain.CredentialStatus;
import com.xammer.guardrail.domain.GovernedAccount;
import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.OutcomeSource;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.dto.HygieneScanReport;
import com.xammer.guardrail.service.audit.AuditSink;
import com.xammer.guardrail.service.credential.CredentialInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Deactivates access keys older than the configured maximum age.
 * <p>
 * Age is measured from creation, not last use. Exactly the threshold is still
 * acceptable; anything beyond it is deactivated. Every credential considered
 * yields one outcome, and the run itself yields a summary record.
 */
@Service
public class CredentialHygieneScanner {

    private static final Logger logger = LoggerFactory.getLogger(CredentialHygieneScanner.class);

    private final GovernedAccountService governedAccountService;
    private final CredentialInventory credentialInventory;
    private final GuardedMutationService guardedMutationService;
    private final AuditSink auditSink;
    private final Executor hygieneTaskExecutor;
    private final Clock clock;
    private final Duration maxKeyAge;

    public CredentialHygieneScanner(GovernedAccountService governedAccountService,
                                    CredentialInventory credentialInventory,
                                    GuardedMutationService guardedMutationService,
                                    AuditSink auditSink,
                                    @Qualifier("hygieneTaskExecutor") Executor hygieneTaskExecutor,
                                    Clock clock,
                                    GuardrailProperties properties) {
        this.governedAccountService = governedAccountService;
        this.credentialInventory = credentialInventory;
        this.guardedMutationService = guardedMutationService;
        this.auditSink = auditSink;
        this.hygieneTaskExecutor = hygieneTaskExecutor;
        this.clock = clock;
        this.maxKeyAge = properties.getHygiene().getMaxKeyAge();
    }

    public HygieneScanReport scan() {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        logger.info("Starting credential hygiene scan {} (max key age {})", runId, maxKeyAge);

        List<String> failedAccounts = new ArrayList<>();
        List<RemediationOutcome> outcomes = new ArrayList<>();
        List<CompletableFuture<RemediationOutcome>> deactivations = new ArrayList<>();
        List<GovernedAccount> accounts = governedAccountService.governedAccounts();

        for (GovernedAccount account : accounts) {
            List<CredentialRecord> credentials;
            try {
                credentials = credentialInventory.listCredentials(account);
            } catch (RuntimeException e) {
                logger.error("Could not enumerate credentials in account {}", account.getAccountId(), e);
                failedAccounts.add(account.getAccountId());
                continue;
            }
            for (CredentialRecord credential : credentials) {
                if (isStale(credential, startedAt) && credential.getStatus() == CredentialStatus.ACTIVE) {
                    deactivations.add(submit(account, credential));
                } else {
                    outcomes.add(untouched(credential, startedAt));
                }
            }
        }
        deactivations.forEach(future -> outcomes.add(future.join()));

        boolean fullySuccessful = failedAccounts.isEmpty()
                && outcomes.stream().noneMatch(outcome -> outcome.getResult() == OutcomeResult.FAILED);
        HygieneScanReport report = HygieneScanReport.builder()
                .runId(runId)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .accountsScanned(accounts.size() - failedAccounts.size())
                .accountsFailed(failedAccounts)
                .outcomes(outcomes)
                .fullySuccessful(fullySuccessful)
                .build();

        outcomes.forEach(auditSink::record);
        auditSink.recordScanSummary(report);
        logger.info("Credential hygiene scan {} finished: {} credentials, {} (fully successful: {})",
                runId, outcomes.size(), report.countsByResult(), fullySuccessful);
        return report;
    }

    private CompletableFuture<RemediationOutcome> submit(GovernedAccount account, CredentialRecord credential) {
        try {
            return CompletableFuture.supplyAsync(() -> deactivate(account, credential), hygieneTaskExecutor);
        } catch (RejectedExecutionException e) {
            logger.debug("Worker pool saturated, deactivating {} on the scan thread", credential.qualifiedId());
            return CompletableFuture.completedFuture(deactivate(account, credential));
        }
    }

    boolean isStale(CredentialRecord credential, Instant now) {
        return credential.getCreatedAt() != null && credential.ageAt(now).compareTo(maxKeyAge) > 0;
    }

    private RemediationOutcome untouched(CredentialRecord credential, Instant now) {
        String reason;
        if (credential.getStatus() == CredentialStatus.DEACTIVATED) {
            reason = RemediationOutcome.ALREADY_SATISFIED;
        } else if (credential.getCreatedAt() == null) {
            reason = "unknown-creation-date";
        } else {
            reason = RemediationOutcome.WITHIN_THRESHOLD;
        }
        return outcome(credential, OutcomeResult.SKIPPED, reason, 0);
    }

    private RemediationOutcome deactivate(GovernedAccount account, CredentialRecord credential) {
        try {
            MutationResult result = guardedMutationService.apply(
                    RemediationAction.DEACTIVATE_STALE_CREDENTIAL.name() + ":" + credential.qualifiedId(),
                    () -> credentialInventory.currentStatus(account, credential) == CredentialStatus.DEACTIVATED,
                    () -> credentialInventory.deactivate(account, credential));
            switch (result.getStatus()) {
                case APPLIED:
                    logger.info("Deactivated stale access key {} (age {} days)",
                            credential.qualifiedId(), credential.ageAt(clock.instant()).toDays());
                    return outcome(credential, OutcomeResult.APPLIED, "deactivated", result.getAttempts());
                case ALREADY_SATISFIED:
                    return outcome(credential, OutcomeResult.SKIPPED, RemediationOutcome.ALREADY_SATISFIED,
                            result.getAttempts());
                default:
                    logger.error("Failed to deactivate access key {}: {}", credential.qualifiedId(), result.getError());
                    return outcome(credential, OutcomeResult.FAILED, result.getError(), result.getAttempts());
            }
        } catch (RuntimeException e) {
            logger.error("Failed to deactivate access key {}", credential.qualifiedId(), e);
            return outcome(credential, OutcomeResult.FAILED, e.getMessage(), 1);
        }
    }

    private RemediationOutcome outcome(CredentialRecord credential, OutcomeResult result, String reason, int attempts) {
        return RemediationOutcome.builder()
                .findingId(credential.getCredentialId())
                .source(OutcomeSource.CREDENTIAL_HYGIENE)
                .action(RemediationAction.DEACTIVATE_STALE_CREDENTIAL)
                .targetRef(credential.qualifiedId())
                .result(result)
                .reason(reason)
                .attempts(attempts)
                .timestamp(clock.instant())
                .build();
    }
}
