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
import com.xammer.guardrail.exception.TransientTargetException;
import com.xammer.guardrail.service.audit.AuditSink;
import com.xammer.guardrail.service.credential.CredentialInventory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CredentialHygieneScanner")
class CredentialHygieneScannerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T03:00:00Z");
    private static final GovernedAccount ACCOUNT_A = GovernedAccount.local("111111111111");
    private static final GovernedAccount ACCOUNT_B = GovernedAccount.local("222222222222");

    @Mock
    private GovernedAccountService governedAccountService;

    @Mock
    private CredentialInventory credentialInventory;

    @Mock
    private AuditSink auditSink;

    private CredentialHygieneScanner scanner;

    @BeforeEach
    void setUp() {
        GuardedMutationService guarded = new GuardedMutationService(RetryTemplate.builder()
                .maxAttempts(2)
                .noBackoff()
                .retryOn(TransientTargetException.class)
                .build());
        scanner = new CredentialHygieneScanner(governedAccountService, credentialInventory, guarded, auditSink,
                new SyncTaskExecutor(), Clock.fixed(NOW, ZoneOffset.UTC), new GuardrailProperties());
    }

    private static CredentialRecord key(GovernedAccount account, String id, Duration age, CredentialStatus status) {
        return CredentialRecord.builder()
                .accountId(account.getAccountId())
                .ownerId("alice")
                .credentialId(id)
                .createdAt(NOW.minus(age))
                .status(status)
                .build();
    }

    private static Map<String, RemediationOutcome> byCredential(HygieneScanReport report) {
        return report.getOutcomes().stream()
                .collect(Collectors.toMap(RemediationOutcome::getFindingId, Function.identity()));
    }

    @Test
    @DisplayName("Stale active keys are deactivated, fresh and already-inactive keys are left alone")
    void staleFreshAndInactive() {
        CredentialRecord k1 = key(ACCOUNT_A, "K1", Duration.ofDays(91), CredentialStatus.ACTIVE);
        CredentialRecord k2 = key(ACCOUNT_A, "K2", Duration.ofDays(45), CredentialStatus.ACTIVE);
        CredentialRecord k3 = key(ACCOUNT_A, "K3", Duration.ofDays(120), CredentialStatus.DEACTIVATED);
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(List.of(k1, k2, k3));
        when(credentialInventory.currentStatus(ACCOUNT_A, k1)).thenReturn(CredentialStatus.ACTIVE);

        HygieneScanReport report = scanner.scan();

        Map<String, RemediationOutcome> outcomes = byCredential(report);
        assertThat(outcomes.get("K1").getResult()).isEqualTo(OutcomeResult.APPLIED);
        assertThat(outcomes.get("K1").getAction()).isEqualTo(RemediationAction.DEACTIVATE_STALE_CREDENTIAL);
        assertThat(outcomes.get("K1").getSource()).isEqualTo(OutcomeSource.CREDENTIAL_HYGIENE);
        assertThat(outcomes.get("K2").getResult()).isEqualTo(OutcomeResult.SKIPPED);
        assertThat(outcomes.get("K2").getReason()).isEqualTo(RemediationOutcome.WITHIN_THRESHOLD);
        assertThat(outcomes.get("K3").getResult()).isEqualTo(OutcomeResult.SKIPPED);
        assertThat(outcomes.get("K3").getReason()).isEqualTo(RemediationOutcome.ALREADY_SATISFIED);
        assertThat(report.isFullySuccessful()).isTrue();
        assertThat(report.getAccountsScanned()).isEqualTo(1);

        verify(credentialInventory).deactivate(ACCOUNT_A, k1);
        verify(credentialInventory, never()).deactivate(ACCOUNT_A, k2);
        verify(credentialInventory, never()).deactivate(ACCOUNT_A, k3);
        verify(credentialInventory, never()).currentStatus(ACCOUNT_A, k3);
        verify(auditSink, times(3)).record(any(RemediationOutcome.class));
        verify(auditSink).recordScanSummary(report);
    }

    @Test
    @DisplayName("A key exactly at the threshold is kept, one second more is deactivated")
    void thresholdBoundary() {
        CredentialRecord atThreshold = key(ACCOUNT_A, "EXACT", Duration.ofDays(90), CredentialStatus.ACTIVE);
        CredentialRecord justOver = key(ACCOUNT_A, "OVER", Duration.ofDays(90).plusSeconds(1), CredentialStatus.ACTIVE);
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(List.of(atThreshold, justOver));
        when(credentialInventory.currentStatus(ACCOUNT_A, justOver)).thenReturn(CredentialStatus.ACTIVE);

        Map<String, RemediationOutcome> outcomes = byCredential(scanner.scan());

        assertThat(outcomes.get("EXACT").getReason()).isEqualTo(RemediationOutcome.WITHIN_THRESHOLD);
        assertThat(outcomes.get("OVER").getResult()).isEqualTo(OutcomeResult.APPLIED);
    }

    @Test
    @DisplayName("A key deactivated by someone else between listing and acting is skipped")
    void concurrentlyDeactivated() {
        CredentialRecord k1 = key(ACCOUNT_A, "K1", Duration.ofDays(120), CredentialStatus.ACTIVE);
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(List.of(k1));
        when(credentialInventory.currentStatus(ACCOUNT_A, k1)).thenReturn(CredentialStatus.DEACTIVATED);

        Map<String, RemediationOutcome> outcomes = byCredential(scanner.scan());

        assertThat(outcomes.get("K1").getResult()).isEqualTo(OutcomeResult.SKIPPED);
        assertThat(outcomes.get("K1").getReason()).isEqualTo(RemediationOutcome.ALREADY_SATISFIED);
        verify(credentialInventory, never()).deactivate(any(), any());
    }

    @Test
    @DisplayName("One failed deactivation does not stop the others and marks the run partial")
    void partialFailure() {
        CredentialRecord denied = key(ACCOUNT_A, "DENIED", Duration.ofDays(100), CredentialStatus.ACTIVE);
        CredentialRecord stale = key(ACCOUNT_A, "STALE", Duration.ofDays(100), CredentialStatus.ACTIVE);
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(List.of(denied, stale));
        when(credentialInventory.currentStatus(any(), any())).thenReturn(CredentialStatus.ACTIVE);
        doAnswer(invocation -> {
            if (invocation.getArgument(1) == denied) {
                throw AwsServiceException.builder()
                        .statusCode(403)
                        .awsErrorDetails(AwsErrorDetails.builder().errorCode("AccessDenied").errorMessage("denied").build())
                        .build();
            }
            return null;
        }).when(credentialInventory).deactivate(any(), any());

        HygieneScanReport report = scanner.scan();

        Map<String, RemediationOutcome> outcomes = byCredential(report);
        assertThat(outcomes.get("DENIED").getResult()).isEqualTo(OutcomeResult.FAILED);
        assertThat(outcomes.get("STALE").getResult()).isEqualTo(OutcomeResult.APPLIED);
        assertThat(report.isFullySuccessful()).isFalse();
        assertThat(report.countsByResult())
                .containsEntry(OutcomeResult.APPLIED, 1L)
                .containsEntry(OutcomeResult.FAILED, 1L)
                .containsEntry(OutcomeResult.SKIPPED, 0L);
    }

    @Test
    @DisplayName("Deactivations the worker pool rejects run on the scan thread and are still recorded")
    void saturatedWorkerPool() {
        List<CredentialRecord> stale = IntStream.range(0, 5)
                .mapToObj(i -> key(ACCOUNT_A, "K" + i, Duration.ofDays(91), CredentialStatus.ACTIVE))
                .collect(Collectors.toList());
        AtomicInteger submitted = new AtomicInteger();
        Executor saturated = task -> {
            if (submitted.incrementAndGet() > 2) {
                throw new TaskRejectedException("Executor queue is full");
            }
            task.run();
        };
        GuardedMutationService guarded = new GuardedMutationService(RetryTemplate.builder()
                .maxAttempts(2)
                .noBackoff()
                .retryOn(TransientTargetException.class)
                .build());
        CredentialHygieneScanner saturatedScanner = new CredentialHygieneScanner(governedAccountService,
                credentialInventory, guarded, auditSink, saturated, Clock.fixed(NOW, ZoneOffset.UTC),
                new GuardrailProperties());
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(stale);
        when(credentialInventory.currentStatus(any(), any())).thenReturn(CredentialStatus.ACTIVE);

        HygieneScanReport report = saturatedScanner.scan();

        assertThat(submitted.get()).isEqualTo(5);
        assertThat(report.getOutcomes()).hasSize(5)
                .allSatisfy(outcome -> assertThat(outcome.getResult()).isEqualTo(OutcomeResult.APPLIED));
        assertThat(report.isFullySuccessful()).isTrue();
        stale.forEach(credential -> verify(credentialInventory).deactivate(ACCOUNT_A, credential));
        verify(auditSink, times(5)).record(any(RemediationOutcome.class));
        verify(auditSink).recordScanSummary(report);
    }

    @Test
    @DisplayName("An account that cannot be enumerated is reported and the rest are still scanned")
    void accountFailure() {
        CredentialRecord k1 = key(ACCOUNT_A, "K1", Duration.ofDays(10), CredentialStatus.ACTIVE);
        when(governedAccountService.governedAccounts()).thenReturn(List.of(ACCOUNT_A, ACCOUNT_B));
        when(credentialInventory.listCredentials(ACCOUNT_A)).thenReturn(List.of(k1));
        when(credentialInventory.listCredentials(ACCOUNT_B)).thenThrow(new IllegalStateException("role not assumable"));

        HygieneScanReport report = scanner.scan();

        assertThat(report.getAccountsFailed()).containsExactly("222222222222");
        assertThat(report.getAccountsScanned()).isEqualTo(1);
        assertThat(report.getOutcomes()).hasSize(1);
        assertThat(report.isFullySuccessful()).isFalse();
        verify(auditSink).recordScanSummary(report);
    }
}
