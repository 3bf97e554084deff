package com.xammer.guardrail.service;

import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.OutcomeSource;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.domain.RemediationPlan;
import com.xammer.guardrail.domain.ResourceRef;
import com.xammer.guardrail.domain.Severity;
import com.xammer.guardrail.exception.AuditSinkException;
import com.xammer.guardrail.exception.TransientTargetException;
import com.xammer.guardrail.service.audit.AuditSink;
import com.xammer.guardrail.service.handler.RemediationHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemediationExecutor")
class RemediationExecutorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private RemediationHandler handler;

    @Mock
    private AuditSink auditSink;

    private RemediationExecutor executor;

    @BeforeEach
    void setUp() {
        when(handler.action()).thenReturn(RemediationAction.BLOCK_PUBLIC_ACCESS);
        GuardedMutationService guarded = new GuardedMutationService(RetryTemplate.builder()
                .maxAttempts(3)
                .noBackoff()
                .retryOn(TransientTargetException.class)
                .build());
        executor = new RemediationExecutor(List.of(handler), guarded, auditSink, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RemediationPlan plan(RemediationAction action) {
        return RemediationPlan.builder()
                .findingId("F-1")
                .action(action)
                .recommendedAction(RemediationAction.BLOCK_PUBLIC_ACCESS)
                .severity(Severity.HIGH)
                .targetRef(ResourceRef.parse("arn:aws:s3:::acme-public"))
                .guidance(List.of())
                .attributes(Map.of())
                .build();
    }

    private RemediationOutcome recorded() {
        ArgumentCaptor<RemediationOutcome> captor = ArgumentCaptor.forClass(RemediationOutcome.class);
        verify(auditSink).record(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Applies the action and records one APPLIED outcome")
    void applies() {
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        when(handler.supports(plan)).thenReturn(true);
        when(handler.isSatisfied(plan)).thenReturn(false);

        RemediationOutcome outcome = executor.execute(plan);

        assertThat(outcome.getResult()).isEqualTo(OutcomeResult.APPLIED);
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getSource()).isEqualTo(OutcomeSource.FINDING_PIPELINE);
        assertThat(outcome.getTargetRef()).isEqualTo("arn:aws:s3:::acme-public");
        assertThat(outcome.getTimestamp()).isEqualTo(NOW);
        assertThat(recorded()).isSameAs(outcome);
        verify(handler).apply(plan);
    }

    @Test
    @DisplayName("Already satisfied targets are skipped without mutation")
    void alreadySatisfied() {
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        when(handler.supports(plan)).thenReturn(true);
        when(handler.isSatisfied(plan)).thenReturn(true);

        RemediationOutcome outcome = executor.execute(plan);

        assertThat(outcome.getResult()).isEqualTo(OutcomeResult.SKIPPED);
        assertThat(outcome.getReason()).isEqualTo(RemediationOutcome.ALREADY_SATISFIED);
        verify(handler, never()).apply(any());
    }

    @Test
    @DisplayName("Transient failures are retried until the action sticks")
    void retriesThenApplies() {
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        when(handler.supports(plan)).thenReturn(true);
        when(handler.isSatisfied(plan)).thenReturn(false);
        doThrow(SdkClientException.create("timeout")).doNothing().when(handler).apply(plan);

        RemediationOutcome outcome = executor.execute(plan);

        assertThat(outcome.getResult()).isEqualTo(OutcomeResult.APPLIED);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        verify(handler, times(2)).apply(plan);
    }

    @Test
    @DisplayName("Exhausted retries end in a FAILED outcome, not an exception")
    void exhausted() {
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        when(handler.supports(plan)).thenReturn(true);
        when(handler.isSatisfied(plan)).thenReturn(false);
        doThrow(SdkClientException.create("timeout")).when(handler).apply(plan);

        RemediationOutcome outcome = executor.execute(plan);

        assertThat(outcome.getResult()).isEqualTo(OutcomeResult.FAILED);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getReason()).contains("timeout");
        assertThat(recorded()).isSameAs(outcome);
    }

    @Test
    @DisplayName("Manual review plans are recorded as SKIPPED and never reach a handler")
    void manualReview() {
        RemediationOutcome outcome = executor.execute(plan(RemediationAction.MANUAL_REVIEW));

        assertThat(outcome.getResult()).isEqualTo(OutcomeResult.SKIPPED);
        assertThat(outcome.getReason()).isEqualTo(RemediationOutcome.MANUAL_REVIEW);
        assertThat(outcome.getAttempts()).isZero();
        verify(handler, never()).isSatisfied(any());
        verify(handler, never()).apply(any());
    }

    @Test
    @DisplayName("Unsupported targets and missing handlers fail")
    void unsupported() {
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        when(handler.supports(plan)).thenReturn(false);

        assertThat(executor.execute(plan).getReason()).startsWith(RemediationOutcome.UNSUPPORTED_TARGET);
        assertThat(executor.execute(plan(RemediationAction.DISABLE_UNUSED_CREDENTIAL)).getReason())
                .startsWith("no-handler");
    }

    @Test
    @DisplayName("Audit sink failures propagate")
    void auditFailure() {
        doThrow(new AuditSinkException("down", null)).when(auditSink).record(any());

        assertThatThrownBy(() -> executor.execute(plan(RemediationAction.MANUAL_REVIEW)))
                .isInstanceOf(AuditSinkException.class);
    }

    @Test
    @DisplayName("Two concurrent deliveries of one finding mutate once and record two outcomes")
    void concurrentDeliveries() throws Exception {
        PublicAccessState bucket = new PublicAccessState();
        GuardedMutationService guarded = new GuardedMutationService(RetryTemplate.builder()
                .maxAttempts(3)
                .noBackoff()
                .retryOn(TransientTargetException.class)
                .build());
        RemediationExecutor concurrent = new RemediationExecutor(List.of(bucket), guarded, auditSink,
                Clock.fixed(NOW, ZoneOffset.UTC));
        RemediationPlan plan = plan(RemediationAction.BLOCK_PUBLIC_ACCESS);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<RemediationOutcome> first = pool.submit(() -> {
                start.await();
                return concurrent.execute(plan);
            });
            Future<RemediationOutcome> second = pool.submit(() -> {
                start.await();
                return concurrent.execute(plan);
            });
            start.countDown();

            List<OutcomeResult> results = List.of(
                    first.get(5, TimeUnit.SECONDS).getResult(),
                    second.get(5, TimeUnit.SECONDS).getResult());
            assertThat(results).containsExactlyInAnyOrder(OutcomeResult.APPLIED, OutcomeResult.SKIPPED);
        } finally {
            pool.shutdownNow();
        }

        assertThat(bucket.applies.get()).isEqualTo(1);
        ArgumentCaptor<RemediationOutcome> captor = ArgumentCaptor.forClass(RemediationOutcome.class);
        verify(auditSink, times(2)).record(captor.capture());
        assertThat(captor.getAllValues())
                .extracting(RemediationOutcome::getReason)
                .containsExactlyInAnyOrder("applied", RemediationOutcome.ALREADY_SATISFIED);
    }

    /** Bucket whose public access block turns on after the first apply. */
    private static final class PublicAccessState implements RemediationHandler {

        private final AtomicBoolean blocked = new AtomicBoolean();
        private final AtomicInteger applies = new AtomicInteger();

        @Override
        public RemediationAction action() {
            return RemediationAction.BLOCK_PUBLIC_ACCESS;
        }

        @Override
        public boolean supports(RemediationPlan plan) {
            return true;
        }

        @Override
        public boolean isSatisfied(RemediationPlan plan) {
            return blocked.get();
        }

        @Override
        public void apply(RemediationPlan plan) {
            applies.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            blocked.set(true);
        }
    }
}
