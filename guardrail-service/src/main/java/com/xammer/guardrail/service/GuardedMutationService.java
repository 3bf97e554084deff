package com.xammer.guardrail.service;

import com.xammer.guardrail.exception.TransientTargetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Check-then-act against live target state, shared by the remediation
 * executor and the credential hygiene scan.
 * <p>
 * Every attempt re-reads the target and skips the mutation when the desired
 * post-condition already holds, so redelivered work never double-applies.
 * Transient AWS errors are retried by the injected {@link RetryTemplate};
 * any failure left after that is returned, never thrown. Each attempt's
 * check and mutation run under a per-target lock within this process; the
 * lock is released between attempts.
 */
@Service
public class GuardedMutationService {

    private static final Logger logger = LoggerFactory.getLogger(GuardedMutationService.class);

    private static final int LOCK_STRIPES = 64;

    private final RetryTemplate retryTemplate;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public GuardedMutationService(RetryTemplate remediationRetryTemplate) {
        this.retryTemplate = remediationRetryTemplate;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public MutationResult apply(String targetKey, BooleanSupplier alreadySatisfied, Runnable mutation) {
        ReentrantLock lock = locks[Math.floorMod(targetKey.hashCode(), LOCK_STRIPES)];
        return retryTemplate.execute(context -> {
            int attempt = context.getRetryCount() + 1;
            // held per attempt only; backoff sleeps run unlocked
            lock.lock();
            try {
                if (translated(alreadySatisfied::getAsBoolean)) {
                    logger.debug("{} already satisfied on attempt {}", targetKey, attempt);
                    return MutationResult.alreadySatisfied(attempt);
                }
                translated(() -> {
                    mutation.run();
                    return Boolean.TRUE;
                });
            } finally {
                lock.unlock();
            }
            logger.debug("{} mutated on attempt {}", targetKey, attempt);
            return MutationResult.applied(attempt);
        }, context -> {
            Throwable last = context.getLastThrowable();
            int attempts = Math.max(1, context.getRetryCount());
            String reason = last instanceof TransientTargetException
                    ? "transient error after " + attempts + " attempt(s): " + rootMessage(last)
                    : rootMessage(last);
            logger.warn("Mutation of {} failed: {}", targetKey, reason);
            return MutationResult.failed(attempts, reason);
        });
    }

    private static <T> T translated(Supplier<T> call) {
        try {
            return call.get();
        } catch (SdkException e) {
            if (TransientErrors.isTransient(e)) {
                throw new TransientTargetException(e.getMessage(), e);
            }
            throw e;
        }
    }

    private static String rootMessage(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        Throwable cause = error instanceof TransientTargetException && error.getCause() != null
                ? error.getCause() : error;
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
