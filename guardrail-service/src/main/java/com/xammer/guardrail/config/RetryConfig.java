package com.xammer.guardrail.config;

import com.xammer.guardrail.exception.TransientTargetException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    /**
     * Bounded exponential backoff for calls against remediation targets.
     * Only {@link TransientTargetException} is retried; everything else fails
     * on the first attempt.
     */
    @Bean
    public RetryTemplate remediationRetryTemplate(GuardrailProperties properties) {
        GuardrailProperties.Retry retry = properties.getRemediation().getRetry();
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .exponentialBackoff(retry.getInitialInterval().toMillis(), retry.getMultiplier(),
                        retry.getMaxInterval().toMillis())
                .retryOn(TransientTargetException.class)
                .build();
    }
}
