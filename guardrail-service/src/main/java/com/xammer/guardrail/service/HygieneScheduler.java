package com.xammer.guardrail.service;

import com.xammer.guardrail.config.GuardrailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HygieneScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HygieneScheduler.class);

    private final CredentialHygieneScanner scanner;
    private final GuardrailProperties properties;

    public HygieneScheduler(CredentialHygieneScanner scanner, GuardrailProperties properties) {
        this.scanner = scanner;
        this.properties = properties;
    }

    /**
     * Runs daily at 03:00 UTC by default. Keys missed because of a failure
     * are picked up again on the next run.
     */
    @Scheduled(cron = "${guardrail.hygiene.cron:0 0 3 * * *}", zone = "UTC")
    public void runScheduledScan() {
        if (!properties.getHygiene().isEnabled()) {
            logger.debug("Credential hygiene scan is disabled");
            return;
        }
        try {
            scanner.scan();
        } catch (RuntimeException e) {
            logger.error("Scheduled credential hygiene scan failed", e);
        }
    }
}
