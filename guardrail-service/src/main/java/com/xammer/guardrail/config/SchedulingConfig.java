package com.xammer.guardrail.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Activates the credential hygiene timer.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
