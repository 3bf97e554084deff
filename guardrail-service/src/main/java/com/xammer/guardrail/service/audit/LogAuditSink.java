package com.xammer.guardrail.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.dto.HygieneScanReport;
import com.xammer.guardrail.exception.AuditSinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;


/**
 * Writes one JSON line per record to the {@code guardrail.audit} logger,
 * which logback-spring.xml routes to its own appender.
 */
@Service
@ConditionalOnProperty(name = "guardrail.audit.sink", havingValue = "log", matchIfMissing = true)
public class LogAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("guardrail.audit");

    private final ObjectMapper objectMapper;

    public LogAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(RemediationOutcome outcome) {
        audit.info(toJson(outcome));
    }

    @Override
    public void recordScanSummary(HygieneScanReport report) {
        audit.info(toJson(report.summary()));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AuditSinkException("Could not serialize audit record", e);
        }
    }
}
