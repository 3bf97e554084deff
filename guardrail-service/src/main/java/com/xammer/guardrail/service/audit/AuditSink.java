package com.xammer.guardrail.service.audit;

import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.dto.HygieneScanReport;
import com.xammer.guardrail.exception.AuditSinkException;

/**
 * Append-only destination for outcome records. Operators observe the
 * pipeline exclusively through this sink.
 *
 * @throws AuditSinkException from either method when the record could not be written
 */
public interface AuditSink {

    void record(RemediationOutcome outcome);

    /** Run-level record, written even when the scan considered no credentials. */
    void recordScanSummary(HygieneScanReport report);
}
