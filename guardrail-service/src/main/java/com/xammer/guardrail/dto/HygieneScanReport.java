package com.xammer.guardrail.dto;

import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.RemediationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HygieneScanReport {

    private String runId;
    private Instant startedAt;
    private Instant finishedAt;
    private int accountsScanned;
    @Builder.Default
    private List<String> accountsFailed = new ArrayList<>();
    @Builder.Default
    private List<RemediationOutcome> outcomes = new ArrayList<>();
    /** True only if every deactivation was applied or a no-op and every account was enumerated. */
    private boolean fullySuccessful;

    public Map<OutcomeResult, Long> countsByResult() {
        Map<OutcomeResult, Long> counts = new EnumMap<>(OutcomeResult.class);
        for (OutcomeResult result : OutcomeResult.values()) {
            counts.put(result, 0L);
        }
        outcomes.forEach(outcome -> counts.merge(outcome.getResult(), 1L, Long::sum));
        return counts;
    }

    /** Run-level audit record. */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", "hygiene-scan-summary");
        summary.put("runId", runId);
        summary.put("startedAt", startedAt);
        summary.put("finishedAt", finishedAt);
        summary.put("accountsScanned", accountsScanned);
        summary.put("accountsFailed", accountsFailed);
        summary.put("credentialsConsidered", outcomes.size());
        summary.put("counts", countsByResult());
        summary.put("fullySuccessful", fullySuccessful);
        return summary;
    }
}
