package com.xammer.guardrail.controller;

import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.dto.RemediationPreview;
import com.xammer.guardrail.service.RemediationPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for finding events delivered by the event platform.
 * The body is taken raw so malformed payloads reach the normalizer and get recorded.
 */
@RestController
@RequestMapping("/api/remediation")
public class RemediationController {

    private final RemediationPipeline remediationPipeline;

    public RemediationController(RemediationPipeline remediationPipeline) {
        this.remediationPipeline = remediationPipeline;
    }

    @PostMapping(value = "/findings", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<RemediationOutcome> processFinding(@RequestBody String payload) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(remediationPipeline.process(payload));
    }

    @PostMapping(value = "/plan", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<RemediationPreview> previewPlan(@RequestBody String payload) {
        return ResponseEntity.ok(remediationPipeline.preview(payload));
    }
}
