package com.xammer.guardrail.controller;

import com.xammer.guardrail.dto.HygieneScanReport;
import com.xammer.guardrail.service.CredentialHygieneScanner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/hygiene")
public class HygieneController {

    private final CredentialHygieneScanner credentialHygieneScanner;

    public HygieneController(CredentialHygieneScanner credentialHygieneScanner) {
        this.credentialHygieneScanner = credentialHygieneScanner;
    }

    @PostMapping("/scan")
    public ResponseEntity<HygieneScanReport> runScan() {
        return ResponseEntity.ok(credentialHygieneScanner.scan());
    }
}
