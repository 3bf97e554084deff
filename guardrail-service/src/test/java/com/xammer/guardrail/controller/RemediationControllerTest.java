package com.xammer.guardrail.controller;

import com.xammer.guardrail.domain.OutcomeResult;
import com.xammer.guardrail.domain.OutcomeSource;
import com.xammer.guardrail.domain.RemediationAction;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.exception.AuditSinkException;
import com.xammer.guardrail.exception.GlobalExceptionHandler;
import com.xammer.guardrail.exception.MalformedFindingException;
import com.xammer.guardrail.service.RemediationPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemediationController")
class RemediationControllerTest {

    @Mock
    private RemediationPipeline remediationPipeline;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RemediationController(remediationPipeline))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Accepted findings return 202 with the outcome")
    void accepted() throws Exception {
        when(remediationPipeline.process(anyString())).thenReturn(RemediationOutcome.builder()
                .findingId("F-1")
                .source(OutcomeSource.FINDING_PIPELINE)
                .action(RemediationAction.BLOCK_PUBLIC_ACCESS)
                .result(OutcomeResult.APPLIED)
                .reason("applied")
                .attempts(1)
                .build());

        mockMvc.perform(post("/api/remediation/findings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"F-1\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.findingId").value("F-1"))
                .andExpect(jsonPath("$.result").value("APPLIED"));
    }

    @Test
    @DisplayName("Malformed findings return 400 with the finding id")
    void malformed() throws Exception {
        when(remediationPipeline.process(anyString()))
                .thenThrow(new MalformedFindingException("Finding F-2 is missing a type", "F-2", null));

        mockMvc.perform(post("/api/remediation/findings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"F-2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.findingId").value("F-2"))
                .andExpect(jsonPath("$.message").value("Finding F-2 is missing a type"));
    }

    @Test
    @DisplayName("An unreachable audit sink returns 503")
    void auditSinkDown() throws Exception {
        when(remediationPipeline.process(anyString())).thenThrow(new AuditSinkException("down", null));

        mockMvc.perform(post("/api/remediation/findings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"F-3\"}"))
                .andExpect(status().isServiceUnavailable());
    }
}
