package com.bank.payout.controller;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.service.AuditTrailService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AutomationConfig automationConfig;

    @MockBean
    private AuditTrailService auditTrailService;

    private void stubThresholds(double full, double partial, double fraction, int maxAttempts) {
        when(automationConfig.getFullThreshold()).thenReturn(full);
        when(automationConfig.getPartialThreshold()).thenReturn(partial);
        when(automationConfig.getPartialAutoApproveFraction()).thenReturn(fraction);
        when(automationConfig.getMaxAttempts()).thenReturn(maxAttempts);
    }

    @Test
    void getAutomation_success() throws Exception {
        stubThresholds(75.0, 50.0, 0.5, 3);
        when(automationConfig.getStuckProcessingTimeoutMinutes()).thenReturn(30L);

        mockMvc.perform(get("/api/v1/config/automation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fullThreshold").value(75.0))
                .andExpect(jsonPath("$.partialThreshold").value(50.0))
                .andExpect(jsonPath("$.partialAutoApproveFraction").value(0.5))
                .andExpect(jsonPath("$.maxAttempts").value(3))
                .andExpect(jsonPath("$.stuckProcessingTimeoutMinutes").value(30));
    }

    @Test
    void updateAutomation_success_isJournaled() throws Exception {
        stubThresholds(75.0, 50.0, 0.5, 3);

        mockMvc.perform(put("/api/v1/config/automation")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "fullThreshold", 80.0,
                                "partialThreshold", 55.0))))
                .andExpect(status().isOk());

        verify(automationConfig).setFullThreshold(80.0);
        verify(automationConfig).setPartialThreshold(55.0);
        verify(automationConfig).setPartialAutoApproveFraction(0.5);
        verify(automationConfig).setMaxAttempts(3);
        verify(auditTrailService).record(eq(AuditEventType.CONFIG_UPDATED), eq(AuditEntry.ENTITY_SYSTEM),
                eq("automation-config"), eq("ops-alice"), anyMap());
    }

    @Test
    void updateAutomation_partialNotBelowFull_returns400() throws Exception {
        stubThresholds(75.0, 50.0, 0.5, 3);

        mockMvc.perform(put("/api/v1/config/automation")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("partialThreshold", 80.0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("partialThreshold must be less than fullThreshold"))
                .andExpect(jsonPath("$.field").value("partialThreshold"));

        verify(automationConfig, never()).setPartialThreshold(anyDouble());
        verifyNoInteractions(auditTrailService);
    }

    @Test
    void updateAutomation_fullAbove100_returns400() throws Exception {
        stubThresholds(75.0, 50.0, 0.5, 3);

        mockMvc.perform(put("/api/v1/config/automation")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("fullThreshold", 120))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("fullThreshold"));
    }

    @Test
    void updateAutomation_fractionOutOfRange_returns400() throws Exception {
        stubThresholds(75.0, 50.0, 0.5, 3);

        mockMvc.perform(put("/api/v1/config/automation")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("partialAutoApproveFraction", 1.5))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("partialAutoApproveFraction must be in (0, 1]"));
    }

    @Test
    void updateAutomation_missingOperator_returns401() throws Exception {
        mockMvc.perform(put("/api/v1/config/automation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullThreshold\":80}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(auditTrailService);
    }
}
