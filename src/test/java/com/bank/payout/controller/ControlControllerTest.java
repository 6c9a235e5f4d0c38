package com.bank.payout.controller;

import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.model.SystemHealth;
import com.bank.payout.service.EmergencyHaltService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ControlController.class)
class ControlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private EmergencyHaltService haltService;

    @Test
    void status_running() throws Exception {
        when(haltService.status()).thenReturn(EmergencyHaltState.running());

        mockMvc.perform(get("/api/v1/control/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(false));
    }

    @Test
    void health_success() throws Exception {
        when(haltService.health()).thenReturn(SystemHealth.builder()
                .halted(false)
                .recentFailures(2)
                .stuckRequests(1)
                .manualReviewQueue(4)
                .healthScore(80)
                .recentEvents(List.of())
                .build());

        mockMvc.perform(get("/api/v1/control/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthScore").value(80))
                .andExpect(jsonPath("$.recentFailures").value(2))
                .andExpect(jsonPath("$.stuckRequests").value(1));
    }

    @Test
    void halt_success() throws Exception {
        when(haltService.halt("treasury incident", "ops-alice")).thenReturn(EmergencyHaltState.builder()
                .halted(true).reason("treasury incident").changedBy("ops-alice").changedAt(1000L).build());

        mockMvc.perform(post("/api/v1/control/halt")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("reason", "treasury incident"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(true))
                .andExpect(jsonPath("$.changedBy").value("ops-alice"));
    }

    @Test
    void halt_withoutReason_returns400() throws Exception {
        when(haltService.halt(null, "ops-alice"))
                .thenThrow(new ValidationException("reason is required to halt processing"));

        mockMvc.perform(post("/api/v1/control/halt")
                        .header("X-Operator-Id", "ops-alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("reason is required to halt processing"));
    }

    @Test
    void halt_missingOperator_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/control/halt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"incident\"}"))
                .andExpect(status().isUnauthorized());

        verify(haltService, never()).halt(any(), any());
    }

    @Test
    void resume_withoutBody() throws Exception {
        when(haltService.resume(null, "ops-alice")).thenReturn(EmergencyHaltState.builder()
                .halted(false).changedBy("ops-alice").build());

        mockMvc.perform(post("/api/v1/control/resume").header("X-Operator-Id", "ops-alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(false));

        verify(haltService).resume(null, "ops-alice");
    }
}
