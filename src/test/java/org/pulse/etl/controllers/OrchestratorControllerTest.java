package org.pulse.etl.controllers;

import org.junit.jupiter.api.Test;
import org.pulse.etl.models.dto.OrchestratorStatusDTO;
import org.pulse.etl.service.orchestration.OrchestratorScheduler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrchestratorController.class)
class OrchestratorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrchestratorScheduler orchestratorScheduler;

    @Test
    void status_shouldReportRuntimeSettings() throws Exception {
        when(orchestratorScheduler.status()).thenReturn(new OrchestratorStatusDTO(true, 60, true,
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T11:00:00Z")));

        mockMvc.perform(get("/api/orchestrator"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.intervalMinutes").value(60));
    }

    @Test
    void disable_shouldTurnOrchestratorOff() throws Exception {
        when(orchestratorScheduler.disable()).thenReturn(new OrchestratorStatusDTO(false, 60, true, null, null));

        mockMvc.perform(post("/api/orchestrator/disable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void enable_shouldTurnOrchestratorOn() throws Exception {
        when(orchestratorScheduler.enable()).thenReturn(new OrchestratorStatusDTO(true, 60, true, null, null));

        mockMvc.perform(post("/api/orchestrator/enable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void updateInterval_shouldApplyMinutes() throws Exception {
        when(orchestratorScheduler.updateInterval(Duration.ofMinutes(15)))
                .thenReturn(new OrchestratorStatusDTO(true, 15, true, null, null));

        mockMvc.perform(put("/api/orchestrator/interval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intervalMinutes\":15}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intervalMinutes").value(15));
    }

    @Test
    void updateInterval_shouldRejectNonPositiveMinutes() throws Exception {
        mockMvc.perform(put("/api/orchestrator/interval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intervalMinutes\":0}"))
                .andExpect(status().isBadRequest());

        verify(orchestratorScheduler, never()).updateInterval(any());
    }
}
