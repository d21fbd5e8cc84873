package org.pulse.etl.controllers;

import org.junit.jupiter.api.Test;
import org.pulse.etl.exceptions.RawDataNotFoundException;
import org.pulse.etl.models.dto.RawDataPage;
import org.pulse.etl.models.enums.ProcessingStatus;
import org.pulse.etl.service.rawdata.RawDataService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RawDataController.class)
class RawDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RawDataService rawDataService;

    @Test
    void list_shouldFilterByLowercaseStatus() throws Exception {
        when(rawDataService.list(1L, ProcessingStatus.FAILED, 0, 50)).thenReturn(new RawDataPage(List.of(), 1L, ProcessingStatus.FAILED, 0, 0, 0, 50));

        mockMvc.perform(get("/api/raw-data").param("tenantId", "1").param("status", "failed"))
                .andExpect(status().isOk());

        verify(rawDataService).list(1L, ProcessingStatus.FAILED, 0, 50);
    }

    @Test
    void list_shouldRejectUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/raw-data").param("status", "exploded")).andExpect(status().isBadRequest());
    }

    @Test
    void reprocess_shouldReturnConflictWhileProcessing() throws Exception {
        when(rawDataService.reprocess(3L)).thenThrow(new IllegalStateException("busy"));

        mockMvc.perform(post("/api/raw-data/3/reprocess")).andExpect(status().isConflict());
    }

    @Test
    void reprocess_shouldReturnNotFoundForUnknownRow() throws Exception {
        when(rawDataService.reprocess(4L)).thenThrow(new RawDataNotFoundException(4L));

        mockMvc.perform(post("/api/raw-data/4/reprocess")).andExpect(status().isNotFound());
    }

    @Test
    void updateStatus_shouldRequireStatus() throws Exception {
        mockMvc.perform(patch("/api/raw-data/5/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"errorDetails\":{\"error\":\"x\"}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void updateStatus_shouldApplyParsedStatus() throws Exception {
        mockMvc.perform(patch("/api/raw-data/5/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isOk());

        verify(rawDataService).updateStatus(eq(5L), eq(ProcessingStatus.COMPLETED), any());
    }
}
