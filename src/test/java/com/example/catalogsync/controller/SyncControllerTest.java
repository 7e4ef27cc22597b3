package com.example.catalogsync.controller;

import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.enums.RunStatus;
import com.example.catalogsync.exception.ResourceNotFoundException;
import com.example.catalogsync.exception.SyncInProgressException;
import com.example.catalogsync.service.CatalogSyncService;
import com.example.catalogsync.service.SyncRunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyncController.class)
class SyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogSyncService syncService;

    @MockBean
    private SyncRunService syncRunService;

    @Test
    void testSync_ReturnsReport() throws Exception {
        when(syncService.sync("laws")).thenReturn(SyncReport.builder()
                .family("laws")
                .status(RunStatus.SUCCESS)
                .message("laws: 1 created")
                .build());

        mockMvc.perform(post("/api/sync/laws"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.family").value("laws"))
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.counts.created").value(0));
    }

    @Test
    void testSync_UnknownFamilyIsNotFound() throws Exception {
        when(syncService.sync("planets")).thenThrow(new ResourceNotFoundException("Entity family", "planets"));

        mockMvc.perform(post("/api/sync/planets"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Entity family not found: planets"));
    }

    @Test
    void testSync_RunningSyncIsConflict() throws Exception {
        when(syncService.sync("org-units")).thenThrow(new SyncInProgressException("org-units"));

        mockMvc.perform(post("/api/sync/org-units"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.family").value("org-units"));
    }

    @Test
    void testGetFamilies() throws Exception {
        when(syncService.getFamilies()).thenReturn(List.of("org-units", "dataset-compositions", "laws"));

        mockMvc.perform(get("/api/sync/families"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[2]").value("laws"));
    }

    @Test
    void testTestConnection_NotConfigured() throws Exception {
        when(syncService.isConfigured()).thenReturn(false);
        when(syncService.testConnection()).thenReturn(false);

        mockMvc.perform(get("/api/sync/test-connection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configured").value(false))
                .andExpect(jsonPath("$.connected").value(false));
    }
}
