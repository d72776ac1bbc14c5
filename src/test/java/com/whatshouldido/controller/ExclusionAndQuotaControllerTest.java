package com.whatshouldido.controller;

import com.whatshouldido.entity.UserExclusion;
import com.whatshouldido.service.history.UserHistoryService;
import com.whatshouldido.service.quota.QuotaService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({ExclusionController.class, QuotaController.class})
class ExclusionAndQuotaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserHistoryService userHistoryService;

    @MockBean
    private QuotaService quotaService;

    @Test
    void quotaStatusForFreeUser() throws Exception {
        when(quotaService.isPremium("user-1")).thenReturn(false);
        when(quotaService.getRemaining("user-1")).thenReturn(3);
        when(quotaService.getDefaultQuota()).thenReturn(5);

        mockMvc.perform(get("/api/quota").header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("user-1"))
                .andExpect(jsonPath("$.remaining").value(3))
                .andExpect(jsonPath("$.limit").value(5))
                .andExpect(jsonPath("$.premium").value(false));
        verify(quotaService).initializeIfNeeded("user-1");
    }

    @Test
    void quotaStatusRequiresUser() throws Exception {
        mockMvc.perform(get("/api/quota"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void addsExclusion() throws Exception {
        UserExclusion saved = new UserExclusion();
        saved.setUserId("user-1");
        saved.setPlaceId("abc");
        saved.setReason("too loud");
        when(userHistoryService.addExclusion("user-1", "abc", "Bar", "too loud", 30)).thenReturn(saved);

        mockMvc.perform(post("/api/exclusions")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"placeId\": \"abc\", \"placeName\": \"Bar\", \"reason\": \"too loud\", \"days\": 30}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.placeId").value("abc"));
    }

    @Test
    void exclusionValidationCollectsErrors() throws Exception {
        mockMvc.perform(post("/api/exclusions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"days\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(3)));
        verify(userHistoryService, never()).addExclusion(anyString(), anyString(), any(), any(), any());
    }

    @Test
    void removingUnknownExclusionIs404() throws Exception {
        when(userHistoryService.removeExclusion("user-1", "zzz")).thenReturn(false);
        when(userHistoryService.removeExclusion("user-1", "abc")).thenReturn(true);

        mockMvc.perform(delete("/api/exclusions/zzz").header("X-User-Id", "user-1"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/exclusions/abc").header("X-User-Id", "user-1"))
                .andExpect(status().isNoContent());
    }
}
