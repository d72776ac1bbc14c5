package com.whatshouldido.controller;

import com.whatshouldido.dto.request.CreateSuggestionsRequest;
import com.whatshouldido.dto.response.FilterInfo;
import com.whatshouldido.dto.response.SuggestionMeta;
import com.whatshouldido.dto.response.SuggestionView;
import com.whatshouldido.dto.response.SuggestionsResponse;
import com.whatshouldido.exception.CollaboratorFailureException;
import com.whatshouldido.exception.QuotaExceededException;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.service.quota.QuotaService;
import com.whatshouldido.service.suggestion.SuggestionOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SuggestionsController.class)
class SuggestionsControllerTest {

    private static final String BODY = """
            {"intent": "FOOD_ONLY", "latitude": 41.0082, "longitude": 28.9784, "radiusMeters": 2000}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SuggestionOrchestrator suggestionOrchestrator;

    @MockBean
    private QuotaService quotaService;

    @Test
    void returnsSuggestionsWithQuotaHeadersForFreeUser() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), eq("user-1")))
                .thenReturn(sampleResponse("user-1"));
        when(quotaService.isPremium("user-1")).thenReturn(false);
        when(quotaService.getRemaining("user-1")).thenReturn(4);
        when(quotaService.getDefaultQuota()).thenReturn(5);

        mockMvc.perform(post("/api/suggestions")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Quota-Remaining", "4"))
                .andExpect(header().string("X-Quota-Limit", "5"))
                .andExpect(jsonPath("$.intent").value("FOOD_ONLY"))
                .andExpect(jsonPath("$.isPersonalized").value(false))
                .andExpect(jsonPath("$.suggestions", hasSize(1)))
                .andExpect(jsonPath("$.route").doesNotExist())
                .andExpect(jsonPath("$.metadata.source").value("IntentOrchestrator"));
    }

    @Test
    void anonymousAndPremiumResponsesHaveNoQuotaHeaders() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), isNull()))
                .thenReturn(sampleResponse(null));

        mockMvc.perform(post("/api/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Quota-Remaining"))
                .andExpect(jsonPath("$.userId").doesNotExist());

        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), eq("vip")))
                .thenReturn(sampleResponse("vip"));
        when(quotaService.isPremium("vip")).thenReturn(true);

        mockMvc.perform(post("/api/suggestions")
                        .header("X-User-Id", "vip")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Quota-Remaining"));
    }

    @Test
    void validationFailureReturns400WithAllErrors() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), any()))
                .thenThrow(new ValidationException(List.of(
                        "Intent is required",
                        "Latitude must be between -90 and 90")));

        mockMvc.perform(post("/api/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": 120, \"longitude\": 28.9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors", hasSize(2)))
                .andExpect(jsonPath("$.path").value("/api/suggestions"));
    }

    @Test
    void quotaExhaustedReturns403() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), eq("user-1")))
                .thenThrow(new QuotaExceededException("user-1", 0, 5));

        mockMvc.perform(post("/api/suggestions")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(header().string("X-Quota-Remaining", "0"))
                .andExpect(header().string("X-Quota-Limit", "5"))
                .andExpect(jsonPath("$.errorCode").value("QUOTA_EXHAUSTED"))
                .andExpect(jsonPath("$.extensions.remaining").value(0))
                .andExpect(jsonPath("$.extensions.limit").value(5));
    }

    @Test
    void collaboratorFailureReturns503() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), any()))
                .thenThrow(new CollaboratorFailureException("PlacesProvider", "Place search timed out", null));

        mockMvc.perform(post("/api/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("SERVICE_UNAVAILABLE"));
    }

    @Test
    void unexpectedErrorReturns500() throws Exception {
        when(suggestionOrchestrator.createSuggestions(any(CreateSuggestionsRequest.class), any()))
                .thenThrow(new NullPointerException("oops"));

        mockMvc.perform(post("/api/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"));
    }

    @Test
    void malformedBodyReturns400() throws Exception {
        mockMvc.perform(post("/api/suggestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    private static SuggestionsResponse sampleResponse(String userId) {
        SuggestionView view = SuggestionView.builder()
                .placeId("abc")
                .name("Karaköy Lokantası")
                .category("restaurant,food")
                .score(0.72)
                .reasons(List.of("Close to your location", "Matches your food preference"))
                .build();
        return SuggestionsResponse.builder()
                .intent("FOOD_ONLY")
                .personalized(false)
                .userId(userId)
                .suggestions(List.of(view))
                .totalCount(1)
                .filters(FilterInfo.builder().radius(2000).walkingDistance(2000).build())
                .metadata(SuggestionMeta.builder().diversityFactor(0.5).build())
                .build();
    }
}
