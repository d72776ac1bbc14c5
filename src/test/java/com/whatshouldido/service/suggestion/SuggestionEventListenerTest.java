package com.whatshouldido.service.suggestion;

import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import com.whatshouldido.service.history.UserHistoryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SuggestionEventListenerTest {

    @Mock
    private UserHistoryService userHistoryService;

    @InjectMocks
    private SuggestionEventListener listener;

    private final List<Place> places = List.of(Place.builder().id("p1").name("Cafe").category("cafe").build());

    @Test
    void savesHistoryForSuccessfulAuthenticatedRequest() {
        listener.onSuggestionsCompleted(event("user-1", true));

        verify(userHistoryService).addSuggestionHistoryBatch("user-1", places, "req-1", "QUICK");
    }

    @Test
    void skipsAnonymousAndFailedRequests() {
        listener.onSuggestionsCompleted(event(null, true));
        listener.onSuggestionsCompleted(event("user-1", false));

        verifyNoInteractions(userHistoryService);
    }

    @Test
    void historyFailureIsContained() {
        doThrow(new IllegalStateException("db down"))
                .when(userHistoryService).addSuggestionHistoryBatch(anyString(), anyList(), any(), any());

        assertThatCode(() -> listener.onSuggestionsCompleted(event("user-1", true))).doesNotThrowAnyException();
    }

    private SuggestionsCompletedEvent event(String userId, boolean success) {
        return SuggestionsCompletedEvent.builder()
                .requestId("req-1")
                .userId(userId)
                .intent(SuggestionIntent.QUICK)
                .success(success)
                .errorCode(success ? null : "SERVICE_UNAVAILABLE")
                .suggestedPlaces(success ? places : List.of())
                .observations(List.of(new StageObservation(PipelineStage.VALIDATE_INTENT, 1,
                        StageObservation.Outcome.SUCCESS)))
                .totalDurationMs(12)
                .build();
    }
}
