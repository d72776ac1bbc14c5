package com.whatshouldido.service.suggestion;

import com.whatshouldido.service.history.UserHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * 추천 완료 후처리 (히스토리 저장, 단계별 소요 시간 로그)
 * 비동기로 실행되며 실패해도 응답에는 영향이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuggestionEventListener {

    private final UserHistoryService userHistoryService;

    @Async("suggestionEventExecutor")
    @EventListener
    public void onSuggestionsCompleted(SuggestionsCompletedEvent event) {
        logObservations(event);

        if (!event.isSuccess() || event.getUserId() == null || event.getSuggestedPlaces().isEmpty()) {
            return;
        }
        try {
            userHistoryService.addSuggestionHistoryBatch(event.getUserId(), event.getSuggestedPlaces(),
                    event.getRequestId(), event.getIntent() != null ? event.getIntent().name() : null);
        } catch (Exception e) {
            log.error("[SuggestionEventListener] Failed to save suggestion history for userId={}, requestId={}: {}",
                    event.getUserId(), event.getRequestId(), e.getMessage(), e);
        }
    }

    private void logObservations(SuggestionsCompletedEvent event) {
        String stages = event.getObservations().stream()
                .map(observation -> observation.getStage() + "=" + observation.getDurationMs() + "ms/"
                        + observation.getOutcome())
                .collect(Collectors.joining(", "));
        if (event.isSuccess()) {
            log.info("[SuggestionEventListener] requestId={} completed in {}ms [{}]",
                    event.getRequestId(), event.getTotalDurationMs(), stages);
        } else {
            log.warn("[SuggestionEventListener] requestId={} failed with {} after {}ms [{}]",
                    event.getRequestId(), event.getErrorCode(), event.getTotalDurationMs(), stages);
        }
    }
}
