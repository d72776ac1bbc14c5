package com.whatshouldido.service.suggestion;

import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 추천 요청 종료 이벤트 (성공/실패 모두 발행). 히스토리 저장과 단계별 로그는 리스너가 비동기로 처리한다.
 */
@Getter
@Builder
public class SuggestionsCompletedEvent {
    private final String requestId;
    private final String userId; // 익명이면 null
    private final SuggestionIntent intent;
    private final boolean success;
    private final String errorCode; // 실패 시
    private final List<Place> suggestedPlaces;
    private final List<StageObservation> observations;
    private final long totalDurationMs;
}
