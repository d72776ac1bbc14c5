package com.whatshouldido.service.scoring;

import com.whatshouldido.model.SuggestionIntent;
import com.whatshouldido.service.context.ContextualInsight;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 요청 단위 스코어링 입력. 요청마다 한 번 만들고 이후에는 읽기만 한다.
 */
@Getter
@Builder
public class ScoringContext {
    private final String userId; // 익명이면 null
    private final ImplicitPreferences implicitPreferences; // 없으면 null
    private final TasteProfile tasteProfile; // 없으면 null
    private final double originLatitude;
    private final double originLongitude;
    private final Instant requestTime;
    private final String intentText;
    private final SuggestionIntent intent;
    private final String sessionId;
    private final boolean includeDebugInfo;
    private final ContextualInsight contextualInsight;

    public boolean isAnonymous() {
        return userId == null;
    }

    public boolean isPersonalized() {
        return implicitPreferences != null || tasteProfile != null;
    }
}
