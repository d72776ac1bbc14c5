package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 스코어링 결과 (불변)
 */
@Getter
@Builder(toBuilder = true)
public class ScoredPlace {
    private final Place place;
    private final double score; // [0,1]
    private final double distanceMeters;
    private final double noveltyScore;
    private final List<String> matchedInterests;
    private final List<RecommendationReason> reasons;
    private final ScoreBreakdown breakdown; // 디버그 모드가 아니면 null
}
