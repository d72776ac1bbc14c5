package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.context.ContextEngine;
import com.whatshouldido.service.context.ContextualInsight;
import com.whatshouldido.service.policy.PlaceCategories;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 시간 / 날씨 / 계절 적합도 점수. 컨텍스트가 없거나 실패하면 0.5 중립.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextScorer {

    static final double NEUTRAL = 0.5;

    private final ContextEngine contextEngine;

    public double score(Place place, ContextualInsight insight) {
        if (insight == null || insight.isEmpty()) {
            return NEUTRAL;
        }

        try {
            List<String> reasons = contextEngine.getContextualReasons(place, insight);
            double score = NEUTRAL + reasons.size() * 0.1;

            // 궂은 날씨에는 실외 장소 감점
            if (insight.getWeather() != null && !insight.getWeather().isGoodForOutdoor()
                    && PlaceCategories.isOutdoor(place) && !PlaceCategories.isIndoor(place)) {
                score -= 0.2;
            }
            return Math.max(0.0, Math.min(1.0, score));
        } catch (Exception e) {
            log.warn("[ContextScorer] context scoring failed for place {}, using neutral: {}",
                    place.getId(), e.getMessage());
            return NEUTRAL;
        }
    }
}
