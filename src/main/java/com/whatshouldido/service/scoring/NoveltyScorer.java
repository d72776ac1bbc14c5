package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 새로움 점수. 방문/추천 이력과 카테고리 익숙함이 클수록 낮아진다.
 */
@Component
public class NoveltyScorer {

    private static final double NEUTRAL = 0.5;
    private static final double VISITED_PENALTY = 0.8;
    private static final double MAX_CATEGORY_PENALTY = 0.3;
    private static final double MAX_FAMILIARITY_PENALTY = 0.4;

    public double score(Place place, ImplicitPreferences history, TasteProfile profile) {
        if (history == null) {
            return NEUTRAL;
        }

        double novelty = 1.0;
        if (place.getId() != null && history.getVisitedPlaceIds().contains(place.getId())) {
            novelty -= VISITED_PENALTY;
        }

        Map<String, Integer> experience = history.getCategoryExperience();
        double familiarity = 0.0;
        for (String category : place.categoryList()) {
            Integer count = experience.get(category);
            if (count != null) {
                familiarity += Math.min(count / 10.0, MAX_CATEGORY_PENALTY);
            }
        }
        novelty -= Math.min(familiarity, MAX_FAMILIARITY_PENALTY);
        novelty = Math.max(0.0, Math.min(1.0, novelty));

        // 새로움 허용도가 낮은 사용자일수록 새로움의 가치를 줄인다
        if (profile != null) {
            novelty = novelty * (0.5 + 0.5 * profile.getNoveltyTolerance());
        }
        return novelty;
    }
}
