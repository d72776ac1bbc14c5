package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.policy.PlaceCategories;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * 행동 기반(암묵적) 선호 점수
 */
@Component
public class ImplicitScorer {

    public double score(Place place, ImplicitPreferences preferences) {
        if (preferences == null) {
            return 0.0;
        }

        double score = 0.5;
        List<String> categories = place.categoryList();

        if (matches(categories, preferences.getFavoriteCuisines())) {
            score += 0.3;
        }
        if (matches(categories, preferences.getFavoriteActivities())) {
            score += 0.2;
        }
        if (matches(categories, preferences.getAvoidedActivities())) {
            score -= 0.4;
        }
        if (place.getRating() != null) {
            score += (place.getRating() / 5.0) * 0.1;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    private boolean matches(List<String> categories, Set<String> preferred) {
        return preferred != null && !preferred.isEmpty() && PlaceCategories.matchesAny(categories, preferred);
    }
}
