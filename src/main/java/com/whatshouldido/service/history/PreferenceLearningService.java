package com.whatshouldido.service.history;

import com.whatshouldido.entity.UserSuggestionHistory;
import com.whatshouldido.model.Place;
import com.whatshouldido.service.policy.PlaceCategories;
import com.whatshouldido.service.scoring.ImplicitPreferences;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 추천 히스토리로부터 암묵적 선호 학습
 * 같은 카테고리가 2번 이상 나오면 선호로 본다 (음식 카테고리 → 요리, 나머지 → 활동)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceLearningService {

    static final int HISTORY_SAMPLE_SIZE = 50;
    static final int FAVORITE_THRESHOLD = 2;
    private static final Set<String> GENERIC_TYPES = Set.of("point_of_interest", "establishment");

    private final UserHistoryService userHistoryService;

    /**
     * @return 히스토리가 없으면 null
     */
    public ImplicitPreferences learn(String userId) {
        List<UserSuggestionHistory> history = userHistoryService.getHistory(userId, HISTORY_SAMPLE_SIZE);
        if (history.isEmpty()) {
            return null;
        }

        Map<String, Integer> counts = new HashMap<>();
        ImplicitPreferences preferences = ImplicitPreferences.builder().build();
        for (UserSuggestionHistory entry : history) {
            preferences.getVisitedPlaceIds().add(entry.getPlaceId());
            Place asPlace = Place.builder().category(entry.getCategory()).build();
            for (String category : asPlace.categoryList()) {
                counts.merge(category, 1, Integer::sum);
            }
        }

        counts.forEach((category, count) -> {
            if (count < FAVORITE_THRESHOLD || GENERIC_TYPES.contains(category)) {
                return;
            }
            if (PlaceCategories.matchesAny(List.of(category), PlaceCategories.FOOD)) {
                preferences.getFavoriteCuisines().add(category);
            } else {
                preferences.getFavoriteActivities().add(category);
            }
        });
        preferences.setCategoryExperience(counts);

        log.debug("[PreferenceLearningService] userId={} learned {} cuisines, {} activities from {} entries",
                userId, preferences.getFavoriteCuisines().size(),
                preferences.getFavoriteActivities().size(), history.size());
        return preferences;
    }
}
