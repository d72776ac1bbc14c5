package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 취향 프로필(명시적 선호) 점수
 */
@Component
@RequiredArgsConstructor
public class ExplicitScorer {

    static final double MATCHED_INTEREST_THRESHOLD = 0.6;
    private static final Set<String> CALM_CATEGORIES = Set.of(
            "library", "museum", "park", "botanical_garden", "spa", "cafe", "book_store", "art_gallery");

    private final PlaceCategoryMapper placeCategoryMapper;

    public double score(Place place, TasteProfile profile) {
        if (profile == null) {
            return 0.0;
        }

        Map<TasteDimension, Double> placeInterests = placeCategoryMapper.mapToInterests(place.categoryList());
        if (placeInterests.isEmpty()) {
            return 0.5;
        }

        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<TasteDimension, Double> entry : placeInterests.entrySet()) {
            weighted += entry.getValue() * profile.weight(entry.getKey());
            totalWeight += entry.getValue();
        }
        double score = totalWeight > 0 ? weighted / totalWeight : 0.5;

        // 고평점 장소는 맛/품질 선호도를 반영
        if (place.getRating() != null && place.getRating() >= 4.5) {
            score = score * 0.8 + profile.weight(TasteDimension.TASTE_QUALITY) * 0.2;
        }
        // 조용한 장소는 차분함 선호도를 반영
        if (isCalm(place)) {
            score = score * 0.9 + profile.weight(TasteDimension.CALMNESS) * 0.1;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * 사용자가 강하게 선호하고 장소도 해당하는 관심사 이름 목록
     */
    public List<String> matchedInterests(Place place, TasteProfile profile) {
        List<String> matched = new ArrayList<>();
        if (profile == null) {
            return matched;
        }
        placeCategoryMapper.mapToInterests(place.categoryList()).forEach((dimension, placeWeight) -> {
            if (placeWeight >= 0.5 && profile.weight(dimension) >= MATCHED_INTEREST_THRESHOLD) {
                matched.add(dimension.label());
            }
        });
        return matched;
    }

    boolean isCalm(Place place) {
        return place.categoryList().stream().anyMatch(CALM_CATEGORIES::contains);
    }
}
