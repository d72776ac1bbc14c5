package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.context.ContextualInsight;
import com.whatshouldido.service.context.TimeOfDay;
import com.whatshouldido.service.context.WeatherInfo;
import com.whatshouldido.service.policy.PlaceCategories;
import com.whatshouldido.service.policy.SuggestionPolicyService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 점수 구성요소로부터 구조화된 추천 이유(reasonCode + 메시지) 생성
 */
@Service
@RequiredArgsConstructor
public class ExplainabilityService {

    public static final int MAX_REASONS = 5;

    private final PlaceCategoryMapper placeCategoryMapper;

    public List<RecommendationReason> generateReasons(Place place, ScoreBreakdown breakdown,
                                                      ScoringContext context, double distanceMeters) {
        List<RecommendationReason> reasons = new ArrayList<>();
        List<String> categories = place.categoryList();

        addTasteReasons(place, context.getTasteProfile(), reasons);
        addHistoryReasons(categories, breakdown, context.getImplicitPreferences(), reasons);

        if (breakdown.getNoveltyScore() > 0.7 && !context.isAnonymous()) {
            reasons.add(new RecommendationReason("TRY_SOMETHING_NEW", "Something new for you to explore",
                    breakdown.getNoveltyScore() * 0.6));
        }

        addContextReasons(place, categories, context.getContextualInsight(), reasons);

        Double rating = place.getRating();
        int reviewCount = place.getReviewCount() != null ? place.getReviewCount() : 0;
        if (rating != null && rating >= 4.5 && reviewCount >= 100) {
            reasons.add(new RecommendationReason("HIGHLY_RATED_POPULAR",
                    String.format(Locale.ROOT, "Highly rated (%.1f) by %d visitors", rating, reviewCount), 0.55));
        } else if (rating != null && rating >= 4.0) {
            reasons.add(new RecommendationReason("HIGHLY_RATED",
                    String.format(Locale.ROOT, "Rated %.1f stars", rating), 0.45));
        }

        if (distanceMeters < SuggestionPolicyService.VERY_CLOSE_METERS) {
            reasons.add(new RecommendationReason("VERY_CLOSE", "Just a short walk away", 0.5));
        } else if (distanceMeters < SuggestionPolicyService.CLOSE_METERS) {
            reasons.add(new RecommendationReason("CLOSE_BY", "Close to your location", 0.35));
        }

        if (reasons.isEmpty()) {
            reasons.add(new RecommendationReason("GENERAL_RECOMMENDATION", "Popular place in the area", 0.1));
        }

        // 가중치 내림차순 (동점은 생성 순서 유지)
        return reasons.stream()
                .sorted(Comparator.comparingDouble((RecommendationReason r) -> r.getWeight() != null ? r.getWeight() : 0.0)
                        .reversed())
                .limit(MAX_REASONS)
                .collect(Collectors.toList());
    }

    private void addTasteReasons(Place place, TasteProfile profile, List<RecommendationReason> reasons) {
        if (profile == null) {
            return;
        }
        Map<TasteDimension, Double> interests = placeCategoryMapper.mapToInterests(place.categoryList());
        interests.forEach((dimension, placeWeight) -> {
            double userWeight = profile.weight(dimension);
            if (userWeight > 0.6 && placeWeight > 0.5) {
                reasons.add(new RecommendationReason("MATCHES_INTEREST_" + dimension.name(),
                        "Matches your interest in " + dimension.label().toLowerCase(Locale.ROOT),
                        userWeight * placeWeight));
            }
        });

        if (profile.weight(TasteDimension.TASTE_QUALITY) > 0.7
                && place.getRating() != null && place.getRating() >= 4.5) {
            reasons.add(new RecommendationReason("HIGH_TASTE_QUALITY", "Known for exceptional quality",
                    profile.weight(TasteDimension.TASTE_QUALITY) * 0.8));
        }
        if (profile.weight(TasteDimension.CALMNESS) > 0.7
                && PlaceCategories.matchesAny(place.categoryList(), Set.of("library", "museum", "park", "spa", "cafe"))) {
            reasons.add(new RecommendationReason("CALM_ATMOSPHERE", "Calm and relaxing atmosphere",
                    profile.weight(TasteDimension.CALMNESS) * 0.7));
        }
    }

    private void addHistoryReasons(List<String> categories, ScoreBreakdown breakdown,
                                   ImplicitPreferences preferences, List<RecommendationReason> reasons) {
        if (preferences == null) {
            return;
        }
        if (PlaceCategories.matchesAny(categories, preferences.getFavoriteCuisines())) {
            reasons.add(new RecommendationReason("FAVORITE_CUISINE", "One of your favorite cuisines", 0.75));
        }
        if (PlaceCategories.matchesAny(categories, preferences.getFavoriteActivities())) {
            reasons.add(new RecommendationReason("FAVORITE_ACTIVITY", "An activity you enjoy", 0.7));
        }
        if (breakdown.getImplicitScore() > 0.6) {
            reasons.add(new RecommendationReason("MATCHES_YOUR_HISTORY", "Similar to places you liked",
                    breakdown.getImplicitScore() * 0.8));
        }
    }

    private void addContextReasons(Place place, List<String> categories, ContextualInsight insight,
                                   List<RecommendationReason> reasons) {
        if (insight == null) {
            return;
        }
        TimeOfDay timeOfDay = insight.getTimeOfDay();
        if (timeOfDay == TimeOfDay.EARLY_MORNING || timeOfDay == TimeOfDay.MORNING) {
            if (PlaceCategories.matchesAny(categories, Set.of("cafe", "bakery", "breakfast"))) {
                reasons.add(new RecommendationReason("PERFECT_FOR_MORNING", "Perfect for the morning", 0.4));
            }
        } else if (timeOfDay == TimeOfDay.LUNCH) {
            if (PlaceCategories.matchesAny(categories, Set.of("restaurant", "meal_takeaway"))) {
                reasons.add(new RecommendationReason("PERFECT_FOR_LUNCH", "Great for lunch", 0.4));
            }
        } else if (timeOfDay == TimeOfDay.EVENING || timeOfDay == TimeOfDay.NIGHT) {
            if (PlaceCategories.matchesAny(categories, Set.of("bar", "restaurant", "night_club"))) {
                reasons.add(new RecommendationReason("PERFECT_FOR_EVENING", "Perfect for the evening", 0.4));
            }
        }

        WeatherInfo weather = insight.getWeather();
        if (weather != null) {
            if (weather.isGoodForOutdoor() && PlaceCategories.isOutdoor(place)) {
                reasons.add(new RecommendationReason("ENJOY_OUTDOORS", "Nice weather to enjoy outdoors", 0.45));
            } else if (!weather.isGoodForOutdoor() && PlaceCategories.isIndoor(place)) {
                reasons.add(new RecommendationReason("INDOOR_COMFORT", "Comfortable indoor option", 0.45));
            }
        }
    }
}
