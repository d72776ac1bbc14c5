package com.whatshouldido.service.policy;

import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import com.whatshouldido.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 의도(intent)별 정책: 요청 검증, 카테고리 필터, 경로 생성 여부, 다양성 계수, 도보 거리, 추천 이유
 * 상태가 없는 순수 함수 모음
 */
@Slf4j
@Service
public class SuggestionPolicyService {

    public static final int MIN_RADIUS_METERS = 100;
    public static final int MAX_RADIUS_METERS = 50_000;
    public static final int MIN_WALKING_METERS = 500;
    public static final int MAX_WALKING_METERS = 10_000;
    public static final int MAX_REASONS = 5;

    public static final double VERY_CLOSE_METERS = 500;
    public static final double CLOSE_METERS = 2_000;
    private static final int MAX_PREFERENCE_MATCHES = 2;
    private static final int MAX_CONTEXTUAL_REASONS = 2;

    /**
     * 요청 검증. 첫 번째 오류에서 멈추지 않고 모든 위반을 모아서 반환한다.
     */
    public List<String> validateRequest(SuggestionIntent intent, double latitude, double longitude,
                                        int radiusMeters, Integer walkingDistanceMeters) {
        List<String> errors = new ArrayList<>();

        if (latitude < -90 || latitude > 90) {
            errors.add("Latitude must be between -90 and 90");
        }
        if (longitude < -180 || longitude > 180) {
            errors.add("Longitude must be between -180 and 180");
        }
        if (radiusMeters < MIN_RADIUS_METERS || radiusMeters > MAX_RADIUS_METERS) {
            errors.add("Radius must be between 100 and 50,000 meters");
        }

        // 값이 주어지면 의도와 무관하게 [500, 10000] 범위, 경로 계획은 필수
        if (intent == SuggestionIntent.ROUTE_PLANNING
                && (walkingDistanceMeters == null || walkingDistanceMeters < MIN_WALKING_METERS)) {
            errors.add("Route planning requires a walking distance of at least 500 meters");
        } else if (walkingDistanceMeters != null && walkingDistanceMeters < MIN_WALKING_METERS) {
            errors.add("Walking distance must be at least 500 meters");
        }
        if (walkingDistanceMeters != null && walkingDistanceMeters > MAX_WALKING_METERS) {
            errors.add("Walking distance cannot exceed 10,000 meters (10 km)");
        }

        return errors;
    }

    /**
     * 의도별 카테고리 필터 + 사용자 제외 목록 적용
     */
    public List<Place> applyIntentFilter(SuggestionIntent intent, List<Place> places, Set<String> userExclusions) {
        Set<String> exclusions = userExclusions != null ? userExclusions : Set.of();

        List<Place> filtered = places.stream()
                .filter(place -> place.getId() == null || !exclusions.contains(place.getId()))
                .filter(place -> matchesIntent(intent, place))
                .collect(Collectors.toList());

        log.debug("[SuggestionPolicyService] intent={} filtered {} -> {} places",
                intent, places.size(), filtered.size());
        return filtered;
    }

    private boolean matchesIntent(SuggestionIntent intent, Place place) {
        switch (intent) {
            case FOOD_ONLY:
                return PlaceCategories.isFood(place);
            case ACTIVITY_ONLY:
                return PlaceCategories.isActivity(place) && !PlaceCategories.isFood(place);
            default:
                return true;
        }
    }

    /**
     * provider 에 넘길 장소 타입. 빈 목록이면 타입 제한 없이 검색
     */
    public List<String> getSearchTypes(SuggestionIntent intent) {
        switch (intent) {
            case FOOD_ONLY:
                return List.of("restaurant", "cafe", "bakery", "meal_takeaway");
            case ACTIVITY_ONLY:
                return List.of("museum", "park", "tourist_attraction", "movie_theater", "art_gallery", "bowling_alley");
            case ROUTE_PLANNING:
                return List.of("tourist_attraction", "museum", "park", "cafe", "restaurant");
            default:
                return List.of();
        }
    }

    public boolean shouldBuildRoute(SuggestionIntent intent) {
        return intent == SuggestionIntent.ROUTE_PLANNING;
    }

    /**
     * 다양성 계수 (높을수록 같은 카테고리 반복을 강하게 밀어냄)
     */
    public double getDiversityFactor(SuggestionIntent intent) {
        switch (intent) {
            case QUICK:
                return 0.3;
            case FOOD_ONLY:
                return 0.5;
            case ACTIVITY_ONLY:
                return 0.6;
            case ROUTE_PLANNING:
                return 0.8;
            case TRY_SOMETHING_NEW:
                return 1.0;
            default:
                return 0.5;
        }
    }

    /**
     * 최대 도보 거리. 사용자 값이 범위 안이면 그대로, 아니면 의도별 기본값.
     */
    public int getMaxWalkingDistance(SuggestionIntent intent, Integer userPreference) {
        if (userPreference != null && userPreference >= MIN_WALKING_METERS && userPreference <= MAX_WALKING_METERS) {
            return userPreference;
        }

        switch (intent) {
            case QUICK:
                return 1_000;
            case FOOD_ONLY:
                return 2_000;
            case ACTIVITY_ONLY:
                return 3_000;
            case ROUTE_PLANNING:
                return 5_000;
            case TRY_SOMETHING_NEW:
                return 4_000;
            default:
                return 2_000;
        }
    }

    /**
     * 사람이 읽을 수 있는 추천 이유 생성 (우선순위 순, 최대 5개)
     * 거리 → 평점 → 의도 → 선호 일치 → 상황(날씨/시간/계절)
     */
    public List<String> generateReasons(SuggestionIntent intent, Place place,
                                        double userLatitude, double userLongitude,
                                        Collection<String> matchedPreferences,
                                        double noveltyScore,
                                        List<String> contextualReasons) {
        List<String> reasons = new ArrayList<>();

        double distance = GeoUtils.distanceMeters(userLatitude, userLongitude,
                place.getLatitude(), place.getLongitude());
        if (distance < VERY_CLOSE_METERS) {
            reasons.add("Very close to you (walking distance)");
        } else if (distance < CLOSE_METERS) {
            reasons.add("Close to your location");
        }

        Double rating = place.getRating();
        if (rating != null) {
            if (rating >= 4.5) {
                reasons.add("Highly rated (4.5+ stars)");
            } else if (rating >= 4.0) {
                reasons.add("Well-rated");
            }
        }

        String intentReason = intentReason(intent, noveltyScore);
        if (intentReason != null) {
            reasons.add(intentReason);
        }

        if (matchedPreferences != null && !matchedPreferences.isEmpty()) {
            String joined = matchedPreferences.stream()
                    .limit(MAX_PREFERENCE_MATCHES)
                    .collect(Collectors.joining(", "));
            reasons.add("Matches your interests: " + joined);
        }

        if (contextualReasons != null) {
            contextualReasons.stream()
                    .limit(MAX_CONTEXTUAL_REASONS)
                    .forEach(reasons::add);
        }

        return reasons.size() > MAX_REASONS ? new ArrayList<>(reasons.subList(0, MAX_REASONS)) : reasons;
    }

    private String intentReason(SuggestionIntent intent, double noveltyScore) {
        switch (intent) {
            case FOOD_ONLY:
                return "Matches your food preference";
            case ACTIVITY_ONLY:
                return "Great activity for your area";
            case ROUTE_PLANNING:
                return "Part of a balanced day plan";
            case TRY_SOMETHING_NEW:
                if (noveltyScore > 0.7) {
                    return "A new experience for you";
                }
                if (noveltyScore > 0.4) {
                    return "Something different but familiar";
                }
                return null;
            default:
                return null;
        }
    }
}
