package com.whatshouldido.service.scoring;

import com.whatshouldido.service.policy.PlaceCategories;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.whatshouldido.service.scoring.TasteDimension.*;

/**
 * 장소 카테고리 → 관심사 가중치 매핑
 */
@Component
public class PlaceCategoryMapper {

    // 순서가 부분 매칭 우선순위이므로 LinkedHashMap 유지
    private static final Map<String, Map<TasteDimension, Double>> MAPPINGS = new LinkedHashMap<>();

    static {
        // 음식
        put("restaurant", FOOD, 1.0);
        put("cafe", FOOD, 0.8, CULTURE, 0.2);
        put("bar", NIGHTLIFE, 0.8, FOOD, 0.2);
        put("bakery", FOOD, 0.9, SHOPPING, 0.1);
        put("meal_delivery", FOOD, 1.0);
        put("meal_takeaway", FOOD, 1.0);
        put("food", FOOD, 1.0);

        // 문화
        put("museum", CULTURE, 1.0);
        put("art_gallery", ART, 0.8, CULTURE, 0.2);
        put("tourist_attraction", CULTURE, 0.7, NATURE, 0.3);
        put("church", CULTURE, 0.8, ART, 0.2);
        put("mosque", CULTURE, 0.8, ART, 0.2);
        put("place_of_worship", CULTURE, 0.7, ART, 0.3);
        put("library", CULTURE, 0.8, ART, 0.2);

        // 자연
        put("park", NATURE, 1.0);
        put("natural_feature", NATURE, 1.0);
        put("hiking_area", NATURE, 0.7, SPORTS, 0.3);
        put("zoo", NATURE, 0.7, CULTURE, 0.3);
        put("aquarium", NATURE, 0.7, CULTURE, 0.3);
        put("botanical_garden", NATURE, 0.9, ART, 0.1);
        put("beach", NATURE, 0.9, SPORTS, 0.1);

        // 나이트라이프 / 엔터테인먼트
        put("night_club", NIGHTLIFE, 1.0);
        put("casino", NIGHTLIFE, 0.9, CULTURE, 0.1);
        put("movie_theater", NIGHTLIFE, 0.6, CULTURE, 0.4);
        put("bowling_alley", NIGHTLIFE, 0.5, SPORTS, 0.5);
        put("amusement_park", NIGHTLIFE, 0.6, NATURE, 0.4);
        put("stadium", SPORTS, 0.7, NIGHTLIFE, 0.3);

        // 쇼핑
        put("shopping_mall", SHOPPING, 1.0);
        put("book_store", SHOPPING, 0.7, CULTURE, 0.3);
        put("market", SHOPPING, 0.8, CULTURE, 0.2);
        put("store", SHOPPING, 1.0);
        put("supermarket", SHOPPING, 1.0);

        // 예술
        put("theater", ART, 0.8, NIGHTLIFE, 0.2);
        put("concert_hall", ART, 0.7, NIGHTLIFE, 0.3);
        put("cultural_center", ART, 0.6, CULTURE, 0.4);

        // 웰니스 / 스포츠
        put("spa", WELLNESS, 1.0);
        put("gym", SPORTS, 0.7, WELLNESS, 0.3);
        put("yoga_studio", WELLNESS, 1.0);
        put("sports_complex", SPORTS, 1.0);
        put("golf_course", SPORTS, 1.0);
        put("swimming_pool", SPORTS, 0.7, WELLNESS, 0.3);
    }

    private static void put(String category, Object... dimensionWeights) {
        Map<TasteDimension, Double> weights = new EnumMap<>(TasteDimension.class);
        for (int i = 0; i < dimensionWeights.length; i += 2) {
            weights.put((TasteDimension) dimensionWeights[i], (Double) dimensionWeights[i + 1]);
        }
        MAPPINGS.put(category, Collections.unmodifiableMap(weights));
    }

    /**
     * 단일 카테고리를 관심사 가중치로 변환. 매핑이 없으면 빈 맵.
     */
    public Map<TasteDimension, Double> mapToInterests(String category) {
        if (category == null || category.isBlank()) {
            return Collections.emptyMap();
        }
        Map<TasteDimension, Double> exact = MAPPINGS.get(category);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Map<TasteDimension, Double>> entry : MAPPINGS.entrySet()) {
            if (PlaceCategories.matches(category, entry.getKey())) {
                return entry.getValue();
            }
        }
        return Collections.emptyMap();
    }

    /**
     * 여러 카테고리를 합산 (차원별 최대값 사용)
     */
    public Map<TasteDimension, Double> mapToInterests(List<String> categories) {
        Map<TasteDimension, Double> merged = new EnumMap<>(TasteDimension.class);
        for (String category : categories) {
            mapToInterests(category).forEach((dimension, weight) -> merged.merge(dimension, weight, Math::max));
        }
        return merged;
    }
}
