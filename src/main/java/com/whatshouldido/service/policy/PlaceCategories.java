package com.whatshouldido.service.policy;

import com.whatshouldido.model.Place;

import java.util.List;
import java.util.Set;

/**
 * 음식 / 액티비티 카테고리 분류 기준
 * 카테고리 토큰은 정확히 같거나, '_' 로 구분된 구간 중 하나가 일치하면 매칭된다.
 * (예: "seafood_restaurant" → restaurant, "wine_bar" → bar, "barber_shop" → 매칭 안 됨)
 */
public final class PlaceCategories {

    public static final Set<String> FOOD = Set.of(
            "restaurant", "cafe", "bar", "bakery", "meal_takeaway", "meal_delivery",
            "food", "dessert", "coffee", "breakfast", "lunch", "dinner", "brunch");

    public static final Set<String> ACTIVITY = Set.of(
            "amusement_park", "aquarium", "art_gallery", "bowling_alley", "casino",
            "movie_theater", "museum", "night_club", "park", "spa", "stadium",
            "tourist_attraction", "zoo", "gym", "shopping_mall", "library", "theater", "concert_hall");

    /** 실내 장소 (날씨가 나쁠 때 우선) */
    public static final Set<String> INDOOR = Set.of(
            "museum", "art_gallery", "shopping_mall", "movie_theater", "cafe", "library",
            "aquarium", "bowling_alley", "spa", "theater", "concert_hall", "restaurant");

    /** 실외 장소 (날씨가 좋을 때 우선) */
    public static final Set<String> OUTDOOR = Set.of(
            "park", "zoo", "tourist_attraction", "amusement_park", "stadium", "beach", "garden");

    private PlaceCategories() {
    }

    public static boolean isFood(Place place) {
        return matchesAny(place.categoryList(), FOOD);
    }

    public static boolean isActivity(Place place) {
        return matchesAny(place.categoryList(), ACTIVITY);
    }

    public static boolean isIndoor(Place place) {
        return matchesAny(place.categoryList(), INDOOR);
    }

    public static boolean isOutdoor(Place place) {
        return matchesAny(place.categoryList(), OUTDOOR);
    }

    public static boolean matchesAny(List<String> categories, Set<String> allowed) {
        for (String category : categories) {
            for (String entry : allowed) {
                if (matches(category, entry)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean matches(String category, String entry) {
        return category.equals(entry)
                || category.startsWith(entry + "_")
                || category.endsWith("_" + entry)
                || category.contains("_" + entry + "_");
    }
}
