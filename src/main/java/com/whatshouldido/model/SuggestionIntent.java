package com.whatshouldido.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 추천 요청 의도. 필터링 / 경로 생성 / 다양성 정책을 결정한다.
 */
public enum SuggestionIntent {
    QUICK("Quick Suggestion"),
    FOOD_ONLY("Food & Dining"),
    ACTIVITY_ONLY("Activities & Entertainment"),
    ROUTE_PLANNING("Day Plan / Route"),
    TRY_SOMETHING_NEW("Try Something New");

    private final String displayName;

    SuggestionIntent(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** "food_only", "FOOD_ONLY", "food-only" 모두 허용 */
    public static Optional<SuggestionIntent> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.name().equals(normalized))
                .findFirst();
    }
}
