package com.whatshouldido.service.scoring;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 취향 프로필 차원. 관심사(INTEREST)와 장소 선호(PREFERENCE) 두 종류.
 */
public enum TasteDimension {
    CULTURE(Kind.INTEREST),
    FOOD(Kind.INTEREST),
    NATURE(Kind.INTEREST),
    NIGHTLIFE(Kind.INTEREST),
    SHOPPING(Kind.INTEREST),
    ART(Kind.INTEREST),
    WELLNESS(Kind.INTEREST),
    SPORTS(Kind.INTEREST),

    TASTE_QUALITY(Kind.PREFERENCE),
    ATMOSPHERE(Kind.PREFERENCE),
    DESIGN(Kind.PREFERENCE),
    CALMNESS(Kind.PREFERENCE),
    SPACIOUSNESS(Kind.PREFERENCE);

    public enum Kind { INTEREST, PREFERENCE }

    private final Kind kind;

    TasteDimension(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInterest() {
        return kind == Kind.INTEREST;
    }

    /** 사람이 읽는 이름 ("Food", "Taste quality") */
    public String label() {
        String lower = name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    /**
     * 퀴즈 / API 경계에서 들어오는 문자열 키 변환 ("Food", "tasteQuality", "taste_quality" 모두 허용)
     */
    public static Optional<TasteDimension> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(dimension -> dimension.name().equals(normalized))
                .findFirst();
    }
}
