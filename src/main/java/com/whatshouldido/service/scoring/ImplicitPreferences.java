package com.whatshouldido.service.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 추천 히스토리에서 학습한 행동 기반 선호
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImplicitPreferences {
    @Builder.Default
    private Set<String> favoriteCuisines = new HashSet<>();
    @Builder.Default
    private Set<String> favoriteActivities = new HashSet<>();
    @Builder.Default
    private Set<String> avoidedActivities = new HashSet<>();
    @Builder.Default
    private Map<String, Integer> categoryExperience = new HashMap<>(); // 카테고리별 추천/방문 횟수
    @Builder.Default
    private Set<String> visitedPlaceIds = new HashSet<>();
}
