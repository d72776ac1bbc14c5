package com.whatshouldido.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 추천 요청 DTO (userId 는 body 가 아니라 X-User-Id 헤더로 받는다)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSuggestionsRequest {
    private String intent; // QUICK, FOOD_ONLY, ACTIVITY_ONLY, ROUTE_PLANNING, TRY_SOMETHING_NEW
    private Double latitude;
    private Double longitude;
    @Builder.Default
    private Integer radiusMeters = 3000;
    private Integer walkingDistanceMeters;
    private String budgetLevel; // FREE ~ VERY_EXPENSIVE
    private List<String> includeCategories;
    private List<String> excludeCategories;
    private List<String> dietaryRestrictions;
    private String areaName;
    private Boolean includeDebugInfo;
}
