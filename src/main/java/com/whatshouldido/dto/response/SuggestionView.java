package com.whatshouldido.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whatshouldido.service.scoring.ScoreBreakdown;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 추천 카드 한 장 (reasons / explanations 는 각각 최대 5개)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionView {
    private String placeId;
    private String name;
    private double latitude;
    private double longitude;
    private String address;
    private String category;
    private Double rating;
    private Integer reviewCount;
    private Integer priceLevel;
    private Boolean openNow;
    private String photoReference;
    private String source;
    private int distanceMeters;
    private double score;
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
    @Builder.Default
    private List<Explanation> explanations = new ArrayList<>();
    private ScoreBreakdown scoreBreakdown; // includeDebugInfo 일 때만

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Explanation {
        private String code;
        private String message;
        private Double weight;
    }
}
