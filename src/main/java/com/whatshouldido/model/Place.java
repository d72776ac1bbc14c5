package com.whatshouldido.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 장소 검색 결과로 받은 후보 장소 (provider 공통 모델)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Place {
    private String id; // provider place_id
    private String name;
    private double latitude;
    private double longitude;
    private String address;
    private String category; // 콤마로 구분된 타입 목록 "restaurant,food"
    private Double rating; // 0.0-5.0
    private Integer reviewCount;
    private Integer priceLevel; // 0-4 (Google API 기준)
    private Boolean openNow;
    private String photoReference;
    private String source; // "google" 등

    /**
     * 카테고리 문자열을 소문자 토큰 리스트로 분리
     */
    public List<String> categoryList() {
        List<String> result = new ArrayList<>();
        if (category == null || category.isBlank()) {
            return result;
        }
        for (String token : category.split(",")) {
            String trimmed = token.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /** 첫 번째 카테고리 (다양성 재정렬 기준) */
    public String primaryCategory() {
        List<String> categories = categoryList();
        return categories.isEmpty() ? "unknown" : categories.get(0);
    }
}
