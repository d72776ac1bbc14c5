package com.whatshouldido.service.places;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * provider 검색 조건
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceSearchFilters {
    @Builder.Default
    private List<String> types = new ArrayList<>(); // provider 장소 타입 ("restaurant", "museum" ...)
    private String keyword; // 식이 제한 등 자유 키워드
    private int maxResults;
}
