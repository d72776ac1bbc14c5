package com.whatshouldido.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 취향 퀴즈 결과 / 피드백 요청
 * weights 키는 "food", "tasteQuality", "TASTE_QUALITY" 등 자유 형식
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TasteProfileRequest {
    private Map<String, Double> weights;
    private Double noveltyTolerance;
}
