package com.whatshouldido.service.scoring;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationReason {
    private String reasonCode; // "MATCHES_INTEREST_FOOD", "VERY_CLOSE" ...
    private String message;
    private Double weight; // 정렬용 가중치 (선택)
}
