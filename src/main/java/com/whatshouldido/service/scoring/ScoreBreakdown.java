package com.whatshouldido.service.scoring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 다섯 개 하위 점수와 가중치. 디버그 모드에서만 응답에 포함된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private double implicitScore;
    private double implicitWeight;
    private double explicitScore;
    private double explicitWeight;
    private double noveltyScore;
    private double noveltyWeight;
    private double contextScore;
    private double contextWeight;
    private double qualityScore;
    private double qualityWeight;

    public double getImplicitContribution() {
        return implicitScore * implicitWeight;
    }

    public double getExplicitContribution() {
        return explicitScore * explicitWeight;
    }

    public double getNoveltyContribution() {
        return noveltyScore * noveltyWeight;
    }

    public double getContextContribution() {
        return contextScore * contextWeight;
    }

    public double getQualityContribution() {
        return qualityScore * qualityWeight;
    }

    public double getFinalScore() {
        double sum = getImplicitContribution() + getExplicitContribution() + getNoveltyContribution()
                + getContextContribution() + getQualityContribution();
        return Math.max(0.0, Math.min(1.0, sum));
    }
}
