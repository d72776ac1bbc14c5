package com.whatshouldido.service.scoring;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 하이브리드 스코어링 설정 (recommendation.scoring.*)
 * 기동 시 한 번 검증하고, 요청 처리 중에는 읽기만 한다.
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "recommendation.scoring")
public class RecommendationScoringOptions {

    public static final double WEIGHT_SUM_TOLERANCE = 0.01;

    private double implicitWeight = 0.25;
    private double explicitWeight = 0.30;
    private double noveltyWeight = 0.20;
    private double contextWeight = 0.15;
    private double qualityWeight = 0.10;

    private int candidateCacheTtlMinutes = 15;
    private int maxCandidates = 100;
    private int maxResults = 20;
    private int defaultRadiusMeters = 3000;

    private double reviewCountSmoothingFactor = 50;
    private double minimumRating = 0;
    private double distancePenaltyStartMeters = 500;
    private double distancePenaltyMaxMeters = 5000;

    private boolean enableDebugFields = false;

    public double weightSum() {
        return implicitWeight + explicitWeight + noveltyWeight + contextWeight + qualityWeight;
    }

    /**
     * 잘못된 설정이면 IllegalStateException (애플리케이션 기동 실패)
     */
    @PostConstruct
    public void validate() {
        checkWeight("implicit-weight", implicitWeight);
        checkWeight("explicit-weight", explicitWeight);
        checkWeight("novelty-weight", noveltyWeight);
        checkWeight("context-weight", contextWeight);
        checkWeight("quality-weight", qualityWeight);

        double sum = weightSum();
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new IllegalStateException(String.format(
                    "Scoring weights must sum to 1.0 (+/- %.2f) but sum to %.4f", WEIGHT_SUM_TOLERANCE, sum));
        }

        if (maxResults < 1) {
            throw new IllegalStateException("recommendation.scoring.max-results must be at least 1");
        }
        if (maxCandidates < 1) {
            throw new IllegalStateException("recommendation.scoring.max-candidates must be at least 1");
        }
        if (reviewCountSmoothingFactor < 0) {
            throw new IllegalStateException("recommendation.scoring.review-count-smoothing-factor cannot be negative");
        }
        if (distancePenaltyStartMeters < 0 || distancePenaltyMaxMeters <= distancePenaltyStartMeters) {
            throw new IllegalStateException(
                    "recommendation.scoring.distance-penalty-max-meters must be greater than distance-penalty-start-meters");
        }

        log.info("[RecommendationScoringOptions] weights implicit={} explicit={} novelty={} context={} quality={}",
                implicitWeight, explicitWeight, noveltyWeight, contextWeight, qualityWeight);
    }

    private void checkWeight(String name, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalStateException(
                    "recommendation.scoring." + name + " must be between 0 and 1 but was " + value);
        }
    }
}
