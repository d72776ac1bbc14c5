package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 품질 점수 = 베이지안 평점(40%) + 거리 감쇠(60%)
 */
@Component
@RequiredArgsConstructor
public class QualityScorer {

    private static final double RATING_SHARE = 0.4;
    private static final double DISTANCE_SHARE = 0.6;

    private final RecommendationScoringOptions options;

    public double score(Place place, double distanceMeters) {
        double score = bayesianRating(place) * RATING_SHARE + distanceDecay(distanceMeters) * DISTANCE_SHARE;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * rating * n / (n + smoothing), 5점 만점 기준 [0,1] 정규화
     */
    double bayesianRating(Place place) {
        if (place.getRating() == null) {
            return 0.0;
        }
        double reviews = place.getReviewCount() != null ? Math.max(0, place.getReviewCount()) : 0;
        double denominator = reviews + options.getReviewCountSmoothingFactor();
        if (denominator <= 0) {
            return Math.min(1.0, place.getRating() / 5.0);
        }
        double smoothed = place.getRating() * reviews / denominator;
        return Math.max(0.0, Math.min(1.0, smoothed / 5.0));
    }

    /**
     * 시작 거리 이하 1.0, 최대 거리까지 선형 감소, 그 이상 0
     */
    double distanceDecay(double distanceMeters) {
        double start = options.getDistancePenaltyStartMeters();
        double max = options.getDistancePenaltyMaxMeters();
        if (distanceMeters <= start) {
            return 1.0;
        }
        if (distanceMeters >= max) {
            return 0.0;
        }
        return 1.0 - (distanceMeters - start) / (max - start);
    }
}
