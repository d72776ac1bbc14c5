package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityScorerTest {

    private final RecommendationScoringOptions options = new RecommendationScoringOptions();
    private final QualityScorer scorer = new QualityScorer(options);

    @Test
    void bayesianRatingShrinksTowardZeroForFewReviews() {
        // 4.0 * 50 / (50 + 50) / 5
        assertThat(scorer.bayesianRating(rated(4.0, 50))).isCloseTo(0.4, within(1e-9));
        // 5.0 * 950 / (950 + 50) / 5
        assertThat(scorer.bayesianRating(rated(5.0, 950))).isCloseTo(0.95, within(1e-9));
        assertThat(scorer.bayesianRating(rated(4.8, 0))).isZero();
    }

    @Test
    void bayesianRatingIsZeroWithoutRating() {
        Place unrated = Place.builder().id("x").reviewCount(100).build();

        assertThat(scorer.bayesianRating(unrated)).isZero();
    }

    @Test
    void bayesianRatingWithoutSmoothingIsPlainRating() {
        options.setReviewCountSmoothingFactor(0);

        assertThat(scorer.bayesianRating(rated(4.0, 10))).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void distanceDecayBoundaries() {
        assertThat(scorer.distanceDecay(0)).isEqualTo(1.0);
        assertThat(scorer.distanceDecay(500)).isEqualTo(1.0);
        assertThat(scorer.distanceDecay(2750)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.distanceDecay(4100)).isCloseTo(0.2, within(1e-9));
        assertThat(scorer.distanceDecay(5000)).isZero();
        assertThat(scorer.distanceDecay(12_000)).isZero();
    }

    @Test
    void scoreBlendsRatingAndDistance() {
        // 0.4 * 0.4 + 0.6 * 0.5
        assertThat(scorer.score(rated(4.0, 50), 2750)).isCloseTo(0.46, within(1e-9));
        assertThat(scorer.score(rated(4.0, 50), 100)).isCloseTo(0.76, within(1e-9));
    }

    private static Place rated(double rating, int reviews) {
        return Place.builder().id("p").rating(rating).reviewCount(reviews).build();
    }
}
