package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.context.DefaultContextEngine;
import com.whatshouldido.service.context.WeatherClient;

import static org.mockito.Mockito.mock;

/**
 * 테스트용 장소 / 스코어링 엔진 생성
 */
public final class ScoringFixtures {

    public static final double ORIGIN_LAT = 41.0082;
    public static final double ORIGIN_LNG = 28.9784;

    private ScoringFixtures() {
    }

    public static HybridScoringEngine engine(RecommendationScoringOptions options) {
        PlaceCategoryMapper mapper = new PlaceCategoryMapper();
        DefaultContextEngine contextEngine = new DefaultContextEngine(mock(WeatherClient.class), "UTC");
        return new HybridScoringEngine(options, new ImplicitScorer(), new ExplicitScorer(mapper),
                new NoveltyScorer(), new ContextScorer(contextEngine), new QualityScorer(options),
                new ExplainabilityService(mapper));
    }

    /** 원점에서 북쪽으로 offsetMeters 떨어진 장소 */
    public static Place place(String id, String category, double rating, int reviewCount, double offsetMeters) {
        return Place.builder()
                .id(id)
                .name("Place " + id)
                .latitude(ORIGIN_LAT + offsetMeters / 111_195.0)
                .longitude(ORIGIN_LNG)
                .category(category)
                .rating(rating)
                .reviewCount(reviewCount)
                .priceLevel(2)
                .source("google")
                .build();
    }
}
