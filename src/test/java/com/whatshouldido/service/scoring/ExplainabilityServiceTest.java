package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ExplainabilityServiceTest {

    private final ExplainabilityService service = new ExplainabilityService(new PlaceCategoryMapper());

    @Test
    void closeByFollowsTwoKilometreThreshold() {
        Place museum = Place.builder().id("m1").name("Museum").category("museum").build();

        assertThat(codes(museum, 300)).contains("VERY_CLOSE");
        assertThat(codes(museum, 1800)).contains("CLOSE_BY");
        assertThat(codes(museum, 2100)).doesNotContain("CLOSE_BY", "VERY_CLOSE");
    }

    private List<String> codes(Place place, double distanceMeters) {
        ScoringContext context = ScoringContext.builder()
                .intent(SuggestionIntent.QUICK)
                .build();
        return service.generateReasons(place, new ScoreBreakdown(), context, distanceMeters).stream()
                .map(RecommendationReason::getReasonCode)
                .collect(Collectors.toList());
    }
}
