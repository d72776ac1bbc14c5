package com.whatshouldido.service.policy;

import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.whatshouldido.service.scoring.ScoringFixtures.ORIGIN_LAT;
import static com.whatshouldido.service.scoring.ScoringFixtures.ORIGIN_LNG;
import static com.whatshouldido.service.scoring.ScoringFixtures.place;
import static org.assertj.core.api.Assertions.assertThat;

class SuggestionPolicyServiceTest {

    private final SuggestionPolicyService policy = new SuggestionPolicyService();

    private final List<Place> mixed = List.of(
            place("r1", "seafood_restaurant,food", 4.5, 100, 200),
            place("c1", "cafe", 4.2, 50, 300),
            place("b1", "wine_bar", 4.0, 30, 400),
            place("m1", "museum", 4.7, 900, 500),
            place("p1", "park", 4.1, 60, 700),
            place("s1", "barber_shop", 4.3, 20, 100),
            place("u1", null, 3.0, 1, 50));

    @Test
    void foodOnlyKeepsOnlyFoodPlaces() {
        List<Place> filtered = policy.applyIntentFilter(SuggestionIntent.FOOD_ONLY, mixed, Set.of());

        assertThat(ids(filtered)).containsExactly("r1", "c1", "b1");
        assertThat(filtered).allMatch(PlaceCategories::isFood);
    }

    @Test
    void activityOnlyExcludesFoodPlaces() {
        List<Place> filtered = policy.applyIntentFilter(SuggestionIntent.ACTIVITY_ONLY, mixed, Set.of());

        assertThat(ids(filtered)).containsExactly("m1", "p1");
        assertThat(filtered).noneMatch(PlaceCategories::isFood);
    }

    @ParameterizedTest
    @EnumSource(SuggestionIntent.class)
    void exclusionsAreAlwaysRemoved(SuggestionIntent intent) {
        List<Place> filtered = policy.applyIntentFilter(intent, mixed, Set.of("r1", "m1"));

        assertThat(ids(filtered)).doesNotContain("r1", "m1");
    }

    @Test
    void unrestrictedIntentsKeepEverythingNotExcluded() {
        assertThat(policy.applyIntentFilter(SuggestionIntent.QUICK, mixed, null)).hasSize(mixed.size());
    }

    @ParameterizedTest
    @EnumSource(SuggestionIntent.class)
    void onlyRoutePlanningBuildsRoute(SuggestionIntent intent) {
        assertThat(policy.shouldBuildRoute(intent)).isEqualTo(intent == SuggestionIntent.ROUTE_PLANNING);
    }

    @Test
    void validationCollectsEveryViolation() {
        List<String> errors = policy.validateRequest(SuggestionIntent.ROUTE_PLANNING, 91, -181, 50, 100);

        assertThat(errors).containsExactlyInAnyOrder(
                "Latitude must be between -90 and 90",
                "Longitude must be between -180 and 180",
                "Radius must be between 100 and 50,000 meters",
                "Route planning requires a walking distance of at least 500 meters");
    }

    @Test
    void validationRejectsExcessiveWalkingDistance() {
        List<String> errors = policy.validateRequest(SuggestionIntent.QUICK, 41, 29, 3000, 12_000);

        assertThat(errors).containsExactly("Walking distance cannot exceed 10,000 meters (10 km)");
    }

    @ParameterizedTest
    @EnumSource(value = SuggestionIntent.class, names = "ROUTE_PLANNING", mode = EnumSource.Mode.EXCLUDE)
    void validationRejectsShortWalkingDistanceForEveryIntent(SuggestionIntent intent) {
        List<String> errors = policy.validateRequest(intent, 41, 29, 3000, 100);

        assertThat(errors).containsExactly("Walking distance must be at least 500 meters");
    }

    @Test
    void walkingDistanceBoundsAreInclusive() {
        assertThat(policy.validateRequest(SuggestionIntent.QUICK, 41, 29, 3000, 500)).isEmpty();
        assertThat(policy.validateRequest(SuggestionIntent.QUICK, 41, 29, 3000, 10_000)).isEmpty();
        assertThat(policy.validateRequest(SuggestionIntent.QUICK, 41, 29, 3000, 499)).hasSize(1);
    }

    @Test
    void validRequestHasNoErrors() {
        assertThat(policy.validateRequest(SuggestionIntent.ROUTE_PLANNING, 41, 29, 3000, 2000)).isEmpty();
        assertThat(policy.validateRequest(SuggestionIntent.FOOD_ONLY, -90, 180, 100, null)).isEmpty();
    }

    @Test
    void diversityFactorAndWalkingDefaultsPerIntent() {
        assertThat(policy.getDiversityFactor(SuggestionIntent.QUICK)).isEqualTo(0.3);
        assertThat(policy.getDiversityFactor(SuggestionIntent.TRY_SOMETHING_NEW)).isEqualTo(1.0);
        assertThat(policy.getMaxWalkingDistance(SuggestionIntent.ROUTE_PLANNING, null)).isEqualTo(5000);
        assertThat(policy.getMaxWalkingDistance(SuggestionIntent.QUICK, 1500)).isEqualTo(1500);
        assertThat(policy.getMaxWalkingDistance(SuggestionIntent.FOOD_ONLY, 20_000)).isEqualTo(2000);
        assertThat(policy.getMaxWalkingDistance(SuggestionIntent.QUICK, 100)).isEqualTo(1000);
        assertThat(policy.getMaxWalkingDistance(SuggestionIntent.QUICK, 500)).isEqualTo(500);
    }

    @Test
    void reasonsNeverExceedFive() {
        Place place = place("r1", "restaurant,park", 4.9, 1000, 100);

        List<String> reasons = policy.generateReasons(SuggestionIntent.FOOD_ONLY, place, ORIGIN_LAT, ORIGIN_LNG,
                List.of("Food", "Nature", "Culture"), 0.9,
                List.of("Great spot for lunch right now", "Spring is the season for parks and gardens", "extra"));

        assertThat(reasons).hasSize(5);
        assertThat(reasons.get(0)).isEqualTo("Very close to you (walking distance)");
        assertThat(reasons).contains("Matches your interests: Food, Nature");
    }

    @Test
    void tryingSomethingNewReasonDependsOnNovelty() {
        Place far = place("m1", "museum", 3.0, 5, 5000);

        assertThat(policy.generateReasons(SuggestionIntent.TRY_SOMETHING_NEW, far, ORIGIN_LAT, ORIGIN_LNG,
                List.of(), 0.8, List.of())).containsExactly("A new experience for you");
        assertThat(policy.generateReasons(SuggestionIntent.TRY_SOMETHING_NEW, far, ORIGIN_LAT, ORIGIN_LNG,
                List.of(), 0.2, List.of())).isEmpty();
    }

    private static List<String> ids(List<Place> places) {
        return places.stream().map(Place::getId).collect(Collectors.toList());
    }
}
