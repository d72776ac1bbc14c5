package com.whatshouldido.service.suggestion;

import com.whatshouldido.dto.request.CreateSuggestionsRequest;
import com.whatshouldido.dto.response.RouteView;
import com.whatshouldido.dto.response.SuggestionView;
import com.whatshouldido.dto.response.SuggestionsResponse;
import com.whatshouldido.exception.CollaboratorFailureException;
import com.whatshouldido.exception.QuotaExceededException;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.model.Place;
import com.whatshouldido.service.context.ContextEngine;
import com.whatshouldido.service.history.PreferenceLearningService;
import com.whatshouldido.service.history.UserHistoryService;
import com.whatshouldido.service.places.PlacesProvider;
import com.whatshouldido.service.policy.PlaceCategories;
import com.whatshouldido.service.policy.SuggestionPolicyService;
import com.whatshouldido.service.profile.TasteProfileService;
import com.whatshouldido.service.quota.QuotaService;
import com.whatshouldido.service.route.NearestNeighborRouteOptimizer;
import com.whatshouldido.service.scoring.DiversityReranker;
import com.whatshouldido.service.scoring.RecommendationScoringOptions;
import com.whatshouldido.service.scoring.ScoringFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.whatshouldido.service.scoring.ScoringFixtures.ORIGIN_LAT;
import static com.whatshouldido.service.scoring.ScoringFixtures.ORIGIN_LNG;
import static com.whatshouldido.service.scoring.ScoringFixtures.place;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuggestionOrchestratorTest {

    @Mock
    private ContextEngine contextEngine;
    @Mock
    private QuotaService quotaService;
    @Mock
    private PlacesProvider placesProvider;
    @Mock
    private UserHistoryService userHistoryService;
    @Mock
    private PreferenceLearningService preferenceLearningService;
    @Mock
    private TasteProfileService tasteProfileService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private CollaboratorInvoker collaboratorInvoker;
    private SuggestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        RecommendationScoringOptions scoringOptions = new RecommendationScoringOptions();
        SuggestionsProperties properties = new SuggestionsProperties();
        collaboratorInvoker = new CollaboratorInvoker(properties);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:30:00Z"), ZoneOffset.UTC);

        orchestrator = new SuggestionOrchestrator(
                new SuggestionPolicyService(),
                new CreateSuggestionsRequestValidator(),
                contextEngine,
                quotaService,
                placesProvider,
                userHistoryService,
                preferenceLearningService,
                tasteProfileService,
                ScoringFixtures.engine(scoringOptions),
                new DiversityReranker(),
                new NearestNeighborRouteOptimizer(),
                collaboratorInvoker,
                properties,
                scoringOptions,
                eventPublisher,
                clock);
    }

    @AfterEach
    void tearDown() {
        collaboratorInvoker.shutdown();
    }

    @Test
    void foodOnlyAnonymousRequestReturnsOnlyFoodSuggestions() {
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(fifteenMixedPlaces());

        SuggestionsResponse response = orchestrator.createSuggestions(request("FOOD_ONLY"), null);

        assertThat(response.getSuggestions()).hasSize(12);
        assertThat(response.getTotalCount()).isEqualTo(12);
        assertThat(response.getRoute()).isNull();
        assertThat(response.isPersonalized()).isFalse();
        assertThat(response.getUserId()).isNull();
        assertThat(response.getIntent()).isEqualTo("FOOD_ONLY");
        assertThat(response.getMetadata().getSource()).isEqualTo("IntentOrchestrator");
        assertThat(response.getSuggestions()).allSatisfy(view -> {
            assertThat(view.getReasons()).hasSizeLessThanOrEqualTo(5);
            assertThat(view.getExplanations()).hasSizeLessThanOrEqualTo(5);
            assertThat(view.getPlaceId()).startsWith("f");
        });
        verifyNoInteractions(quotaService, userHistoryService, preferenceLearningService);
    }

    @Test
    void completionEventIsPublishedWithObservations() {
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(fifteenMixedPlaces());

        orchestrator.createSuggestions(request("QUICK"), null);

        SuggestionsCompletedEvent event = capturedEvent();
        assertThat(event.isSuccess()).isTrue();
        assertThat(event.getSuggestedPlaces()).hasSize(15);
        assertThat(event.getObservations()).extracting(StageObservation::getStage)
                .containsExactly(PipelineStage.values());
        assertThat(event.getObservations())
                .filteredOn(observation -> observation.getStage() == PipelineStage.ADMIT)
                .extracting(StageObservation::getOutcome)
                .containsExactly(StageObservation.Outcome.SKIPPED);
    }

    @Test
    void invalidRequestReportsAllErrorsWithoutTouchingQuota() {
        CreateSuggestionsRequest request = request(null);
        request.setLatitude(120.0);
        request.setBudgetLevel("CHEAP");
        request.setAreaName("x".repeat(101));

        assertThatThrownBy(() -> orchestrator.createSuggestions(request, "user-1"))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors()).hasSize(3));

        verifyNoInteractions(quotaService, placesProvider);
        assertThat(capturedEvent().getErrorCode()).isEqualTo("VALIDATION_FAILED");
    }

    @Test
    void policyErrorsAreCollectedAlongsideShapeErrors() {
        CreateSuggestionsRequest request = request("ROUTE_PLANNING");
        request.setLatitude(95.0);
        request.setExcludeCategories(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k"));

        assertThatThrownBy(() -> orchestrator.createSuggestions(request, null))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrors()).containsExactlyInAnyOrder(
                        "Maximum 10 exclude categories allowed",
                        "Latitude must be between -90 and 90",
                        "Route planning requires a walking distance of at least 500 meters"));
    }

    @Test
    void deniedQuotaStopsBeforeFetchingCandidates() {
        when(quotaService.tryConsume("user-1")).thenReturn(false);
        when(quotaService.getDefaultQuota()).thenReturn(5);

        assertThatThrownBy(() -> orchestrator.createSuggestions(request("QUICK"), "user-1"))
                .isInstanceOf(QuotaExceededException.class)
                .satisfies(e -> assertThat(((QuotaExceededException) e).getLimit()).isEqualTo(5));

        verify(quotaService).initializeIfNeeded("user-1");
        verifyNoInteractions(placesProvider);
    }

    @Test
    void quotaBackendErrorIsTreatedAsDenied() {
        when(quotaService.tryConsume("user-1")).thenThrow(new IllegalStateException("redis down"));

        assertThatThrownBy(() -> orchestrator.createSuggestions(request("QUICK"), "user-1"))
                .isInstanceOf(QuotaExceededException.class);
        verifyNoInteractions(placesProvider);
    }

    @Test
    void providerFailureAfterAdmissionKeepsTheCredit() {
        when(quotaService.tryConsume("user-1")).thenReturn(true);
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any()))
                .thenThrow(new IllegalStateException("All Google Places nearby searches failed"));

        assertThatThrownBy(() -> orchestrator.createSuggestions(request("QUICK"), "user-1"))
                .isInstanceOf(CollaboratorFailureException.class);

        verify(quotaService, times(1)).tryConsume("user-1");
        verify(quotaService, never()).resetQuota(any());
    }

    @Test
    void contextFailureFallsBackToNeutralContext() {
        when(contextEngine.getContextualInsights(anyDouble(), anyDouble(), any()))
                .thenThrow(new IllegalStateException("weather service down"));
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(fifteenMixedPlaces());

        SuggestionsResponse response = orchestrator.createSuggestions(request("QUICK"), null);

        assertThat(response.getSuggestions()).isNotEmpty();
        assertThat(response.getMetadata().isUsedContextEngine()).isFalse();
    }

    @Test
    void authenticatedUserExclusionsAndRecentSuggestionsAreFiltered() {
        when(quotaService.tryConsume("user-1")).thenReturn(true);
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(fifteenMixedPlaces());
        when(userHistoryService.getActiveExclusions("user-1")).thenReturn(Set.of("f1"));
        when(userHistoryService.getRecentSuggestions("user-1", 3)).thenReturn(List.of("f2", "f3"));

        SuggestionsResponse response = orchestrator.createSuggestions(request("FOOD_ONLY"), "user-1");

        assertThat(response.getSuggestions()).extracting(SuggestionView::getPlaceId)
                .hasSize(9)
                .doesNotContain("f1", "f2", "f3");
        assertThat(response.getUserId()).isEqualTo("user-1");
        assertThat(response.isPersonalized()).isFalse();
        assertThat(response.getFilters().isAppliedVariety()).isTrue();
    }

    @Test
    void includeExcludeAndBudgetFiltersNarrowCandidates() {
        List<Place> places = new ArrayList<>(fifteenMixedPlaces());
        places.get(5).setPriceLevel(4);
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(places);

        CreateSuggestionsRequest request = request("FOOD_ONLY");
        request.setIncludeCategories(List.of("restaurant", "cafe"));
        request.setExcludeCategories(List.of("cafe"));
        request.setBudgetLevel("moderate");

        SuggestionsResponse response = orchestrator.createSuggestions(request, null);

        assertThat(response.getSuggestions()).isNotEmpty();
        assertThat(response.getSuggestions()).allSatisfy(view -> {
            assertThat(view.getCategory()).contains("restaurant");
            assertThat(view.getPriceLevel()).isLessThanOrEqualTo(2);
        });
        assertThat(response.getFilters().getBudget()).isEqualTo("MODERATE");
    }

    @Test
    void routePlanningReturnsRouteInsteadOfSuggestions() {
        List<Place> places = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            places.add(place("m" + i, i % 2 == 0 ? "museum" : "park", 4.2, 100, 150 + i * 120));
        }
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(places);

        CreateSuggestionsRequest request = request("ROUTE_PLANNING");
        request.setWalkingDistanceMeters(5000);

        SuggestionsResponse response = orchestrator.createSuggestions(request, null);

        assertThat(response.getSuggestions()).isNull();
        assertThat(response.getTotalCount()).isNull();
        RouteView route = response.getRoute();
        assertThat(route).isNotNull();
        assertThat(route.getName()).isEqualTo("Day Plan / Route - 2024-05-01");
        assertThat(route.getTransportationMode()).isEqualTo("walking");
        assertThat(route.getRouteType()).isEqualTo("intent_orchestrated");
        assertThat(route.getStops()).isNotEmpty().hasSizeLessThanOrEqualTo(8);
        assertThat(route.getStops()).allSatisfy(stop -> assertThat(stop.getPlace()).isNotNull());
    }

    @Test
    void nonRouteIntentsNeverReturnRoute() {
        when(placesProvider.search(anyDouble(), anyDouble(), anyInt(), any())).thenReturn(fifteenMixedPlaces());

        for (String intent : List.of("QUICK", "FOOD_ONLY", "ACTIVITY_ONLY", "TRY_SOMETHING_NEW")) {
            SuggestionsResponse response = orchestrator.createSuggestions(request(intent), null);
            assertThat(response.getRoute()).as(intent).isNull();
            assertThat(response.getSuggestions()).as(intent).isNotNull();
        }
    }

    private SuggestionsCompletedEvent capturedEvent() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return (SuggestionsCompletedEvent) captor.getValue();
    }

    private static CreateSuggestionsRequest request(String intent) {
        return CreateSuggestionsRequest.builder()
                .intent(intent)
                .latitude(ORIGIN_LAT)
                .longitude(ORIGIN_LNG)
                .radiusMeters(3000)
                .build();
    }

    /** 음식점 12곳 + 비음식 3곳 */
    private static List<Place> fifteenMixedPlaces() {
        String[] foodCategories = {"restaurant,food", "cafe", "bakery", "italian_restaurant", "meal_takeaway", "wine_bar"};
        List<Place> places = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            places.add(place("f" + i, foodCategories[i % foodCategories.length], 3.8 + (i % 5) * 0.2, 40 + i * 10,
                    100 + i * 90));
        }
        places.add(place("n1", "museum", 4.7, 1500, 400));
        places.add(place("n2", "park", 4.5, 300, 700));
        places.add(place("n3", "shopping_mall", 4.1, 800, 1200));

        assertThat(places.stream().filter(PlaceCategories::isFood).collect(Collectors.toList())).hasSize(12);
        return places;
    }
}
