package com.whatshouldido.service.suggestion;

import com.whatshouldido.dto.request.CreateSuggestionsRequest;
import com.whatshouldido.dto.response.FilterInfo;
import com.whatshouldido.dto.response.RouteView;
import com.whatshouldido.dto.response.SuggestionMeta;
import com.whatshouldido.dto.response.SuggestionView;
import com.whatshouldido.dto.response.SuggestionsResponse;
import com.whatshouldido.exception.CollaboratorFailureException;
import com.whatshouldido.exception.QuotaExceededException;
import com.whatshouldido.exception.SuggestionServiceException;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.model.BudgetLevel;
import com.whatshouldido.model.Place;
import com.whatshouldido.model.SuggestionIntent;
import com.whatshouldido.service.context.ContextEngine;
import com.whatshouldido.service.context.ContextualInsight;
import com.whatshouldido.service.history.PreferenceLearningService;
import com.whatshouldido.service.history.UserHistoryService;
import com.whatshouldido.service.places.PlaceSearchFilters;
import com.whatshouldido.service.places.PlacesProvider;
import com.whatshouldido.service.policy.PlaceCategories;
import com.whatshouldido.service.policy.SuggestionPolicyService;
import com.whatshouldido.service.profile.TasteProfileService;
import com.whatshouldido.service.quota.QuotaService;
import com.whatshouldido.service.route.OptimizedRoute;
import com.whatshouldido.service.route.RouteOptimizationService;
import com.whatshouldido.service.scoring.DiversityReranker;
import com.whatshouldido.service.scoring.HybridScoringEngine;
import com.whatshouldido.service.scoring.ImplicitPreferences;
import com.whatshouldido.service.scoring.RecommendationScoringOptions;
import com.whatshouldido.service.scoring.ScoredPlace;
import com.whatshouldido.service.scoring.ScoringContext;
import com.whatshouldido.service.scoring.TasteProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 의도 기반 추천 파이프라인
 * 검증 → 컨텍스트 → 쿼터 차감 → 후보 조회 → 제외 목록 → 의도 필터 → 스코어링/다양성 → 이유 생성 → (경로) → 응답 조립
 * 쿼터는 한 번만 차감되며 이후 단계가 실패해도 환불하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionOrchestrator {

    static final String ROUTE_MODE = "walking";
    static final String ROUTE_TYPE = "intent_orchestrated";

    private final SuggestionPolicyService policyService;
    private final CreateSuggestionsRequestValidator requestValidator;
    private final ContextEngine contextEngine;
    private final QuotaService quotaService;
    private final PlacesProvider placesProvider;
    private final UserHistoryService userHistoryService;
    private final PreferenceLearningService preferenceLearningService;
    private final TasteProfileService tasteProfileService;
    private final HybridScoringEngine scoringEngine;
    private final DiversityReranker diversityReranker;
    private final RouteOptimizationService routeOptimizationService;
    private final CollaboratorInvoker collaboratorInvoker;
    private final SuggestionsProperties properties;
    private final RecommendationScoringOptions scoringOptions;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @param userId X-User-Id 헤더 값 (없으면 익명)
     */
    public SuggestionsResponse createSuggestions(CreateSuggestionsRequest request, String userId) {
        String normalizedUserId = userId != null && !userId.isBlank() ? userId.trim() : null;
        PipelineRun run = new PipelineRun(UUID.randomUUID().toString(), normalizedUserId);

        try {
            SuggestionsResponse response = execute(request, run);
            run.success = true;
            return response;
        } catch (RuntimeException e) {
            run.failCurrentStage();
            run.errorCode = e instanceof SuggestionServiceException
                    ? ((SuggestionServiceException) e).getErrorCode()
                    : "INTERNAL_ERROR";
            throw e;
        } finally {
            publishCompleted(run);
        }
    }

    private SuggestionsResponse execute(CreateSuggestionsRequest request, PipelineRun run) {
        String userId = run.userId;

        // 1. ValidateIntent
        run.begin(PipelineStage.VALIDATE_INTENT);
        int radius = request.getRadiusMeters() != null ? request.getRadiusMeters() : scoringOptions.getDefaultRadiusMeters();
        List<String> errors = new ArrayList<>(requestValidator.validate(request));
        SuggestionIntent intent = SuggestionIntent.parse(request.getIntent()).orElse(null);
        if (intent != null && request.getLatitude() != null && request.getLongitude() != null) {
            errors.addAll(policyService.validateRequest(intent, request.getLatitude(), request.getLongitude(),
                    radius, request.getWalkingDistanceMeters()));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        run.intent = intent;
        double latitude = request.getLatitude();
        double longitude = request.getLongitude();
        run.end(StageObservation.Outcome.SUCCESS);

        // 2. BuildContext (실패 시 중립 컨텍스트로 계속)
        run.begin(PipelineStage.BUILD_CONTEXT);
        Instant now = clock.instant();
        ContextualInsight insight = buildContext(latitude, longitude, now);
        run.end(insight.isEmpty() ? StageObservation.Outcome.DEGRADED : StageObservation.Outcome.SUCCESS);

        // 3. Admit
        run.begin(PipelineStage.ADMIT);
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Request cancelled before admission");
        }
        if (userId != null) {
            admit(userId);
            run.end(StageObservation.Outcome.SUCCESS);
        } else {
            run.end(StageObservation.Outcome.SKIPPED);
        }

        // 4. FetchCandidates
        run.begin(PipelineStage.FETCH_CANDIDATES);
        List<Place> candidates = fetchCandidates(intent, latitude, longitude, radius, request.getDietaryRestrictions());
        run.end(StageObservation.Outcome.SUCCESS);

        // 5. LoadExclusions
        run.begin(PipelineStage.LOAD_EXCLUSIONS);
        Set<String> exclusions = new HashSet<>();
        if (userId != null) {
            exclusions.addAll(userHistoryService.getActiveExclusions(userId));
            exclusions.addAll(userHistoryService.getRecentSuggestions(userId, properties.getRecentSuggestionWindow()));
            run.end(StageObservation.Outcome.SUCCESS);
        } else {
            run.end(StageObservation.Outcome.SKIPPED);
        }

        // 6. FilterByIntent
        run.begin(PipelineStage.FILTER_BY_INTENT);
        List<Place> filtered = policyService.applyIntentFilter(intent, candidates, exclusions);
        filtered = applyRequestFilters(filtered, request);
        run.end(StageObservation.Outcome.SUCCESS);

        // 7. Score & Personalize
        run.begin(PipelineStage.SCORE_AND_PERSONALIZE);
        ScoringContext scoringContext = buildScoringContext(request, run, intent, latitude, longitude, now, insight);
        double diversityFactor = policyService.getDiversityFactor(intent);
        List<ScoredPlace> ranked = diversityReranker.rerank(
                scoringEngine.scoreAndRank(scoringContext, filtered), diversityFactor);
        run.end(StageObservation.Outcome.SUCCESS);

        // 8. Explain
        run.begin(PipelineStage.EXPLAIN);
        List<SuggestionView> views = ranked.stream()
                .map(scored -> toView(scored, intent, latitude, longitude, insight))
                .collect(Collectors.toList());
        run.end(StageObservation.Outcome.SUCCESS);

        // 9. BuildRouteIfNeeded
        run.begin(PipelineStage.BUILD_ROUTE_IF_NEEDED);
        RouteView route = null;
        if (policyService.shouldBuildRoute(intent)) {
            int maxWalking = policyService.getMaxWalkingDistance(intent, request.getWalkingDistanceMeters());
            route = buildRoute(intent, latitude, longitude, ranked, views, maxWalking);
            run.end(StageObservation.Outcome.SUCCESS);
        } else {
            run.end(StageObservation.Outcome.SKIPPED);
        }

        // 10. Assemble
        run.begin(PipelineStage.ASSEMBLE);
        boolean personalized = userId != null && scoringContext.isPersonalized();
        SuggestionsResponse.SuggestionsResponseBuilder builder = SuggestionsResponse.builder()
                .intent(intent.name())
                .personalized(personalized)
                .userId(userId)
                .filters(buildFilterInfo(request, radius, intent, exclusions, insight))
                .metadata(buildMeta(now, diversityFactor, personalized, insight));

        if (route != null) {
            builder.route(route);
            run.suggestedPlaces = route.getStops().stream()
                    .map(stop -> placeOf(stop.getPlace(), ranked))
                    .collect(Collectors.toList());
        } else {
            builder.suggestions(views).totalCount(views.size());
            run.suggestedPlaces = ranked.stream().map(ScoredPlace::getPlace).collect(Collectors.toList());
        }
        run.end(StageObservation.Outcome.SUCCESS);

        log.info("[SuggestionOrchestrator] requestId={} intent={} user={} candidates={} filtered={} results={} route={}",
                run.requestId, intent, userId != null ? userId : "anonymous", candidates.size(), filtered.size(),
                views.size(), route != null);
        return builder.build();
    }

    private ContextualInsight buildContext(double latitude, double longitude, Instant now) {
        try {
            ContextualInsight insight = collaboratorInvoker.call("ContextEngine",
                    () -> contextEngine.getContextualInsights(latitude, longitude, now),
                    properties.getContextTimeout());
            return insight != null ? insight : ContextualInsight.neutral();
        } catch (TimeoutException e) {
            log.warn("[SuggestionOrchestrator] Context lookup timed out, continuing with neutral context");
            return ContextualInsight.neutral();
        } catch (ExecutionException e) {
            log.warn("[SuggestionOrchestrator] Context lookup failed, continuing with neutral context: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return ContextualInsight.neutral();
        }
    }

    /**
     * 무료 사용자 쿼터 차감. 쿼터 백엔드 오류도 거부로 처리한다.
     */
    private void admit(String userId) {
        boolean admitted;
        try {
            quotaService.initializeIfNeeded(userId);
            admitted = quotaService.tryConsume(userId);
        } catch (RuntimeException e) {
            log.error("[SuggestionOrchestrator] Admission failed for userId={}: {}", userId, e.getMessage(), e);
            admitted = false;
        }

        if (!admitted) {
            throw new QuotaExceededException(userId, quotaService.getRemaining(userId), quotaService.getDefaultQuota());
        }
    }

    private List<Place> fetchCandidates(SuggestionIntent intent, double latitude, double longitude, int radius,
                                        List<String> dietaryRestrictions) {
        PlaceSearchFilters filters = PlaceSearchFilters.builder()
                .types(policyService.getSearchTypes(intent))
                .keyword(dietaryRestrictions == null || dietaryRestrictions.isEmpty()
                        ? null
                        : String.join(" ", dietaryRestrictions))
                .maxResults(scoringOptions.getMaxCandidates())
                .build();

        List<Place> candidates;
        try {
            candidates = collaboratorInvoker.call("PlacesProvider",
                    () -> placesProvider.search(latitude, longitude, radius, filters),
                    properties.getProviderTimeout());
        } catch (TimeoutException e) {
            throw new CollaboratorFailureException("PlacesProvider", "Place search timed out", e);
        } catch (ExecutionException e) {
            throw new CollaboratorFailureException("PlacesProvider", "Place search failed", e.getCause());
        }

        if (candidates == null) {
            return new ArrayList<>();
        }
        return candidates.size() > scoringOptions.getMaxCandidates()
                ? new ArrayList<>(candidates.subList(0, scoringOptions.getMaxCandidates()))
                : candidates;
    }

    /**
     * include / exclude 카테고리와 예산 필터 (가격 정보가 없는 장소는 예산 필터를 통과)
     */
    List<Place> applyRequestFilters(List<Place> places, CreateSuggestionsRequest request) {
        Set<String> include = normalize(request.getIncludeCategories());
        Set<String> exclude = normalize(request.getExcludeCategories());
        BudgetLevel budget = BudgetLevel.parse(request.getBudgetLevel()).orElse(null);

        return places.stream()
                .filter(place -> include.isEmpty() || PlaceCategories.matchesAny(place.categoryList(), include))
                .filter(place -> exclude.isEmpty() || !PlaceCategories.matchesAny(place.categoryList(), exclude))
                .filter(place -> budget == null || place.getPriceLevel() == null
                        || place.getPriceLevel() <= budget.maxPriceLevel())
                .collect(Collectors.toList());
    }

    private static Set<String> normalize(List<String> categories) {
        if (categories == null) {
            return Set.of();
        }
        return categories.stream()
                .filter(category -> category != null && !category.isBlank())
                .map(category -> category.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private ScoringContext buildScoringContext(CreateSuggestionsRequest request, PipelineRun run,
                                               SuggestionIntent intent, double latitude, double longitude,
                                               Instant now, ContextualInsight insight) {
        ImplicitPreferences implicitPreferences = null;
        TasteProfile tasteProfile = null;
        if (run.userId != null) {
            try {
                implicitPreferences = preferenceLearningService.learn(run.userId);
                tasteProfile = tasteProfileService.load(run.userId);
            } catch (RuntimeException e) {
                log.warn("[SuggestionOrchestrator] Personalization unavailable for userId={}: {}",
                        run.userId, e.getMessage());
            }
        }

        return ScoringContext.builder()
                .userId(run.userId)
                .implicitPreferences(implicitPreferences)
                .tasteProfile(tasteProfile)
                .originLatitude(latitude)
                .originLongitude(longitude)
                .requestTime(now)
                .intentText(request.getAreaName())
                .intent(intent)
                .sessionId(run.requestId)
                .includeDebugInfo(Boolean.TRUE.equals(request.getIncludeDebugInfo()))
                .contextualInsight(insight)
                .build();
    }

    private SuggestionView toView(ScoredPlace scored, SuggestionIntent intent, double latitude, double longitude,
                                  ContextualInsight insight) {
        Place place = scored.getPlace();
        List<String> contextualReasons = contextEngine.getContextualReasons(place, insight);
        List<String> reasons = policyService.generateReasons(intent, place, latitude, longitude,
                scored.getMatchedInterests(), scored.getNoveltyScore(), contextualReasons);

        List<SuggestionView.Explanation> explanations = scored.getReasons() == null
                ? new ArrayList<>()
                : scored.getReasons().stream()
                        .limit(SuggestionPolicyService.MAX_REASONS)
                        .map(reason -> new SuggestionView.Explanation(reason.getReasonCode(), reason.getMessage(),
                                reason.getWeight()))
                        .collect(Collectors.toList());

        return SuggestionView.builder()
                .placeId(place.getId())
                .name(place.getName())
                .latitude(place.getLatitude())
                .longitude(place.getLongitude())
                .address(place.getAddress())
                .category(place.getCategory())
                .rating(place.getRating())
                .reviewCount(place.getReviewCount())
                .priceLevel(place.getPriceLevel())
                .openNow(place.getOpenNow())
                .photoReference(place.getPhotoReference())
                .source(place.getSource())
                .distanceMeters((int) Math.round(scored.getDistanceMeters()))
                .score(scored.getScore())
                .reasons(reasons)
                .explanations(explanations)
                .scoreBreakdown(scored.getBreakdown())
                .build();
    }

    /**
     * 최대 도보 거리 안의 상위 장소(최대 maxRouteStops 개)로 경로 생성
     */
    private RouteView buildRoute(SuggestionIntent intent, double latitude, double longitude,
                                 List<ScoredPlace> ranked, List<SuggestionView> views, int maxWalkingMeters) {
        List<Place> stops = ranked.stream()
                .filter(scored -> scored.getDistanceMeters() <= maxWalkingMeters)
                .limit(properties.getMaxRouteStops())
                .map(ScoredPlace::getPlace)
                .collect(Collectors.toList());

        OptimizedRoute optimized;
        try {
            optimized = collaboratorInvoker.call("RouteOptimizer",
                    () -> routeOptimizationService.optimize(latitude, longitude, stops, maxWalkingMeters, ROUTE_MODE),
                    properties.getRouteTimeout());
        } catch (TimeoutException e) {
            throw new CollaboratorFailureException("RouteOptimizer", "Route optimization timed out", e);
        } catch (ExecutionException e) {
            throw new CollaboratorFailureException("RouteOptimizer", "Route optimization failed", e.getCause());
        }
        if (optimized == null) {
            throw new CollaboratorFailureException("RouteOptimizer", "Route optimizer returned no route", null);
        }

        Map<String, SuggestionView> viewsById = new LinkedHashMap<>();
        for (SuggestionView view : views) {
            viewsById.putIfAbsent(view.getPlaceId(), view);
        }

        List<RouteView.RouteStopView> stopViews = optimized.getOrderedStops().stream()
                .map(stop -> new RouteView.RouteStopView(stop.getOrder(),
                        viewsById.get(stop.getPlace().getId()),
                        stop.getDistanceFromPreviousMeters(),
                        stop.getDurationFromPreviousSeconds()))
                .collect(Collectors.toList());

        return RouteView.builder()
                .name(intent.getDisplayName() + " - " + LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE))
                .transportationMode(ROUTE_MODE)
                .routeType(ROUTE_TYPE)
                .optimizationMethod(optimized.getOptimizationMethod())
                .totalDistanceMeters(optimized.getTotalDistanceMeters())
                .totalDurationSeconds(optimized.getTotalDurationSeconds())
                .stops(stopViews)
                .build();
    }

    private static Place placeOf(SuggestionView view, List<ScoredPlace> ranked) {
        return ranked.stream()
                .map(ScoredPlace::getPlace)
                .filter(place -> view != null && place.getId() != null && place.getId().equals(view.getPlaceId()))
                .findFirst()
                .orElse(null);
    }

    private FilterInfo buildFilterInfo(CreateSuggestionsRequest request, int radius, SuggestionIntent intent,
                                       Set<String> exclusions, ContextualInsight insight) {
        return FilterInfo.builder()
                .radius(radius)
                .walkingDistance(policyService.getMaxWalkingDistance(intent, request.getWalkingDistanceMeters()))
                .budget(BudgetLevel.parse(request.getBudgetLevel()).map(Enum::name).orElse(null))
                .include(request.getIncludeCategories())
                .exclude(request.getExcludeCategories())
                .dietary(request.getDietaryRestrictions())
                .appliedVariety(!exclusions.isEmpty())
                .appliedContextual(!insight.isEmpty())
                .build();
    }

    private SuggestionMeta buildMeta(Instant now, double diversityFactor, boolean personalized,
                                     ContextualInsight insight) {
        return SuggestionMeta.builder()
                .generatedAt(now)
                .diversityFactor(diversityFactor)
                .usedAI(false)
                .usedPersonalization(personalized)
                .usedContextEngine(!insight.isEmpty())
                .usedVariabilityEngine(diversityFactor > 0)
                .timeOfDay(insight.getTimeOfDay() != null ? insight.getTimeOfDay().name() : null)
                .weather(insight.getWeather() != null ? insight.getWeather().getCondition() : null)
                .season(insight.getSeason() != null ? insight.getSeason().name() : null)
                .build();
    }

    private void publishCompleted(PipelineRun run) {
        try {
            eventPublisher.publishEvent(SuggestionsCompletedEvent.builder()
                    .requestId(run.requestId)
                    .userId(run.userId)
                    .intent(run.intent)
                    .success(run.success)
                    .errorCode(run.errorCode)
                    .suggestedPlaces(run.suggestedPlaces.stream()
                            .filter(place -> place != null)
                            .collect(Collectors.toList()))
                    .observations(List.copyOf(run.observations))
                    .totalDurationMs((System.nanoTime() - run.startedNanos) / 1_000_000)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[SuggestionOrchestrator] Failed to publish completion event for requestId={}: {}",
                    run.requestId, e.getMessage(), e);
        }
    }

    /** 요청 하나의 단계별 관측값 */
    private static final class PipelineRun {
        private final String requestId;
        private final String userId;
        private final long startedNanos = System.nanoTime();
        private final List<StageObservation> observations = new ArrayList<>();
        private SuggestionIntent intent;
        private boolean success;
        private String errorCode;
        private List<Place> suggestedPlaces = new ArrayList<>();

        private PipelineStage currentStage;
        private long stageStartedNanos;

        private PipelineRun(String requestId, String userId) {
            this.requestId = requestId;
            this.userId = userId;
        }

        private void begin(PipelineStage stage) {
            currentStage = stage;
            stageStartedNanos = System.nanoTime();
        }

        private void end(StageObservation.Outcome outcome) {
            observations.add(new StageObservation(currentStage,
                    (System.nanoTime() - stageStartedNanos) / 1_000_000, outcome));
            currentStage = null;
        }

        private void failCurrentStage() {
            if (currentStage != null) {
                end(StageObservation.Outcome.FAILED);
            }
        }
    }
}
