package com.whatshouldido.service.scoring;

import com.whatshouldido.model.Place;
import com.whatshouldido.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 다섯 가지 하위 점수(암묵/명시/새로움/상황/품질)의 가중합으로 후보를 정렬한다.
 * 입력은 변경하지 않으며, 같은 입력이면 항상 같은 순서와 점수를 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridScoringEngine {

    /** 점수 내림차순 → 거리 오름차순 → id 오름차순 */
    static final Comparator<ScoredPlace> RANKING = Comparator
            .comparingDouble(ScoredPlace::getScore).reversed()
            .thenComparingDouble(ScoredPlace::getDistanceMeters)
            .thenComparing(scored -> scored.getPlace().getId(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final RecommendationScoringOptions options;
    private final ImplicitScorer implicitScorer;
    private final ExplicitScorer explicitScorer;
    private final NoveltyScorer noveltyScorer;
    private final ContextScorer contextScorer;
    private final QualityScorer qualityScorer;
    private final ExplainabilityService explainabilityService;

    /**
     * 최소 평점 필터 → 스코어링 → 정렬 → maxResults 개로 자름
     */
    public List<ScoredPlace> scoreAndRank(ScoringContext context, List<Place> candidates) {
        List<ScoredPlace> ranked = candidates.stream()
                .filter(this::meetsMinimumRating)
                .map(place -> score(context, place))
                .sorted(RANKING)
                .limit(options.getMaxResults())
                .collect(Collectors.toList());

        log.debug("[HybridScoringEngine] scored {} candidates -> {} results (user={})",
                candidates.size(), ranked.size(), context.getUserId());
        return ranked;
    }

    public ScoredPlace score(ScoringContext context, Place place) {
        double distance = GeoUtils.distanceMeters(context.getOriginLatitude(), context.getOriginLongitude(),
                place.getLatitude(), place.getLongitude());

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .implicitScore(implicitScorer.score(place, context.getImplicitPreferences()))
                .implicitWeight(options.getImplicitWeight())
                .explicitScore(explicitScorer.score(place, context.getTasteProfile()))
                .explicitWeight(options.getExplicitWeight())
                .noveltyScore(noveltyScorer.score(place, context.getImplicitPreferences(), context.getTasteProfile()))
                .noveltyWeight(options.getNoveltyWeight())
                .contextScore(contextScorer.score(place, context.getContextualInsight()))
                .contextWeight(options.getContextWeight())
                .qualityScore(qualityScorer.score(place, distance))
                .qualityWeight(options.getQualityWeight())
                .build();

        boolean debug = context.isIncludeDebugInfo() && options.isEnableDebugFields();

        return ScoredPlace.builder()
                .place(place)
                .score(breakdown.getFinalScore())
                .distanceMeters(distance)
                .noveltyScore(breakdown.getNoveltyScore())
                .matchedInterests(explicitScorer.matchedInterests(place, context.getTasteProfile()))
                .reasons(explainabilityService.generateReasons(place, breakdown, context, distance))
                .breakdown(debug ? breakdown : null)
                .build();
    }

    private boolean meetsMinimumRating(Place place) {
        if (options.getMinimumRating() <= 0) {
            return true;
        }
        return place.getRating() != null && place.getRating() >= options.getMinimumRating();
    }
}
