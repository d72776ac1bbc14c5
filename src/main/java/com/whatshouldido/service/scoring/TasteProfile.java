package com.whatshouldido.service.scoring;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 사용자 명시적 취향 프로필 (불변)
 * 모든 가중치는 [0,1], 값이 없으면 0.5 중립
 */
public final class TasteProfile {

    public static final double NEUTRAL = 0.5;
    public static final double MAX_DELTA_PER_UPDATE = 0.05;

    private final Map<TasteDimension, Double> weights;
    private final double noveltyTolerance;

    private TasteProfile(Map<TasteDimension, Double> weights, double noveltyTolerance) {
        this.weights = Collections.unmodifiableMap(weights);
        this.noveltyTolerance = noveltyTolerance;
    }

    public static TasteProfile neutral() {
        return new TasteProfile(new EnumMap<>(TasteDimension.class), NEUTRAL);
    }

    public static TasteProfile of(Map<TasteDimension, Double> weights, double noveltyTolerance) {
        EnumMap<TasteDimension, Double> copy = new EnumMap<>(TasteDimension.class);
        if (weights != null) {
            weights.forEach((dimension, value) -> {
                if (dimension != null && value != null) {
                    copy.put(dimension, clamp(value));
                }
            });
        }
        return new TasteProfile(copy, clamp(noveltyTolerance));
    }

    public double weight(TasteDimension dimension) {
        return weights.getOrDefault(dimension, NEUTRAL);
    }

    public double getNoveltyTolerance() {
        return noveltyTolerance;
    }

    public Map<TasteDimension, Double> getWeights() {
        return weights;
    }

    /**
     * 피드백 반영. 한 번에 차원별 최대 ±0.05 까지만 움직인다.
     */
    public TasteProfile applyDeltas(Map<TasteDimension, Double> deltas) {
        EnumMap<TasteDimension, Double> updated = new EnumMap<>(TasteDimension.class);
        updated.putAll(weights);
        deltas.forEach((dimension, delta) -> {
            double bounded = Math.max(-MAX_DELTA_PER_UPDATE, Math.min(MAX_DELTA_PER_UPDATE, delta));
            updated.put(dimension, clamp(weight(dimension) + bounded));
        });
        return new TasteProfile(updated, noveltyTolerance);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
