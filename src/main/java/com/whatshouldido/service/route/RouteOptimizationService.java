package com.whatshouldido.service.route;

import com.whatshouldido.model.Place;

import java.util.List;

/**
 * 방문 순서 최적화
 */
public interface RouteOptimizationService {

    /**
     * @param maxWalkingDistanceMeters 전체 이동 거리 상한
     * @param mode "walking" 등 이동 수단
     */
    OptimizedRoute optimize(double originLatitude, double originLongitude, List<Place> places,
                            int maxWalkingDistanceMeters, String mode);
}
