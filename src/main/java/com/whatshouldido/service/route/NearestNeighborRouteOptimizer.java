package com.whatshouldido.service.route;

import com.whatshouldido.model.Place;
import com.whatshouldido.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 최근접 이웃 방식 경로 최적화 (직선 거리 기준)
 * 다음 지점을 더하면 전체 거리가 상한을 넘는 경우 그 지점은 건너뛴다.
 */
@Slf4j
@Service
public class NearestNeighborRouteOptimizer implements RouteOptimizationService {

    private static final double WALKING_METERS_PER_SECOND = 5000.0 / 3600.0; // 5km/h
    private static final double DRIVING_METERS_PER_SECOND = 30000.0 / 3600.0; // 시내 30km/h

    @Override
    public OptimizedRoute optimize(double originLatitude, double originLongitude, List<Place> places,
                                   int maxWalkingDistanceMeters, String mode) {
        if (places == null || places.isEmpty()) {
            return OptimizedRoute.builder().optimizationMethod("None - Empty Route").build();
        }

        List<Place> unvisited = new ArrayList<>(places);
        List<OptimizedRoute.Stop> stops = new ArrayList<>();
        double currentLat = originLatitude;
        double currentLng = originLongitude;
        int totalDistance = 0;
        int totalDuration = 0;

        while (!unvisited.isEmpty()) {
            int nearestIndex = -1;
            double nearestDistance = Double.MAX_VALUE;
            for (int i = 0; i < unvisited.size(); i++) {
                Place candidate = unvisited.get(i);
                double distance = GeoUtils.distanceMeters(currentLat, currentLng,
                        candidate.getLatitude(), candidate.getLongitude());
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearestIndex = i;
                }
            }

            Place next = unvisited.remove(nearestIndex);
            int legDistance = (int) Math.round(nearestDistance);
            if (totalDistance + legDistance > maxWalkingDistanceMeters) {
                // 가장 가까운 지점도 상한을 넘으면 더 이상 추가할 수 없음
                break;
            }

            int legDuration = estimateDurationSeconds(legDistance, mode);
            stops.add(new OptimizedRoute.Stop(next, stops.size() + 1, legDistance, legDuration));
            totalDistance += legDistance;
            totalDuration += legDuration;
            currentLat = next.getLatitude();
            currentLng = next.getLongitude();
        }

        log.info("[NearestNeighborRouteOptimizer] {} of {} places routed, {}m / {}s",
                stops.size(), places.size(), totalDistance, totalDuration);

        return OptimizedRoute.builder()
                .orderedStops(stops)
                .totalDistanceMeters(totalDistance)
                .totalDurationSeconds(totalDuration)
                .optimizationMethod("Nearest Neighbor")
                .build();
    }

    private int estimateDurationSeconds(int distanceMeters, String mode) {
        double speed = "driving".equalsIgnoreCase(mode) ? DRIVING_METERS_PER_SECOND : WALKING_METERS_PER_SECOND;
        return (int) Math.round(distanceMeters / speed);
    }
}
