package com.whatshouldido.service.route;

import com.whatshouldido.model.Place;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizedRoute {
    @Builder.Default
    private List<Stop> orderedStops = new ArrayList<>();
    private int totalDistanceMeters;
    private int totalDurationSeconds;
    private String optimizationMethod;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stop {
        private Place place;
        private int order; // 1부터 시작
        private int distanceFromPreviousMeters;
        private int durationFromPreviousSeconds;
    }
}
