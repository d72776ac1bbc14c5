package com.whatshouldido.dto.response;

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
public class RouteView {
    private String name; // "{의도 표시명} - yyyy-MM-dd"
    private String transportationMode; // "walking"
    private String routeType; // "intent_orchestrated"
    private String optimizationMethod;
    private int totalDistanceMeters;
    private int totalDurationSeconds;
    @Builder.Default
    private List<RouteStopView> stops = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RouteStopView {
        private int order;
        private SuggestionView place;
        private int distanceFromPreviousMeters;
        private int durationFromPreviousSeconds;
    }
}
