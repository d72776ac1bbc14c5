package com.whatshouldido.service.suggestion;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 추천 파이프라인 설정 (suggestions.*)
 */
@Data
@Component
@ConfigurationProperties(prefix = "suggestions")
public class SuggestionsProperties {

    private Duration contextTimeout = Duration.ofSeconds(2);
    private Duration providerTimeout = Duration.ofSeconds(8);
    private Duration routeTimeout = Duration.ofSeconds(5);

    /** 최근 N개 추천 장소는 다시 추천하지 않음 */
    private int recentSuggestionWindow = 3;

    private int maxRouteStops = 8;

    private int collaboratorPoolSize = 16;

    @PostConstruct
    public void validate() {
        if (contextTimeout.isNegative() || contextTimeout.isZero()
                || providerTimeout.isNegative() || providerTimeout.isZero()
                || routeTimeout.isNegative() || routeTimeout.isZero()) {
            throw new IllegalStateException("suggestions.*-timeout must be positive");
        }
        if (recentSuggestionWindow < 0) {
            throw new IllegalStateException("suggestions.recent-suggestion-window must be >= 0");
        }
        if (maxRouteStops < 1 || collaboratorPoolSize < 1) {
            throw new IllegalStateException("suggestions.max-route-stops and collaborator-pool-size must be >= 1");
        }
    }
}
