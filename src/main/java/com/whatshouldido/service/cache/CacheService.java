package com.whatshouldido.service.cache;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.scoring.RecommendationScoringOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 인메모리 캐시 서비스 (Redis 스타일 추상화)
 * 주변 검색 결과를 candidate-cache-ttl-minutes 동안 보관
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheService {

    private final RecommendationScoringOptions options;
    private final Clock clock;

    private final Map<String, CacheEntry<List<Place>>> nearbySearchCache = new ConcurrentHashMap<>();

    /**
     * Nearby Search 결과 캐시 키 생성 (좌표는 소수 4자리 ≒ 11m 단위로 묶음)
     */
    private String generateNearbySearchKey(double latitude, double longitude, int radius, String discriminator) {
        return String.format(Locale.ROOT, "nearby:%.4f:%.4f:%d:%s", latitude, longitude, radius, discriminator);
    }

    /**
     * Nearby Search 결과 가져오기. 없거나 만료되면 null.
     */
    public List<Place> getNearbyPlaces(double latitude, double longitude, int radius, String discriminator) {
        String key = generateNearbySearchKey(latitude, longitude, radius, discriminator);
        CacheEntry<List<Place>> entry = nearbySearchCache.get(key);

        if (entry != null && !entry.isExpired(clock.instant(), ttl())) {
            return entry.getValue();
        }

        // 만료되었거나 없으면 제거
        if (entry != null) {
            nearbySearchCache.remove(key);
        }

        return null;
    }

    /**
     * Nearby Search 결과 저장
     */
    public void setNearbyPlaces(double latitude, double longitude, int radius, String discriminator, List<Place> places) {
        String key = generateNearbySearchKey(latitude, longitude, radius, discriminator);
        nearbySearchCache.put(key, new CacheEntry<>(List.copyOf(places), clock.instant()));
    }

    /**
     * 5분마다 만료된 엔트리 정리 (다시 조회되지 않는 좌표 키가 계속 쌓이지 않도록)
     */
    @Scheduled(fixedRate = 300000) // 5분 = 300,000ms
    public void evictExpired() {
        Instant now = clock.instant();
        Duration ttl = ttl();
        int before = nearbySearchCache.size();
        nearbySearchCache.entrySet().removeIf(entry -> entry.getValue().isExpired(now, ttl));
        int removed = Math.max(0, before - nearbySearchCache.size());
        if (removed > 0) {
            log.debug("[CacheService] evicted {} expired nearby-search entries, {} remaining",
                    removed, nearbySearchCache.size());
        }
    }

    int size() {
        return nearbySearchCache.size();
    }

    private Duration ttl() {
        return Duration.ofMinutes(options.getCandidateCacheTtlMinutes());
    }

    /**
     * 캐시 엔트리 내부 클래스
     */
    private static class CacheEntry<T> {
        private final T value;
        private final Instant createdAt;

        CacheEntry(T value, Instant createdAt) {
            this.value = value;
            this.createdAt = createdAt;
        }

        T getValue() {
            return value;
        }

        boolean isExpired(Instant now, Duration ttl) {
            return now.isAfter(createdAt.plus(ttl));
        }
    }
}
