package com.whatshouldido.service.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whatshouldido.model.Place;
import com.whatshouldido.service.cache.CacheService;
import com.whatshouldido.service.places.PlaceSearchFilters;
import com.whatshouldido.service.places.PlacesProvider;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Google Places API 클라이언트 래퍼 (Nearby Search)
 * 타입별로 병렬 호출한 뒤 place_id 기준으로 합친다.
 */
@Slf4j
@Service
public class GooglePlacesClient implements PlacesProvider {

    private static final String PLACES_API_BASE_URL = "https://maps.googleapis.com/maps/api/place/nearbysearch/json";

    private final String apiKey;
    private final CacheService cacheService;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // 타입별 병렬 호출용 스레드 풀 (최대 10개 동시 요청)
    private final ExecutorService executorService = Executors.newFixedThreadPool(10);

    @Autowired
    public GooglePlacesClient(@Value("${google.places.api.key:}") String apiKey,
                              CacheService cacheService) {
        this(apiKey, cacheService, new RestTemplate());
    }

    GooglePlacesClient(String apiKey, CacheService cacheService, RestTemplate restTemplate) {
        this.apiKey = apiKey;
        this.cacheService = cacheService;
        this.restTemplate = restTemplate;
    }

    /**
     * 주변 장소 검색
     * @return 거리 계산 전의 원본 후보 목록 (place_id 중복 제거)
     */
    @Override
    public List<Place> search(double latitude, double longitude, int radiusMeters, PlaceSearchFilters filters) {
        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("[GooglePlacesClient] Google Places API key is not set (GOOGLE_PLACES_API_KEY). Returning no candidates.");
            return new ArrayList<>();
        }

        String discriminator = String.join("|", filters.getTypes()) + "#" + (filters.getKeyword() != null ? filters.getKeyword() : "");
        List<Place> cached = cacheService.getNearbyPlaces(latitude, longitude, radiusMeters, discriminator);
        if (cached != null) {
            log.debug("[GooglePlacesClient] cache hit: {} places", cached.size());
            return limit(cached, filters.getMaxResults());
        }

        List<String> types = filters.getTypes().isEmpty() ? List.of("point_of_interest") : filters.getTypes();
        List<CompletableFuture<List<Place>>> futures = types.stream()
                .map(type -> CompletableFuture.supplyAsync(
                        () -> searchByType(latitude, longitude, radiusMeters, type, filters.getKeyword()),
                        executorService))
                .collect(Collectors.toList());

        // 모든 병렬 작업 완료 대기 및 결과 수집 (일부 실패는 허용)
        Map<String, Place> merged = new LinkedHashMap<>();
        int failures = 0;
        RuntimeException lastFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                for (Place place : futures.get(i).join()) {
                    merged.putIfAbsent(place.getId(), place);
                }
            } catch (CompletionException e) {
                failures++;
                lastFailure = e;
                log.warn("[GooglePlacesClient] nearby search failed for type {}: {}", types.get(i),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
        }

        if (failures == futures.size() && lastFailure != null) {
            throw new IllegalStateException("All Google Places nearby searches failed", lastFailure);
        }

        List<Place> places = new ArrayList<>(merged.values());
        if (failures == 0) {
            cacheService.setNearbyPlaces(latitude, longitude, radiusMeters, discriminator, places);
        }
        log.info("[GooglePlacesClient] {} places for {} types (failed types: {})", places.size(), types.size(), failures);
        return limit(places, filters.getMaxResults());
    }

    private List<Place> searchByType(double latitude, double longitude, int radius, String type, String keyword) {
        UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(PLACES_API_BASE_URL)
                .queryParam("location", latitude + "," + longitude)
                .queryParam("radius", radius)
                .queryParam("type", type)
                .queryParam("key", apiKey);
        if (keyword != null && !keyword.isBlank()) {
            uriBuilder.queryParam("keyword", keyword);
        }

        ResponseEntity<String> response = restTemplate.getForEntity(uriBuilder.toUriString(), String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException("Nearby search returned status " + response.getStatusCode());
        }

        try {
            return parseNearbyResults(objectMapper.readTree(response.getBody()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse nearby search response for type " + type, e);
        }
    }

    /**
     * Nearby Search JSON 파싱
     */
    List<Place> parseNearbyResults(JsonNode root) {
        String status = root.path("status").asText("OK");
        if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
            String message = root.path("error_message").asText(status);
            throw new IllegalStateException("Google Places error: " + message);
        }

        List<Place> places = new ArrayList<>();
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            return places;
        }

        for (JsonNode result : results) {
            if (!result.has("place_id")) {
                continue;
            }
            Place.PlaceBuilder builder = Place.builder()
                    .id(result.get("place_id").asText())
                    .name(result.path("name").asText(null))
                    .address(result.path("vicinity").asText(null))
                    .source("google");

            // 위치 정보
            JsonNode location = result.path("geometry").path("location");
            builder.latitude(location.path("lat").asDouble());
            builder.longitude(location.path("lng").asDouble());

            // 평점 및 리뷰 수
            if (result.has("rating")) {
                builder.rating(result.get("rating").asDouble());
            }
            if (result.has("user_ratings_total")) {
                builder.reviewCount(result.get("user_ratings_total").asInt());
            }
            if (result.has("price_level")) {
                builder.priceLevel(result.get("price_level").asInt());
            }
            if (result.path("opening_hours").has("open_now")) {
                builder.openNow(result.get("opening_hours").get("open_now").asBoolean());
            }

            // 타입 정보 → 콤마 구분 카테고리
            if (result.has("types") && result.get("types").isArray()) {
                List<String> types = new ArrayList<>();
                for (JsonNode type : result.get("types")) {
                    types.add(type.asText());
                }
                builder.category(String.join(",", types));
            }

            JsonNode photos = result.get("photos");
            if (photos != null && photos.isArray() && photos.size() > 0 && photos.get(0).has("photo_reference")) {
                builder.photoReference(photos.get(0).get("photo_reference").asText());
            }

            places.add(builder.build());
        }
        return places;
    }

    private List<Place> limit(List<Place> places, int maxResults) {
        if (maxResults <= 0 || places.size() <= maxResults) {
            return places;
        }
        // 리뷰 수가 많은 순으로 상한 적용
        return places.stream()
                .sorted(Comparator.comparing((Place p) -> p.getReviewCount() != null ? p.getReviewCount() : 0).reversed()
                        .thenComparing(Place::getId))
                .limit(maxResults)
                .collect(Collectors.toList());
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
