package com.whatshouldido.service.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * OpenWeatherMap 현재 날씨 API 클라이언트
 */
@Slf4j
@Service
public class WeatherClient {

    private static final Set<String> BAD_WEATHER = Set.of("rain", "drizzle", "thunderstorm", "snow");

    @Value("${weather.api.key:}")
    private String apiKey;

    @Value("${weather.api.base-url:https://api.openweathermap.org/data/2.5/weather}")
    private String baseUrl;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 현재 날씨 조회. API 키가 없으면 empty.
     */
    public Optional<WeatherInfo> getCurrentWeather(double latitude, double longitude) throws IOException {
        if (apiKey == null || apiKey.isEmpty()) {
            log.debug("[WeatherClient] weather.api.key is not set, skipping weather lookup");
            return Optional.empty();
        }

        String uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("lat", latitude)
                .queryParam("lon", longitude)
                .queryParam("units", "metric")
                .queryParam("appid", apiKey)
                .toUriString();

        ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            log.warn("[WeatherClient] non-2xx status: {}", response.getStatusCode());
            return Optional.empty();
        }

        return Optional.of(parseWeather(objectMapper.readTree(response.getBody())));
    }

    WeatherInfo parseWeather(JsonNode root) {
        String condition = "Clear";
        String description = null;
        JsonNode weatherArray = root.get("weather");
        if (weatherArray != null && weatherArray.isArray() && weatherArray.size() > 0) {
            condition = weatherArray.get(0).path("main").asText("Clear");
            description = weatherArray.get(0).path("description").asText(null);
        }

        double temperature = root.path("main").path("temp").asDouble(20.0);
        boolean bad = BAD_WEATHER.contains(condition.toLowerCase()) || temperature < 5 || temperature > 35;

        return WeatherInfo.builder()
                .condition(condition)
                .temperature(temperature)
                .goodForOutdoor(!bad)
                .description(description != null ? description : condition)
                .build();
    }
}
