package com.whatshouldido.service.context;

import com.whatshouldido.model.Place;
import com.whatshouldido.service.policy.PlaceCategories;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 시간대 / 계절은 요청 시각으로 계산하고, 날씨는 WeatherClient로 조회한다.
 * 날씨 조회 실패는 날씨 필드만 비우고 계속 진행.
 */
@Slf4j
@Service
public class DefaultContextEngine implements ContextEngine {

    private static final int MAX_CONTEXTUAL_REASONS = 2;

    private final WeatherClient weatherClient;
    private final ZoneId zoneId;

    public DefaultContextEngine(WeatherClient weatherClient,
                                @Value("${context.zone-id:UTC}") String zoneId) {
        this.weatherClient = weatherClient;
        this.zoneId = ZoneId.of(zoneId);
    }

    @Override
    public ContextualInsight getContextualInsights(double latitude, double longitude, Instant time) {
        ZonedDateTime local = time.atZone(zoneId);

        WeatherInfo weather = null;
        try {
            weather = weatherClient.getCurrentWeather(latitude, longitude).orElse(null);
        } catch (Exception e) {
            log.warn("[DefaultContextEngine] weather lookup failed, continuing without weather: {}", e.getMessage());
        }

        return ContextualInsight.builder()
                .timeOfDay(TimeOfDay.fromHour(local.getHour()))
                .season(Season.fromMonth(local.getMonthValue()))
                .weather(weather)
                .build();
    }

    @Override
    public List<String> getContextualReasons(Place place, ContextualInsight insight) {
        List<String> reasons = new ArrayList<>();
        if (insight == null || insight.isEmpty()) {
            return reasons;
        }
        List<String> categories = place.categoryList();

        if (insight.getTimeOfDay() != null) {
            switch (insight.getTimeOfDay()) {
                case EARLY_MORNING:
                case MORNING:
                    if (PlaceCategories.matchesAny(categories, Set.of("cafe", "bakery", "breakfast", "coffee"))) {
                        reasons.add("Perfect for a morning coffee or breakfast");
                    }
                    break;
                case LUNCH:
                    if (PlaceCategories.matchesAny(categories, Set.of("restaurant", "meal_takeaway", "food"))) {
                        reasons.add("Great spot for lunch right now");
                    }
                    break;
                case EVENING:
                case NIGHT:
                    if (PlaceCategories.matchesAny(categories, Set.of("bar", "restaurant", "night_club", "pub"))) {
                        reasons.add("Good choice for the evening");
                    }
                    break;
                default:
                    break;
            }
        }

        WeatherInfo weather = insight.getWeather();
        if (weather != null) {
            if (!weather.isGoodForOutdoor()) {
                if (PlaceCategories.isIndoor(place)) {
                    reasons.add("Cozy indoor option for the weather (" + weather.getDescription() + ")");
                }
            } else if (weather.getTemperature() > 20 && PlaceCategories.isOutdoor(place)) {
                reasons.add(String.format(Locale.ROOT, "Enjoy the nice weather outside (%.0f°C)", weather.getTemperature()));
            }
        }

        if (insight.getSeason() != null) {
            switch (insight.getSeason()) {
                case SPRING:
                    if (PlaceCategories.matchesAny(categories, Set.of("park", "garden", "botanical_garden"))) {
                        reasons.add("Spring is the season for parks and gardens");
                    }
                    break;
                case SUMMER:
                    if (PlaceCategories.matchesAny(categories, Set.of("beach", "marina", "swimming_pool", "waterfront"))) {
                        reasons.add("Great summer spot by the water");
                    }
                    break;
                case WINTER:
                    if (PlaceCategories.matchesAny(categories, Set.of("museum", "cafe", "restaurant"))) {
                        reasons.add("Warm indoor spot for winter");
                    }
                    break;
                default:
                    break;
            }
        }

        return reasons.size() > MAX_CONTEXTUAL_REASONS
                ? new ArrayList<>(reasons.subList(0, MAX_CONTEXTUAL_REASONS))
                : reasons;
    }
}
