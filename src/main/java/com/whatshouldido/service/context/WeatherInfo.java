package com.whatshouldido.service.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherInfo {
    private String condition; // "Clear", "Rain", "Snow" ...
    @Builder.Default
    private double temperature = 20.0; // 섭씨
    @Builder.Default
    private boolean goodForOutdoor = true;
    private String description;
}
