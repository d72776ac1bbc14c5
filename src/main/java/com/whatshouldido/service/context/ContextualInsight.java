package com.whatshouldido.service.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 요청 시점의 상황 정보. 모든 필드는 선택적이며, 없으면 해당 신호는 중립 처리된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextualInsight {
    private TimeOfDay timeOfDay;
    private Season season;
    private WeatherInfo weather;

    public static ContextualInsight neutral() {
        return new ContextualInsight();
    }

    public boolean isEmpty() {
        return timeOfDay == null && season == null && weather == null;
    }
}
