package com.whatshouldido.service.context;

import com.whatshouldido.model.Place;

import java.time.Instant;
import java.util.List;

/**
 * 시간 / 날씨 / 계절 컨텍스트 제공자
 */
public interface ContextEngine {

    /** 외부 조회가 포함될 수 있음 (날씨). 실패해도 가능한 필드만 채워서 반환 */
    ContextualInsight getContextualInsights(double latitude, double longitude, Instant time);

    /** 이미 조회된 컨텍스트 기준으로 장소별 상황 이유 생성 (최대 2개, I/O 없음) */
    List<String> getContextualReasons(Place place, ContextualInsight insight);
}
