package com.whatshouldido.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 시간대는 UTC 고정 (쿼터 리셋 / 시간대별 컨텍스트 기준) */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
