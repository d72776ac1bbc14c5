package com.whatshouldido.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 비동기 이벤트 처리용 Executor 설정
 */
@Configuration
public class AsyncConfig {

    /** 요청 종료 후 히스토리 저장 / 로그 처리용 */
    @Bean(name = "suggestionEventExecutor")
    public Executor suggestionEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("suggestion-event-");
        executor.initialize();
        return executor;
    }
}
