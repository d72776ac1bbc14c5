package com.whatshouldido.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis 설정 - quota.storage-backend=REDIS 일 때만 활성화
 * 쿼터 카운터는 Lua 스크립트에서 tonumber()로 읽기 때문에 값도 문자열로 직렬화한다.
 */
@Configuration
@ConditionalOnProperty(prefix = "quota", name = "storage-backend", havingValue = "REDIS")
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        logger.info("[RedisConfig] Creating StringRedisTemplate...");
        logger.info("[RedisConfig] RedisConnectionFactory: {}", connectionFactory.getClass().getName());

        try {
            // Redis 연결 테스트
            connectionFactory.getConnection().ping();
            logger.info("[RedisConfig] Redis connection test: SUCCESS");
        } catch (Exception e) {
            logger.error("[RedisConfig] Redis connection test: FAILED - {}", e.getMessage());
        }

        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer serializer = new StringRedisSerializer();
        template.setKeySerializer(serializer);
        template.setValueSerializer(serializer);
        template.setHashKeySerializer(serializer);
        template.setHashValueSerializer(serializer);

        template.afterPropertiesSet();
        logger.info("[RedisConfig] StringRedisTemplate created successfully");
        return template;
    }
}
