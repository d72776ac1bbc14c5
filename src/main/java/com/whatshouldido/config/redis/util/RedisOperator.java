package com.whatshouldido.config.redis.util;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class RedisOperator {
    private final StringRedisTemplate redisTemplate;

    /** 단순 String 값을 TTL과 함께 저장 */
    public void setStringValue(String key, String value, Duration ttl) {
        if (ttl != null) {
            this.redisTemplate.opsForValue().set(key, value, ttl);
        } else {
            this.redisTemplate.opsForValue().set(key, value);
        }
    }

    /** SET NX: 키가 없을 때만 저장하고 저장 여부 반환 */
    public boolean setStringValueIfAbsent(String key, String value) {
        return Boolean.TRUE.equals(this.redisTemplate.opsForValue().setIfAbsent(key, value));
    }

    public String getStringValue(String key) {
        return this.redisTemplate.opsForValue().get(key);
    }

    /** Lua 스크립트 실행 (EVALSHA, 없으면 EVAL) */
    public <T> T executeScript(RedisScript<T> script, List<String> keys, String... args) {
        return this.redisTemplate.execute(script, keys, (Object[]) args);
    }

    /** KEYS 대신 SCAN으로 패턴 매칭 키 조회 */
    public List<String> scanKeys(String pattern, long batchSize) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(batchSize).build();
        try (Cursor<String> cursor = this.redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }
}
