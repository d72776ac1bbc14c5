package com.whatshouldido.service.quota;

import com.whatshouldido.config.redis.util.RedisOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis 기반 쿼터 저장소 (다중 인스턴스 운영용)
 * 조건부 차감은 Lua 스크립트로 GET/비교/DECRBY를 한 번에 실행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quota", name = "storage-backend", havingValue = "REDIS")
public class RedisQuotaStore implements QuotaStore {

    static final String KEY_PREFIX = "quota:";

    static final RedisScript<Long> CONSUME_SCRIPT = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[1]))
            if current == nil then
                return 0
            end
            local amount = tonumber(ARGV[1])
            if current >= amount then
                redis.call('DECRBY', KEYS[1], amount)
                return 1
            end
            return 0
            """, Long.class);

    private final RedisOperator redisOperator;

    @Override
    public Optional<Integer> get(String userId) {
        try {
            String value = redisOperator.getStringValue(key(userId));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(Integer.parseInt(value));
        } catch (Exception e) {
            log.error("[RedisQuotaStore] get failed for userId={}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean compareExchangeConsume(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        try {
            Long result = redisOperator.executeScript(CONSUME_SCRIPT, List.of(key(userId)), String.valueOf(amount));
            return result != null && result == 1L;
        } catch (Exception e) {
            // 백엔드 오류는 차감 실패로 처리 (fail closed)
            log.error("[RedisQuotaStore] consume failed for userId={}, amount={}: {}",
                    userId, amount, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void set(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }
        redisOperator.setStringValue(key(userId), String.valueOf(value), null);
        log.debug("[RedisQuotaStore] set quota. userId={}, value={}", userId, value);
    }

    @Override
    public boolean initializeIfAbsent(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }
        boolean created = redisOperator.setStringValueIfAbsent(key(userId), String.valueOf(value));
        log.debug("[RedisQuotaStore] initializeIfAbsent. userId={}, value={}, created={}", userId, value, created);
        return created;
    }

    @Override
    public Collection<String> trackedUserIds() {
        return redisOperator.scanKeys(KEY_PREFIX + "*", 500).stream()
                .map(key -> key.substring(KEY_PREFIX.length()))
                .collect(Collectors.toList());
    }

    private String key(String userId) {
        return KEY_PREFIX + userId;
    }
}
