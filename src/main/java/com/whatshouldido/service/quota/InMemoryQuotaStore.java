package com.whatshouldido.service.quota;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 로컬 쿼터 저장소 (단일 인스턴스 / 개발용)
 * 차감은 ConcurrentHashMap.computeIfPresent 안에서 키 단위로 원자적으로 수행된다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "quota", name = "storage-backend", havingValue = "IN_MEMORY", matchIfMissing = true)
public class InMemoryQuotaStore implements QuotaStore {

    private final Map<String, Integer> quotas = new ConcurrentHashMap<>();

    @Override
    public Optional<Integer> get(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(quotas.get(userId));
    }

    @Override
    public boolean compareExchangeConsume(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (userId == null) {
            return false;
        }

        boolean[] consumed = {false};
        quotas.computeIfPresent(userId, (key, remaining) -> {
            if (remaining >= amount) {
                consumed[0] = true;
                return remaining - amount;
            }
            return remaining;
        });

        if (!consumed[0]) {
            log.debug("[InMemoryQuotaStore] consume denied. userId={}, amount={}, remaining={}",
                    userId, amount, quotas.get(userId));
        }
        return consumed[0];
    }

    @Override
    public void set(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }
        quotas.put(userId, value);
    }

    @Override
    public boolean initializeIfAbsent(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }
        return quotas.putIfAbsent(userId, value) == null;
    }

    @Override
    public Collection<String> trackedUserIds() {
        return List.copyOf(quotas.keySet());
    }
}
