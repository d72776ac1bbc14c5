package com.whatshouldido.service.quota;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 요청 허용 여부 판단 (Admission Controller)
 * 프리미엄 여부 확인 후 무료 사용자만 쿼터를 차감한다. 오류 시에는 항상 거부.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaService {

    private final QuotaStore quotaStore;
    private final EntitlementService entitlementService;
    private final QuotaProperties quotaProperties;

    private final AtomicLong consumedTotal = new AtomicLong();
    private final AtomicLong blockedTotal = new AtomicLong();
    private final Set<String> usersAtZero = ConcurrentHashMap.newKeySet();

    /**
     * 남은 쿼터 조회. 레코드가 없거나 조회 실패 시 0.
     */
    public int getRemaining(String userId) {
        try {
            return quotaStore.get(userId).orElse(0);
        } catch (Exception e) {
            log.error("[QuotaService] getRemaining failed for userId={}: {}", userId, e.getMessage(), e);
            return 0;
        }
    }

    public boolean isPremium(String userId) {
        return entitlementService.isPremium(userId);
    }

    public int getDefaultQuota() {
        return quotaProperties.getDefaultFreeQuota();
    }

    /**
     * 처음 요청하는 무료 사용자에게 기본 쿼터 부여. 여러 번, 동시에 호출해도 결과는 같다.
     * 이미 차감이 시작된 레코드를 덮어쓰지 않도록 저장소의 원자적 생성만 사용한다.
     */
    public void initializeIfNeeded(String userId) {
        if (quotaStore.get(userId).isPresent()) {
            return;
        }
        if (entitlementService.isPremium(userId)) {
            return;
        }

        if (quotaStore.initializeIfAbsent(userId, quotaProperties.getDefaultFreeQuota())) {
            log.info("[QuotaService] Initialized quota for userId={} with {} credits",
                    userId, quotaProperties.getDefaultFreeQuota());
        }
    }

    public boolean tryConsume(String userId) {
        return tryConsume(userId, 1);
    }

    /**
     * 쿼터 차감 시도
     * @return 프리미엄이면 저장소를 건드리지 않고 true, 무료 사용자는 차감 성공 여부
     */
    public boolean tryConsume(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }

        try {
            if (entitlementService.isPremium(userId)) {
                log.debug("[QuotaService] Premium user {} bypasses quota", userId);
                return true;
            }

            boolean consumed = quotaStore.compareExchangeConsume(userId, amount);
            if (consumed) {
                consumedTotal.incrementAndGet();
                if (quotaStore.get(userId).orElse(0) == 0) {
                    usersAtZero.add(userId);
                }
            } else {
                blockedTotal.incrementAndGet();
                usersAtZero.add(userId);
                log.info("[QuotaService] Quota denied for userId={}, amount={}", userId, amount);
            }
            return consumed;
        } catch (Exception e) {
            blockedTotal.incrementAndGet();
            log.error("[QuotaService] tryConsume failed for userId={}, denying request: {}",
                    userId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * 무료 사용자의 쿼터를 기본값으로 되돌림
     * @return 리셋했으면 true, 프리미엄이라 건너뛰었으면 false
     */
    public boolean resetQuota(String userId) {
        if (entitlementService.isPremium(userId)) {
            return false;
        }
        quotaStore.set(userId, quotaProperties.getDefaultFreeQuota());
        usersAtZero.remove(userId);
        return true;
    }

    public QuotaSnapshot getSnapshot() {
        return new QuotaSnapshot(consumedTotal.get(), blockedTotal.get(), usersAtZero.size());
    }
}
