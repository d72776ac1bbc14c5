package com.whatshouldido.service.quota;

import com.whatshouldido.repository.UserSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 프리미엄(무제한) 여부 판단
 * 신호가 없거나 애매하면 항상 false (fail closed)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementService {

    private final UserSubscriptionRepository userSubscriptionRepository;
    private final QuotaProperties quotaProperties;
    private final Clock clock;

    public boolean isPremium(String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }

        try {
            boolean subscribed = userSubscriptionRepository.findFirstByUserIdOrderByUpdatedAtDesc(userId)
                    .map(subscription -> subscription.isActivePremium(LocalDateTime.now(clock)))
                    .orElse(false);
            if (subscribed) {
                return true;
            }

            // 운영용 허용 목록 (테스트 계정 등)
            return quotaProperties.getPremiumUserIds().contains(userId);
        } catch (Exception e) {
            log.error("[EntitlementService] premium check failed for userId={}: {}", userId, e.getMessage(), e);
            return false;
        }
    }
}
