package com.whatshouldido.service.quota;

import com.whatshouldido.entity.UserQuota;
import com.whatshouldido.repository.UserQuotaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * RDB 기반 쿼터 저장소
 * 차감은 "remaining_credits >= amount" 조건이 걸린 단일 UPDATE 문으로 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quota", name = "storage-backend", havingValue = "DATABASE")
public class DatabaseQuotaStore implements QuotaStore {

    private final UserQuotaRepository userQuotaRepository;

    @Override
    public Optional<Integer> get(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        try {
            return userQuotaRepository.findById(userId).map(UserQuota::getRemainingCredits);
        } catch (Exception e) {
            log.error("[DatabaseQuotaStore] get failed for userId={}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean compareExchangeConsume(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        try {
            return userQuotaRepository.consumeIfAvailable(userId, amount, LocalDateTime.now()) == 1;
        } catch (Exception e) {
            log.error("[DatabaseQuotaStore] consume failed for userId={}, amount={}: {}",
                    userId, amount, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void set(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }

        UserQuota quota = userQuotaRepository.findById(userId)
                .orElseGet(() -> new UserQuota(userId, value));
        quota.setRemainingCredits(value);

        try {
            userQuotaRepository.saveAndFlush(quota);
        } catch (DataIntegrityViolationException e) {
            // 동시 초기화로 같은 user_id가 먼저 INSERT된 경우: 재조회 후 덮어쓰기
            UserQuota existing = userQuotaRepository.findById(userId)
                    .orElseThrow(() -> new IllegalStateException(
                            "user_quotas duplicate key but row not found for userId: " + userId, e));
            existing.setRemainingCredits(value);
            userQuotaRepository.saveAndFlush(existing);
        }
    }

    @Override
    public boolean initializeIfAbsent(String userId, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Quota value cannot be negative");
        }
        if (userQuotaRepository.existsById(userId)) {
            return false;
        }
        try {
            return userQuotaRepository.insertQuota(userId, value, LocalDateTime.now()) == 1;
        } catch (DataIntegrityViolationException e) {
            // 동시 초기화로 다른 요청이 먼저 INSERT한 경우: 기존 값 유지
            log.debug("[DatabaseQuotaStore] quota row already created for userId={}", userId);
            return false;
        }
    }

    @Override
    public Collection<String> trackedUserIds() {
        return userQuotaRepository.findAllUserIds();
    }
}
