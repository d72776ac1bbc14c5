package com.whatshouldido.service.quota;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 매일 정해진 UTC 시각에 무료 사용자 쿼터를 기본값으로 리셋
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quota", name = "daily-reset-enabled", havingValue = "true", matchIfMissing = true)
public class DailyQuotaResetJob {

    private final QuotaStore quotaStore;
    private final QuotaService quotaService;
    private final QuotaProperties quotaProperties;

    @Scheduled(cron = "${quota.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDailyQuotas() {
        log.info("[DailyQuotaResetJob] Starting daily quota reset");
        long start = System.currentTimeMillis();
        try {
            ResetSummary summary = resetAll();
            log.info("[DailyQuotaResetJob] Completed in {}ms. reset={}, skippedPremium={}, failed={}",
                    System.currentTimeMillis() - start, summary.reset, summary.skipped, summary.failed);
        } catch (Exception e) {
            log.error("[DailyQuotaResetJob] Daily quota reset aborted: {}", e.getMessage(), e);
        }
    }

    ResetSummary resetAll() {
        List<String> userIds = new ArrayList<>(quotaStore.trackedUserIds());
        ResetSummary summary = new ResetSummary();
        int batchSize = quotaProperties.getResetBatchSize();

        for (int from = 0; from < userIds.size(); from += batchSize) {
            List<String> batch = userIds.subList(from, Math.min(from + batchSize, userIds.size()));
            for (String userId : batch) {
                try {
                    if (quotaService.resetQuota(userId)) {
                        summary.reset++;
                    } else {
                        summary.skipped++;
                    }
                } catch (Exception e) {
                    summary.failed++;
                    log.warn("[DailyQuotaResetJob] Failed to reset quota for userId={}: {}", userId, e.getMessage());
                }
            }

            boolean lastBatch = from + batchSize >= userIds.size();
            if (!lastBatch && quotaProperties.getResetBatchDelayMs() > 0) {
                try {
                    Thread.sleep(quotaProperties.getResetBatchDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[DailyQuotaResetJob] Interrupted after {} users", from + batch.size());
                    break;
                }
            }
        }
        return summary;
    }

    static class ResetSummary {
        int reset;
        int skipped;
        int failed;
    }
}
