package com.whatshouldido.service.quota;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * quota.* 설정
 */
@Data
@Component
@ConfigurationProperties(prefix = "quota")
public class QuotaProperties {

    public enum StorageBackend { IN_MEMORY, REDIS, DATABASE }

    private int defaultFreeQuota = 5;
    private StorageBackend storageBackend = StorageBackend.IN_MEMORY;
    private boolean dailyResetEnabled = true;
    private String dailyResetCron = "0 0 0 * * *";
    private int resetBatchSize = 100;
    private long resetBatchDelayMs = 100;
    private List<String> premiumUserIds = new ArrayList<>();

    @PostConstruct
    public void validate() {
        if (defaultFreeQuota < 1 || defaultFreeQuota > 1000) {
            throw new IllegalStateException(
                    "quota.default-free-quota must be between 1 and 1000 but was " + defaultFreeQuota);
        }
        if (resetBatchSize < 1) {
            throw new IllegalStateException("quota.reset-batch-size must be positive");
        }
    }
}
