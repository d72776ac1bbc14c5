package com.whatshouldido.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자별 남은 무료 요청 수
 */
@Entity
@Table(name = "user_quotas", indexes = {
    @Index(name = "idx_user_quotas_updated_at", columnList = "lastUpdatedAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserQuota {
    @Id
    @Column(nullable = false, length = 128)
    private String userId;

    @Column(nullable = false)
    private Integer remainingCredits = 0; // 항상 0 이상

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime lastUpdatedAt;

    public UserQuota(String userId, int remainingCredits) {
        this.userId = userId;
        this.remainingCredits = remainingCredits;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        lastUpdatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdatedAt = LocalDateTime.now();
    }
}
