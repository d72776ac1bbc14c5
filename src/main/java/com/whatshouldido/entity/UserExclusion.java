package com.whatshouldido.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * "다시 보지 않기" 처리된 장소. expiresAt 이 null 이면 영구 제외
 */
@Entity
@Table(name = "user_exclusions",
    uniqueConstraints = @UniqueConstraint(name = "uk_exclusion_user_place", columnNames = {"userId", "placeId"}),
    indexes = @Index(name = "idx_exclusion_user", columnList = "userId"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserExclusion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String userId;

    @Column(nullable = false)
    private String placeId;

    private String placeName;

    @Column(length = 500)
    private String reason;

    @Column(nullable = false)
    private LocalDateTime excludedAt;

    private LocalDateTime expiresAt;

    @PrePersist
    protected void onCreate() {
        if (excludedAt == null) {
            excludedAt = LocalDateTime.now();
        }
    }

    public boolean isActive(LocalDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
