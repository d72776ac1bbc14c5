package com.whatshouldido.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자에게 추천된 장소 기록 (사용자별 최근 20개 유지)
 */
@Entity
@Table(name = "user_suggestion_history", indexes = {
    @Index(name = "idx_suggestion_user_seq", columnList = "userId,sequenceNumber")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserSuggestionHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String userId;

    @Column(nullable = false)
    private String placeId;

    @Column(nullable = false)
    private String placeName;

    @Column(length = 500)
    private String category;

    @Column(length = 32)
    private String source;

    @Column(length = 64)
    private String sessionId;

    @Column(length = 32)
    private String intent;

    @Column(nullable = false)
    private Long sequenceNumber; // 사용자별 단조 증가

    @Column(nullable = false)
    private LocalDateTime suggestedAt;

    @PrePersist
    protected void onCreate() {
        if (suggestedAt == null) {
            suggestedAt = LocalDateTime.now();
        }
    }
}
