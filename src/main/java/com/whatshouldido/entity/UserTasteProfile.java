package com.whatshouldido.entity;

import com.whatshouldido.service.scoring.TasteDimension;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * 취향 퀴즈/피드백으로 만들어진 명시적 취향 프로필
 */
@Entity
@Table(name = "user_taste_profiles")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserTasteProfile {
    @Id
    @Column(nullable = false, length = 128)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_taste_weights", joinColumns = @JoinColumn(name = "user_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "dimension", length = 32)
    @Column(name = "weight", nullable = false)
    private Map<TasteDimension, Double> weights = new EnumMap<>(TasteDimension.class);

    @Column(nullable = false)
    private Double noveltyTolerance = 0.5;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
