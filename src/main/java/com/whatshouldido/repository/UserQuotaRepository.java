package com.whatshouldido.repository;

import com.whatshouldido.entity.UserQuota;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface UserQuotaRepository extends JpaRepository<UserQuota, String> {

    /**
     * 남은 쿼터가 amount 이상일 때만 차감 (단일 UPDATE 문으로 원자성 보장)
     * @return 변경된 행 수 (1이면 차감 성공, 0이면 레코드 없음 또는 잔여 부족)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE UserQuota q
        SET q.remainingCredits = q.remainingCredits - :amount, q.lastUpdatedAt = :now
        WHERE q.userId = :userId AND q.remainingCredits >= :amount
        """)
    int consumeIfAvailable(
        @Param("userId") String userId,
        @Param("amount") int amount,
        @Param("now") LocalDateTime now
    );

    /**
     * 신규 쿼터 행 INSERT. 같은 user_id가 이미 있으면 PK 충돌로 DataIntegrityViolationException.
     */
    @Transactional
    @Modifying
    @Query(value = """
        INSERT INTO user_quotas (user_id, remaining_credits, created_at, last_updated_at)
        VALUES (:userId, :credits, :now, :now)
        """, nativeQuery = true)
    int insertQuota(
        @Param("userId") String userId,
        @Param("credits") int credits,
        @Param("now") LocalDateTime now
    );

    @Query("SELECT q.userId FROM UserQuota q ORDER BY q.userId")
    List<String> findAllUserIds();
}
