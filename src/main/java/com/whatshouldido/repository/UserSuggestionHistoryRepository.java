package com.whatshouldido.repository;

import com.whatshouldido.entity.UserSuggestionHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserSuggestionHistoryRepository extends JpaRepository<UserSuggestionHistory, Long> {

    /** 최신순 (sequenceNumber 내림차순) */
    List<UserSuggestionHistory> findByUserIdOrderBySequenceNumberDesc(String userId, Pageable pageable);

    List<UserSuggestionHistory> findByUserIdOrderBySequenceNumberDesc(String userId);

    @Query("SELECT COALESCE(MAX(h.sequenceNumber), 0) FROM UserSuggestionHistory h WHERE h.userId = :userId")
    long findMaxSequenceNumber(@Param("userId") String userId);
}
