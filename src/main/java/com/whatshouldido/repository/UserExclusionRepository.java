package com.whatshouldido.repository;

import com.whatshouldido.entity.UserExclusion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserExclusionRepository extends JpaRepository<UserExclusion, Long> {

    Optional<UserExclusion> findByUserIdAndPlaceId(String userId, String placeId);

    /** 만료되지 않은 제외 장소 id */
    @Query("SELECT e.placeId FROM UserExclusion e WHERE e.userId = :userId AND (e.expiresAt IS NULL OR e.expiresAt > :now)")
    List<String> findActivePlaceIds(@Param("userId") String userId, @Param("now") LocalDateTime now);
}
