package com.whatshouldido.service.history;

import com.whatshouldido.entity.UserExclusion;
import com.whatshouldido.entity.UserSuggestionHistory;
import com.whatshouldido.model.Place;
import com.whatshouldido.repository.UserExclusionRepository;
import com.whatshouldido.repository.UserSuggestionHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 추천 히스토리 / 제외 목록 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserHistoryService {

    public static final int MAX_SUGGESTION_HISTORY = 20;

    private final UserSuggestionHistoryRepository historyRepository;
    private final UserExclusionRepository exclusionRepository;
    private final Clock clock;

    /**
     * 만료되지 않은 제외 장소 id 목록
     */
    @Transactional(readOnly = true)
    public Set<String> getActiveExclusions(String userId) {
        return new HashSet<>(exclusionRepository.findActivePlaceIds(userId, now()));
    }

    /**
     * 최근 추천된 장소 id (최신순 n개)
     */
    @Transactional(readOnly = true)
    public List<String> getRecentSuggestions(String userId, int n) {
        if (n <= 0) {
            return List.of();
        }
        return historyRepository.findByUserIdOrderBySequenceNumberDesc(userId, PageRequest.of(0, n)).stream()
                .map(UserSuggestionHistory::getPlaceId)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<UserSuggestionHistory> getHistory(String userId, int n) {
        return historyRepository.findByUserIdOrderBySequenceNumberDesc(userId, PageRequest.of(0, Math.max(1, n)));
    }

    /**
     * 한 번의 추천 결과를 순서대로 저장하고, 사용자별 최근 20개만 남긴다.
     */
    @Transactional
    public void addSuggestionHistoryBatch(String userId, List<Place> places, String sessionId, String intent) {
        if (userId == null || places == null || places.isEmpty()) {
            return;
        }

        long sequence = historyRepository.findMaxSequenceNumber(userId);
        LocalDateTime now = now();
        for (Place place : places) {
            UserSuggestionHistory history = new UserSuggestionHistory();
            history.setUserId(userId);
            history.setPlaceId(place.getId());
            history.setPlaceName(place.getName() != null ? place.getName() : place.getId());
            history.setCategory(place.getCategory());
            history.setSource(place.getSource());
            history.setSessionId(sessionId);
            history.setIntent(intent);
            history.setSequenceNumber(++sequence);
            history.setSuggestedAt(now);
            historyRepository.save(history);
        }

        pruneHistory(userId);
        log.info("[UserHistoryService] Saved {} suggestions for userId={}, sessionId={}",
                places.size(), userId, sessionId);
    }

    private void pruneHistory(String userId) {
        List<UserSuggestionHistory> all = historyRepository.findByUserIdOrderBySequenceNumberDesc(userId);
        if (all.size() <= MAX_SUGGESTION_HISTORY) {
            return;
        }
        List<UserSuggestionHistory> toDelete = all.subList(MAX_SUGGESTION_HISTORY, all.size());
        historyRepository.deleteAll(toDelete);
        log.debug("[UserHistoryService] Pruned {} old history rows for userId={}", toDelete.size(), userId);
    }

    /**
     * 장소 제외 등록. days 가 null 이면 영구, 이미 있으면 사유/만료만 갱신
     */
    @Transactional
    public UserExclusion addExclusion(String userId, String placeId, String placeName, String reason, Integer days) {
        LocalDateTime now = now();
        UserExclusion exclusion = exclusionRepository.findByUserIdAndPlaceId(userId, placeId)
                .orElseGet(UserExclusion::new);
        exclusion.setUserId(userId);
        exclusion.setPlaceId(placeId);
        if (placeName != null) {
            exclusion.setPlaceName(placeName);
        }
        exclusion.setReason(reason);
        exclusion.setExcludedAt(now);
        exclusion.setExpiresAt(days != null ? now.plusDays(days) : null);

        UserExclusion saved = exclusionRepository.save(exclusion);
        log.info("[UserHistoryService] Excluded placeId={} for userId={} (days={})", placeId, userId, days);
        return saved;
    }

    /**
     * @return 삭제했으면 true, 원래 없던 항목이면 false
     */
    @Transactional
    public boolean removeExclusion(String userId, String placeId) {
        return exclusionRepository.findByUserIdAndPlaceId(userId, placeId)
                .map(exclusion -> {
                    exclusionRepository.delete(exclusion);
                    log.info("[UserHistoryService] Removed exclusion placeId={} for userId={}", placeId, userId);
                    return true;
                })
                .orElse(false);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
