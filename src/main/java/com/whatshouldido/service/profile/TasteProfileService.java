package com.whatshouldido.service.profile;

import com.whatshouldido.entity.UserTasteProfile;
import com.whatshouldido.repository.UserTasteProfileRepository;
import com.whatshouldido.service.scoring.TasteDimension;
import com.whatshouldido.service.scoring.TasteProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 명시적 취향 프로필 저장 / 조회 / 피드백 반영
 * 문자열 키 → TasteDimension 변환은 이 클래스에서만 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TasteProfileService {

    private final UserTasteProfileRepository repository;

    /**
     * @return 프로필이 없으면 null
     */
    @Transactional(readOnly = true)
    public TasteProfile load(String userId) {
        if (userId == null) {
            return null;
        }
        return repository.findById(userId)
                .map(entity -> TasteProfile.of(entity.getWeights(), entity.getNoveltyTolerance()))
                .orElse(null);
    }

    /**
     * 퀴즈 결과 저장. 알 수 없는 키는 오류 목록으로 돌려준다.
     */
    @Transactional
    public TasteProfile save(String userId, Map<String, Double> rawWeights, Double noveltyTolerance) {
        List<String> unknownKeys = new ArrayList<>();
        Map<TasteDimension, Double> weights = toDimensions(rawWeights, unknownKeys);
        if (!unknownKeys.isEmpty()) {
            throw new IllegalArgumentException("Unknown taste dimensions: " + String.join(", ", unknownKeys));
        }

        TasteProfile profile = TasteProfile.of(weights,
                noveltyTolerance != null ? noveltyTolerance : TasteProfile.NEUTRAL);
        persist(userId, profile);
        log.info("[TasteProfileService] Saved taste profile for userId={} ({} dimensions)", userId, weights.size());
        return profile;
    }

    /**
     * 좋아요/싫어요 피드백 반영 (차원별 최대 ±0.05)
     */
    @Transactional
    public TasteProfile applyFeedback(String userId, Map<String, Double> rawDeltas) {
        List<String> unknownKeys = new ArrayList<>();
        Map<TasteDimension, Double> deltas = toDimensions(rawDeltas, unknownKeys);
        if (!unknownKeys.isEmpty()) {
            log.warn("[TasteProfileService] Ignoring unknown feedback dimensions {} for userId={}", unknownKeys, userId);
        }

        TasteProfile current = Optional.ofNullable(load(userId)).orElseGet(TasteProfile::neutral);
        TasteProfile updated = current.applyDeltas(deltas);
        persist(userId, updated);
        return updated;
    }

    private void persist(String userId, TasteProfile profile) {
        UserTasteProfile entity = repository.findById(userId).orElseGet(() -> {
            UserTasteProfile created = new UserTasteProfile();
            created.setUserId(userId);
            return created;
        });
        Map<TasteDimension, Double> weights = new EnumMap<>(TasteDimension.class);
        weights.putAll(profile.getWeights());
        entity.setWeights(weights);
        entity.setNoveltyTolerance(profile.getNoveltyTolerance());
        repository.save(entity);
    }

    private static Map<TasteDimension, Double> toDimensions(Map<String, Double> raw, List<String> unknownKeys) {
        Map<TasteDimension, Double> result = new EnumMap<>(TasteDimension.class);
        if (raw == null) {
            return result;
        }
        raw.forEach((key, value) -> {
            Optional<TasteDimension> dimension = TasteDimension.fromKey(key);
            if (dimension.isPresent() && value != null) {
                result.put(dimension.get(), value);
            } else {
                unknownKeys.add(key);
            }
        });
        return result;
    }
}
