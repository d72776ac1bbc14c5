package com.whatshouldido.service.quota;

import java.util.Collection;
import java.util.Optional;

/**
 * 사용자별 쿼터 카운터 저장소.
 * 모든 구현체는 같은 동시성 계약을 따른다: K개의 크레딧에 N(>K)개의 동시 1-크레딧 차감 요청이 오면
 * 정확히 K개만 성공하고 잔여는 0이 된다.
 */
public interface QuotaStore {

    /**
     * 남은 크레딧 조회. 레코드가 없거나 백엔드 조회가 실패하면 empty.
     */
    Optional<Integer> get(String userId);

    /**
     * 남은 크레딧이 amount 이상이면 원자적으로 차감하고 true.
     * 레코드가 없거나, 잔여가 부족하거나, 백엔드 오류가 나면 상태를 바꾸지 않고 false.
     */
    boolean compareExchangeConsume(String userId, int amount);

    /**
     * 잔여 크레딧 덮어쓰기 (초기화 / 리셋용). 음수는 IllegalArgumentException.
     */
    void set(String userId, int value);

    /**
     * 레코드가 없을 때만 원자적으로 생성. 생성했으면 true, 이미 있으면 기존 값을 건드리지 않고 false.
     */
    boolean initializeIfAbsent(String userId, int value);

    /** 쿼터 레코드가 있는 사용자 목록 (일일 리셋용) */
    Collection<String> trackedUserIds();
}
