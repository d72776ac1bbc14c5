package com.whatshouldido.service.quota;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 쿼터 관련 카운터의 특정 시점 스냅샷 (pull 방식 조회용)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuotaSnapshot {
    private long consumedTotal;      // 차감 성공 누적 횟수
    private long blockedTotal;       // 차감 거부 누적 횟수 (백엔드 오류 포함)
    private long usersWithZeroQuota; // 현재 잔여 0으로 관측된 사용자 수
}
