package com.whatshouldido.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 무료 사용자의 일일 쿼터 소진 (쿼터 백엔드 장애도 동일하게 취급)
 */
@Getter
public class QuotaExceededException extends SuggestionServiceException {

    public static final String ERROR_CODE = "QUOTA_EXHAUSTED";

    private final String userId;
    private final int remaining;
    private final int limit;

    public QuotaExceededException(String userId, int remaining, int limit) {
        super("You have used all your free requests. Upgrade to premium for unlimited access.",
                HttpStatus.FORBIDDEN, ERROR_CODE);
        this.userId = userId;
        this.remaining = remaining;
        this.limit = limit;
    }
}
