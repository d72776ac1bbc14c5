package com.whatshouldido.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 후보 조회 / 경로 최적화처럼 결과를 만들 수 없게 하는 외부 연동 실패
 */
@Getter
public class CollaboratorFailureException extends SuggestionServiceException {

    public static final String ERROR_CODE = "SERVICE_UNAVAILABLE";

    private final String collaborator;

    public CollaboratorFailureException(String collaborator, String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, ERROR_CODE, cause);
        this.collaborator = collaborator;
    }
}
