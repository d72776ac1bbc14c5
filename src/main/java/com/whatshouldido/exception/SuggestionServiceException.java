package com.whatshouldido.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 클라이언트에게 타입별로 구분되어 전달되는 예외의 공통 부모
 */
@Getter
public abstract class SuggestionServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected SuggestionServiceException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    protected SuggestionServiceException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
