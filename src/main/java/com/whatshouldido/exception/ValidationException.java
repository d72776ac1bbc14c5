package com.whatshouldido.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * 입력값 오류. 발견된 모든 위반 사항을 한 번에 담는다.
 */
@Getter
public class ValidationException extends SuggestionServiceException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Request validation failed: " + String.join("; ", errors), HttpStatus.BAD_REQUEST, ERROR_CODE);
        this.errors = List.copyOf(errors);
    }
}
