package com.vendinghive.exception;

import lombok.Getter;

/**
 * 요청 검증 실패. 어떤 필드가 문제인지 함께 전달
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
