package com.vendinghive.exception;

/**
 * 호출 스레드가 인터럽트되어 검색이 중단됨. 이력은 저장하지 않음
 */
public class SearchCancelledException extends RuntimeException {

    public SearchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
