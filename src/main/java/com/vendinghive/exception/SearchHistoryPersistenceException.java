package com.vendinghive.exception;

/**
 * 검색 이력 저장 실패. 랭킹 결과는 그대로 반환하고 경고로만 알림
 */
public class SearchHistoryPersistenceException extends RuntimeException {

    public SearchHistoryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
