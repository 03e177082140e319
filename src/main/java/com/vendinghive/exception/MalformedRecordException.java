package com.vendinghive.exception;

import com.vendinghive.model.ProviderSource;
import lombok.Getter;

/**
 * provider 레코드 하나를 정규화할 수 없을 때 (이름/좌표 누락 등)
 * 해당 레코드만 버리고 검색은 계속 진행
 */
@Getter
public class MalformedRecordException extends Exception {

    private final ProviderSource source;

    public MalformedRecordException(ProviderSource source, String message) {
        super(message);
        this.source = source;
    }
}
