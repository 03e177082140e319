package com.vendinghive.exception;

import com.vendinghive.model.ProviderSource;
import lombok.Getter;

/**
 * provider 호출 실패 (타임아웃, 전송 오류, API 에러 응답)
 * 응답의 provider_errors 로만 노출되고 검색 자체는 실패시키지 않음
 */
@Getter
public class ProviderUnavailableException extends RuntimeException {

    private final ProviderSource source;

    public ProviderUnavailableException(ProviderSource source, String reason) {
        super(reason);
        this.source = source;
    }

    public ProviderUnavailableException(ProviderSource source, String reason, Throwable cause) {
        super(reason, cause);
        this.source = source;
    }
}
