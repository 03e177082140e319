package com.vendinghive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendinghive.exception.ProviderUnavailableException;
import com.vendinghive.model.ProviderSource;

import java.util.List;

/**
 * 외부 지리 데이터 소스. 중심점/반경/카테고리로 원본 레코드 조회
 */
public interface LocationProvider {

    ProviderSource source();

    /**
     * @return provider 원본 레코드 (정규화 전)
     * @throws ProviderUnavailableException 전송 오류, API 오류 응답, 설정 누락
     */
    List<JsonNode> fetch(ProviderQuery query);
}
