package com.vendinghive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendinghive.exception.MalformedRecordException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.ProviderSource;

/**
 * provider 원본 레코드 -> CandidateLocation 변환
 */
public interface RecordNormalizer {

    ProviderSource source();

    CandidateLocation normalize(JsonNode record) throws MalformedRecordException;
}
