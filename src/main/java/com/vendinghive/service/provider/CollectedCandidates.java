package com.vendinghive.service.provider;

import com.vendinghive.model.CandidateLocation;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 정규화된 후보 + provider 별 실패 사유 (provider 코드 -> 사유)
 */
@Value
public class CollectedCandidates {

    List<CandidateLocation> candidates;
    Map<String, String> providerErrors;
}
