package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;

/**
 * 공유 id 가 없는 두 후보가 같은 장소인지 판단
 */
public interface CandidateMatcher {

    boolean isSamePlace(CandidateLocation a, CandidateLocation b);
}
