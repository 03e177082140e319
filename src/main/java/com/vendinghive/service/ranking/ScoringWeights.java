package com.vendinghive.service.ranking;

import lombok.Getter;
import lombok.Setter;

/**
 * 우선순위 점수 가중치 (locator.scoring.*)
 * 기본값은 기존 랭킹 결과와 호환되어야 하므로 임의로 바꾸지 말 것
 */
@Getter
@Setter
public class ScoringWeights {

    // 연락처
    private int contactBoth = 50;
    private int contactPhoneOnly = 30;
    private int contactEmailOnly = 20;
    private int contactNone = 10;

    // 리뷰 수 (100 / 50 / 10 이상)
    private int reviewsHigh = 20;
    private int reviewsMedium = 15;
    private int reviewsLow = 10;

    // 평점 (4.5 / 4.0 / 3.5 이상)
    private int ratingExcellent = 15;
    private int ratingGood = 10;
    private int ratingFair = 5;

    // 유동인구
    private int trafficVeryHigh = 20;
    private int trafficHigh = 15;
    private int trafficModerate = 10;
    private int trafficLow = 5;
    private int trafficVeryLow = 0;

    // 영업 상태
    private int statusOperational = 10;
    private int statusUncertain = 5; // closed_temporarily, unknown
    private int statusClosedPermanently = 0;
}
