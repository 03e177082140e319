package com.vendinghive.service.geocode;

import com.vendinghive.exception.GeocodingUnavailableException;
import com.vendinghive.model.GeoPoint;

import java.util.Optional;

/**
 * 우편번호 -> 중심 좌표
 */
public interface ZipCodeGeocoder {

    /**
     * @return 좌표, 우편번호를 찾지 못하면 empty
     * @throws GeocodingUnavailableException 지오코딩 서비스에 접근할 수 없을 때
     */
    Optional<GeoPoint> locate(String zipCode);
}
