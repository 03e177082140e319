package com.vendinghive.service.ranking;

import com.vendinghive.model.CandidateLocation;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 거리(haversine)와 이름 유사도로 같은 장소 여부 판단
 * - 거리 임계값 이내
 * - 정규화한 이름의 토큰 유사도가 임계값 이상 (한쪽 이름이 다른 쪽을 포함하면 1.0)
 */
public class ProximityNameMatcher implements CandidateMatcher {

    private final double proximityMeters;
    private final double nameSimilarityThreshold;

    public ProximityNameMatcher(double proximityMeters, double nameSimilarityThreshold) {
        this.proximityMeters = proximityMeters;
        this.nameSimilarityThreshold = nameSimilarityThreshold;
    }

    @Override
    public boolean isSamePlace(CandidateLocation a, CandidateLocation b) {
        if (a.getLatitude() == null || b.getLatitude() == null
                || a.getLongitude() == null || b.getLongitude() == null) {
            return false;
        }
        if (a.toGeoPoint().distanceMetersTo(b.toGeoPoint()) > proximityMeters) {
            return false;
        }
        return nameSimilarity(a.getName(), b.getName()) >= nameSimilarityThreshold;
    }

    double nameSimilarity(String first, String second) {
        String left = normalize(first);
        String right = normalize(second);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        String compactLeft = left.replace(" ", "");
        String compactRight = right.replace(" ", "");
        if (compactLeft.contains(compactRight) || compactRight.contains(compactLeft)) {
            return 1.0;
        }

        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        Set<String> union = new HashSet<>(leftTokens);
        union.addAll(rightTokens);
        Set<String> intersection = new HashSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    static String normalize(String name) {
        if (StringUtils.isBlank(name)) {
            return "";
        }
        String stripped = StringUtils.stripAccents(name).toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[^a-z0-9 ]", " ");
        return StringUtils.normalizeSpace(stripped);
    }

    private static Set<String> tokens(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.toSet());
    }
}
