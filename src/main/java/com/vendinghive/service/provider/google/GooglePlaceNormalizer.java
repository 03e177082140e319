package com.vendinghive.service.provider.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendinghive.exception.MalformedRecordException;
import com.vendinghive.model.CandidateLocation;
import com.vendinghive.model.OperationalStatus;
import com.vendinghive.model.PlaceCategory;
import com.vendinghive.model.ProviderSource;
import com.vendinghive.service.provider.RecordNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Place Details / Nearby Search result 정규화
 */
@Component
public class GooglePlaceNormalizer implements RecordNormalizer {

    private static final String MAPS_URL_PREFIX = "https://www.google.com/maps/place/?q=place_id:";

    @Override
    public ProviderSource source() {
        return ProviderSource.GOOGLE_PLACES;
    }

    @Override
    public CandidateLocation normalize(JsonNode result) throws MalformedRecordException {
        if (result == null || !result.isObject()) {
            throw malformed("result is not an object");
        }
        String placeId = text(result, "place_id");
        if (placeId == null) {
            throw malformed("missing place_id");
        }
        String name = text(result, "name");
        if (name == null) {
            throw malformed(placeId + " has no name");
        }

        JsonNode location = result.path("geometry").path("location");
        JsonNode lat = location.get("lat");
        JsonNode lng = location.get("lng");
        if (lat == null || lng == null || !lat.isNumber() || !lng.isNumber()) {
            throw malformed(placeId + " has no usable coordinates");
        }

        List<String> types = new ArrayList<>();
        result.path("types").forEach(type -> types.add(type.asText()));

        return CandidateLocation.builder()
                .providerId(placeId)
                .googlePlaceId(placeId)
                .sources(EnumSet.of(ProviderSource.GOOGLE_PLACES))
                .name(name)
                .detailedCategory(types.isEmpty() ? null : String.join(", ", types.subList(0, Math.min(3, types.size()))))
                .placeCategories(PlaceCategory.fromGoogleTypes(types))
                .latitude(CandidateLocation.toCoordinate(lat.asDouble()))
                .longitude(CandidateLocation.toCoordinate(lng.asDouble()))
                .address(StringUtils.firstNonBlank(text(result, "formatted_address"), text(result, "vicinity")))
                .phone(StringUtils.firstNonBlank(text(result, "formatted_phone_number"), text(result, "international_phone_number")))
                .website(text(result, "website"))
                .mapsUrl(StringUtils.defaultIfBlank(text(result, "url"), MAPS_URL_PREFIX + placeId))
                .businessHours(weekdayText(result.path("opening_hours")))
                .rating(rating(result.get("rating")))
                .reviewCount(reviewCount(result.get("user_ratings_total")))
                .operationalStatus(OperationalStatus.fromGoogleStatus(text(result, "business_status")))
                .build();
    }

    private String weekdayText(JsonNode openingHours) {
        JsonNode weekdayText = openingHours.path("weekday_text");
        if (!weekdayText.isArray() || weekdayText.isEmpty()) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        weekdayText.forEach(line -> lines.add(line.asText()));
        return String.join("\n", lines);
    }

    // 범위를 벗어난 평점은 없는 것으로 취급
    private Double rating(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        return value >= 0 && value <= 5 ? value : null;
    }

    private Integer reviewCount(JsonNode node) {
        if (node == null || !node.canConvertToInt()) {
            return null;
        }
        int value = node.asInt();
        return value >= 0 ? value : null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }

    private MalformedRecordException malformed(String message) {
        return new MalformedRecordException(ProviderSource.GOOGLE_PLACES, message);
    }
}
