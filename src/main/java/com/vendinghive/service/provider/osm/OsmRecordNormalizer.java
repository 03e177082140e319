package com.vendinghive.service.provider.osm;

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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overpass element (node/way) 정규화
 */
@Component
public class OsmRecordNormalizer implements RecordNormalizer {

    private static final List<String> CATEGORY_KEYS =
            List.of("amenity", "shop", "building", "leisure", "tourism", "healthcare");

    @Override
    public ProviderSource source() {
        return ProviderSource.OPENSTREETMAP;
    }

    @Override
    public CandidateLocation normalize(JsonNode element) throws MalformedRecordException {
        if (element == null || !element.isObject()) {
            throw malformed("element is not an object");
        }
        JsonNode idNode = element.get("id");
        if (idNode == null || !idNode.canConvertToLong()) {
            throw malformed("missing element id");
        }
        String type = StringUtils.defaultIfBlank(element.path("type").asText(null), "node");
        String osmId = "osm:" + type + "/" + idNode.asLong();

        Map<String, String> tags = readTags(element.path("tags"));
        String name = StringUtils.trimToNull(tags.get("name"));
        if (name == null) {
            throw malformed(osmId + " has no name");
        }

        double[] coordinates = readCoordinates(element, osmId);

        return CandidateLocation.builder()
                .providerId(osmId)
                .osmId(osmId)
                .sources(EnumSet.of(ProviderSource.OPENSTREETMAP))
                .name(name)
                .category(extractCategory(tags))
                .placeCategories(PlaceCategory.fromOsmTags(tags))
                .latitude(CandidateLocation.toCoordinate(coordinates[0]))
                .longitude(CandidateLocation.toCoordinate(coordinates[1]))
                .address(buildAddress(tags))
                .phone(firstTag(tags, "phone", "contact:phone"))
                .email(firstTag(tags, "email", "contact:email"))
                .website(firstTag(tags, "website", "contact:website"))
                .mapsUrl("https://www.openstreetmap.org/" + type + "/" + idNode.asLong())
                .businessHours(StringUtils.trimToNull(tags.get("opening_hours")))
                .operationalStatus(OperationalStatus.UNKNOWN)
                .build();
    }

    private Map<String, String> readTags(JsonNode tagsNode) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (tagsNode != null && tagsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = tagsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode()) {
                    tags.put(field.getKey(), field.getValue().asText());
                }
            }
        }
        return tags;
    }

    // node 는 lat/lon, way 는 out center 로 받은 center.lat/center.lon
    private double[] readCoordinates(JsonNode element, String osmId) throws MalformedRecordException {
        JsonNode source = element.has("lat") && element.has("lon") ? element : element.path("center");
        JsonNode lat = source.get("lat");
        JsonNode lon = source.get("lon");
        if (lat == null || lon == null || !lat.isNumber() || !lon.isNumber()) {
            throw malformed(osmId + " has no usable coordinates");
        }
        double latitude = lat.asDouble();
        double longitude = lon.asDouble();
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw malformed(osmId + " has out-of-range coordinates");
        }
        return new double[]{latitude, longitude};
    }

    String extractCategory(Map<String, String> tags) {
        for (String key : CATEGORY_KEYS) {
            String value = tags.get(key);
            if (StringUtils.isNotBlank(value)) {
                return key + ":" + value;
            }
        }
        return "unknown";
    }

    /**
     * 123 Main St, Springfield, IL 62701
     */
    String buildAddress(Map<String, String> tags) {
        List<String> parts = new ArrayList<>();
        String street = StringUtils.normalizeSpace(
                StringUtils.defaultString(tags.get("addr:housenumber")) + " " + StringUtils.defaultString(tags.get("addr:street")));
        if (StringUtils.isNotBlank(street)) {
            parts.add(street);
        }
        if (StringUtils.isNotBlank(tags.get("addr:city"))) {
            parts.add(tags.get("addr:city").trim());
        }
        String statePostcode = StringUtils.normalizeSpace(
                StringUtils.defaultString(tags.get("addr:state")) + " " + StringUtils.defaultString(tags.get("addr:postcode")));
        if (StringUtils.isNotBlank(statePostcode)) {
            parts.add(statePostcode);
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String firstTag(Map<String, String> tags, String... keys) {
        for (String key : keys) {
            String value = StringUtils.trimToNull(tags.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private MalformedRecordException malformed(String message) {
        return new MalformedRecordException(ProviderSource.OPENSTREETMAP, message);
    }
}
