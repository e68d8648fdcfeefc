package com.riansoft.route_planner.service.parking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.StreetSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Overpass API client for OpenStreetMap parking data.
 */
@Service
public class OverpassApiService implements ParkingPoiClient {

    private static final Logger log = LoggerFactory.getLogger(OverpassApiService.class);

    public static final List<String> PARKING_WAY_TAGS = List.of(
            "parking", "parking:lane", "parking:condition", "street_parking",
            "parking:left", "parking:right", "parking:both");

    // Baden-Wuerttemberg, roughly
    public static final double[] DEFAULT_BBOX = {47.5, 7.5, 49.8, 10.5};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RoutePlannerProperties.Overpass config;

    public OverpassApiService(@Qualifier("overpassRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper,
                              RoutePlannerProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getOverpass();
    }

    @Override
    public Optional<List<Stop>> fetchParkingNearby(GeoPoint point, int radiusMeters, int limit) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        String around = String.format(Locale.ROOT, "(around:%d,%.6f,%.6f)", radiusMeters, point.lat, point.lon);
        String query = "[out:json][timeout:25];\n(\n"
                + "  node[\"amenity\"=\"parking\"]" + around + ";\n"
                + "  way[\"amenity\"=\"parking\"]" + around + ";\n"
                + "  relation[\"amenity\"=\"parking\"]" + around + ";\n"
                + ");\nout center " + limit + ";";
        try {
            JsonNode payload = post(query);
            List<Stop> parks = new ArrayList<>();
            for (JsonNode element : payload.path("elements")) {
                JsonNode located = "node".equals(element.path("type").asText()) ? element : element.path("center");
                if (!located.path("lat").isNumber() || !located.path("lon").isNumber()) {
                    continue;
                }
                JsonNode tags = element.path("tags");
                parks.add(new Stop("osm:" + element.path("type").asText() + "/" + element.path("id").asLong(),
                        new GeoPoint(located.path("lat").asDouble(), located.path("lon").asDouble()),
                        tags.path("name").asText("OSM Parking"),
                        tags.hasNonNull("addr:full") ? tags.path("addr:full").asText() : null));
                if (parks.size() >= limit) {
                    break;
                }
            }
            log.debug("[OVERPASS] {} parking places around {}", parks.size(), point);
            return Optional.of(parks);
        } catch (RestClientException | JsonProcessingException e) {
            log.warn("[OVERPASS] parking request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<StreetSegment> fetchParkingSegments(double south, double west, double north, double east,
                                                    List<String> tags) {
        StringBuilder filters = new StringBuilder();
        for (String tag : (tags == null || tags.isEmpty() ? PARKING_WAY_TAGS : tags)) {
            filters.append(String.format(Locale.ROOT, "  way[\"%s\"](%.4f,%.4f,%.4f,%.4f);%n",
                    tag, south, west, north, east));
        }
        String query = "[out:json][timeout:180];\n(\n" + filters + ");\nout geom;";
        log.info("[OVERPASS] downloading parking street segments for bbox {},{},{},{}", south, west, north, east);
        JsonNode payload;
        try {
            payload = post(query);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Overpass returned unreadable segment payload", e);
        }
        List<StreetSegment> segments = new ArrayList<>();
        for (JsonNode element : payload.path("elements")) {
            if (!"way".equals(element.path("type").asText())) {
                continue;
            }
            List<GeoPoint> geometry = new ArrayList<>();
            for (JsonNode node : element.path("geometry")) {
                if (node.path("lat").isNumber() && node.path("lon").isNumber()) {
                    geometry.add(new GeoPoint(node.path("lat").asDouble(), node.path("lon").asDouble()));
                }
            }
            JsonNode wayTags = element.path("tags");
            String address = wayTags.hasNonNull("addr:full") ? wayTags.path("addr:full").asText()
                    : wayTags.hasNonNull("addr:street") ? wayTags.path("addr:street").asText() : null;
            segments.add(new StreetSegment(element.path("id").asLong(),
                    wayTags.path("name").asText("OSM Street Parking"), address, geometry));
        }
        log.info("[OVERPASS] {} parking street segments downloaded", segments.size());
        return segments;
    }

    private JsonNode post(String query) throws JsonProcessingException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("data", query);
        String body = restTemplate.postForObject(config.getUrl(), new HttpEntity<>(form, headers), String.class);
        if (body == null) {
            throw new RestClientException("empty Overpass response");
        }
        return objectMapper.readTree(body);
    }
}
