package com.riansoft.route_planner.service.distance;

import com.fasterxml.jackson.databind.JsonNode;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.DistanceProvenance;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;
import com.riansoft.route_planner.model.TurnInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OSRM HTTP client (route, table and nearest services).
 * OSRM takes coordinates as lon,lat, longitude first.
 */
@Service
public class OsrmApiService implements RoadNetworkClient {

    private static final Logger log = LoggerFactory.getLogger(OsrmApiService.class);

    private static final String PROBE_COORDINATES = "9.21,48.78;9.18,48.77";

    private final RestTemplate restTemplate;
    private final RoutePlannerProperties.Osrm config;

    public OsrmApiService(@Qualifier("osrmRestTemplate") RestTemplate restTemplate, RoutePlannerProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getOsrm();
    }

    @Override
    public boolean probe() {
        if (!config.isEnabled()) {
            return false;
        }
        Optional<JsonNode> body = get("route", PROBE_COORDINATES, "overview=false");
        return body.isPresent() && !body.get().path("routes").isEmpty();
    }

    @Override
    public Optional<TravelCost> route(GeoPoint from, GeoPoint to) {
        return query("route", coordinates(List.of(from, to)), "overview=false&steps=false",
                body -> {
                    JsonNode route = body.path("routes").path(0);
                    if (!route.path("distance").isNumber() || !route.path("duration").isNumber()) {
                        log.warn("[OSRM] route response without distance/duration");
                        return Optional.empty();
                    }
                    return Optional.of(new TravelCost(route.path("distance").asDouble(),
                            route.path("duration").asDouble(), DistanceProvenance.ROAD_NETWORK));
                });
    }

    @Override
    public Optional<RoadRoute> route(List<GeoPoint> points) {
        if (points.size() < 2) {
            return Optional.empty();
        }
        return query("route", coordinates(points), "overview=full&geometries=geojson&steps=false",
                body -> parseRoute(body, points.size() - 1));
    }

    @Override
    public Optional<DistanceMatrix> table(List<GeoPoint> sources, List<GeoPoint> destinations) {
        if (sources.isEmpty() || destinations.isEmpty()) {
            return Optional.empty();
        }
        List<GeoPoint> all = new ArrayList<>(sources);
        all.addAll(destinations);
        String sourceIdx = indexList(0, sources.size());
        String destinationIdx = indexList(sources.size(), destinations.size());
        String params = "annotations=distance,duration&sources=" + sourceIdx + "&destinations=" + destinationIdx;
        return query("table", coordinates(all), params,
                body -> parseTable(body, sources.size(), destinations.size()));
    }

    @Override
    public Optional<GeoPoint> nearest(GeoPoint point) {
        return query("nearest", coordinates(List.of(point)), "number=1",
                body -> lonLat(body.path("waypoints").path(0).path("location")));
    }

    @Override
    public Optional<List<TurnInstruction>> directions(GeoPoint from, GeoPoint to) {
        return query("route", coordinates(List.of(from, to)), "overview=false&steps=true",
                body -> {
                    List<TurnInstruction> instructions = new ArrayList<>();
                    for (JsonNode step : body.path("routes").path(0).path("legs").path(0).path("steps")) {
                        String name = step.path("name").asText("");
                        instructions.add(new TurnInstruction(describe(step.path("maneuver"), name), name,
                                step.path("distance").asDouble(), step.path("duration").asDouble()));
                    }
                    return Optional.of(instructions);
                });
    }

    /**
     * Runs {@code parser} on an Ok response. A body the parser cannot read counts as no answer.
     */
    private <T> Optional<T> query(String service, String coordinates, String query,
                                  Function<JsonNode, Optional<T>> parser) {
        Optional<JsonNode> body = get(service, coordinates, query);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        try {
            return parser.apply(body.get());
        } catch (RuntimeException e) {
            log.warn("[OSRM] unreadable {} response: {}", service, e.toString());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> get(String service, String coordinates, String query) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        URI uri = URI.create(String.format("%s/%s/v1/%s/%s?%s",
                config.getBaseUrl(), service, config.getProfile(), coordinates, query));
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            if (body == null || !"Ok".equals(body.path("code").asText())) {
                log.warn("[OSRM] {} answered code={}", service, body == null ? "<empty>" : body.path("code").asText());
                return Optional.empty();
            }
            return Optional.of(body);
        } catch (RestClientException e) {
            log.debug("[OSRM] {} request failed: {}", service, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<RoadRoute> parseRoute(JsonNode body, int expectedLegs) {
        JsonNode route = body.path("routes").path(0);
        if (!route.path("distance").isNumber() || !route.path("duration").isNumber()) {
            return Optional.empty();
        }
        JsonNode legsNode = route.path("legs");
        if (legsNode.size() != expectedLegs) {
            log.warn("[OSRM] expected {} legs but got {}", expectedLegs, legsNode.size());
            return Optional.empty();
        }
        List<TravelCost> legs = new ArrayList<>();
        for (JsonNode leg : legsNode) {
            legs.add(new TravelCost(leg.path("distance").asDouble(), leg.path("duration").asDouble(),
                    DistanceProvenance.ROAD_NETWORK));
        }
        List<GeoPoint> geometry = new ArrayList<>();
        for (JsonNode coordinate : route.path("geometry").path("coordinates")) {
            Optional<GeoPoint> point = lonLat(coordinate);
            if (point.isEmpty()) {
                log.warn("[OSRM] malformed geometry coordinate {}", coordinate);
                return Optional.empty();
            }
            geometry.add(point.get());
        }
        return Optional.of(new RoadRoute(route.path("distance").asDouble(), route.path("duration").asDouble(),
                legs, geometry, DistanceProvenance.ROAD_NETWORK));
    }

    private Optional<DistanceMatrix> parseTable(JsonNode body, int rows, int cols) {
        JsonNode distances = body.path("distances");
        JsonNode durations = body.path("durations");
        if (distances.size() != rows || durations.size() != rows) {
            log.warn("[OSRM] table has {} rows, expected {}", distances.size(), rows);
            return Optional.empty();
        }
        double[][] distanceTable = new double[rows][cols];
        double[][] durationTable = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            if (distances.get(i).size() != cols || durations.get(i).size() != cols) {
                return Optional.empty();
            }
            for (int j = 0; j < cols; j++) {
                JsonNode distance = distances.get(i).get(j);
                JsonNode duration = durations.get(i).get(j);
                // unreachable pairs come back as null
                if (!distance.isNumber() || !duration.isNumber()) {
                    log.warn("[OSRM] table cell ({}, {}) is not routable", i, j);
                    return Optional.empty();
                }
                distanceTable[i][j] = distance.asDouble();
                durationTable[i][j] = duration.asDouble();
            }
        }
        return Optional.of(new DistanceMatrix(distanceTable, durationTable, DistanceProvenance.ROAD_NETWORK));
    }

    // [lon, lat]
    private static Optional<GeoPoint> lonLat(JsonNode coordinate) {
        if (!coordinate.isArray() || coordinate.size() != 2
                || !coordinate.get(0).isNumber() || !coordinate.get(1).isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(coordinate.get(1).asDouble(), coordinate.get(0).asDouble()));
    }

    private static String describe(JsonNode maneuver, String roadName) {
        String type = maneuver.path("type").asText("continue");
        String modifier = maneuver.path("modifier").asText("");
        String onto = roadName.isEmpty() ? "" : " onto " + roadName;
        switch (type) {
            case "depart":
                return "Depart" + (roadName.isEmpty() ? "" : " on " + roadName);
            case "arrive":
                return "Arrive at destination";
            case "roundabout":
            case "rotary":
                return "Enter the roundabout" + onto;
            default:
                String verb = type.equals("turn") || type.equals("end of road") ? "Turn" : capitalize(type);
                return (modifier.isEmpty() ? verb : verb + " " + modifier) + onto;
        }
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String coordinates(List<GeoPoint> points) {
        return points.stream()
                .map(p -> String.format(Locale.ROOT, "%.6f,%.6f", p.lon, p.lat))
                .collect(Collectors.joining(";"));
    }

    private static String indexList(int start, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append(';');
            sb.append(start + i);
        }
        return sb.toString();
    }
}
