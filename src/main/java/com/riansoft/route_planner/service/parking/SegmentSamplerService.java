package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.StreetSegment;
import com.riansoft.route_planner.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Offline helper that turns parking-tagged street ways into evenly spaced static parking candidates.
 */
@Service
public class SegmentSamplerService {

    private static final Logger log = LoggerFactory.getLogger(SegmentSamplerService.class);

    private final ParkingPoiClient poiClient;
    private final RoutePlannerProperties.Parking config;

    public SegmentSamplerService(ParkingPoiClient poiClient, RoutePlannerProperties properties) {
        this.poiClient = poiClient;
        this.config = properties.getParking();
    }

    /**
     * Downloads parking ways for the bounding box and samples them with the configured spacing.
     * Transport failures propagate to the operator.
     */
    public List<Stop> importSegments(double south, double west, double north, double east, Integer maxPoints) {
        List<StreetSegment> segments = poiClient.fetchParkingSegments(south, west, north, east,
                OverpassApiService.PARKING_WAY_TAGS);
        return sample(segments, config.getSegmentSpacingMeters(), config.getSegmentDedupeDecimals(), maxPoints);
    }

    /**
     * Walks each segment and emits a point every {@code spacingMeters}, both ends included.
     * Points that round to an already emitted coordinate at {@code dedupeDecimals} are dropped.
     *
     * @param maxPoints stop after this many points; {@code null} or non-positive means no cap
     */
    public List<Stop> sample(List<StreetSegment> segments, double spacingMeters, int dedupeDecimals, Integer maxPoints) {
        List<Stop> points = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        double spacing = Math.max(1.0, spacingMeters);

        for (StreetSegment segment : segments) {
            List<GeoPoint> coords = segment.geometry;
            if (coords.size() < 2) {
                continue;
            }
            double[] lengths = new double[coords.size() - 1];
            double total = 0;
            for (int i = 0; i < lengths.length; i++) {
                lengths[i] = GeoUtils.haversineMeters(coords.get(i), coords.get(i + 1));
                total += lengths[i];
            }
            if (total == 0) {
                continue;
            }

            int steps = Math.max(1, (int) (total / spacing));
            String address = segment.address != null ? segment.address : "OSM parking way " + segment.wayId;
            int walked = 0;
            double walkedLength = 0;
            for (int step = 0; step <= steps; step++) {
                double target = step == steps ? total : ((double) step / steps) * total;
                while (walked < lengths.length && walkedLength + lengths[walked] < target) {
                    walkedLength += lengths[walked];
                    walked++;
                }
                GeoPoint point = interpolate(coords, lengths, walked, target - walkedLength);

                String key = GeoUtils.round(point.lat, dedupeDecimals) + ":" + GeoUtils.round(point.lon, dedupeDecimals);
                if (!seen.add(key)) {
                    continue;
                }
                points.add(new Stop("way:" + segment.wayId + ":" + step, point, segment.name, address));
                if (maxPoints != null && maxPoints > 0 && points.size() >= maxPoints) {
                    log.info("[SAMPLER] point cap {} reached", maxPoints);
                    return points;
                }
            }
        }
        log.info("[SAMPLER] {} segments -> {} parking points", segments.size(), points.size());
        return points;
    }

    private static GeoPoint interpolate(List<GeoPoint> coords, double[] lengths, int index, double offset) {
        if (index >= lengths.length) {
            return coords.get(coords.size() - 1);
        }
        GeoPoint start = coords.get(index);
        GeoPoint end = coords.get(index + 1);
        if (lengths[index] == 0) {
            return end;
        }
        double ratio = Math.max(0.0, Math.min(1.0, offset / lengths[index]));
        return new GeoPoint(start.lat + (end.lat - start.lat) * ratio, start.lon + (end.lon - start.lon) * ratio);
    }
}
