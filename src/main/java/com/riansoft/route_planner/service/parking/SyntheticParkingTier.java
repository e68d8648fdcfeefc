package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.ParkingSource;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.service.distance.DistanceService;
import com.riansoft.route_planner.util.GeoUtils;

import java.util.List;
import java.util.Optional;

/**
 * Points on a circle around the delivery, snapped to the road network.
 * Picks the snapped point whose distance is closest to the circle radius.
 */
public class SyntheticParkingTier implements ParkingTier {

    private final DistanceService distanceService;

    public SyntheticParkingTier(DistanceService distanceService) {
        this.distanceService = distanceService;
    }

    @Override
    public ParkingSource source() {
        return ParkingSource.SYNTHETIC_ROAD_SNAP;
    }

    @Override
    public Optional<ParkingCandidate> attempt(GeoPoint deliveryPoint, List<Stop> staticCandidates, ParkingOptions options) {
        if (!options.isSyntheticEnabled() || options.getSyntheticCandidateCount() < 1) {
            return Optional.empty();
        }
        double radius = options.getSyntheticRadiusMeters();
        GeoPoint best = null;
        double bestDistance = 0;
        double bestGap = Double.POSITIVE_INFINITY;
        for (GeoPoint raw : GeoUtils.circle(deliveryPoint, radius, options.getSyntheticCandidateCount())) {
            GeoPoint snapped = distanceService.snapToRoad(raw);
            double d = GeoUtils.haversineMeters(deliveryPoint, snapped);
            double gap = Math.abs(d - radius);
            if (gap < bestGap) {
                best = snapped;
                bestDistance = d;
                bestGap = gap;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new ParkingCandidate(best, ParkingSource.SYNTHETIC_ROAD_SNAP, bestDistance,
                "Roadside parking"));
    }
}
