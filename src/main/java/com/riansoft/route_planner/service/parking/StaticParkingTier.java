package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.ParkingSource;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.util.GeoUtils;

import java.util.List;
import java.util.Optional;

/**
 * Nearest pre-computed candidate within the static radius.
 */
public class StaticParkingTier implements ParkingTier {

    @Override
    public ParkingSource source() {
        return ParkingSource.CACHED;
    }

    @Override
    public Optional<ParkingCandidate> attempt(GeoPoint deliveryPoint, List<Stop> staticCandidates, ParkingOptions options) {
        return nearest(deliveryPoint, staticCandidates, options.getMaxStaticRadiusMeters());
    }

    /**
     * Nearest located candidate no farther than {@code maxRadiusMeters}; ties go to the earlier candidate.
     */
    static Optional<ParkingCandidate> nearest(GeoPoint target, List<Stop> candidates, double maxRadiusMeters) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Stop best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (Stop candidate : candidates) {
            if (!candidate.hasLocation()) {
                continue;
            }
            double d = GeoUtils.haversineMeters(target, candidate.point);
            if (d <= maxRadiusMeters && d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new ParkingCandidate(best.point, ParkingSource.CACHED, bestDistance, best.name));
    }
}
