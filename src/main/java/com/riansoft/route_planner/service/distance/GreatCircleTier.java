package com.riansoft.route_planner.service.distance;

import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.DistanceProvenance;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;
import com.riansoft.route_planner.util.GeoUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Closed-form fallback: haversine distance, duration from an assumed speed inflated by an urban buffer.
 * Always available and symmetric.
 */
public class GreatCircleTier implements DistanceTier {

    private final double averageSpeedKmh;
    private final double bufferMultiplier;

    public GreatCircleTier(RoutePlannerProperties.Estimate estimate) {
        this(estimate.getAverageSpeedKmh(), estimate.getUrbanBufferMultiplier());
    }

    public GreatCircleTier(double averageSpeedKmh, double bufferMultiplier) {
        if (averageSpeedKmh <= 0) {
            throw new IllegalArgumentException("averageSpeedKmh must be positive");
        }
        this.averageSpeedKmh = averageSpeedKmh;
        this.bufferMultiplier = bufferMultiplier;
    }

    @Override
    public DistanceProvenance provenance() {
        return DistanceProvenance.GREAT_CIRCLE_ESTIMATE;
    }

    @Override
    public boolean isLikelyAvailable() {
        return true;
    }

    public TravelCost estimate(GeoPoint from, GeoPoint to) {
        double meters = GeoUtils.haversineMeters(from, to);
        return new TravelCost(meters, durationSeconds(meters), DistanceProvenance.GREAT_CIRCLE_ESTIMATE);
    }

    double durationSeconds(double meters) {
        if (meters <= 0) {
            return 0;
        }
        double hours = (meters / 1000.0) / averageSpeedKmh;
        return hours * 3600.0 * bufferMultiplier;
    }

    @Override
    public Optional<DistanceMatrix> matrix(List<GeoPoint> sources, List<GeoPoint> destinations) {
        double[][] distances = new double[sources.size()][destinations.size()];
        double[][] durations = new double[sources.size()][destinations.size()];
        for (int i = 0; i < sources.size(); i++) {
            for (int j = 0; j < destinations.size(); j++) {
                double meters = GeoUtils.haversineMeters(sources.get(i), destinations.get(j));
                distances[i][j] = meters;
                durations[i][j] = durationSeconds(meters);
            }
        }
        return Optional.of(new DistanceMatrix(distances, durations, DistanceProvenance.GREAT_CIRCLE_ESTIMATE));
    }

    @Override
    public Optional<TravelCost> pair(GeoPoint from, GeoPoint to) {
        return Optional.of(estimate(from, to));
    }

    @Override
    public Optional<RoadRoute> route(List<GeoPoint> points) {
        List<TravelCost> legs = new ArrayList<>();
        double distance = 0;
        double duration = 0;
        for (int i = 0; i + 1 < points.size(); i++) {
            TravelCost leg = estimate(points.get(i), points.get(i + 1));
            legs.add(leg);
            distance += leg.distanceMeters;
            duration += leg.durationSeconds;
        }
        return Optional.of(new RoadRoute(distance, duration, legs, null, DistanceProvenance.GREAT_CIRCLE_ESTIMATE));
    }
}
