package com.riansoft.route_planner.service.distance;

import com.riansoft.route_planner.cache.AvailabilityProbe;
import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.DistanceProvenance;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;

import java.util.List;
import java.util.Optional;

/**
 * Live road-network tier. Feeds the outcome of every real request back into the probe cache.
 */
public class RoadNetworkTier implements DistanceTier {

    private final RoadNetworkClient client;
    private final AvailabilityProbe probe;

    public RoadNetworkTier(RoadNetworkClient client, AvailabilityProbe probe) {
        this.client = client;
        this.probe = probe;
    }

    @Override
    public DistanceProvenance provenance() {
        return DistanceProvenance.ROAD_NETWORK;
    }

    @Override
    public boolean isLikelyAvailable() {
        return probe.isAvailable(client::probe);
    }

    @Override
    public Optional<DistanceMatrix> matrix(List<GeoPoint> sources, List<GeoPoint> destinations) {
        return recorded(client.table(sources, destinations));
    }

    @Override
    public Optional<TravelCost> pair(GeoPoint from, GeoPoint to) {
        return recorded(client.route(from, to));
    }

    @Override
    public Optional<RoadRoute> route(List<GeoPoint> points) {
        return recorded(client.route(points));
    }

    private <T> Optional<T> recorded(Optional<T> result) {
        probe.record(result.isPresent());
        return result;
    }
}
