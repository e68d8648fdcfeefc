package com.riansoft.route_planner.service.distance;

import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.DistanceProvenance;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;

import java.util.List;
import java.util.Optional;

/**
 * One way of producing travel costs. {@link DistanceService} tries its tiers in declared order
 * and takes the first non-empty answer; everything a tier returns carries its {@link #provenance()}.
 */
public interface DistanceTier {

    DistanceProvenance provenance();

    /** Cheap, possibly stale guess. Skipped tiers may still be attempted when the caller insists. */
    boolean isLikelyAvailable();

    Optional<DistanceMatrix> matrix(List<GeoPoint> sources, List<GeoPoint> destinations);

    Optional<TravelCost> pair(GeoPoint from, GeoPoint to);

    Optional<RoadRoute> route(List<GeoPoint> points);
}
