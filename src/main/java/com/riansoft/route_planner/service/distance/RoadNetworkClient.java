package com.riansoft.route_planner.service.distance;

import com.riansoft.route_planner.model.DistanceMatrix;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.RoadRoute;
import com.riansoft.route_planner.model.TravelCost;
import com.riansoft.route_planner.model.TurnInstruction;

import java.util.List;
import java.util.Optional;

/**
 * Outbound road-network routing service. Every call is best-effort: an empty result means
 * "unavailable" (down, timed out, or answered with something unusable) and never throws.
 */
public interface RoadNetworkClient {

    /** Tiny fixed query used to guess whether the service is up. */
    boolean probe();

    Optional<TravelCost> route(GeoPoint from, GeoPoint to);

    /** One route through all points in order, with one leg per consecutive pair and the path geometry. */
    Optional<RoadRoute> route(List<GeoPoint> points);

    Optional<DistanceMatrix> table(List<GeoPoint> sources, List<GeoPoint> destinations);

    Optional<GeoPoint> nearest(GeoPoint point);

    Optional<List<TurnInstruction>> directions(GeoPoint from, GeoPoint to);
}
