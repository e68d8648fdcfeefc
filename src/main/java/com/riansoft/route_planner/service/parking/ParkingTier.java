package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.ParkingSource;
import com.riansoft.route_planner.model.Stop;

import java.util.List;
import java.util.Optional;

/**
 * One step of the parking fallback chain. Empty means "try the next tier".
 */
public interface ParkingTier {

    ParkingSource source();

    Optional<ParkingCandidate> attempt(GeoPoint deliveryPoint, List<Stop> staticCandidates, ParkingOptions options);
}
