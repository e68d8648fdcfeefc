package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.StreetSegment;

import java.util.List;
import java.util.Optional;

/**
 * Outbound point-of-interest / map-data service.
 */
public interface ParkingPoiClient {

    /**
     * Parking amenities within {@code radiusMeters} of {@code point}.
     * Empty when the service could not be asked; an empty list when it answered with nothing.
     */
    Optional<List<Stop>> fetchParkingNearby(GeoPoint point, int radiusMeters, int limit);

    /**
     * Parking-tagged street ways inside a bounding box. Offline use only; failures propagate.
     */
    List<StreetSegment> fetchParkingSegments(double south, double west, double north, double east, List<String> tags);
}
