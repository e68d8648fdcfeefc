package com.riansoft.route_planner.model;

import java.util.Collections;
import java.util.List;

/**
 * Multi-point route through consecutive points: one leg per consecutive pair, plus optional path geometry.
 */
public class RoadRoute {
    public final double distanceMeters;
    public final double durationSeconds;
    public final List<TravelCost> legs;
    public final List<GeoPoint> geometry;
    public final DistanceProvenance provenance;

    public RoadRoute(double distanceMeters, double durationSeconds, List<TravelCost> legs,
                     List<GeoPoint> geometry, DistanceProvenance provenance) {
        this.distanceMeters = distanceMeters;
        this.durationSeconds = durationSeconds;
        this.legs = Collections.unmodifiableList(legs);
        this.geometry = geometry == null ? Collections.emptyList() : Collections.unmodifiableList(geometry);
        this.provenance = provenance;
    }
}
