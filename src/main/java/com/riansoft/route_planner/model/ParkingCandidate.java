package com.riansoft.route_planner.model;

/**
 * A place to leave the vehicle near a delivery. Not persisted.
 */
public class ParkingCandidate {
    public final GeoPoint point;
    public final ParkingSource source;
    public final Double distanceToTargetMeters;
    public final String name;

    public ParkingCandidate(GeoPoint point, ParkingSource source, Double distanceToTargetMeters, String name) {
        this.point = point;
        this.source = source;
        this.distanceToTargetMeters = distanceToTargetMeters;
        this.name = name;
    }

    @Override
    public String toString() {
        String dist = distanceToTargetMeters == null ? "?" : String.format("%.0f m", distanceToTargetMeters);
        return String.format("%s %s (%s away)", source.tag(), point, dist);
    }
}
