package com.riansoft.route_planner.model;

/**
 * Distance and duration between two points, tagged with where the numbers came from.
 */
public class TravelCost {
    public final double distanceMeters;
    public final double durationSeconds;
    public final DistanceProvenance provenance;

    public TravelCost(double distanceMeters, double durationSeconds, DistanceProvenance provenance) {
        this.distanceMeters = distanceMeters;
        this.durationSeconds = durationSeconds;
        this.provenance = provenance;
    }

    @Override
    public String toString() {
        return String.format("%.1f m / %.1f s [%s]", distanceMeters, durationSeconds, provenance.tag());
    }
}
