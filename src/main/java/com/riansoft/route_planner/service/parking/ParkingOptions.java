package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.config.RoutePlannerProperties;

/**
 * Per-call knobs for parking resolution. Defaults come from configuration.
 */
public class ParkingOptions {

    private double maxStaticRadiusMeters;
    private boolean liveEnabled;
    private int liveRadiusMeters;
    private int liveLimit;
    private boolean syntheticEnabled;
    private double syntheticRadiusMeters;
    private int syntheticCandidateCount;

    public static ParkingOptions from(RoutePlannerProperties properties) {
        RoutePlannerProperties.Parking parking = properties.getParking();
        ParkingOptions options = new ParkingOptions();
        options.setMaxStaticRadiusMeters(parking.getMaxStaticRadiusMeters());
        options.setLiveEnabled(parking.isLiveEnabled() && properties.getOverpass().isEnabled());
        options.setLiveRadiusMeters(properties.getOverpass().getRadiusMeters());
        options.setLiveLimit(properties.getOverpass().getLimit());
        options.setSyntheticEnabled(parking.isSyntheticEnabled());
        options.setSyntheticRadiusMeters(parking.getSyntheticRadiusMeters());
        options.setSyntheticCandidateCount(parking.getSyntheticCandidateCount());
        return options;
    }

    public double getMaxStaticRadiusMeters() { return maxStaticRadiusMeters; }
    public void setMaxStaticRadiusMeters(double maxStaticRadiusMeters) { this.maxStaticRadiusMeters = maxStaticRadiusMeters; }
    public boolean isLiveEnabled() { return liveEnabled; }
    public void setLiveEnabled(boolean liveEnabled) { this.liveEnabled = liveEnabled; }
    public int getLiveRadiusMeters() { return liveRadiusMeters; }
    public void setLiveRadiusMeters(int liveRadiusMeters) { this.liveRadiusMeters = liveRadiusMeters; }
    public int getLiveLimit() { return liveLimit; }
    public void setLiveLimit(int liveLimit) { this.liveLimit = liveLimit; }
    public boolean isSyntheticEnabled() { return syntheticEnabled; }
    public void setSyntheticEnabled(boolean syntheticEnabled) { this.syntheticEnabled = syntheticEnabled; }
    public double getSyntheticRadiusMeters() { return syntheticRadiusMeters; }
    public void setSyntheticRadiusMeters(double syntheticRadiusMeters) { this.syntheticRadiusMeters = syntheticRadiusMeters; }
    public int getSyntheticCandidateCount() { return syntheticCandidateCount; }
    public void setSyntheticCandidateCount(int syntheticCandidateCount) { this.syntheticCandidateCount = syntheticCandidateCount; }
}
