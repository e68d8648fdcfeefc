package com.riansoft.route_planner.dto;

public class ImprovementDto {
    private double originalDistanceKm;
    private double optimizedDistanceKm;
    private double distanceSavedKm;
    private double improvementPercent;

    public ImprovementDto() {}

    public ImprovementDto(double originalDistanceKm, double optimizedDistanceKm) {
        this.originalDistanceKm = originalDistanceKm;
        this.optimizedDistanceKm = optimizedDistanceKm;
        this.distanceSavedKm = originalDistanceKm - optimizedDistanceKm;
        this.improvementPercent = originalDistanceKm > 0 ? distanceSavedKm / originalDistanceKm * 100.0 : 0.0;
    }

    public double getOriginalDistanceKm() { return originalDistanceKm; }
    public void setOriginalDistanceKm(double originalDistanceKm) { this.originalDistanceKm = originalDistanceKm; }
    public double getOptimizedDistanceKm() { return optimizedDistanceKm; }
    public void setOptimizedDistanceKm(double optimizedDistanceKm) { this.optimizedDistanceKm = optimizedDistanceKm; }
    public double getDistanceSavedKm() { return distanceSavedKm; }
    public void setDistanceSavedKm(double distanceSavedKm) { this.distanceSavedKm = distanceSavedKm; }
    public double getImprovementPercent() { return improvementPercent; }
    public void setImprovementPercent(double improvementPercent) { this.improvementPercent = improvementPercent; }
}
